package spectraview.windows.image;

import javafx.scene.paint.Color;

/**
 * One line trace for a plot window.
 *
 * @param title plot title
 * @param xValues x coordinates, typically wavelengths
 * @param yValues y coordinates, same length as {@code xValues}
 * @param xLabel x axis label
 * @param yLabel y axis label
 * @param color line color, or null for the plot window's default
 */
public record PlotData(String title, double[] xValues, double[] yValues, String xLabel, String yLabel, Color color) {

    public PlotData {
        if (xValues.length != yValues.length) {
            throw new IllegalArgumentException("x and y values differ in length: "
                    + xValues.length + " != " + yValues.length);
        }
    }

    /**
     * Create a copy drawn in another color.
     */
    public PlotData withColor(Color newColor) {
        return new PlotData(title, xValues, yValues, xLabel, yLabel, newColor);
    }
}
