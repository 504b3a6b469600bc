package spectraview.windows;

import javafx.geometry.Rectangle2D;
import spectraview.windows.image.PlotData;

import java.util.function.Consumer;

/**
 * A window drawing line plots, used for spectral curves and band statistics.
 */
public interface PlotWindow {

    /**
     * Replace the live trace.
     */
    void plot(PlotData data);

    /**
     * Add a fixed trace alongside the existing ones.
     */
    void addPlot(PlotData data);

    /**
     * Remove the live trace and every fixed trace.
     */
    void clearPlots();

    void setPlotTitle(String title);

    boolean isVisible();

    void setBounds(double x, double y, double width, double height);

    Rectangle2D getBounds();

    void show();

    void close();

    /**
     * Add a listener called once the window closed, whether closed by the user or by {@link #close()}.
     */
    void addCloseListener(Consumer<PlotWindow> listener);
}
