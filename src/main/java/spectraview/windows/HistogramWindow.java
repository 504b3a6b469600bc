package spectraview.windows;

import javafx.geometry.Rectangle2D;
import spectraview.windows.image.Band;
import spectraview.windows.image.HistogramData;

/**
 * A window showing one histogram control per image channel, each with draggable cutoff limits.
 */
public interface HistogramWindow {

    void createPlotControl(HistogramData raw, HistogramData adjusted, Band band);

    void setAdjustedData(HistogramData adjusted, Band band);

    /**
     * Move the limit markers of a channel to the limits of {@code raw}.
     */
    void updateLimits(HistogramData raw, Band band);

    void addHistogramListener(HistogramListener listener);

    void setBounds(double x, double y, double width, double height);

    Rectangle2D getBounds();

    void show();

    void close();
}
