package spectraview.windows;

import javafx.geometry.Rectangle2D;
import spectraview.windows.image.SpectralImage;

/**
 * Creates the windows of a window set. Implemented by the host viewer, which does the rendering.
 */
public interface WindowFactory {

    ImageWindow createMainImageWindow(SpectralImage image, String title, ImageFormat format,
                                      Rectangle2D availableBounds);

    ImageWindow createZoomImageWindow(SpectralImage image, String title, ImageFormat format,
                                      Rectangle2D availableBounds);

    HistogramWindow createHistogramWindow(ImageWindow owner);

    /**
     * @param owner the main image window the plot belongs to
     * @param title window title, or null for the default
     */
    PlotWindow createPlotWindow(ImageWindow owner, String title);
}
