package spectraview.windows;

import javafx.geometry.Rectangle2D;
import spectraview.windows.events.AreaSelectedEvent;

/**
 * A window rendering an image: either the main view of a window set or its zoom view.
 */
public interface ImageWindow {

    void addImageWindowListener(ImageWindowListener listener);

    void removeImageWindowListener(ImageWindowListener listener);

    /**
     * Make this main window follow and control the given zoom window.
     */
    void connectZoomWindow(ImageWindow zoomWindow);

    /**
     * Draw a region selected in the paired window, so both views show it.
     */
    void handleRegionSelected(AreaSelectedEvent event);

    /**
     * Redraw from the image's current adjusted pixel data.
     */
    void refreshImage();

    /**
     * Remove every region overlay.
     */
    void removeAllRegions();

    void moveTo(double x, double y);

    Rectangle2D getBounds();

    void show();

    /**
     * Close the window. Listeners still registered receive {@link ImageWindowListener#windowClosed}.
     */
    void close();
}
