package spectraview.windows;

import spectraview.windows.events.AreaSelectedEvent;
import spectraview.windows.events.PixelEvent;
import spectraview.windows.events.WindowCloseEvent;

import java.util.EventListener;

/**
 * Receives pointer and lifecycle events from an {@link ImageWindow}.
 * Every event carries the window it came from.
 */
public interface ImageWindowListener extends EventListener {

    default void pixelSelected(PixelEvent event) {
    }

    default void mouseMoved(PixelEvent event) {
    }

    default void areaSelected(AreaSelectedEvent event) {
    }

    default void windowClosed(WindowCloseEvent event) {
    }
}
