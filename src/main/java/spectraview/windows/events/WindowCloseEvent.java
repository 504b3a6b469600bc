package spectraview.windows.events;

import spectraview.windows.ImageWindow;

/**
 * An image window closed.
 */
public record WindowCloseEvent(ImageWindow target) {
}
