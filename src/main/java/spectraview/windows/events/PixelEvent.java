package spectraview.windows.events;

import spectraview.windows.ImageWindow;

/**
 * A pointer event on an image window, in image pixel coordinates.
 *
 * @param source the window the event happened in
 * @param pixelX sample (column) of the pixel
 * @param pixelY line (row) of the pixel
 */
public record PixelEvent(ImageWindow source, int pixelX, int pixelY) {
}
