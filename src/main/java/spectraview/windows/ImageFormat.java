package spectraview.windows;

import spectraview.windows.image.GreyscaleImage;
import spectraview.windows.image.RgbImage;
import spectraview.windows.image.SpectralImage;

/**
 * Pixel format an image window renders with.
 */
public enum ImageFormat {
    GREYSCALE_8,
    RGB_32;

    /**
     * @throws IllegalArgumentException if the image is of an unrecognized type
     */
    public static ImageFormat of(SpectralImage image) {
        if (image instanceof GreyscaleImage) {
            return GREYSCALE_8;
        } else if (image instanceof RgbImage) {
            return RGB_32;
        }
        throw new IllegalArgumentException("Image type not recognized, found type: " + image.getClass().getName());
    }
}
