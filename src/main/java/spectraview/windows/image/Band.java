package spectraview.windows.image;

import java.util.List;

/**
 * Display channel of an image: the single channel of a greyscale image,
 * or one of the three channels of an RGB image.
 */
public enum Band {
    GREY,
    RED,
    GREEN,
    BLUE;

    /**
     * Get the channels an image displays.
     *
     * @param image the image
     * @return {@code [GREY]} for a greyscale image, {@code [RED, GREEN, BLUE]} for an RGB image
     * @throws IllegalArgumentException if the image is of an unrecognized type
     */
    public static List<Band> channelsOf(SpectralImage image) {
        if (image instanceof RgbImage) {
            return List.of(RED, GREEN, BLUE);
        } else if (image instanceof GreyscaleImage) {
            return List.of(GREY);
        }
        throw new IllegalArgumentException("Image type not recognized, found type: " + image.getClass().getName());
    }
}
