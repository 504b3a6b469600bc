package spectraview.windows.events;

import spectraview.windows.image.BandDescriptor;

/**
 * Three bands were chosen for RGB display.
 */
public record RgbSelectedBands(
        String fileName,
        int redIndex,
        int greenIndex,
        int blueIndex,
        BandDescriptor redDescriptor,
        BandDescriptor greenDescriptor,
        BandDescriptor blueDescriptor
) {
}
