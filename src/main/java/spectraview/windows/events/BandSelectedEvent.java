package spectraview.windows.events;

import spectraview.windows.image.BandDescriptor;

/**
 * A single band was chosen for greyscale display.
 *
 * @param fileName file the band belongs to
 * @param bandIndex 0-based index of the band
 * @param descriptor the band
 */
public record BandSelectedEvent(String fileName, int bandIndex, BandDescriptor descriptor) {
}
