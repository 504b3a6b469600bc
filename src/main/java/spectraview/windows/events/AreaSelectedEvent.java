package spectraview.windows.events;

import spectraview.windows.ImageWindow;
import spectraview.windows.roi.RegionDisplayItem;
import spectraview.windows.roi.RegionOfInterest;

/**
 * The user drew a region in an image window.
 *
 * @param source the window the region was drawn in
 * @param region the new region
 * @param displayItem the overlay drawing the region in {@code source}
 */
public record AreaSelectedEvent(ImageWindow source, RegionOfInterest region, RegionDisplayItem displayItem) {
}
