package spectraview.windows.roi;

/**
 * Request to flip the visibility of a region's overlay.
 */
public record RegionToggleEvent(RegionOfInterest region) implements RegionEvent {
}
