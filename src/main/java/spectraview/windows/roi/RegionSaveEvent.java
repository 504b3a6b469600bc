package spectraview.windows.roi;

/**
 * Request to export a region.
 */
public record RegionSaveEvent(RegionOfInterest region) implements RegionEvent {
}
