package spectraview.windows.roi;

/**
 * Request to show band statistics for a region.
 */
public record RegionStatsEvent(RegionOfInterest region) implements RegionEvent {
}
