package spectraview.windows.roi;

/**
 * Notification that a region's display name was edited; the region already carries the new name.
 */
public record RegionNameChangeEvent(RegionOfInterest region) implements RegionEvent {
}
