package spectraview.windows.roi;

/**
 * Request to close a region.
 * <p>
 * The region handle identifies the row to remove; the row position is looked up
 * when the close is carried out, so reordering rows cannot close the wrong region.
 */
public record RegionCloseEvent(RegionOfInterest region) implements RegionEvent {
}
