package spectraview.windows.roi;

/**
 * A request made from the region list about a single region.
 */
public sealed interface RegionEvent
        permits RegionToggleEvent, RegionStatsEvent, RegionNameChangeEvent, RegionSaveEvent, RegionCloseEvent {

    RegionOfInterest region();
}
