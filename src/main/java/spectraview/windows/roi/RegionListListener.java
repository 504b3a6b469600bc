package spectraview.windows.roi;

import java.util.EventListener;

/**
 * Receives the requests a user makes through the region list.
 */
public interface RegionListListener extends EventListener {

    void regionToggled(RegionToggleEvent event);

    void regionNameChanged(RegionNameChangeEvent event);

    void statsRequested(RegionStatsEvent event);

    void regionSaveRequested(RegionSaveEvent event);

    void regionCloseRequested(RegionCloseEvent event);

    /**
     * Called when the user closes the region list window itself.
     */
    void listWindowClosed();
}
