package spectraview.windows.roi;

import javafx.scene.paint.Color;

/**
 * Overlay drawing a region inside an image window.
 */
public interface RegionDisplayItem {

    Color getColor();

    boolean isOn();

    void setOn(boolean on);

    /**
     * Remove the overlay from its image window.
     */
    void close();
}
