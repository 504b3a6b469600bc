package spectraview.windows;

import javafx.geometry.Rectangle2D;
import javafx.stage.Screen;

/**
 * Size of the screen windows are placed on.
 *
 * @param screenBounds full bounds of the screen
 * @param availableBounds bounds excluding task bars and system menus
 */
public record ScreenGeometry(Rectangle2D screenBounds, Rectangle2D availableBounds) {

    /**
     * Geometry of the primary screen. Requires the JavaFX toolkit to be running.
     */
    public static ScreenGeometry ofPrimaryScreen() {
        Screen screen = Screen.getPrimary();
        return new ScreenGeometry(screen.getBounds(), screen.getVisualBounds());
    }
}
