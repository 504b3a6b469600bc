package spectraview.windows;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.roi.RegionOfInterestManager;

/**
 * Installs window set and region management into a host viewer.
 * <p>
 * The host supplies the band browser and the factory for its image and plot windows;
 * this extension provides:
 * <ul>
 *   <li>One {@link WindowManager} routing band selections to per-file window sets</li>
 *   <li>The shared region list and its save and close dialogs</li>
 *   <li>Region save defaults kept between sessions</li>
 * </ul>
 */
public class SpectralWindowsExtension {

    private static final Logger logger = LoggerFactory.getLogger(SpectralWindowsExtension.class);

    private static final String EXTENSION_NAME = "Spectral Window Manager";

    private WindowManager windowManager;

    public String getName() {
        return EXTENSION_NAME;
    }

    /**
     * Install, creating the window manager. Must be called on the JavaFX application thread.
     *
     * @param bandList the host's band browser
     * @param windowFactory creates the host's image and plot windows
     * @return the window manager files are added to
     */
    public WindowManager installExtension(BandSelectionSource bandList, WindowFactory windowFactory) {
        if (isInstalled()) {
            logger.warn("{} is already installed", EXTENSION_NAME);
            return windowManager;
        }

        logger.info("Installing extension: {}", EXTENSION_NAME);

        windowManager = new WindowManager(
                ScreenGeometry.ofPrimaryScreen(),
                bandList,
                windowFactory,
                RegionOfInterestManager.getInstance(),
                WindowPlacement.defaults());

        logger.info("{} installation complete", EXTENSION_NAME);
        return windowManager;
    }

    public boolean isInstalled() {
        return windowManager != null;
    }
}
