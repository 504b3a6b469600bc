package spectraview.windows;

import javafx.geometry.Rectangle2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.events.BandSelectedEvent;
import spectraview.windows.events.RgbSelectedBands;
import spectraview.windows.roi.RegionOfInterestManager;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top level registry of opened files.
 * <p>
 * Each file gets a {@link FileManager}, keyed by file name. Band selections made in
 * the band browser are routed to the file manager of the file they belong to.
 */
public class WindowManager {

    private static final Logger logger = LoggerFactory.getLogger(WindowManager.class);

    private final ScreenGeometry screenGeometry;
    private final BandSelectionSource bandList;
    private final WindowFactory windowFactory;
    private final RegionOfInterestManager roiManager;
    private final WindowPlacement placement;
    private final Map<String, FileManager> fileManagers = new LinkedHashMap<>();

    /**
     * @param screenGeometry size of the screen windows are placed on
     * @param bandList the band browser, whose selections open window sets
     * @param windowFactory creates the windows of each window set
     * @param roiManager the region registry shared by every window set
     * @param placement window layout
     */
    public WindowManager(ScreenGeometry screenGeometry, BandSelectionSource bandList, WindowFactory windowFactory,
                         RegionOfInterestManager roiManager, WindowPlacement placement) {
        this.screenGeometry = screenGeometry;
        this.bandList = bandList;
        this.windowFactory = windowFactory;
        this.roiManager = roiManager;
        this.placement = placement;

        logger.debug("Screen height: {}, width: {}",
                screenGeometry.screenBounds().getHeight(), screenGeometry.screenBounds().getWidth());
        logger.debug("Available height: {}, width: {}",
                screenGeometry.availableBounds().getHeight(), screenGeometry.availableBounds().getWidth());

        this.bandList.addBandSelectionListener(new BandSelectionListener() {
            @Override
            public void bandSelected(BandSelectedEvent event) {
                handleBandSelect(event);
            }

            @Override
            public void rgbSelected(RgbSelectedBands bands) {
                handleRgbSelect(bands);
            }
        });
    }

    /**
     * Add an opened file and list its bands in the band browser.
     *
     * @return false if a file with the same name is already open, in which case nothing changes
     */
    public boolean addFile(SpectralFile file) {
        String fileName = file.name();
        if (fileManagers.containsKey(fileName)) {
            logger.warn("File {} is already open, ignoring", fileName);
            return false;
        }

        FileManager fileManager = new FileManager(file, this);
        fileManagers.put(fileName, fileManager);
        bandList.addFile(fileName, fileManager.getHeader().bandCount(), fileManager.getBandTools());

        logger.info("Opened file {}", fileName);
        if (logger.isDebugEnabled()) {
            logger.debug("{}", fileManager.getHeader().dump());
        }
        return true;
    }

    /**
     * @return the file manager of the named file, or null if no such file is open
     */
    public FileManager getFileManager(String fileName) {
        return fileManagers.get(fileName);
    }

    public Map<String, FileManager> getFileManagers() {
        return Collections.unmodifiableMap(fileManagers);
    }

    public Rectangle2D getScreenGeometry() {
        return screenGeometry.screenBounds();
    }

    public Rectangle2D getAvailableGeometry() {
        return screenGeometry.availableBounds();
    }

    public WindowFactory getWindowFactory() {
        return windowFactory;
    }

    public WindowPlacement getWindowPlacement() {
        return placement;
    }

    public RegionOfInterestManager getRegionOfInterestManager() {
        return roiManager;
    }

    private void handleBandSelect(BandSelectedEvent event) {
        logger.debug("Band selected for: {}, {}, {}", event.fileName(),
                event.descriptor().bandName(), event.descriptor().wavelengthLabel());
        FileManager fileManager = fileManagers.get(event.fileName());
        if (fileManager != null) {
            fileManager.addGreyWindowSet(event.bandIndex(), event.descriptor());
        } else {
            logger.warn("Band selected for unknown file: {}", event.fileName());
        }
    }

    private void handleRgbSelect(RgbSelectedBands bands) {
        FileManager fileManager = fileManagers.get(bands.fileName());
        if (fileManager != null) {
            fileManager.addRgbWindowSet(bands);
        } else {
            logger.warn("RGB bands selected for unknown file: {}", bands.fileName());
        }
    }
}
