package spectraview.windows;

import javafx.geometry.Rectangle2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.events.RgbSelectedBands;
import spectraview.windows.image.BandDescriptor;
import spectraview.windows.image.BandTools;
import spectraview.windows.image.ImageTools;
import spectraview.windows.image.SpectralImage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The window sets opened for one file.
 * <p>
 * A new window set is created for every band combination the user asks to display.
 * Window sets cascade left to right in creation order and are dropped when they close.
 */
public class FileManager {

    private static final Logger logger = LoggerFactory.getLogger(FileManager.class);

    private final WindowManager windowManager;
    private final SpectralFile file;
    private final BandTools bandTools;
    private final ImageTools imageTools;
    private final List<WindowSet> windowSets = new ArrayList<>();

    public FileManager(SpectralFile file, WindowManager windowManager) {
        this.windowManager = windowManager;
        this.file = file;
        this.bandTools = file.createBandTools();
        this.imageTools = file.createImageTools();
    }

    /**
     * Open a window set showing three bands as red, green and blue.
     */
    public WindowSet addRgbWindowSet(RgbSelectedBands bands) {
        logger.debug("New RGB window: {} - {} - {}", bands.redDescriptor().label(),
                bands.greenDescriptor().label(), bands.blueDescriptor().label());
        SpectralImage image = imageTools.rgbImage(
                bands.redIndex(), bands.greenIndex(), bands.blueIndex(),
                bands.redDescriptor(), bands.greenDescriptor(), bands.blueDescriptor());
        return createWindowSet(image);
    }

    /**
     * Open a window set showing one band in greyscale.
     */
    public WindowSet addGreyWindowSet(int index, BandDescriptor descriptor) {
        logger.debug("New greyscale window: {}", descriptor.label());
        SpectralImage image = imageTools.greyscaleImage(index, descriptor);
        return createWindowSet(image);
    }

    public FileHeader getHeader() {
        return file.header();
    }

    public String getFileName() {
        return file.name();
    }

    public BandTools getBandTools() {
        return bandTools;
    }

    public ImageTools getImageTools() {
        return imageTools;
    }

    public WindowManager getWindowManager() {
        return windowManager;
    }

    /**
     * Get the open window sets in creation order.
     */
    public List<WindowSet> getWindowSets() {
        return Collections.unmodifiableList(windowSets);
    }

    private WindowSet createWindowSet(SpectralImage image) {
        WindowSet windowSet = new WindowSet(image, image.label(), this);
        windowSet.addClosedListener(this::handleWindowSetClosed);

        WindowPlacement placement = windowManager.getWindowPlacement();
        double x;
        if (windowSets.isEmpty()) {
            x = placement.firstX();
        } else {
            Rectangle2D rect = windowSets.get(windowSets.size() - 1).getImageWindowBounds();
            x = rect.getMaxX() + placement.gap();
        }

        windowSet.initPosition(x, placement.topY());
        windowSets.add(windowSet);
        return windowSet;
    }

    private void handleWindowSetClosed(WindowSet windowSet) {
        windowSets.remove(windowSet);
        logger.debug("WindowSets open for {}: {}", file.name(), windowSets.size());
    }
}
