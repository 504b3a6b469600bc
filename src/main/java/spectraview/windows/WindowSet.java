package spectraview.windows;

import javafx.geometry.Rectangle2D;
import javafx.scene.paint.Color;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.events.AreaSelectedEvent;
import spectraview.windows.events.LimitChangeEvent;
import spectraview.windows.events.PixelEvent;
import spectraview.windows.events.WindowCloseEvent;
import spectraview.windows.image.Band;
import spectraview.windows.image.BandStatistics;
import spectraview.windows.image.BandTools;
import spectraview.windows.image.HistogramTools;
import spectraview.windows.image.PlotData;
import spectraview.windows.image.SpectralImage;
import spectraview.windows.roi.RegionCloseEvent;
import spectraview.windows.roi.RegionNameChangeEvent;
import spectraview.windows.roi.RegionOfInterest;
import spectraview.windows.roi.RegionOfInterestManager;
import spectraview.windows.roi.RegionStatsEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The windows displaying one image: main view, zoom view, histogram, spectral plot
 * and any band stats plots opened for its regions.
 * <p>
 * The windows live and die together. Closing either the main or the zoom window
 * closes every other window of the set and notifies the closed listeners once.
 */
public class WindowSet {

    private static final Logger logger = LoggerFactory.getLogger(WindowSet.class);

    private static final String BAND_STATS_TITLE = "Band Stats";

    private final FileManager fileManager;
    private final SpectralImage image;
    private final String title;
    private final BandTools bandTools;
    private final HistogramTools histogramTools;
    private final WindowFactory windowFactory;
    private final WindowPlacement placement;
    private final RegionOfInterestManager roiManager;

    private ImageWindow mainImageWindow;
    private ImageWindow zoomImageWindow;
    private HistogramWindow histogramWindow;
    private PlotWindow specPlotWindow;

    // Band stats windows by region, a window is removed when it closes
    private final Map<RegionOfInterest, PlotWindow> bandStatsWindows = new LinkedHashMap<>();

    private final ImageWindowListener imageHandler = new ImageHandler();
    private final Runnable regionWindowClosedHandler = this::handleRegionWindowClosed;
    private final List<Consumer<WindowSet>> closedListeners = new ArrayList<>();

    private boolean closed = false;

    /**
     * Create the windows for an image. They are not shown until {@link #initPosition(double, double)}.
     *
     * @throws IllegalArgumentException if the image is of an unrecognized type
     */
    public WindowSet(SpectralImage image, String title, FileManager fileManager) {
        this.fileManager = fileManager;
        this.image = image;
        this.title = title;

        WindowManager windowManager = fileManager.getWindowManager();
        this.windowFactory = windowManager.getWindowFactory();
        this.placement = windowManager.getWindowPlacement();
        this.roiManager = windowManager.getRegionOfInterestManager();
        this.bandTools = fileManager.getBandTools();
        this.histogramTools = fileManager.getImageTools().histogramTools(image);

        initImageWindows(windowManager.getAvailableGeometry());
        initPlotWindows();
        initRoi();
    }

    private void initImageWindows(Rectangle2D availableBounds) {
        ImageFormat format = ImageFormat.of(image);
        mainImageWindow = windowFactory.createMainImageWindow(image, title, format, availableBounds);
        zoomImageWindow = windowFactory.createZoomImageWindow(image, title, format, availableBounds);

        mainImageWindow.connectZoomWindow(zoomImageWindow);

        mainImageWindow.addImageWindowListener(imageHandler);
        mainImageWindow.addImageWindowListener(new RegionMirror(zoomImageWindow));

        zoomImageWindow.addImageWindowListener(imageHandler);
        zoomImageWindow.addImageWindowListener(new RegionMirror(mainImageWindow));
    }

    private void initPlotWindows() {
        specPlotWindow = windowFactory.createPlotWindow(mainImageWindow, null);

        histogramWindow = windowFactory.createHistogramWindow(mainImageWindow);
        histogramWindow.addHistogramListener(new HistogramListener() {
            @Override
            public void limitChanged(LimitChangeEvent event) {
                handleHistogramLimitChange(event);
            }

            @Override
            public void limitsReset() {
                handleHistogramLimitsReset();
            }
        });
    }

    private void initRoi() {
        // Find out when the region list is closed, our overlays go with it
        roiManager.addRegionWindowClosedListener(regionWindowClosedHandler);
    }

    private void initHistogram(double x, double y) {
        for (Band band : Band.channelsOf(image)) {
            histogramWindow.createPlotControl(
                    histogramTools.rawHistogram(band), histogramTools.adjustedHistogram(band), band);
        }

        histogramWindow.setBounds(x, y + getImageWindowBounds().getHeight() + placement.histogramGap(),
                placement.histogramWidth(), placement.histogramHeight());
        histogramWindow.show();
    }

    /**
     * Show the windows, with the main window's top left corner at {@code (x, y)}.
     */
    public void initPosition(double x, double y) {
        mainImageWindow.moveTo(x, y);
        mainImageWindow.show();

        zoomImageWindow.moveTo(x + placement.zoomOffset(), y + placement.zoomOffset());
        zoomImageWindow.show();

        initHistogram(x, y);
    }

    public Rectangle2D getImageWindowBounds() {
        return mainImageWindow.getBounds();
    }

    public SpectralImage getImage() {
        return image;
    }

    public String getTitle() {
        return title;
    }

    public BandTools getBandTools() {
        return bandTools;
    }

    public FileManager getFileManager() {
        return fileManager;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean hasBandStatsWindow(RegionOfInterest region) {
        return bandStatsWindows.containsKey(region);
    }

    /**
     * Add a listener called once, after every window of the set closed.
     */
    public void addClosedListener(Consumer<WindowSet> listener) {
        closedListeners.add(listener);
    }

    // ========== Region requests, forwarded by the RegionOfInterestManager ==========

    /**
     * Open a band stats window for a region, or refresh the one already open.
     */
    public void handleRegionStats(RegionStatsEvent event) {
        if (closed) {
            logger.warn("Ignoring band stats request for region {}, window set {} is closed",
                    event.region().getDisplayName(), title);
            return;
        }

        RegionOfInterest region = event.region();
        int[] lines = region.yPoints();
        int[] samples = region.xPoints();
        logger.debug("Band stats for region {} over {} pixels", region.getDisplayName(), lines.length);

        PlotWindow bandStatsWindow = bandStatsWindows.get(region);
        if (bandStatsWindow == null) {
            bandStatsWindow = windowFactory.createPlotWindow(mainImageWindow, BAND_STATS_TITLE);
            bandStatsWindow.addCloseListener(this::handleBandStatsClosed);
            bandStatsWindows.put(region, bandStatsWindow);

            Rectangle2D rect = histogramWindow.getBounds();
            bandStatsWindow.setBounds(rect.getMinX() + placement.statsOffset(), rect.getMinY() + placement.statsOffset(),
                    placement.plotWidth(), placement.plotHeight());
        } else {
            bandStatsWindow.clearPlots();
        }

        BandStatistics stats = bandTools.statisticsPlot(lines, samples, statsTitle(region));
        bandStatsWindow.plot(stats.mean());
        bandStatsWindow.addPlot(stats.min());
        bandStatsWindow.addPlot(stats.max());
        bandStatsWindow.addPlot(stats.plusOneStd());
        bandStatsWindow.addPlot(stats.minusOneStd());
        bandStatsWindow.show();
    }

    public void handleRegionNameChanged(RegionNameChangeEvent event) {
        RegionOfInterest region = event.region();
        logger.debug("New band stats title: {}", region.getDisplayName());

        PlotWindow bandStatsWindow = bandStatsWindows.get(region);
        if (bandStatsWindow != null) {
            bandStatsWindow.setPlotTitle(statsTitle(region));
        }
    }

    public void handleRegionClosed(RegionCloseEvent event) {
        RegionOfInterest region = event.region();
        PlotWindow bandStatsWindow = bandStatsWindows.get(region);
        if (bandStatsWindow != null) {
            bandStatsWindow.close();
            // Closing should have untracked it already
            if (bandStatsWindows.remove(region) != null) {
                logger.warn("Band stats window was still tracked after being closed");
            }
        }
    }

    // ========== Window events ==========

    private void handlePixelClick(PixelEvent event) {
        if (specPlotWindow.isVisible()) {
            PlotData plotData = bandTools.spectralPlot(event.pixelY(), event.pixelX()).withColor(Color.GREEN);
            specPlotWindow.addPlot(plotData);
        }
    }

    private void handleMouseMove(PixelEvent event) {
        PlotData plotData = bandTools.spectralPlot(event.pixelY(), event.pixelX());
        specPlotWindow.plot(plotData);

        if (!specPlotWindow.isVisible()) {
            Rectangle2D rect = histogramWindow.getBounds();
            specPlotWindow.setBounds(rect.getMinX() + placement.plotOffset(), rect.getMinY() + placement.plotOffset(),
                    placement.plotWidth(), placement.plotHeight());
            specPlotWindow.show();
        }
    }

    private void handleAreaSelected(AreaSelectedEvent event) {
        roiManager.addRegion(event.region(), event.displayItem(), this);
    }

    private void handleImageClosed(WindowCloseEvent event) {
        if (event.target() == mainImageWindow) {
            logger.debug("Main window closed for {}", title);
            // Disconnect first so closing the zoom window doesn't tear down a second time
            zoomImageWindow.removeImageWindowListener(imageHandler);
            zoomImageWindow.close();
        } else if (event.target() == zoomImageWindow) {
            logger.debug("Zoom window closed for {}", title);
            mainImageWindow.removeImageWindowListener(imageHandler);
            mainImageWindow.close();
        } else {
            logger.error("Received WindowCloseEvent but target was not in window set {}", title);
            return;
        }

        histogramWindow.close();
        specPlotWindow.close();
        closeBandStatsWindows();

        roiManager.removeRegionWindowClosedListener(regionWindowClosedHandler);
        closed = true;

        for (Consumer<WindowSet> listener : new ArrayList<>(closedListeners)) {
            listener.accept(this);
        }
    }

    private void handleHistogramLimitChange(LimitChangeEvent event) {
        logger.debug("Limit change event {}, {}", event.lowerLimit(), event.upperLimit());
        boolean updated = false;
        if (event.hasUpperLimitChange()) {
            image.setHighCutoff(event.upperLimit(), event.band());
            updated = true;
        }

        if (event.hasLowerLimitChange()) {
            image.setLowCutoff(event.lowerLimit(), event.band());
            updated = true;
        }

        if (updated) {
            image.adjust();
            mainImageWindow.refreshImage();
            zoomImageWindow.refreshImage();
            histogramWindow.setAdjustedData(histogramTools.adjustedHistogram(event.band()), event.band());
        } else {
            logger.warn("Got limit change event with no limits");
        }
    }

    private void handleHistogramLimitsReset() {
        image.resetStretch();
        image.adjust();
        mainImageWindow.refreshImage();
        zoomImageWindow.refreshImage();

        for (Band band : Band.channelsOf(image)) {
            histogramWindow.updateLimits(histogramTools.rawHistogram(band), band);
            histogramWindow.setAdjustedData(histogramTools.adjustedHistogram(band), band);
        }
    }

    private void handleRegionWindowClosed() {
        closeBandStatsWindows();
        mainImageWindow.removeAllRegions();
        zoomImageWindow.removeAllRegions();
    }

    private void handleBandStatsClosed(PlotWindow target) {
        bandStatsWindows.values().removeIf(window -> window == target);
    }

    private void closeBandStatsWindows() {
        // Untrack before closing so the close listener finds nothing to remove
        while (!bandStatsWindows.isEmpty()) {
            Iterator<PlotWindow> iterator = bandStatsWindows.values().iterator();
            PlotWindow window = iterator.next();
            iterator.remove();
            window.close();
        }
    }

    private static String statsTitle(RegionOfInterest region) {
        return "Region: " + region.getDisplayName();
    }

    @Override
    public String toString() {
        return "WindowSet[" + title + (closed ? " CLOSED" : "") + "]";
    }

    private class ImageHandler implements ImageWindowListener {

        @Override
        public void pixelSelected(PixelEvent event) {
            handlePixelClick(event);
        }

        @Override
        public void mouseMoved(PixelEvent event) {
            handleMouseMove(event);
        }

        @Override
        public void areaSelected(AreaSelectedEvent event) {
            handleAreaSelected(event);
        }

        @Override
        public void windowClosed(WindowCloseEvent event) {
            handleImageClosed(event);
        }
    }

    /**
     * Draws regions selected in one image window in the other one too.
     */
    private static class RegionMirror implements ImageWindowListener {

        private final ImageWindow target;

        RegionMirror(ImageWindow target) {
            this.target = target;
        }

        @Override
        public void areaSelected(AreaSelectedEvent event) {
            target.handleRegionSelected(event);
        }
    }
}
