package spectraview.windows.roi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.ViewerPreferences;
import spectraview.windows.WindowSet;
import spectraview.windows.ui.RegionDialogs;
import spectraview.windows.ui.RegionListWindow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process wide registry of the regions of interest drawn in every open window set.
 * <p>
 * This manager:
 * <ul>
 *   <li>Names new regions and adds them to the shared region list</li>
 *   <li>Remembers which window set and overlay each region belongs to</li>
 *   <li>Tracks whether each region was saved since it was drawn</li>
 *   <li>Asks for confirmation before saving, and before closing an unsaved region</li>
 *   <li>Forwards rename and band stats requests to the owning window set</li>
 * </ul>
 * <p>
 * Every registered region has exactly one row in the region list and the rows are in
 * registration order. Handlers either complete or return before changing anything,
 * so a cancelled prompt leaves both the rows and the registry untouched.
 * <p>
 * All methods must be called from the UI thread.
 */
public final class RegionOfInterestManager {

    private static final Logger logger = LoggerFactory.getLogger(RegionOfInterestManager.class);

    private static RegionOfInterestManager instance;

    // Registration order matches the row order of the region list
    private final Map<RegionOfInterest, RegionSet> regionSets = new LinkedHashMap<>();

    private final List<Runnable> regionWindowClosedListeners = new CopyOnWriteArrayList<>();

    private final RegionListView regionListView;
    private final RegionPrompts prompts;
    private final RegionExporter exporter;
    private final RegionSaveDefaults saveDefaults;

    private int counter = 1;

    private RegionOfInterestManager() {
        if (instance != null) {
            throw new IllegalStateException("RegionOfInterestManager is a singleton, use getInstance() instead");
        }
        RegionListWindow listWindow = new RegionListWindow();
        this.regionListView = listWindow;
        this.prompts = new RegionDialogs(listWindow);
        this.exporter = new CsvRegionExporter();
        this.saveDefaults = ViewerPreferences.getDefault().loadSaveDefaults();
        regionListView.setRegionListListener(new ListHandler());
    }

    /**
     * Create a manager with explicit collaborators.
     * <p>
     * The application root creates one instance and hands it to every component that needs it.
     *
     * @param regionListView the shared region list
     * @param prompts save and close prompts
     * @param exporter writes saved regions
     * @param saveDefaults save directory and "include bands" state remembered between saves
     */
    public RegionOfInterestManager(RegionListView regionListView, RegionPrompts prompts,
                                   RegionExporter exporter, RegionSaveDefaults saveDefaults) {
        this.regionListView = regionListView;
        this.prompts = prompts;
        this.exporter = exporter;
        this.saveDefaults = saveDefaults;
        regionListView.setRegionListListener(new ListHandler());
    }

    /**
     * Get the singleton instance, wired to the JavaFX region list and dialogs.
     */
    public static synchronized RegionOfInterestManager getInstance() {
        if (instance == null) {
            instance = new RegionOfInterestManager();
        }
        return instance;
    }

    /**
     * Register a newly drawn region.
     * <p>
     * An unnamed region is given the next "Region N" name. If the owning window set's
     * file is georeferenced the map info is attached to the region. The region list is
     * shown if it was hidden.
     *
     * @param region the region, registered at most once
     * @param displayItem the overlay drawing the region in the window it was drawn in
     * @param windowSet the window set the region was drawn in
     */
    public void addRegion(RegionOfInterest region, RegionDisplayItem displayItem, WindowSet windowSet) {
        if (regionSets.containsKey(region)) {
            logger.warn("Region {} is already registered, ignoring", region.getDisplayName());
            return;
        }

        if (region.getDisplayName() == null) {
            region.setDisplayName("Region " + counter);
            counter++;
        }

        MapInfo mapInfo = windowSet.getFileManager().getHeader().mapInfo();
        if (mapInfo != null) {
            region.setMapInfo(mapInfo);
        }

        regionListView.addItem(region, displayItem.getColor());
        regionSets.put(region, new RegionSet(windowSet, displayItem));
        logger.debug("Added region {}, {} regions open", region.getDisplayName(), regionSets.size());

        if (!regionListView.isShowing()) {
            regionListView.show();
        }
    }

    /**
     * Add a listener called after the region list window was closed and every region dropped.
     */
    public void addRegionWindowClosedListener(Runnable listener) {
        regionWindowClosedListeners.add(listener);
    }

    public void removeRegionWindowClosedListener(Runnable listener) {
        regionWindowClosedListeners.remove(listener);
    }

    public int getRegionCount() {
        return regionSets.size();
    }

    public boolean isRegistered(RegionOfInterest region) {
        return regionSets.containsKey(region);
    }

    /**
     * @return true if the region was saved since it was registered; false if it was not, or is unknown
     */
    public boolean isSaved(RegionOfInterest region) {
        RegionSet set = regionSets.get(region);
        return set != null && set.isSaved();
    }

    /**
     * Get the registered regions in registration order.
     */
    public List<RegionOfInterest> getRegions() {
        return new ArrayList<>(regionSets.keySet());
    }

    // ========== Handlers ==========

    private void handleRegionToggled(RegionToggleEvent event) {
        RegionSet set = findRegionSet(event, "toggle");
        if (set != null) {
            RegionDisplayItem displayItem = set.displayItem();
            displayItem.setOn(!displayItem.isOn());
        }
    }

    private void handleRegionNameChanged(RegionNameChangeEvent event) {
        RegionSet set = findRegionSet(event, "name");
        if (set != null) {
            set.windowSet().handleRegionNameChanged(event);
        }
    }

    private void handleStatsRequested(RegionStatsEvent event) {
        RegionSet set = findRegionSet(event, "stats");
        if (set != null) {
            set.windowSet().handleRegionStats(event);
        }
    }

    private void handleRegionSaved(RegionSaveEvent event) {
        RegionSet set = findRegionSet(event, "save");
        if (set == null) {
            return;
        }

        RegionOfInterest region = event.region();
        logger.debug("Save requested for region: {}", region.getDisplayName());

        RegionPrompts.SaveChoice choice = prompts.promptSave(region, saveDefaults.isIncludeBands());
        logger.debug("Save dialog result: {}", choice);
        if (!choice.confirmed()) {
            logger.debug("Region save canceled");
            return;
        }
        saveDefaults.setIncludeBands(choice.includeBands());

        Path defaultFile = saveDefaults.getSaveDirectory().resolve(region.getDisplayName());
        logger.debug("Default location: {}", saveDefaults.getSaveDirectory());
        Optional<Path> chosen = prompts.promptSaveFile(defaultFile);
        if (chosen.isEmpty()) {
            logger.debug("Region save canceled");
            return;
        }

        Path file = withCsvExtension(chosen.get());
        Path directory = file.toAbsolutePath().getParent();
        if (directory != null) {
            saveDefaults.setSaveDirectory(directory);
        }

        try {
            exporter.export(region, set.windowSet().getBandTools(), file, choice.includeBands());
            set.setSaved(true);
            logger.info("Saved region {} to {}", region.getDisplayName(), file);
        } catch (IOException e) {
            logger.error("Failed to save region {} to {}: {}", region.getDisplayName(), file, e.getMessage(), e);
        }
    }

    private void handleRegionClosed(RegionCloseEvent event) {
        RegionSet set = findRegionSet(event, "close");
        if (set == null) {
            return;
        }

        if (!set.isSaved() && !prompts.confirmClose(event.region())) {
            logger.debug("Region close canceled");
            return;
        }
        doClose(event, set);
    }

    private void doClose(RegionCloseEvent event, RegionSet set) {
        RegionOfInterest region = event.region();
        set.windowSet().handleRegionClosed(event);
        set.displayItem().close();

        int row = regionListView.indexOf(region);
        if (row >= 0) {
            regionListView.removeRow(row);
        } else {
            logger.warn("Region {} had no row in the region list", region.getDisplayName());
        }
        regionSets.remove(region);
        logger.debug("Closed region {}, {} regions open", region.getDisplayName(), regionSets.size());
    }

    private void handleListWindowClosed() {
        regionListView.removeAll();
        regionSets.clear();
        logger.debug("Region list closed, all regions dropped");
        for (Runnable listener : regionWindowClosedListeners) {
            listener.run();
        }
    }

    private RegionSet findRegionSet(RegionEvent event, String eventName) {
        RegionOfInterest region = event.region();
        RegionSet set = regionSets.get(region);
        if (set == null) {
            logger.warn("Region with id: {}, name: {} not found handling {} event",
                    System.identityHashCode(region), region.getDisplayName(), eventName);
        }
        return set;
    }

    private static Path withCsvExtension(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".csv")) {
            return file;
        }
        return file.resolveSibling(name + ".csv");
    }

    /**
     * The window set, overlay and saved state of one registered region.
     */
    private static class RegionSet {

        private final WindowSet windowSet;
        private final RegionDisplayItem displayItem;
        private boolean saved;

        RegionSet(WindowSet windowSet, RegionDisplayItem displayItem) {
            this.windowSet = windowSet;
            this.displayItem = displayItem;
        }

        WindowSet windowSet() {
            return windowSet;
        }

        RegionDisplayItem displayItem() {
            return displayItem;
        }

        boolean isSaved() {
            return saved;
        }

        void setSaved(boolean saved) {
            this.saved = saved;
        }
    }

    private class ListHandler implements RegionListListener {

        @Override
        public void regionToggled(RegionToggleEvent event) {
            handleRegionToggled(event);
        }

        @Override
        public void regionNameChanged(RegionNameChangeEvent event) {
            handleRegionNameChanged(event);
        }

        @Override
        public void statsRequested(RegionStatsEvent event) {
            handleStatsRequested(event);
        }

        @Override
        public void regionSaveRequested(RegionSaveEvent event) {
            handleRegionSaved(event);
        }

        @Override
        public void regionCloseRequested(RegionCloseEvent event) {
            handleRegionClosed(event);
        }

        @Override
        public void listWindowClosed() {
            handleListWindowClosed();
        }
    }
}
