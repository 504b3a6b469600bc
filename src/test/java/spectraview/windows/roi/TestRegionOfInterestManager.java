package spectraview.windows.roi;

import javafx.scene.paint.Color;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import spectraview.windows.FakePlotWindow;
import spectraview.windows.FileManager;
import spectraview.windows.WindowFixture;
import spectraview.windows.WindowSet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestRegionOfInterestManager {

    private static final MapInfo MAP_INFO = new MapInfo("UTM", 1, 1, 500000, 4000000, 30, 30, "Meters");

    private WindowFixture fixture;
    private RegionOfInterestManager manager;
    private FakeRegionListView regionList;
    private ScriptedPrompts prompts;
    private WindowSet windowSet;

    @BeforeEach
    void setUp() {
        fixture = new WindowFixture(Path.of("regions").toAbsolutePath());
        manager = fixture.roiManager;
        regionList = fixture.regionList;
        prompts = fixture.prompts;
        FileManager fileManager = fixture.openFile("cube.hdr");
        windowSet = fixture.openGreyWindowSet(fileManager, 0);
    }

    private RegionOfInterest addRegion(FakeDisplayItem displayItem) {
        RegionOfInterest region = RegionOfInterest.rectangle(0, 0, 2, 2, "");
        manager.addRegion(region, displayItem, windowSet);
        return region;
    }

    private RegionOfInterest addRegion() {
        return addRegion(new FakeDisplayItem(Color.RED));
    }

    @Test
    void testRegionsAreNamedInOrder() {
        RegionOfInterest first = addRegion();
        RegionOfInterest second = addRegion();

        assertEquals("Region 1", first.getDisplayName());
        assertEquals("Region 2", second.getDisplayName());
        assertEquals(List.of(first, second), manager.getRegions());
        assertEquals(List.of(first, second), regionList.rows);
    }

    @Test
    void testNamesAreNotReused() {
        RegionOfInterest first = addRegion();
        regionList.userCloses(first);

        RegionOfInterest second = addRegion();

        assertEquals("Region 2", second.getDisplayName());
    }

    @Test
    void testNamedRegionKeepsItsName() {
        RegionOfInterest region = RegionOfInterest.rectangle(0, 0, 1, 1, "");
        region.setDisplayName("Lake");
        manager.addRegion(region, new FakeDisplayItem(Color.RED), windowSet);

        assertEquals("Lake", region.getDisplayName());
        assertEquals("Region 1", addRegion().getDisplayName());
    }

    @Test
    void testRowColorComesFromOverlay() {
        addRegion(new FakeDisplayItem(Color.YELLOW));

        assertEquals(List.of(Color.YELLOW), regionList.colors);
    }

    @Test
    void testListIsShownOnlyWhenHidden() {
        addRegion();
        addRegion();
        assertEquals(1, regionList.showCount);

        regionList.showing = false;
        addRegion();
        assertEquals(2, regionList.showCount);
    }

    @Test
    void testDuplicateRegionIsIgnored() {
        RegionOfInterest region = addRegion();

        manager.addRegion(region, new FakeDisplayItem(Color.BLUE), windowSet);

        assertEquals(1, manager.getRegionCount());
        assertEquals(1, regionList.getRowCount());
        assertEquals("Region 1", region.getDisplayName());
    }

    @Test
    void testMapInfoIsAttached() {
        FileManager georeferenced = fixture.openFile("geo.hdr", MAP_INFO);
        WindowSet geoWindowSet = fixture.openGreyWindowSet(georeferenced, 0);

        RegionOfInterest plain = addRegion();
        RegionOfInterest mapped = RegionOfInterest.rectangle(0, 0, 1, 1, "");
        manager.addRegion(mapped, new FakeDisplayItem(Color.RED), geoWindowSet);

        assertNull(plain.getMapInfo());
        assertSame(MAP_INFO, mapped.getMapInfo());
    }

    @Test
    void testToggleFlipsOverlay() {
        FakeDisplayItem displayItem = new FakeDisplayItem(Color.RED);
        RegionOfInterest region = addRegion(displayItem);

        regionList.userToggles(region);
        assertFalse(displayItem.on);

        regionList.userToggles(region);
        assertTrue(displayItem.on);
    }

    @Test
    void testSaveCanceledInFirstPrompt() {
        RegionOfInterest region = addRegion();
        prompts.saveChoice = RegionPrompts.SaveChoice.cancel(true);
        prompts.saveFile = Path.of("out.csv");

        regionList.userSaves(region);

        assertTrue(prompts.defaultFiles.isEmpty());
        assertTrue(fixture.exporter.exports.isEmpty());
        assertFalse(manager.isSaved(region));
        assertFalse(fixture.saveDefaults.isIncludeBands());
    }

    @Test
    void testSaveCanceledInFilePrompt() {
        RegionOfInterest region = addRegion();
        prompts.saveChoice = RegionPrompts.SaveChoice.save(true);

        regionList.userSaves(region);

        assertEquals(1, prompts.defaultFiles.size());
        assertTrue(fixture.exporter.exports.isEmpty());
        assertFalse(manager.isSaved(region));
    }

    @Test
    void testSave() {
        RegionOfInterest region = addRegion();
        Path directory = Path.of("exports").toAbsolutePath();
        prompts.saveChoice = RegionPrompts.SaveChoice.save(true);
        prompts.saveFile = directory.resolve("lake");

        regionList.userSaves(region);

        assertEquals(Path.of("regions").toAbsolutePath().resolve("Region 1"), prompts.defaultFiles.get(0));
        assertEquals(List.of(false), prompts.saveIncludeBandsDefaults);

        assertEquals(1, fixture.exporter.exports.size());
        RecordingExporter.Export export = fixture.exporter.exports.get(0);
        assertSame(region, export.region());
        assertEquals(directory.resolve("lake.csv"), export.file());
        assertTrue(export.includeBands());
        assertSame(windowSet.getBandTools(), export.bandTools());
        assertTrue(manager.isSaved(region));

        assertEquals(directory, fixture.saveDefaults.getSaveDirectory());
        assertTrue(fixture.saveDefaults.isIncludeBands());

        // The next save starts from the remembered choices
        RegionOfInterest next = addRegion();
        prompts.saveFile = directory.resolve("pond.csv");
        regionList.userSaves(next);
        assertEquals(directory.resolve("Region 2"), prompts.defaultFiles.get(1));
        assertEquals(List.of(false, true), prompts.saveIncludeBandsDefaults);
        assertEquals(directory.resolve("pond.csv"), fixture.exporter.exports.get(1).file());
    }

    @Test
    void testFailedExportLeavesRegionUnsaved() {
        RegionOfInterest region = addRegion();
        prompts.saveFile = Path.of("out.csv").toAbsolutePath();
        fixture.exporter.failure = new IOException("disk full");

        regionList.userSaves(region);

        assertFalse(manager.isSaved(region));
        assertTrue(manager.isRegistered(region));
    }

    @Test
    void testClosingUnsavedRegionAsksFirst() {
        FakeDisplayItem displayItem = new FakeDisplayItem(Color.RED);
        RegionOfInterest region = addRegion(displayItem);
        prompts.confirmClose = false;

        regionList.userCloses(region);

        assertEquals(List.of(region), prompts.closePrompts);
        assertTrue(manager.isRegistered(region));
        assertEquals(1, regionList.getRowCount());
        assertFalse(displayItem.closed);

        prompts.confirmClose = true;
        regionList.userCloses(region);

        assertFalse(manager.isRegistered(region));
        assertEquals(0, regionList.getRowCount());
        assertTrue(displayItem.closed);
    }

    @Test
    void testClosingSavedRegionDoesNotAsk() {
        RegionOfInterest region = addRegion();
        prompts.saveFile = Path.of("out.csv").toAbsolutePath();
        regionList.userSaves(region);
        prompts.confirmClose = false;

        regionList.userCloses(region);

        assertTrue(prompts.closePrompts.isEmpty());
        assertFalse(manager.isRegistered(region));
    }

    @Test
    void testRowsStayAlignedAfterClose() {
        RegionOfInterest first = addRegion();
        RegionOfInterest second = addRegion();
        RegionOfInterest third = addRegion();

        regionList.userCloses(second);

        assertEquals(List.of(first, third), regionList.rows);
        assertEquals(List.of(first, third), manager.getRegions());

        regionList.userCloses(third);
        assertEquals(List.of(first), regionList.rows);
    }

    @Test
    void testRequestForUnknownRegionIsIgnored() {
        RegionOfInterest region = addRegion();
        regionList.userRequestsStats(region);
        FakePlotWindow stats = fixture.bandStatsWindows().get(0);
        RegionOfInterest stranger = RegionOfInterest.rectangle(0, 0, 1, 1, "");

        regionList.userCloses(stranger);
        regionList.userSaves(stranger);
        regionList.userToggles(stranger);
        regionList.userRequestsStats(stranger);
        regionList.userRenames(stranger, "x");

        assertTrue(prompts.closePrompts.isEmpty());
        assertTrue(prompts.saveIncludeBandsDefaults.isEmpty());
        assertEquals(List.of(region), regionList.rows);
        assertEquals(1, fixture.bandStatsWindows().size());
        assertNull(stats.plotTitle);
        assertEquals(0, stats.clearCount);
    }

    @Test
    void testStaleCloseIsIgnored() {
        RegionOfInterest region = addRegion();
        regionList.userCloses(region);

        regionList.userCloses(region);

        assertEquals(1, prompts.closePrompts.size());
        assertEquals(0, manager.getRegionCount());
    }

    @Test
    void testClosingListDropsEverything() {
        addRegion();
        addRegion();
        AtomicInteger notified = new AtomicInteger();
        manager.addRegionWindowClosedListener(notified::incrementAndGet);

        regionList.userClosesWindow();

        assertEquals(0, manager.getRegionCount());
        assertEquals(0, regionList.getRowCount());
        assertEquals(1, notified.get());
        assertEquals(1, fixture.lastMainWindow().removeAllRegionsCount);

        // Regions drawn afterwards start a new list but keep counting
        RegionOfInterest region = addRegion();
        assertEquals("Region 3", region.getDisplayName());
        assertEquals(1, regionList.getRowCount());
    }

    @Test
    void testRemovedListenerIsNotNotified() {
        AtomicInteger notified = new AtomicInteger();
        Runnable listener = notified::incrementAndGet;
        manager.addRegionWindowClosedListener(listener);
        manager.removeRegionWindowClosedListener(listener);

        regionList.userClosesWindow();

        assertEquals(0, notified.get());
    }
}
