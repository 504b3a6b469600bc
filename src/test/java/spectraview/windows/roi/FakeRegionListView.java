package spectraview.windows.roi;

import javafx.scene.paint.Color;

import java.util.ArrayList;
import java.util.List;

/**
 * Region list keeping its rows in memory; user requests are made with the {@code user*} methods.
 */
public class FakeRegionListView implements RegionListView {

    public final List<RegionOfInterest> rows = new ArrayList<>();
    public final List<Color> colors = new ArrayList<>();

    public RegionListListener listener;
    public boolean showing;
    public int showCount;

    public void userToggles(RegionOfInterest region) {
        listener.regionToggled(new RegionToggleEvent(region));
    }

    public void userRenames(RegionOfInterest region, String newName) {
        region.setDisplayName(newName);
        listener.regionNameChanged(new RegionNameChangeEvent(region));
    }

    public void userRequestsStats(RegionOfInterest region) {
        listener.statsRequested(new RegionStatsEvent(region));
    }

    public void userSaves(RegionOfInterest region) {
        listener.regionSaveRequested(new RegionSaveEvent(region));
    }

    public void userCloses(RegionOfInterest region) {
        listener.regionCloseRequested(new RegionCloseEvent(region));
    }

    public void userClosesWindow() {
        showing = false;
        listener.listWindowClosed();
    }

    @Override
    public void addItem(RegionOfInterest region, Color color) {
        rows.add(region);
        colors.add(color);
    }

    @Override
    public int indexOf(RegionOfInterest region) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i) == region) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public void removeRow(int row) {
        rows.remove(row);
        colors.remove(row);
    }

    @Override
    public void removeAll() {
        rows.clear();
        colors.clear();
    }

    @Override
    public int getRowCount() {
        return rows.size();
    }

    @Override
    public boolean isShowing() {
        return showing;
    }

    @Override
    public void show() {
        showing = true;
        showCount++;
    }

    @Override
    public void setRegionListListener(RegionListListener listener) {
        this.listener = listener;
    }
}
