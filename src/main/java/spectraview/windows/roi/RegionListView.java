package spectraview.windows.roi;

import javafx.scene.paint.Color;

/**
 * The single list of open regions shown to the user.
 * <p>
 * Rows are kept in the order regions were added. User requests made on a row
 * are reported to the {@link RegionListListener}.
 */
public interface RegionListView {

    /**
     * Append a row showing the region's name, color swatch, size and description.
     */
    void addItem(RegionOfInterest region, Color color);

    /**
     * @return the row currently showing the region, or -1 if there is none
     */
    int indexOf(RegionOfInterest region);

    void removeRow(int row);

    void removeAll();

    int getRowCount();

    boolean isShowing();

    void show();

    void setRegionListListener(RegionListListener listener);
}
