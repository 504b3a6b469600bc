package spectraview.windows.ui;

import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.ContextMenu;
import javafx.scene.control.Label;
import javafx.scene.control.MenuItem;
import javafx.scene.control.SelectionMode;
import javafx.scene.control.SeparatorMenuItem;
import javafx.scene.control.TableCell;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableView;
import javafx.scene.control.Tooltip;
import javafx.scene.control.cell.TextFieldTableCell;
import javafx.scene.layout.BorderPane;
import javafx.scene.paint.Color;
import javafx.stage.Modality;
import javafx.stage.Stage;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.roi.RegionCloseEvent;
import spectraview.windows.roi.RegionListListener;
import spectraview.windows.roi.RegionListView;
import spectraview.windows.roi.RegionNameChangeEvent;
import spectraview.windows.roi.RegionOfInterest;
import spectraview.windows.roi.RegionSaveEvent;
import spectraview.windows.roi.RegionStatsEvent;
import spectraview.windows.roi.RegionToggleEvent;

import java.util.function.Consumer;

/**
 * The shared "Region of Interest" window, listing every open region.
 * <p>
 * Each row shows the region's color, name, size and description. The name can be
 * edited in place. A context menu on a row offers:
 * <ul>
 *   <li>Toggle the region's overlay</li>
 *   <li>Show band stats for the region</li>
 *   <li>Save the region</li>
 *   <li>Close the region</li>
 * </ul>
 * The stage is created the first time it is shown, so rows may be added before that.
 * Closing the window is reported to the listener and only hides the stage, which is reused.
 */
public class RegionListWindow implements RegionListView {

    private static final Logger logger = LoggerFactory.getLogger(RegionListWindow.class);

    private static final String TITLE = "Region of Interest";

    private final ObservableList<RegionRow> rows = FXCollections.observableArrayList();

    private RegionListListener listener;
    private Stage stage;
    private TableView<RegionRow> table;

    @Override
    public void setRegionListListener(RegionListListener listener) {
        this.listener = listener;
    }

    @Override
    public void addItem(RegionOfInterest region, Color color) {
        rows.add(new RegionRow(region, color));
        logger.debug("Added row {} for region {}", rows.size() - 1, region.getDisplayName());
    }

    @Override
    public int indexOf(RegionOfInterest region) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).region() == region) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public void removeRow(int row) {
        rows.remove(row);
        if (table != null) {
            table.getSelectionModel().clearSelection();
        }
    }

    @Override
    public void removeAll() {
        rows.clear();
    }

    @Override
    public int getRowCount() {
        return rows.size();
    }

    @Override
    public boolean isShowing() {
        return stage != null && stage.isShowing();
    }

    @Override
    public void show() {
        if (stage == null) {
            stage = createStage();
        }
        if (!stage.isShowing()) {
            stage.show();
        }
        stage.toFront();
    }

    /**
     * @return the stage, or null if the window was never shown
     */
    public Window getWindow() {
        return stage;
    }

    private Stage createStage() {
        Stage regionStage = new Stage();
        regionStage.initModality(Modality.NONE);
        regionStage.setTitle(TITLE);
        regionStage.setMinWidth(400);
        regionStage.setMinHeight(200);

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(5));
        table = createTable();
        root.setCenter(table);

        regionStage.setScene(new Scene(root, 500, 300));

        // Closing only hides the stage; every region is dropped with it
        regionStage.setOnCloseRequest(e -> {
            logger.debug("Region list window closed");
            fire(RegionListListener::listWindowClosed);
        });
        return regionStage;
    }

    private TableView<RegionRow> createTable() {
        TableView<RegionRow> tableView = new TableView<>(rows);
        tableView.setEditable(true);
        tableView.getSelectionModel().setSelectionMode(SelectionMode.SINGLE);
        tableView.setColumnResizePolicy(TableView.CONSTRAINED_RESIZE_POLICY);
        tableView.setPlaceholder(new Label("Draw a region in an image window to add it here."));

        TableColumn<RegionRow, Color> colorColumn = new TableColumn<>("Color");
        colorColumn.setCellValueFactory(data -> new ReadOnlyObjectWrapper<>(data.getValue().color()));
        colorColumn.setCellFactory(column -> new ColorCell());
        colorColumn.setSortable(false);
        colorColumn.setMaxWidth(60);
        colorColumn.setMinWidth(40);

        TableColumn<RegionRow, String> nameColumn = new TableColumn<>("Name");
        nameColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(data.getValue().region().getDisplayName()));
        nameColumn.setCellFactory(TextFieldTableCell.forTableColumn());
        nameColumn.setSortable(false);
        nameColumn.setOnEditCommit(e -> {
            RegionOfInterest region = e.getRowValue().region();
            String newName = e.getNewValue();
            if (newName == null || newName.isBlank()) {
                tableView.refresh();
                return;
            }
            logger.debug("Region {} renamed to {}", region.getDisplayName(), newName);
            region.setDisplayName(newName);
            fire(l -> l.regionNameChanged(new RegionNameChangeEvent(region)));
        });

        TableColumn<RegionRow, String> sizeColumn = new TableColumn<>("Size (h x w)");
        sizeColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(
                data.getValue().region().height() + " x " + data.getValue().region().width()));
        sizeColumn.setSortable(false);

        TableColumn<RegionRow, String> descriptionColumn = new TableColumn<>("Description");
        descriptionColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(data.getValue().region().description()));
        descriptionColumn.setSortable(false);

        tableView.getColumns().add(colorColumn);
        tableView.getColumns().add(nameColumn);
        tableView.getColumns().add(sizeColumn);
        tableView.getColumns().add(descriptionColumn);

        tableView.setContextMenu(createContextMenu(tableView));
        return tableView;
    }

    private ContextMenu createContextMenu(TableView<RegionRow> tableView) {
        ContextMenu menu = new ContextMenu();

        MenuItem toggleItem = new MenuItem("Toggle");
        toggleItem.setOnAction(e -> {
            RegionRow selected = tableView.getSelectionModel().getSelectedItem();
            if (selected != null) {
                logger.debug("Toggle region: {}", selected.region().getDisplayName());
                fire(l -> l.regionToggled(new RegionToggleEvent(selected.region())));
            }
        });

        MenuItem statsItem = new MenuItem("Band stats");
        statsItem.setOnAction(e -> {
            RegionRow selected = tableView.getSelectionModel().getSelectedItem();
            if (selected != null) {
                logger.debug("Band stats region: {}", selected.region().getDisplayName());
                fire(l -> l.statsRequested(new RegionStatsEvent(selected.region())));
            }
        });

        MenuItem saveItem = new MenuItem("Save");
        saveItem.setOnAction(e -> {
            RegionRow selected = tableView.getSelectionModel().getSelectedItem();
            if (selected != null) {
                logger.debug("Save region: {}", selected.region().getDisplayName());
                fire(l -> l.regionSaveRequested(new RegionSaveEvent(selected.region())));
            }
        });

        MenuItem closeItem = new MenuItem("Close");
        closeItem.setOnAction(e -> {
            RegionRow selected = tableView.getSelectionModel().getSelectedItem();
            if (selected != null) {
                logger.debug("Close region: {}", selected.region().getDisplayName());
                fire(l -> l.regionCloseRequested(new RegionCloseEvent(selected.region())));
            }
        });

        // Disable items when no row is selected
        menu.setOnShowing(e -> {
            boolean hasSelection = tableView.getSelectionModel().getSelectedItem() != null;
            toggleItem.setDisable(!hasSelection);
            statsItem.setDisable(!hasSelection);
            saveItem.setDisable(!hasSelection);
            closeItem.setDisable(!hasSelection);
        });

        menu.getItems().addAll(toggleItem, statsItem, new SeparatorMenuItem(), saveItem, closeItem);
        return menu;
    }

    private void fire(Consumer<RegionListListener> action) {
        if (listener != null) {
            action.accept(listener);
        } else {
            logger.warn("No listener for region list events");
        }
    }

    private record RegionRow(RegionOfInterest region, Color color) {
    }

    /**
     * Cell showing a color swatch.
     */
    private static class ColorCell extends TableCell<RegionRow, Color> {

        ColorCell() {
            setAlignment(Pos.CENTER);
        }

        @Override
        protected void updateItem(Color color, boolean empty) {
            super.updateItem(color, empty);

            if (empty || color == null) {
                setText(null);
                setStyle("");
                setTooltip(null);
                return;
            }

            String web = toWeb(color);
            setText("...");
            setStyle("-fx-background-color: " + web + "; -fx-font-weight: bold;");
            setTooltip(new Tooltip(web));
        }

        private static String toWeb(Color color) {
            return String.format("#%02x%02x%02x",
                    (int) Math.round(color.getRed() * 255),
                    (int) Math.round(color.getGreen() * 255),
                    (int) Math.round(color.getBlue() * 255));
        }
    }
}
