package spectraview.windows.ui;

import javafx.scene.control.Alert;
import javafx.scene.control.ButtonBar;
import javafx.scene.control.ButtonType;
import javafx.scene.control.CheckBox;
import javafx.scene.control.Label;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.roi.RegionOfInterest;
import spectraview.windows.roi.RegionPrompts;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * JavaFX dialogs shown while saving and closing regions, owned by the region list window.
 */
public class RegionDialogs implements RegionPrompts {

    private static final Logger logger = LoggerFactory.getLogger(RegionDialogs.class);

    private static final ButtonType SAVE = new ButtonType("Save", ButtonBar.ButtonData.OK_DONE);

    private static final FileChooser.ExtensionFilter CSV_FILTER =
            new FileChooser.ExtensionFilter("CSV files (*.csv)", "*.csv");

    private final RegionListWindow owner;

    public RegionDialogs(RegionListWindow owner) {
        this.owner = owner;
    }

    @Override
    public SaveChoice promptSave(RegionOfInterest region, boolean includeBandsDefault) {
        CheckBox checkBox = new CheckBox("Include bands?");
        checkBox.setSelected(includeBandsDefault);

        VBox content = new VBox(10, createContentLabel("Save region '" + region.getDisplayName() + "'?"), checkBox);

        Alert dialog = new Alert(Alert.AlertType.CONFIRMATION, null, ButtonType.CANCEL, SAVE);
        dialog.initOwner(owner.getWindow());
        dialog.setTitle("Save region");
        dialog.setHeaderText(null);
        dialog.getDialogPane().setContent(content);

        ButtonType result = dialog.showAndWait().orElse(ButtonType.CANCEL);
        boolean includeBands = checkBox.isSelected();
        logger.debug("Save dialog result: {}, is checked: {}", result.getText(), includeBands);
        return result == SAVE ? SaveChoice.save(includeBands) : SaveChoice.cancel(includeBands);
    }

    @Override
    public Optional<Path> promptSaveFile(Path defaultFile) {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Save region");
        chooser.getExtensionFilters().add(CSV_FILTER);

        Path directory = defaultFile.getParent();
        if (directory != null && Files.isDirectory(directory)) {
            chooser.setInitialDirectory(directory.toFile());
        }
        if (defaultFile.getFileName() != null) {
            chooser.setInitialFileName(defaultFile.getFileName().toString());
        }

        File file = chooser.showSaveDialog(owner.getWindow());
        return file == null ? Optional.empty() : Optional.of(file.toPath());
    }

    @Override
    public boolean confirmClose(RegionOfInterest region) {
        Alert dialog = new Alert(Alert.AlertType.CONFIRMATION, null, ButtonType.CANCEL, ButtonType.YES);
        dialog.initOwner(owner.getWindow());
        dialog.setTitle("Close region");
        dialog.setHeaderText(null);
        dialog.getDialogPane().setContent(createContentLabel(
                "Are you sure you want close the unsaved region '" + region.getDisplayName() + "'?  It will be lost."));

        ButtonType result = dialog.showAndWait().orElse(ButtonType.CANCEL);
        logger.debug("Close dialog result: {}", result.getText());
        return result == ButtonType.YES;
    }

    /**
     * Wrapping label that keeps its preferred size, so long names are not cut off with an ellipsis.
     */
    private static Label createContentLabel(String text) {
        var label = new Label(text);
        label.setMaxWidth(Double.MAX_VALUE);
        label.setMaxHeight(Double.MAX_VALUE);
        label.setMinSize(Label.USE_PREF_SIZE, Label.USE_PREF_SIZE);
        label.setWrapText(true);
        label.setPrefWidth(360);
        return label;
    }
}
