package spectraview.windows.roi;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Choices remembered between region saves: the last directory saved to and
 * the last state of the "include bands" check box.
 */
public class RegionSaveDefaults {

    private Path saveDirectory;
    private boolean includeBands;
    private final Consumer<RegionSaveDefaults> onChange;

    public RegionSaveDefaults(Path saveDirectory, boolean includeBands) {
        this(saveDirectory, includeBands, defaults -> {});
    }

    /**
     * Create defaults that report every change, e.g. to store them as preferences.
     */
    public RegionSaveDefaults(Path saveDirectory, boolean includeBands, Consumer<RegionSaveDefaults> onChange) {
        this.saveDirectory = Objects.requireNonNull(saveDirectory);
        this.includeBands = includeBands;
        this.onChange = Objects.requireNonNull(onChange);
    }

    /**
     * The user's download directory, used when nothing was saved yet.
     */
    public static Path defaultSaveDirectory() {
        return Path.of(System.getProperty("user.home"), "Downloads");
    }

    public Path getSaveDirectory() {
        return saveDirectory;
    }

    public void setSaveDirectory(Path saveDirectory) {
        if (!saveDirectory.equals(this.saveDirectory)) {
            this.saveDirectory = saveDirectory;
            onChange.accept(this);
        }
    }

    public boolean isIncludeBands() {
        return includeBands;
    }

    public void setIncludeBands(boolean includeBands) {
        if (includeBands != this.includeBands) {
            this.includeBands = includeBands;
            onChange.accept(this);
        }
    }

    @Override
    public String toString() {
        return "RegionSaveDefaults[" + saveDirectory + ", includeBands=" + includeBands + "]";
    }
}
