package spectraview.windows.roi;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Modal prompts shown while saving or closing regions.
 * Each call blocks until the user answers.
 */
public interface RegionPrompts {

    /**
     * Ask whether to save a region.
     *
     * @param region the region to save
     * @param includeBandsDefault initial state of the "include bands" check box
     */
    SaveChoice promptSave(RegionOfInterest region, boolean includeBandsDefault);

    /**
     * Ask for the file to save a region to.
     *
     * @param defaultFile file offered initially
     * @return the chosen file, or empty if the user cancelled
     */
    Optional<Path> promptSaveFile(Path defaultFile);

    /**
     * Ask to confirm closing a region that was never saved.
     *
     * @return true if the region should be closed
     */
    boolean confirmClose(RegionOfInterest region);

    /**
     * Answer to {@link #promptSave(RegionOfInterest, boolean)}.
     *
     * @param confirmed true if the user chose to save
     * @param includeBands state of the "include bands" check box when the prompt closed
     */
    record SaveChoice(boolean confirmed, boolean includeBands) {

        public static SaveChoice cancel(boolean includeBands) {
            return new SaveChoice(false, includeBands);
        }

        public static SaveChoice save(boolean includeBands) {
            return new SaveChoice(true, includeBands);
        }
    }
}
