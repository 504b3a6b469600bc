package spectraview.windows.roi;

import spectraview.windows.image.BandTools;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a region to a delimited text file.
 */
@FunctionalInterface
public interface RegionExporter {

    /**
     * @param region the region to write
     * @param bandTools band data of the file the region was drawn on
     * @param file destination file, overwritten if present
     * @param includeBands whether to write every band's value for each pixel
     * @throws IOException if the file cannot be written
     */
    void export(RegionOfInterest region, BandTools bandTools, Path file, boolean includeBands) throws IOException;
}
