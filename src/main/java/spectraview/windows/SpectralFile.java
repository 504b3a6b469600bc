package spectraview.windows;

import spectraview.windows.image.BandTools;
import spectraview.windows.image.ImageTools;

/**
 * An opened hyperspectral cube.
 */
public interface SpectralFile {

    /**
     * Name identifying the file; no two open files share a name.
     */
    String name();

    FileHeader header();

    BandTools createBandTools();

    ImageTools createImageTools();
}
