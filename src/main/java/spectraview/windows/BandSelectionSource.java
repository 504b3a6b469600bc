package spectraview.windows;

import spectraview.windows.image.BandTools;

/**
 * The band browser listing the bands of every open file.
 */
public interface BandSelectionSource {

    /**
     * List a newly opened file's bands.
     */
    void addFile(String fileName, int bandCount, BandTools bandTools);

    void addBandSelectionListener(BandSelectionListener listener);
}
