package spectraview.windows;

import spectraview.windows.roi.MapInfo;

/**
 * Header facts of an opened spectral file.
 *
 * @param lines number of lines (rows)
 * @param samples number of samples (columns)
 * @param bandCount number of bands
 * @param interleave data interleave, e.g. "bsq", "bil" or "bip"
 * @param mapInfo georeference, or null if the file has none
 */
public record FileHeader(int lines, int samples, int bandCount, String interleave, MapInfo mapInfo) {

    /**
     * Multi line description for debug logging.
     */
    public String dump() {
        return String.format("lines: %d%nsamples: %d%nbands: %d%ninterleave: %s%nmap info: %s",
                lines, samples, bandCount, interleave, mapInfo);
    }
}
