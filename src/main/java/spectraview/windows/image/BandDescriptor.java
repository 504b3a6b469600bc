package spectraview.windows.image;

/**
 * Identifies one band of an opened file.
 *
 * @param fileName name of the file the band belongs to
 * @param bandName band name from the file header
 * @param wavelengthLabel wavelength of the band, formatted for display
 */
public record BandDescriptor(String fileName, String bandName, String wavelengthLabel) {

    /**
     * Label used for window titles.
     */
    public String label() {
        return fileName + ": " + bandName + " - " + wavelengthLabel;
    }
}
