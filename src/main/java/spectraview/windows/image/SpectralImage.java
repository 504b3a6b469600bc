package spectraview.windows.image;

/**
 * A displayable image derived from one or three bands of a spectral cube.
 * <p>
 * The image keeps low and high cutoffs per channel and derives its displayed
 * pixel data from them when {@link #adjust()} is called.
 */
public sealed interface SpectralImage permits GreyscaleImage, RgbImage {

    String label();

    int width();

    int height();

    void setLowCutoff(double value, Band band);

    void setHighCutoff(double value, Band band);

    /**
     * Restore the default stretch for every channel.
     */
    void resetStretch();

    /**
     * Recompute the displayed pixel data from the current cutoffs.
     */
    void adjust();
}
