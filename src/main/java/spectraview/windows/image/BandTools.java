package spectraview.windows.image;

/**
 * Query object over the bands of one opened file.
 */
public interface BandTools {

    /**
     * Get the spectral curve of a pixel across all bands.
     *
     * @param line row of the pixel
     * @param sample column of the pixel
     */
    PlotData spectralPlot(int line, int sample);

    /**
     * Get mean, min, max and mean &plusmn; one standard deviation across a set of pixels.
     *
     * @param lines row of each pixel
     * @param samples column of each pixel, same length as {@code lines}
     * @param title title for the resulting traces
     */
    BandStatistics statisticsPlot(int[] lines, int[] samples, String title);
}
