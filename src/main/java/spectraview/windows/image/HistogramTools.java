package spectraview.windows.image;

/**
 * Histograms of one image's channels.
 */
public interface HistogramTools {

    /**
     * Histogram of the raw band data feeding a channel.
     */
    HistogramData rawHistogram(Band band);

    /**
     * Histogram of a channel after its cutoffs were applied.
     */
    HistogramData adjustedHistogram(Band band);
}
