package spectraview.windows.image;

/**
 * Intensity histogram of one channel.
 *
 * @param title histogram title
 * @param binCenters bin centers
 * @param counts pixel count per bin
 * @param lowerLimit current low cutoff
 * @param upperLimit current high cutoff
 */
public record HistogramData(String title, double[] binCenters, double[] counts, double lowerLimit, double upperLimit) {
}
