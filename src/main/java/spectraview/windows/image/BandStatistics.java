package spectraview.windows.image;

/**
 * Per band statistics across the pixels of a region, one trace per statistic.
 */
public record BandStatistics(PlotData mean, PlotData min, PlotData max, PlotData plusOneStd, PlotData minusOneStd) {
}
