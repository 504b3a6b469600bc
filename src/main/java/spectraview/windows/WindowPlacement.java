package spectraview.windows;

/**
 * Offsets and sizes used to lay out window sets.
 * <p>
 * Window sets cascade left to right: the first main window opens at
 * {@code (firstX, topY)}, each following one {@code gap} to the right of the
 * previous one. The other windows of a set are placed relative to its main window
 * or its histogram window.
 *
 * @param firstX x of the first window set's main window
 * @param topY y of every window set's main window
 * @param gap horizontal space between consecutive window sets
 * @param zoomOffset offset of the zoom window from the main window, in both directions
 * @param histogramGap vertical space between the main window and the histogram window
 * @param histogramWidth width of the histogram window
 * @param histogramHeight height of the histogram window
 * @param plotOffset offset of the spectral plot window from the histogram window
 * @param statsOffset offset of band stats windows from the histogram window
 * @param plotWidth width of spectral plot and band stats windows
 * @param plotHeight height of spectral plot and band stats windows
 */
public record WindowPlacement(
        double firstX,
        double topY,
        double gap,
        double zoomOffset,
        double histogramGap,
        double histogramWidth,
        double histogramHeight,
        double plotOffset,
        double statsOffset,
        double plotWidth,
        double plotHeight
) {

    private static final WindowPlacement DEFAULTS =
            new WindowPlacement(300, 25, 25, 50, 50, 800, 400, 50, 75, 500, 400);

    public static WindowPlacement defaults() {
        return DEFAULTS;
    }
}
