package spectraview.windows.roi;

/**
 * Georeference of a file, as found in an ENVI style "map info" header entry.
 * <p>
 * The reference pixel is 1-based, as in the header; sample and line arguments
 * to the conversion methods are 0-based.
 *
 * @param projectionName name of the projection
 * @param xReferencePixel reference pixel x (1-based)
 * @param yReferencePixel reference pixel y (1-based)
 * @param xZeroCoordinate map x coordinate of the reference pixel
 * @param yZeroCoordinate map y coordinate of the reference pixel
 * @param xPixelSize pixel size along x, in map units
 * @param yPixelSize pixel size along y, in map units
 * @param units map units
 */
public record MapInfo(
        String projectionName,
        double xReferencePixel,
        double yReferencePixel,
        double xZeroCoordinate,
        double yZeroCoordinate,
        double xPixelSize,
        double yPixelSize,
        String units
) {

    public double toMapX(int sample) {
        return xZeroCoordinate + (sample + 1 - xReferencePixel) * xPixelSize;
    }

    // Map y grows northward while lines grow downward
    public double toMapY(int line) {
        return yZeroCoordinate - (line + 1 - yReferencePixel) * yPixelSize;
    }
}
