package spectraview.windows.roi;

/**
 * A user drawn region of an image.
 * <p>
 * Regions are compared by identity: two regions with the same name and extent
 * are still different regions. The display name is unset until the region is
 * registered with the {@link RegionOfInterestManager}, which assigns one if needed.
 * <p>
 * The extent is stored as parallel arrays of pixel coordinates, one entry per pixel.
 */
public class RegionOfInterest {

    private final int[] xPoints;
    private final int[] yPoints;
    private final int height;
    private final int width;
    private final String description;

    private String displayName;
    private MapInfo mapInfo;

    /**
     * Create a region.
     *
     * @param xPoints sample (column) of each pixel in the region
     * @param yPoints line (row) of each pixel in the region
     * @param height height of the region's bounding box
     * @param width width of the region's bounding box
     * @param description free text description, may be empty
     */
    public RegionOfInterest(int[] xPoints, int[] yPoints, int height, int width, String description) {
        if (xPoints.length != yPoints.length) {
            throw new IllegalArgumentException("x and y points differ in length: "
                    + xPoints.length + " != " + yPoints.length);
        }
        this.xPoints = xPoints.clone();
        this.yPoints = yPoints.clone();
        this.height = height;
        this.width = width;
        this.description = description == null ? "" : description;
    }

    /**
     * Create a rectangular region covering every pixel from {@code (x, y)} inclusive
     * to {@code (x + width, y + height)} exclusive.
     */
    public static RegionOfInterest rectangle(int x, int y, int width, int height, String description) {
        int count = width * height;
        int[] xs = new int[count];
        int[] ys = new int[count];
        int i = 0;
        for (int line = y; line < y + height; line++) {
            for (int sample = x; sample < x + width; sample++) {
                xs[i] = sample;
                ys[i] = line;
                i++;
            }
        }
        return new RegionOfInterest(xs, ys, height, width, description);
    }

    public int[] xPoints() {
        return xPoints.clone();
    }

    public int[] yPoints() {
        return yPoints.clone();
    }

    public int pixelCount() {
        return xPoints.length;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public String description() {
        return description;
    }

    /**
     * @return the display name, or null if the region was never named
     */
    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return the georeference of the file the region was drawn on, or null if the file has none
     */
    public MapInfo getMapInfo() {
        return mapInfo;
    }

    public void setMapInfo(MapInfo mapInfo) {
        this.mapInfo = mapInfo;
    }

    @Override
    public String toString() {
        return String.format("RegionOfInterest[%s %dx%d, %d pixels]",
                displayName, height, width, xPoints.length);
    }
}
