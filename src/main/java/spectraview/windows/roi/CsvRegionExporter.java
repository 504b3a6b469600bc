package spectraview.windows.roi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.image.BandTools;
import spectraview.windows.image.PlotData;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a region as comma separated values.
 * <p>
 * The file starts with {@code #} comment lines naming the region, its description and,
 * if the region is georeferenced, its map info. A header row follows, then one row per
 * pixel: sample and line, the map coordinates if georeferenced, and the value of every
 * band if requested.
 */
public class CsvRegionExporter implements RegionExporter {

    private static final Logger logger = LoggerFactory.getLogger(CsvRegionExporter.class);

    private static final String DELIMITER = ",";

    @Override
    public void export(RegionOfInterest region, BandTools bandTools, Path file, boolean includeBands) throws IOException {
        int[] samples = region.xPoints();
        int[] lines = region.yPoints();
        MapInfo mapInfo = region.getMapInfo();

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write("# name: " + region.getDisplayName());
            writer.newLine();
            writer.write("# description: " + region.description());
            writer.newLine();
            writer.write("# size: " + region.height() + " x " + region.width());
            writer.newLine();
            if (mapInfo != null) {
                writer.write(String.format(Locale.ROOT, "# map info: %s, %s, %s, %s, %s, %s, %s, %s",
                        mapInfo.projectionName(), mapInfo.xReferencePixel(), mapInfo.yReferencePixel(),
                        mapInfo.xZeroCoordinate(), mapInfo.yZeroCoordinate(),
                        mapInfo.xPixelSize(), mapInfo.yPixelSize(), mapInfo.units()));
                writer.newLine();
            }

            List<String> header = new ArrayList<>(List.of("sample", "line"));
            if (mapInfo != null) {
                header.add("x coordinate");
                header.add("y coordinate");
            }

            for (int i = 0; i < samples.length; i++) {
                List<String> row = new ArrayList<>();
                row.add(Integer.toString(samples[i]));
                row.add(Integer.toString(lines[i]));
                if (mapInfo != null) {
                    row.add(format(mapInfo.toMapX(samples[i])));
                    row.add(format(mapInfo.toMapY(lines[i])));
                }
                if (includeBands) {
                    PlotData spectrum = bandTools.spectralPlot(lines[i], samples[i]);
                    // Band columns are named after the first pixel's wavelengths
                    if (i == 0) {
                        for (double wavelength : spectrum.xValues()) {
                            header.add(format(wavelength));
                        }
                    }
                    for (double value : spectrum.yValues()) {
                        row.add(format(value));
                    }
                }
                if (i == 0) {
                    writeRow(writer, header);
                }
                writeRow(writer, row);
            }
            if (samples.length == 0) {
                writeRow(writer, header);
            }
        }
        logger.debug("Wrote {} pixels of region {} to {}", samples.length, region.getDisplayName(), file);
    }

    private static void writeRow(BufferedWriter writer, List<String> values) throws IOException {
        writer.write(String.join(DELIMITER, values));
        writer.newLine();
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
