package spectraview.windows.image;

import org.junit.jupiter.api.Test;
import spectraview.windows.FakeImages;
import spectraview.windows.ImageFormat;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TestBand {

    private static final BandDescriptor RED = new BandDescriptor("cube.hdr", "Band 3", "650 nm");
    private static final BandDescriptor GREEN = new BandDescriptor("cube.hdr", "Band 2", "550 nm");
    private static final BandDescriptor BLUE = new BandDescriptor("cube.hdr", "Band 1", "450 nm");

    @Test
    void testChannels() {
        assertEquals(List.of(Band.GREY), Band.channelsOf(new FakeImages.FakeGreyscaleImage(RED)));
        assertEquals(List.of(Band.RED, Band.GREEN, Band.BLUE),
                Band.channelsOf(new FakeImages.FakeRgbImage(RED, GREEN, BLUE)));
    }

    @Test
    void testImageFormat() {
        assertEquals(ImageFormat.GREYSCALE_8, ImageFormat.of(new FakeImages.FakeGreyscaleImage(RED)));
        assertEquals(ImageFormat.RGB_32, ImageFormat.of(new FakeImages.FakeRgbImage(RED, GREEN, BLUE)));
    }

    @Test
    void testDescriptorLabel() {
        assertEquals("cube.hdr: Band 3 - 650 nm", RED.label());
    }

    @Test
    void testPlotDataLengthsMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new PlotData("t", new double[] {1, 2}, new double[] {1}, "x", "y", null));
    }
}
