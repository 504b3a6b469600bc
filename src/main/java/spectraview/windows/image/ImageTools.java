package spectraview.windows.image;

/**
 * Derives displayable images from the bands of one opened file.
 */
public interface ImageTools {

    GreyscaleImage greyscaleImage(int band, BandDescriptor descriptor);

    RgbImage rgbImage(int redBand, int greenBand, int blueBand,
                      BandDescriptor red, BandDescriptor green, BandDescriptor blue);

    HistogramTools histogramTools(SpectralImage image);
}
