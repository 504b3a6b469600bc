package spectraview.windows.image;

/**
 * Three channel image, addressed with {@link Band#RED}, {@link Band#GREEN} and {@link Band#BLUE}.
 */
public non-sealed interface RgbImage extends SpectralImage {

    BandDescriptor descriptor(Band band);
}
