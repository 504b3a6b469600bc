package spectraview.windows.image;

/**
 * Single channel image, addressed with {@link Band#GREY}.
 */
public non-sealed interface GreyscaleImage extends SpectralImage {

    BandDescriptor descriptor();
}
