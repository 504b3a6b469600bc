package spectraview.windows;

import spectraview.windows.image.BandTools;
import spectraview.windows.image.ImageTools;
import spectraview.windows.roi.MapInfo;

public class FakeSpectralFile implements SpectralFile {

    public final String name;
    public final FileHeader header;
    public final FakeImages.FakeBandTools bandTools = new FakeImages.FakeBandTools();
    public final FakeImages.FakeImageTools imageTools = new FakeImages.FakeImageTools();

    public FakeSpectralFile(String name) {
        this(name, null);
    }

    public FakeSpectralFile(String name, MapInfo mapInfo) {
        this.name = name;
        this.header = new FileHeader(80, 100, 3, "bsq", mapInfo);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public FileHeader header() {
        return header;
    }

    @Override
    public BandTools createBandTools() {
        return bandTools;
    }

    @Override
    public ImageTools createImageTools() {
        return imageTools;
    }
}
