package spectraview.windows.roi;

import javafx.scene.paint.Color;

public class FakeDisplayItem implements RegionDisplayItem {

    public final Color color;
    public boolean on = true;
    public boolean closed;

    public FakeDisplayItem(Color color) {
        this.color = color;
    }

    @Override
    public Color getColor() {
        return color;
    }

    @Override
    public boolean isOn() {
        return on;
    }

    @Override
    public void setOn(boolean on) {
        this.on = on;
    }

    @Override
    public void close() {
        closed = true;
    }
}
