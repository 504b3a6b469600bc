package spectraview.windows;

import javafx.geometry.Rectangle2D;
import spectraview.windows.events.LimitChangeEvent;
import spectraview.windows.image.Band;
import spectraview.windows.image.HistogramData;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class FakeHistogramWindow implements HistogramWindow {

    public final ImageWindow owner;
    public final List<HistogramListener> listeners = new ArrayList<>();

    public final Map<Band, HistogramData> rawData = new EnumMap<>(Band.class);
    public final Map<Band, HistogramData> adjustedData = new EnumMap<>(Band.class);
    public final List<Band> controls = new ArrayList<>();
    public final List<Band> adjustedUpdates = new ArrayList<>();
    public final List<Band> limitUpdates = new ArrayList<>();

    public Rectangle2D bounds = Rectangle2D.EMPTY;
    public boolean showing;
    public boolean closed;

    public FakeHistogramWindow(ImageWindow owner) {
        this.owner = owner;
    }

    public void fireLimitChange(LimitChangeEvent event) {
        for (HistogramListener listener : new ArrayList<>(listeners)) {
            listener.limitChanged(event);
        }
    }

    public void fireLimitsReset() {
        for (HistogramListener listener : new ArrayList<>(listeners)) {
            listener.limitsReset();
        }
    }

    @Override
    public void createPlotControl(HistogramData raw, HistogramData adjusted, Band band) {
        controls.add(band);
        rawData.put(band, raw);
        adjustedData.put(band, adjusted);
    }

    @Override
    public void setAdjustedData(HistogramData adjusted, Band band) {
        adjustedUpdates.add(band);
        adjustedData.put(band, adjusted);
    }

    @Override
    public void updateLimits(HistogramData raw, Band band) {
        limitUpdates.add(band);
        rawData.put(band, raw);
    }

    @Override
    public void addHistogramListener(HistogramListener listener) {
        listeners.add(listener);
    }

    @Override
    public void setBounds(double x, double y, double width, double height) {
        bounds = new Rectangle2D(x, y, width, height);
    }

    @Override
    public Rectangle2D getBounds() {
        return bounds;
    }

    @Override
    public void show() {
        showing = true;
    }

    @Override
    public void close() {
        closed = true;
        showing = false;
    }
}
