package spectraview.windows;

import spectraview.windows.events.LimitChangeEvent;

import java.util.EventListener;

/**
 * Receives cutoff changes made in a {@link HistogramWindow}.
 */
public interface HistogramListener extends EventListener {

    void limitChanged(LimitChangeEvent event);

    void limitsReset();
}
