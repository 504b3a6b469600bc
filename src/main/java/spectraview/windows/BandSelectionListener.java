package spectraview.windows;

import spectraview.windows.events.BandSelectedEvent;
import spectraview.windows.events.RgbSelectedBands;

import java.util.EventListener;

/**
 * Receives the band combinations the user asks to display.
 */
public interface BandSelectionListener extends EventListener {

    void bandSelected(BandSelectedEvent event);

    void rgbSelected(RgbSelectedBands bands);
}
