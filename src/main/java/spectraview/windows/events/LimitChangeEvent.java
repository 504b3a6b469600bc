package spectraview.windows.events;

import spectraview.windows.image.Band;

/**
 * Cutoff limits of one channel were moved in a histogram window.
 * Either limit may be missing when only the other one moved.
 *
 * @param band the channel
 * @param lowerLimit new low cutoff, or null if unchanged
 * @param upperLimit new high cutoff, or null if unchanged
 */
public record LimitChangeEvent(Band band, Double lowerLimit, Double upperLimit) {

    public boolean hasLowerLimitChange() {
        return lowerLimit != null;
    }

    public boolean hasUpperLimitChange() {
        return upperLimit != null;
    }
}
