package ch.ethz.systems.vialbench.core.sim.leftover;

import java.util.Locale;

/**
 * Selects how leftover fragments are stored.
 */
public enum LeftoverPolicy {

    /**
     * At most one fragment; a newer one overwrites the older.
     */
    SINGLE_SLOT,

    /**
     * Any number of fragments, served smallest-fit first.
     */
    SMALLEST_FIT;

    /**
     * @return A fresh, empty pool for one trial
     */
    public ILeftoverPool createPool() {
        switch (this) {
            case SINGLE_SLOT:
                return new SingleSlotLeftoverPool();
            case SMALLEST_FIT:
                return new SmallestFitLeftoverPool();
            default:
                throw new IllegalStateException("Unknown leftover policy: " + this);
        }
    }

    /**
     * Parse a configuration value such as {@code single_slot} or {@code smallest-fit}.
     *
     * @param value     Configuration value
     *
     * @return Policy
     */
    public static LeftoverPolicy fromConfigValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LeftoverPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown leftover policy: " + value);
    }

}
