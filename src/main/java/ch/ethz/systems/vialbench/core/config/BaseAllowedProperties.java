package ch.ethz.systems.vialbench.core.config;

public class BaseAllowedProperties {

    private BaseAllowedProperties() {
        // Private constructor, cannot be constructed
    }

    public static final String[] LOG = new String[]{
            "enable_log_trial_outcomes",
            "enable_log_vial_replacements",
    };

    public static final String[] PROPERTIES_RUN = new String[] {

            // Vials
            "num_vials",
            "vial_volume_ml",

            // Sweep
            "people",
            "dose_rate_step",
            "num_outcomes",

            // Simulator
            "leftover_policy"

    };

    /**
     * Per-person keys are written as {@code person_<name>_<suffix>}.
     */
    public static final String PERSON_PREFIX = "person_";

    public static final String[] PERSON_SUFFIXES = new String[]{
            "_dose_rate_start",
            "_dose_rate_stop",
            "_dose_freqs",
    };

}
