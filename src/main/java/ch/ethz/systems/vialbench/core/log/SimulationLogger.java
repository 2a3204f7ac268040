package ch.ethz.systems.vialbench.core.log;

import ch.ethz.systems.vialbench.core.config.VBProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Run-level logging facade. Information about the run setup and its outcome
 * is written as {@code KEY: value} lines to the "simulation" logger; the
 * optional per-trial and per-replacement logs are switched on through
 * properties and written at debug level.
 */
public class SimulationLogger {

    private static final Logger logger = LogManager.getLogger("simulation");

    private static boolean logTrialOutcomes = false;
    private static boolean logVialReplacements = false;

    private SimulationLogger() {
        // Only static class
    }

    /**
     * Read the log switches from the configuration and record it.
     *
     * @param configuration     Run configuration
     */
    public static void open(VBProperties configuration) {
        logTrialOutcomes = configuration.getBooleanPropertyWithDefault("enable_log_trial_outcomes", false);
        logVialReplacements = configuration.getBooleanPropertyWithDefault("enable_log_vial_replacements", false);
        logger.info("Run configuration:\n{}", configuration.getAllPropertiesToString());
    }

    /**
     * Reset the log switches, e.g. between tests.
     */
    public static void close() {
        logTrialOutcomes = false;
        logVialReplacements = false;
    }

    public static void logInfo(String key, String value) {
        logger.info("{}: {}", key, value);
    }

    public static void logWarning(String key, String value) {
        logger.warn("{}: {}", key, value);
    }

    public static void logTrialOutcome(String message) {
        if (logTrialOutcomes) {
            logger.info("TRIAL {}", message);
        }
    }

    public static void logVialReplacement(int day, String message) {
        if (logVialReplacements) {
            logger.info("DAY {} {}", day, message);
        }
    }

    public static boolean isTrialOutcomeLoggingEnabled() {
        return logTrialOutcomes;
    }

    public static boolean isVialReplacementLoggingEnabled() {
        return logVialReplacements;
    }

}
