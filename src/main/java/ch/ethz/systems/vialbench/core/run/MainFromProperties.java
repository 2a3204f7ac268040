package ch.ethz.systems.vialbench.core.run;

import ch.ethz.systems.vialbench.core.config.VBProperties;
import ch.ethz.systems.vialbench.core.log.SimulationLogger;
import ch.ethz.systems.vialbench.core.output.SweepReportWriter;
import ch.ethz.systems.vialbench.core.sim.InjectionSimulator;
import ch.ethz.systems.vialbench.core.sweep.SweepConfiguration;
import ch.ethz.systems.vialbench.core.sweep.SweepRunner;
import ch.ethz.systems.vialbench.core.sweep.SweepSummary;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

public class MainFromProperties {

    /**
     * Main from properties file.
     *
     * @param args  Command line arguments: properties file, then zero or more key=value overrides
     *
     * @throws IOException  If the properties file cannot be read
     */
    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            throw new IllegalArgumentException("Usage: MainFromProperties <run.properties> [key=value ...]");
        }

        VBProperties properties = loadConfiguration(Paths.get(args[0]), Arrays.copyOfRange(args, 1, args.length));
        run(properties, System.out);
    }

    /**
     * Load the properties file, apply overrides and check the keys.
     *
     * @param path          Properties file
     * @param overrides     key=value overrides
     *
     * @return Run configuration
     *
     * @throws IOException  If the properties file cannot be read
     */
    static VBProperties loadConfiguration(Path path, String[] overrides) throws IOException {
        VBProperties properties = VBProperties.fromFile(path);
        properties.applyOverrides(overrides);
        properties.validate();
        return properties;
    }

    /**
     * Run the sweep described by the configuration and print the report.
     *
     * @param properties    Run configuration
     * @param out           Report destination
     *
     * @return Sweep summary
     */
    static SweepSummary run(VBProperties properties, PrintStream out) {
        SimulationLogger.open(properties);
        try {
            SweepConfiguration configuration = SweepConfiguration.fromProperties(properties);
            SimulationLogger.logInfo("LEFTOVER_POLICY", configuration.getLeftoverPolicy().name());

            SweepRunner runner = new SweepRunner(
                    new InjectionSimulator(configuration.getLeftoverPolicy()),
                    configuration.getNumVials(),
                    configuration.getVialVolume()
            );
            long start = System.currentTimeMillis();
            SweepSummary summary = runner.run(configuration.createSweep());
            SimulationLogger.logInfo("SWEEP_DURATION_MS", Long.toString(System.currentTimeMillis() - start));
            if (summary.getAbortedTrials() > 0) {
                SimulationLogger.logWarning("ABORTED_TRIALS", Long.toString(summary.getAbortedTrials()));
            }

            new SweepReportWriter(out).write(summary, configuration.getNumOutcomes());
            return summary;
        } finally {
            SimulationLogger.close();
        }
    }

}
