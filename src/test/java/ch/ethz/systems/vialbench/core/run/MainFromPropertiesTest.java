package ch.ethz.systems.vialbench.core.run;

import ch.ethz.systems.vialbench.core.config.VBProperties;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyNotExistingException;
import ch.ethz.systems.vialbench.core.sim.PersonDosage;
import ch.ethz.systems.vialbench.core.sim.TrialResult;
import ch.ethz.systems.vialbench.core.sweep.NoUsableScheduleException;
import ch.ethz.systems.vialbench.core.sweep.SweepSummary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end sweep over two people: Dana (2.0 or 3.0 mL every 2 days) and
 * Eli (2.0 or 2.5 mL daily, or 4.0 or 5.0 mL every 2 days), two 5 mL vials.
 */
class MainFromPropertiesTest {

    private Path runFile;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() throws URISyntaxException {
        runFile = Paths.get(getClass().getResource("/two_people_sweep.properties").toURI());
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Sweep runs every combination and ranks the results")
    void run_twoPeopleSweep() throws Exception {
        VBProperties properties = MainFromProperties.loadConfiguration(runFile, new String[0]);

        SweepSummary summary = MainFromProperties.run(properties, out);

        assertEquals(8, summary.getTotalTrials());
        assertEquals(0, summary.getAbortedTrials());
        assertEquals(8, summary.getResults().size());

        TrialResult best = summary.getBest();
        assertEquals(0.0, best.getWaste());
        assertEquals(2, best.getDay());
        assertEquals(Arrays.asList(new PersonDosage("Eli", 2.5, 1), new PersonDosage("Dana", 2.0, 2)), best.getRoster());

        TrialResult worst = summary.getResults().get(7);
        assertEquals(3.0, worst.getWaste(), 1e-9);
        assertEquals(Arrays.asList(new PersonDosage("Eli", 4.0, 2), new PersonDosage("Dana", 3.0, 2)), worst.getRoster());

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Optimal outcome: 3"));
        assertFalse(text.contains("Optimal outcome: 4"));
        assertTrue(text.contains("Dana's dosage: 2.00 mL every 2 days"));
    }

    @Test
    @DisplayName("Overrides can make trials invalid, which are counted as aborted")
    void run_withSmallerVials_abortsOversizedDoses() throws Exception {
        VBProperties properties = MainFromProperties.loadConfiguration(runFile, new String[]{"vial_volume_ml=4.0"});

        SweepSummary summary = MainFromProperties.run(properties, out);

        // Eli at 2.5 mL/day every 2 days needs 5.0 mL
        assertEquals(2, summary.getAbortedTrials());
        assertEquals(6, summary.getResults().size());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).startsWith("2 trials were aborted."));
    }

    @Test
    @DisplayName("A sweep where nothing fits is fatal")
    void run_nothingFits_throws() throws Exception {
        VBProperties properties = MainFromProperties.loadConfiguration(runFile, new String[]{"vial_volume_ml=1.0"});

        assertThrows(NoUsableScheduleException.class, () -> MainFromProperties.run(properties, out));
    }

    @Test
    @DisplayName("Unknown override keys are rejected on load")
    void loadConfiguration_unknownKey_throws() {
        assertThrows(PropertyNotExistingException.class,
                () -> MainFromProperties.loadConfiguration(runFile, new String[]{"vials=3"}));
    }

    @Test
    @DisplayName("Main needs a properties file")
    void main_withoutArguments_throws() {
        assertThrows(IllegalArgumentException.class, () -> MainFromProperties.main(new String[0]));
    }

}
