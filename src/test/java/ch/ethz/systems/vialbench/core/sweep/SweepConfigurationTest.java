package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.config.VBProperties;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.vialbench.core.sim.leftover.LeftoverPolicy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SweepConfigurationTest {

    @Mock
    private VBProperties mockConfig;

    @BeforeEach
    void setUp() {
        // Defaults for every optional key
        when(mockConfig.getIntegerPropertyWithDefault(anyString(), anyInt())).thenAnswer(i -> i.getArgument(1));
        when(mockConfig.getDoublePropertyWithDefault(anyString(), anyDouble())).thenAnswer(i -> i.getArgument(1));
        when(mockConfig.getPropertyWithDefault(anyString(), any())).thenAnswer(i -> i.getArgument(1));

        when(mockConfig.getListProperty("people")).thenReturn(Arrays.asList("Alice", "Bob"));
        when(mockConfig.getDoublePropertyOrFail("person_Alice_dose_rate_start")).thenReturn(0.038);
        when(mockConfig.getDoublePropertyOrFail("person_Alice_dose_rate_stop")).thenReturn(0.042);
        when(mockConfig.getIntegerListPropertyOrFail("person_Alice_dose_freqs")).thenReturn(new int[]{7, 8});
        when(mockConfig.getDoublePropertyOrFail("person_Bob_dose_rate_start")).thenReturn(0.06);
        when(mockConfig.getDoublePropertyOrFail("person_Bob_dose_rate_stop")).thenReturn(0.063);
        when(mockConfig.getIntegerListPropertyOrFail("person_Bob_dose_freqs")).thenReturn(new int[]{4, 5});
    }

    @Test
    @DisplayName("Defaults apply when optional keys are absent")
    void fromProperties_defaults() {
        SweepConfiguration configuration = SweepConfiguration.fromProperties(mockConfig);

        assertEquals(SweepConfiguration.DEFAULT_NUM_VIALS, configuration.getNumVials());
        assertEquals(SweepConfiguration.DEFAULT_VIAL_VOLUME_ML, configuration.getVialVolume());
        assertEquals(SweepConfiguration.DEFAULT_DOSE_RATE_STEP, configuration.getDoseRateStep());
        assertEquals(SweepConfiguration.DEFAULT_NUM_OUTCOMES, configuration.getNumOutcomes());
        assertEquals(LeftoverPolicy.SINGLE_SLOT, configuration.getLeftoverPolicy());
    }

    @Test
    @DisplayName("Per-person ranges are read in configured order")
    void fromProperties_people() {
        SweepConfiguration configuration = SweepConfiguration.fromProperties(mockConfig);

        assertEquals(2, configuration.getPeople().size());
        assertEquals("Alice", configuration.getPeople().get(0).getName());
        assertEquals(5, configuration.getPeople().get(0).getDoseRates().length);
        assertEquals(4, configuration.getPeople().get(1).getDoseRates().length);
        assertArrayEquals(new int[]{4, 5}, configuration.getPeople().get(1).getFrequencies());
        // (5 * 2) * (4 * 2)
        assertEquals(80, configuration.createSweep().size());
    }

    @Test
    @DisplayName("Leftover policy is selected by name")
    void fromProperties_policy() {
        when(mockConfig.getPropertyWithDefault(eq("leftover_policy"), any())).thenReturn("smallest_fit");

        assertEquals(LeftoverPolicy.SMALLEST_FIT, SweepConfiguration.fromProperties(mockConfig).getLeftoverPolicy());
    }

    @Test
    @DisplayName("Unknown leftover policy is a configuration error")
    void fromProperties_unknownPolicy_throws() {
        when(mockConfig.getPropertyWithDefault(eq("leftover_policy"), any())).thenReturn("biggest_first");

        assertThrows(PropertyValueInvalidException.class, () -> SweepConfiguration.fromProperties(mockConfig));
    }

    @Test
    @DisplayName("Out of range numbers are configuration errors")
    void fromProperties_invalidNumbers_throw() {
        when(mockConfig.getIntegerPropertyWithDefault(eq("num_vials"), anyInt())).thenReturn(0);
        assertThrows(PropertyValueInvalidException.class, () -> SweepConfiguration.fromProperties(mockConfig));

        when(mockConfig.getIntegerPropertyWithDefault(eq("num_vials"), anyInt())).thenReturn(5);
        when(mockConfig.getDoublePropertyWithDefault(eq("vial_volume_ml"), anyDouble())).thenReturn(-1.0);
        assertThrows(PropertyValueInvalidException.class, () -> SweepConfiguration.fromProperties(mockConfig));
    }

    @Test
    @DisplayName("Empty dose rate range is a configuration error")
    void fromProperties_emptyRange_throws() {
        when(mockConfig.getDoublePropertyOrFail("person_Bob_dose_rate_stop")).thenReturn(0.06);

        assertThrows(PropertyValueInvalidException.class, () -> SweepConfiguration.fromProperties(mockConfig));
    }

    @Test
    @DisplayName("Duplicate people are rejected")
    void fromProperties_duplicatePerson_throws() {
        when(mockConfig.getListProperty("people")).thenReturn(Arrays.asList("Alice", "Alice"));

        assertThrows(PropertyValueInvalidException.class, () -> SweepConfiguration.fromProperties(mockConfig));
    }

    @Test
    @DisplayName("Missing per-person key propagates")
    void fromProperties_missingPersonKey_throws() {
        when(mockConfig.getDoublePropertyOrFail("person_Bob_dose_rate_start"))
                .thenThrow(new PropertyMissingException("person_Bob_dose_rate_start"));

        assertThrows(PropertyMissingException.class, () -> SweepConfiguration.fromProperties(mockConfig));
    }

}
