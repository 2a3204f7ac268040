package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.vialbench.core.config.VBProperties;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.vialbench.core.sim.leftover.LeftoverPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a sweep needs, read from the run properties.
 *
 * <pre>
 * num_vials=20
 * vial_volume_ml=5.0
 * dose_rate_step=0.001
 * num_outcomes=5
 * leftover_policy=single_slot
 * people=Alice,Bob
 * person_Alice_dose_rate_start=0.038
 * person_Alice_dose_rate_stop=0.042
 * person_Alice_dose_freqs=7,8
 * ...
 * </pre>
 */
public class SweepConfiguration {

    public static final int DEFAULT_NUM_VIALS = 20;
    public static final double DEFAULT_VIAL_VOLUME_ML = 5.0;
    public static final double DEFAULT_DOSE_RATE_STEP = 0.001;
    public static final int DEFAULT_NUM_OUTCOMES = 5;

    private final int numVials;
    private final double vialVolume;
    private final double doseRateStep;
    private final int numOutcomes;
    private final LeftoverPolicy leftoverPolicy;
    private final List<PersonRange> people;

    public SweepConfiguration(int numVials, double vialVolume, double doseRateStep, int numOutcomes,
                              LeftoverPolicy leftoverPolicy, List<PersonRange> people) {
        this.numVials = numVials;
        this.vialVolume = vialVolume;
        this.doseRateStep = doseRateStep;
        this.numOutcomes = numOutcomes;
        this.leftoverPolicy = leftoverPolicy;
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
    }

    /**
     * Read and check the sweep configuration.
     *
     * @param properties    Run properties
     *
     * @return Configuration
     */
    public static SweepConfiguration fromProperties(VBProperties properties) {
        int numVials = properties.getIntegerPropertyWithDefault("num_vials", DEFAULT_NUM_VIALS);
        if (numVials < 1) {
            throw new PropertyValueInvalidException("num_vials", Integer.toString(numVials), "must be at least 1");
        }
        double vialVolume = properties.getDoublePropertyWithDefault("vial_volume_ml", DEFAULT_VIAL_VOLUME_ML);
        if (!(vialVolume > 0) || Double.isInfinite(vialVolume)) {
            throw new PropertyValueInvalidException("vial_volume_ml", Double.toString(vialVolume), "must be positive");
        }
        double step = properties.getDoublePropertyWithDefault("dose_rate_step", DEFAULT_DOSE_RATE_STEP);
        if (!(step > 0)) {
            throw new PropertyValueInvalidException("dose_rate_step", Double.toString(step), "must be positive");
        }
        int numOutcomes = properties.getIntegerPropertyWithDefault("num_outcomes", DEFAULT_NUM_OUTCOMES);
        if (numOutcomes < 1) {
            throw new PropertyValueInvalidException("num_outcomes", Integer.toString(numOutcomes), "must be at least 1");
        }

        String policyValue = properties.getPropertyWithDefault("leftover_policy", "single_slot");
        LeftoverPolicy policy;
        try {
            policy = LeftoverPolicy.fromConfigValue(policyValue);
        } catch (IllegalArgumentException e) {
            throw new PropertyValueInvalidException("leftover_policy", policyValue, e);
        }

        List<String> names = properties.getListProperty("people");
        Set<String> seen = new HashSet<>();
        List<PersonRange> people = new ArrayList<>(names.size());
        for (String name : names) {
            if (!seen.add(name)) {
                throw new PropertyValueInvalidException("people", properties.getProperty("people"), "duplicate name " + name);
            }
            people.add(readPerson(properties, name, step));
        }

        return new SweepConfiguration(numVials, vialVolume, step, numOutcomes, policy, people);
    }

    private static PersonRange readPerson(VBProperties properties, String name, double step) {
        String prefix = BaseAllowedProperties.PERSON_PREFIX + name;
        double start = properties.getDoublePropertyOrFail(prefix + "_dose_rate_start");
        double stop = properties.getDoublePropertyOrFail(prefix + "_dose_rate_stop");
        double[] rates = PersonRange.doseRateRange(start, stop, step);
        if (rates.length == 0) {
            throw new PropertyValueInvalidException(prefix + "_dose_rate_stop", Double.toString(stop),
                    "range [" + start + ", " + stop + ") with step " + step + " is empty");
        }
        int[] frequencies = properties.getIntegerListPropertyOrFail(prefix + "_dose_freqs");
        return new PersonRange(name, rates, frequencies);
    }

    public ParameterSweep createSweep() {
        return new ParameterSweep(people);
    }

    public int getNumVials() {
        return numVials;
    }

    public double getVialVolume() {
        return vialVolume;
    }

    public double getDoseRateStep() {
        return doseRateStep;
    }

    public int getNumOutcomes() {
        return numOutcomes;
    }

    public LeftoverPolicy getLeftoverPolicy() {
        return leftoverPolicy;
    }

    public List<PersonRange> getPeople() {
        return people;
    }

}
