package ch.ethz.systems.vialbench.core.sweep;

import java.util.Arrays;

/**
 * Candidate dose rates and injection intervals for one person.
 */
public class PersonRange {

    private final String name;
    private final double[] doseRates;
    private final int[] frequencies;

    /**
     * @param name          Person name
     * @param doseRates     Candidate dose rates (mL/day), at least one
     * @param frequencies   Candidate intervals (days), at least one
     */
    public PersonRange(String name, double[] doseRates, int[] frequencies) {
        if (doseRates.length == 0) {
            throw new IllegalArgumentException("No dose rate candidates for " + name);
        }
        if (frequencies.length == 0) {
            throw new IllegalArgumentException("No frequency candidates for " + name);
        }
        this.name = name;
        this.doseRates = doseRates.clone();
        this.frequencies = frequencies.clone();
    }

    /**
     * Dose rates {@code start, start + step, ...} below {@code stop}, counted the way
     * {@code numpy.arange} counts them: {@code ceil((stop - start) / step)} values.
     * Float error in that quotient can add one value that is equal to {@code stop}
     * up to rounding, e.g. {@code (0.038, 0.042, 0.001)} yields five rates.
     *
     * @param start     First rate (inclusive)
     * @param stop      Upper bound (exclusive)
     * @param step      Increment, positive
     *
     * @return Rates
     */
    public static double[] doseRateRange(double start, double stop, double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("Dose rate step must be positive: " + step);
        }
        int count = (int) Math.ceil((stop - start) / step);
        if (count <= 0) {
            return new double[0];
        }
        double[] rates = new double[count];
        for (int i = 0; i < count; i++) {
            rates[i] = start + i * step;
        }
        return rates;
    }

    public String getName() {
        return name;
    }

    public double[] getDoseRates() {
        return doseRates.clone();
    }

    public int[] getFrequencies() {
        return frequencies.clone();
    }

    int doseRateCount() {
        return doseRates.length;
    }

    int frequencyCount() {
        return frequencies.length;
    }

    double doseRateAt(int index) {
        return doseRates[index];
    }

    int frequencyAt(int index) {
        return frequencies[index];
    }

    @Override
    public String toString() {
        return name + "{doseRates=" + Arrays.toString(doseRates) + ", frequencies=" + Arrays.toString(frequencies) + "}";
    }

}
