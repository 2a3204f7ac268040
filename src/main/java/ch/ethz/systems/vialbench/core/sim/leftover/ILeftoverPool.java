package ch.ethz.systems.vialbench.core.sim.leftover;

import java.util.List;

/**
 * Storage for leftover fragments of one trial. Injections are served from
 * the pool before the active vial; the pool decides which fragment serves
 * a dose and what happens when a new fragment is retained.
 */
public interface ILeftoverPool {

    /**
     * Find the fragment that should serve the given dose.
     *
     * @param dose  Dose (mL)
     *
     * @return Serving fragment, or null if no fragment can cover the dose
     */
    LeftoverFragment findFragmentFor(double dose);

    /**
     * Draw a dose from a fragment returned by {@link #findFragmentFor(double)}.
     * If what remains is less than the smallest dosage of the roster, the
     * fragment is dropped and its remainder returned as waste.
     *
     * @param fragment      Serving fragment
     * @param dose          Dose (mL)
     * @param minDosage     Smallest dosage in the roster (mL)
     *
     * @return Volume discarded as waste (mL), zero if the fragment stays usable
     */
    double consume(LeftoverFragment fragment, double dose, double minDosage);

    /**
     * Keep the remainder of a replaced vial as a new fragment.
     *
     * @param amount    Remainder (mL)
     *
     * @return Volume of fragments overwritten to make room (mL)
     */
    double retain(double amount);

    /**
     * @return Volume held across all usable fragments (mL)
     */
    double totalRemaining();

    /**
     * @return Usable fragments, unmodifiable
     */
    List<LeftoverFragment> getFragments();

}
