package ch.ethz.systems.vialbench.core.sim.leftover;

/**
 * The retained remainder of a replaced vial.
 */
public class LeftoverFragment {

    private double amount;

    LeftoverFragment(double amount) {
        this.amount = amount;
    }

    /**
     * @param dose  Dose (mL)
     *
     * @return True iff the fragment holds at least the dose
     */
    public boolean canCover(double dose) {
        return amount - dose >= 0;
    }

    void draw(double dose) {
        amount = amount - dose;
    }

    public double getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        return "LeftoverFragment(" + amount + " mL)";
    }

}
