package co.fanki.dirrollup.estimation.domain;

import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

/**
 * Coefficients of the power-law cost model for one kind of organization.
 *
 * @param name the preset name, e.g. {@code sme}
 * @param a effort multiplier
 * @param b effort exponent over KLOC
 * @param c schedule multiplier
 * @param d schedule exponent over effort
 * @param annualWage average annual wage, 0 for volunteer work
 * @param overhead loaded-cost multiplier applied to the wage
 * @param effortAdjustment effort adjustment factor (EAF)
 * @param description what kind of organization the preset describes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CocomoPreset(
        String name,
        double a,
        double b,
        double c,
        double d,
        double annualWage,
        double overhead,
        double effortAdjustment,
        String description) implements ValueObject {

    /** Validates the coefficients. */
    public CocomoPreset {
        Preconditions.requireNonBlank(name, "Preset name is required");
        Preconditions.require(a > 0, "Coefficient a must be positive");
        Preconditions.require(b > 0, "Coefficient b must be positive");
        Preconditions.require(c > 0, "Coefficient c must be positive");
        Preconditions.require(d > 0, "Coefficient d must be positive");
        Preconditions.requireNonNegative(annualWage,
                "Annual wage must not be negative");
        Preconditions.requireNonNegative(overhead,
                "Overhead must not be negative");
        Preconditions.require(effortAdjustment > 0,
                "Effort adjustment must be positive");
        description = description == null ? "" : description;
    }

    /**
     * Returns the loaded cost of one person-month.
     *
     * @return annual wage / 12 * overhead
     */
    public double monthlyRate() {
        return annualWage / 12 * overhead;
    }

    /**
     * Checks whether the preset carries no labour cost.
     *
     * @return true for a zero wage or zero overhead
     */
    public boolean unpaid() {
        return monthlyRate() == 0;
    }

}
