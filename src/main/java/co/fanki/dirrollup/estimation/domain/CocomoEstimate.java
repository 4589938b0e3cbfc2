package co.fanki.dirrollup.estimation.domain;

import co.fanki.dirrollup.shared.ValueObject;

/**
 * Effort, schedule, headcount and cost estimate for one preset.
 *
 * @param effortPersonMonths estimated effort in person-months
 * @param scheduleMonths estimated calendar schedule in months
 * @param people average headcount, effort / schedule
 * @param cost loaded labour cost
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CocomoEstimate(
        double effortPersonMonths,
        double scheduleMonths,
        double people,
        double cost) implements ValueObject {

    /** The estimate for an empty code base. */
    public static final CocomoEstimate ZERO = new CocomoEstimate(0, 0, 0, 0);

}
