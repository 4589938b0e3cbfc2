package co.fanki.dirrollup.estimation.domain;

import co.fanki.dirrollup.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimates development effort and cost from code size.
 *
 * <pre>
 * effort   = a * KLOC^b * EAF
 * schedule = c * effort^d
 * people   = effort / schedule
 * cost     = effort * monthly rate
 * </pre>
 *
 * <p>A preset without a wage keeps a positive effort and schedule with a
 * cost of 0.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CostEstimator {

    private final CocomoPresetTable presetTable;

    /**
     * Creates a new estimator.
     *
     * @param thePresetTable the presets to estimate with
     */
    public CostEstimator(final CocomoPresetTable thePresetTable) {
        this.presetTable = Preconditions.requireNonNull(thePresetTable,
                "Preset table is required");
    }

    /**
     * Estimates with one preset.
     *
     * @param kloc thousands of lines of code
     * @param preset the preset
     * @return the estimate, {@link CocomoEstimate#ZERO} for a KLOC of 0 or
     *         less
     */
    public CocomoEstimate estimate(final double kloc,
            final CocomoPreset preset) {
        Preconditions.requireNonNull(preset, "Preset is required");

        if (!(kloc > 0) || Double.isInfinite(kloc)) {
            return CocomoEstimate.ZERO;
        }

        final double effort = preset.a() * Math.pow(kloc, preset.b())
                * preset.effortAdjustment();
        final double schedule = preset.c() * Math.pow(effort, preset.d());
        final double people = schedule > 0 ? effort / schedule : 0;
        final double cost = effort * preset.monthlyRate();

        return new CocomoEstimate(effort, schedule, people, cost);
    }

    /**
     * Estimates with a preset of the table.
     *
     * @param kloc thousands of lines of code
     * @param presetName the preset name
     * @return the estimate
     */
    public CocomoEstimate estimate(final double kloc,
            final String presetName) {
        return estimate(kloc, presetTable.preset(presetName));
    }

    /**
     * Estimates with every preset of the table.
     *
     * @param kloc thousands of lines of code
     * @return the estimates keyed by preset name, in table order
     */
    public Map<String, CocomoEstimate> estimateAll(final double kloc) {
        final Map<String, CocomoEstimate> result = new LinkedHashMap<>();
        for (final CocomoPreset preset : presetTable.presets()) {
            result.put(preset.name(), estimate(kloc, preset));
        }
        return Collections.unmodifiableMap(result);
    }

}
