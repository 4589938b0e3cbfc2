package co.fanki.dirrollup.estimation.domain;

import co.fanki.dirrollup.shared.DomainException;
import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named, ordered set of {@link CocomoPreset}s.
 *
 * <p>Passed to the {@link CostEstimator} explicitly so a test or a
 * deployment can substitute its own table.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CocomoPresetTable {

    /** Error code for a preset name the table does not hold. */
    public static final String UNKNOWN_PRESET = "UNKNOWN_PRESET";

    private final Map<String, CocomoPreset> presets;

    private CocomoPresetTable(final Map<String, CocomoPreset> thePresets) {
        this.presets = Collections.unmodifiableMap(thePresets);
    }

    /**
     * Creates a table from presets, keeping their order.
     *
     * @param presets the presets, names must be unique
     * @return the table
     */
    public static CocomoPresetTable of(final List<CocomoPreset> presets) {
        Preconditions.requireNonEmpty(presets, "At least one preset is required");
        final Map<String, CocomoPreset> byName = new LinkedHashMap<>();
        for (final CocomoPreset preset : presets) {
            Preconditions.require(byName.put(preset.name(), preset) == null,
                    "Duplicate preset: " + preset.name());
        }
        return new CocomoPresetTable(byName);
    }

    /**
     * Returns the standard table, from early startups to regulated
     * industries, plus an unpaid open source baseline.
     *
     * @return the standard table
     */
    public static CocomoPresetTable standard() {
        return of(List.of(
                new CocomoPreset("early_startup", 2.0, 1.00, 2.2, 0.40,
                        150000, 1.5, 0.8,
                        "< 10 employees, flat structure, no bureaucracy"),
                new CocomoPreset("growth_startup", 2.4, 1.05, 2.5, 0.38,
                        140000, 1.8, 0.9,
                        "10-50 employees, adding process"),
                new CocomoPreset("scale_up", 2.8, 1.08, 2.5, 0.36,
                        130000, 2.2, 1.0,
                        "50-200 employees, formal processes emerging"),
                new CocomoPreset("sme", 3.0, 1.12, 2.5, 0.35,
                        120000, 2.4, 1.0,
                        "200-500 employees, established processes"),
                new CocomoPreset("mid_market", 3.2, 1.15, 2.5, 0.34,
                        115000, 2.6, 1.1,
                        "500-2000 employees, compliance overhead"),
                new CocomoPreset("large_enterprise", 3.6, 1.20, 2.5, 0.32,
                        110000, 3.0, 1.2,
                        "2000+ employees, heavy governance"),
                new CocomoPreset("regulated", 4.0, 1.25, 2.8, 0.30,
                        120000, 3.5, 1.5,
                        "Finance, Healthcare, Defense, Government"),
                new CocomoPreset("open_source", 2.0, 1.00, 3.0, 0.42,
                        0, 1.0, 0.5,
                        "Volunteer, no cost model applicable")));
    }

    /**
     * Returns a preset by name.
     *
     * @param name the preset name
     * @return the preset
     * @throws DomainException if the table holds no such preset
     */
    public CocomoPreset preset(final String name) {
        final CocomoPreset preset = presets.get(name);
        if (preset == null) {
            throw new DomainException("Unknown COCOMO preset: " + name,
                    UNKNOWN_PRESET);
        }
        return preset;
    }

    /**
     * Returns the presets in table order.
     *
     * @return unmodifiable list of presets
     */
    public List<CocomoPreset> presets() {
        return List.copyOf(presets.values());
    }

    /**
     * Returns the preset names in table order.
     *
     * @return unmodifiable list of names
     */
    public List<String> names() {
        return List.copyOf(presets.keySet());
    }

    /**
     * Returns the paid presets ordered by loaded monthly rate, the order
     * in which estimated cost must not decrease.
     *
     * @return the presets with a non-zero rate, cheapest first
     */
    public List<CocomoPreset> paidByRate() {
        final List<CocomoPreset> result = new ArrayList<>();
        for (final CocomoPreset preset : presets.values()) {
            if (!preset.unpaid()) {
                result.add(preset);
            }
        }
        result.sort((x, y) -> Double.compare(x.monthlyRate(),
                y.monthlyRate()));
        return List.copyOf(result);
    }

}
