package co.fanki.dirrollup.estimation.domain;

import co.fanki.dirrollup.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for CostEstimator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CostEstimatorTest {

    private static final double EPSILON = 1e-9;

    private final CostEstimator estimator =
            new CostEstimator(CocomoPresetTable.standard());

    @Test
    void whenEstimating_givenPositiveKloc_shouldApplyThePowerLaw() {
        final CocomoPreset sme = CocomoPresetTable.standard().preset("sme");

        final CocomoEstimate estimate = estimator.estimate(10, sme);

        final double effort = 3.0 * Math.pow(10, 1.12) * 1.0;
        final double schedule = 2.5 * Math.pow(effort, 0.35);
        assertEquals(effort, estimate.effortPersonMonths(), EPSILON);
        assertEquals(schedule, estimate.scheduleMonths(), EPSILON);
        assertEquals(effort / schedule, estimate.people(), EPSILON);
        assertEquals(effort * 120000 / 12 * 2.4, estimate.cost(), 1e-6);
    }

    @Test
    void whenEstimating_givenZeroOrNegativeKloc_shouldReturnZero() {
        assertSame(CocomoEstimate.ZERO, estimator.estimate(0, "sme"));
        assertSame(CocomoEstimate.ZERO, estimator.estimate(-5, "regulated"));
    }

    @Test
    void whenEstimating_givenOpenSourcePreset_shouldCostNothingButTakeEffort() {
        final CocomoEstimate estimate = estimator.estimate(25, "open_source");

        assertEquals(0.0, estimate.cost());
        assertTrue(estimate.effortPersonMonths() > 0);
        assertTrue(estimate.scheduleMonths() > 0);
    }

    @Test
    void whenEstimating_givenLargerOrganization_shouldCostMore() {
        final double early = estimator.estimate(50, "early_startup").cost();
        final double large = estimator.estimate(50, "large_enterprise").cost();

        assertTrue(large > early);
    }

    @Test
    void whenEstimatingAll_givenStandardTable_shouldKeepTableOrder() {
        final Map<String, CocomoEstimate> estimates =
                estimator.estimateAll(12.5);

        assertEquals(CocomoPresetTable.standard().names(),
                List.copyOf(estimates.keySet()));
    }

    @Test
    void whenEstimatingAll_givenTypicalSizes_shouldGrowWithMonthlyRate() {
        for (final double kloc : new double[] {1, 10, 100, 1000}) {
            double previous = -1;
            for (final CocomoPreset preset
                    : CocomoPresetTable.standard().paidByRate()) {
                final double cost = estimator.estimate(kloc, preset).cost();
                assertTrue(cost >= previous, preset.name() + " at " + kloc);
                previous = cost;
            }
        }
    }

    @Test
    void whenEstimating_givenUnknownPreset_shouldThrowException() {
        final DomainException e = assertThrows(DomainException.class,
                () -> estimator.estimate(10, "unicorn"));

        assertEquals(CocomoPresetTable.UNKNOWN_PRESET, e.getErrorCode());
    }

    @Test
    void whenEstimating_givenCustomTable_shouldUseIt() {
        final CostEstimator custom = new CostEstimator(CocomoPresetTable.of(
                List.of(new CocomoPreset("flat", 1, 1, 1, 1, 12000, 1, 1,
                        "one person-month per KLOC"))));

        final CocomoEstimate estimate = custom.estimate(3, "flat");

        assertEquals(3.0, estimate.effortPersonMonths(), EPSILON);
        assertEquals(3000.0, estimate.cost(), EPSILON);
    }

}
