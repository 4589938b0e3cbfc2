package co.fanki.dirrollup.rollup.application;

import co.fanki.dirrollup.rollup.domain.RollupReport;
import co.fanki.dirrollup.validation.domain.InvariantViolation;

import java.util.List;

/**
 * Outcome of a rollup run: the report, the rejected records and the
 * consistency checks the report failed.
 *
 * @param report the rollup report
 * @param errors the rejected input records
 * @param violations the failed consistency checks
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RollupResult(
        RollupReport report,
        List<RecordError> errors,
        List<InvariantViolation> violations) {

    /** Copies the lists. */
    public RollupResult {
        errors = List.copyOf(errors);
        violations = List.copyOf(violations);
    }

    /**
     * Checks whether every record was accepted and every check passed.
     *
     * @return true for a clean run
     */
    public boolean clean() {
        return errors.isEmpty() && violations.isEmpty();
    }

}
