package co.fanki.dirrollup.validation.domain;

import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

/**
 * A failed consistency check.
 *
 * @param checkId the check that failed
 * @param path the directory the check ran on, {@code /} for
 *        repository-wide checks
 * @param expected the expected value or bound
 * @param actual the value found
 * @param message a readable description
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record InvariantViolation(
        CheckId checkId,
        String path,
        String expected,
        String actual,
        String message) implements ValueObject {

    /** Validates the violation. */
    public InvariantViolation {
        Preconditions.requireNonNull(checkId, "Check id is required");
        Preconditions.requireNonBlank(path, "Path is required");
        Preconditions.requireNonBlank(message, "Message is required");
    }

}
