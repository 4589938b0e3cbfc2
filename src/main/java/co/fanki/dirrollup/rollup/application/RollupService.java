package co.fanki.dirrollup.rollup.application;

import co.fanki.dirrollup.rollup.application.FileRecordReader.ReadResult;
import co.fanki.dirrollup.rollup.domain.FileRecord;
import co.fanki.dirrollup.rollup.domain.RollupReport;
import co.fanki.dirrollup.rollup.domain.RollupReportAssembler;
import co.fanki.dirrollup.rollup.domain.RollupStrategy;
import co.fanki.dirrollup.shared.DomainException;
import co.fanki.dirrollup.validation.domain.InvariantViolation;
import co.fanki.dirrollup.validation.domain.ReportValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a rollup: reads the records, assembles the report and validates
 * it.
 *
 * <p>Rejected records and failed checks are reported in the
 * {@link RollupResult}; neither stops the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RollupService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RollupService.class);

    private final RollupReportAssembler assembler;
    private final ReportValidator validator;
    private final RollupStrategy defaultStrategy;

    /**
     * Creates a new RollupService.
     *
     * @param theAssembler builds the report
     * @param theValidator checks the report
     * @param theDefaultStrategy the strategy used when a request names
     *        none
     */
    public RollupService(final RollupReportAssembler theAssembler,
            final ReportValidator theValidator,
            @Value("${rollup.strategy:BOTTOM_UP}")
            final String theDefaultStrategy) {
        this.assembler = theAssembler;
        this.validator = theValidator;
        this.defaultStrategy = RollupStrategy.fromString(theDefaultStrategy,
                RollupStrategy.BOTTOM_UP);
    }

    /**
     * Rolls up collector JSON.
     *
     * @param input the parsed request body
     * @param strategy the strategy name, null for the default one
     * @return the result
     * @throws DomainException if the body holds no record list or the
     *         strategy is unknown
     */
    public RollupResult rollup(final JsonNode input, final String strategy) {
        final RollupStrategy resolved = RollupStrategy.fromString(strategy,
                defaultStrategy);
        final ReadResult read = FileRecordReader.read(input);

        for (final RecordError error : read.errors()) {
            LOG.warn("Rejected record {} ({}): {}", error.index(),
                    error.path(), error.reason());
        }
        return rollup(read.records(), read.errors(), resolved);
    }

    /**
     * Rolls up records that were already read.
     *
     * @param records the records, paths must be unique
     * @param strategy how recursive stats are gathered
     * @return the result, without record errors
     */
    public RollupResult rollup(final List<FileRecord> records,
            final RollupStrategy strategy) {
        return rollup(records, List.of(), strategy);
    }

    private RollupResult rollup(final List<FileRecord> records,
            final List<RecordError> errors, final RollupStrategy strategy) {
        LOG.debug("Rolling up {} records with strategy {}", records.size(),
                strategy);

        final RollupReport report = assembler.assemble(records, strategy);
        final List<InvariantViolation> violations = validator.validate(report);

        for (final InvariantViolation violation : violations) {
            LOG.warn("Check {} failed on {}: {} (expected {}, actual {})",
                    violation.checkId(), violation.path(),
                    violation.message(), violation.expected(),
                    violation.actual());
        }

        LOG.info("Rollup complete: {} records, {} directories, {} errors,"
                        + " {} violations", records.size(),
                report.directories().size(), errors.size(),
                violations.size());

        return new RollupResult(report, errors, violations);
    }

}
