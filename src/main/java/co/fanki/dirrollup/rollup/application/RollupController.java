package co.fanki.dirrollup.rollup.application;

import co.fanki.dirrollup.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for directory rollups.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/rollup")
@Tag(name = "Rollup",
        description = "Roll up per-file metrics over the directory tree")
public class RollupController {

    private static final Logger LOG = LoggerFactory.getLogger(
            RollupController.class);

    private final RollupService rollupService;

    /**
     * Creates a new RollupController.
     *
     * @param theRollupService the rollup service
     */
    public RollupController(final RollupService theRollupService) {
        this.rollupService = theRollupService;
    }

    /**
     * Rolls up a list of file records.
     *
     * @param body the collector output, {@code {"files": [...]}}
     * @param strategy optional rollup strategy name
     * @return the rollup result, or 400 for a malformed body
     */
    @PostMapping
    @Operation(summary = "Roll up file metrics",
            description = "Builds the directory tree of the given files and"
                    + " returns direct and recursive stats per directory,"
                    + " a repository summary and cost estimates."
                    + " Rejected records and failed consistency checks are"
                    + " listed in the response.")
    public ResponseEntity<?> rollup(@RequestBody final JsonNode body,
            @RequestParam(name = "strategy", required = false)
            final String strategy) {

        try {
            return ResponseEntity.ok(rollupService.rollup(body, strategy));
        } catch (final DomainException e) {
            LOG.warn("Rollup request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

}
