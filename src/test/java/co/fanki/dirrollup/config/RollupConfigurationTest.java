package co.fanki.dirrollup.config;

import co.fanki.dirrollup.estimation.domain.CocomoPresetTable;
import co.fanki.dirrollup.rollup.application.RollupResult;
import co.fanki.dirrollup.rollup.domain.FileFlags;
import co.fanki.dirrollup.rollup.domain.FileRecord;
import co.fanki.dirrollup.rollup.domain.RollupAggregator;
import co.fanki.dirrollup.rollup.domain.RollupReport;
import co.fanki.dirrollup.rollup.domain.RollupStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RollupConfiguration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RollupConfigurationTest {

    private final RollupConfiguration configuration = new RollupConfiguration();

    private RollupProperties properties;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        properties = new RollupProperties();
        final Jackson2ObjectMapperBuilder builder =
                new Jackson2ObjectMapperBuilder();
        configuration.snakeCaseCustomizer().customize(builder);
        mapper = builder.build();
    }

    @Test
    void whenCreatingPresetTable_givenNoPresets_shouldUseTheStandardOne() {
        assertEquals(CocomoPresetTable.standard().names(),
                configuration.cocomoPresetTable(properties).names());
    }

    @Test
    void whenCreatingPresetTable_givenConfiguredPresets_shouldUseThem() {
        final RollupProperties.Preset preset = new RollupProperties.Preset();
        preset.setName("agency");
        preset.setA(2.5);
        preset.setB(1.1);
        preset.setC(2.5);
        preset.setD(0.35);
        preset.setAnnualWage(90000);
        properties.setPresets(List.of(preset));

        final CocomoPresetTable table =
                configuration.cocomoPresetTable(properties);

        assertEquals(List.of("agency"), table.names());
        assertEquals(7500.0, table.preset("agency").monthlyRate(), 1e-9);
    }

    @Test
    void whenSerializingResult_givenReport_shouldWriteSnakeCase()
            throws Exception {
        final JsonNode json = mapper.valueToTree(new RollupResult(report(),
                List.of(), List.of()));

        final JsonNode report = json.get("report");
        assertEquals("2.1", report.get("schema_version").asText());

        final JsonNode root = report.get("directories").get(0);
        assertEquals("/", root.get("path").asText());
        assertFalse(root.get("is_leaf").asBoolean());
        assertEquals(1, root.get("child_count").asInt());

        final JsonNode recursive = root.get("recursive");
        assertEquals(5, recursive.get("file_count").asInt());
        assertTrue(recursive.get("classifications").has("source_file_count"));
        assertTrue(recursive.get("classifications").has("ci_loc"));
        assertTrue(recursive.get("ratios").has("avg_file_loc"));

        final JsonNode loc = recursive.get("distributions").get("lines_code");
        assertTrue(loc.has("top_10_pct_share"));
        assertTrue(loc.has("bottom_50_pct_share"));
        assertTrue(loc.has("p25"));
        assertEquals("Infinity", loc.get("palma").asText());

        final JsonNode file = report.get("files").get(0);
        assertTrue(file.get("is_minified").asBoolean());
        assertTrue(file.has("bytes_per_loc"));

        final JsonNode summary = report.get("summary");
        assertTrue(summary.get("languages").has("dominant_language"));
        assertTrue(summary.get("structure").has("leaf_directory_count"));
        assertTrue(summary.get("comment_ratio_distribution").has("gini"));
        assertTrue(recursive.has("comment_ratio_distribution"));
        assertTrue(summary.get("cocomo").get("sme")
                .has("effort_person_months"));

        assertTrue(json.get("errors").isArray());
        assertTrue(json.get("violations").isArray());
    }

    @Test
    void whenCreatingAggregator_givenTrackedMetrics_shouldReportThemFirst() {
        properties.setTrackedMetrics(List.of("findings", "lines_code"));

        final RollupAggregator aggregator = configuration.rollupAggregator(
                properties, configuration.fileClassifier());

        assertEquals(List.of("findings", "lines_code", "bytes"),
                aggregator.trackedMetrics(List.of(FileRecord.of("a.py",
                        Map.of("bytes", 1.0)))));
    }

    private RollupReport report() {
        return configuration.rollupReportAssembler(
                configuration.rollupAggregator(properties,
                        configuration.fileClassifier()),
                configuration.costEstimator(
                        configuration.cocomoPresetTable(properties)))
                .assemble(List.of(
                        FileRecord.of("lib/a.min.js", "JavaScript",
                                Map.of("lines_code", 0.0),
                                new FileFlags(true, false, false)),
                        FileRecord.of("lib/b.js", "JavaScript",
                                Map.of("lines_code", 0.0), FileFlags.NONE),
                        FileRecord.of("lib/c.js", "JavaScript",
                                Map.of("lines_code", 0.0), FileFlags.NONE),
                        FileRecord.of("lib/d.js", "JavaScript",
                                Map.of("lines_code", 0.0), FileFlags.NONE),
                        FileRecord.of("lib/e.js", "JavaScript",
                                Map.of("lines_code", 900.0), FileFlags.NONE)),
                        RollupStrategy.BOTTOM_UP);
    }

}
