package co.fanki.dirrollup.config;

import co.fanki.dirrollup.classification.domain.FileClassifier;
import co.fanki.dirrollup.estimation.domain.CocomoPreset;
import co.fanki.dirrollup.estimation.domain.CocomoPresetTable;
import co.fanki.dirrollup.estimation.domain.CostEstimator;
import co.fanki.dirrollup.rollup.domain.RollupAggregator;
import co.fanki.dirrollup.rollup.domain.RollupReportAssembler;
import co.fanki.dirrollup.validation.domain.ReportValidator;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the rollup domain from {@link RollupProperties}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@EnableConfigurationProperties(RollupProperties.class)
public class RollupConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            RollupConfiguration.class);

    /**
     * Creates the COCOMO preset table, the standard one unless presets
     * are configured.
     *
     * @param properties the rollup properties
     * @return the preset table
     */
    @Bean
    public CocomoPresetTable cocomoPresetTable(
            final RollupProperties properties) {
        if (properties.getPresets().isEmpty()) {
            return CocomoPresetTable.standard();
        }
        final List<CocomoPreset> presets = new ArrayList<>();
        for (final RollupProperties.Preset preset : properties.getPresets()) {
            presets.add(new CocomoPreset(preset.getName(), preset.getA(),
                    preset.getB(), preset.getC(), preset.getD(),
                    preset.getAnnualWage(), preset.getOverhead(),
                    preset.getEaf(), preset.getDescription()));
        }
        LOG.info("Using {} configured COCOMO presets", presets.size());
        return CocomoPresetTable.of(presets);
    }

    /**
     * Creates the file classifier with the standard rules.
     *
     * @return the classifier
     */
    @Bean
    public FileClassifier fileClassifier() {
        return FileClassifier.standard();
    }

    /**
     * Creates the cost estimator.
     *
     * @param presetTable the preset table
     * @return the estimator
     */
    @Bean
    public CostEstimator costEstimator(final CocomoPresetTable presetTable) {
        return new CostEstimator(presetTable);
    }

    /**
     * Creates the aggregator.
     *
     * @param properties the rollup properties
     * @param classifier the file classifier
     * @return the aggregator
     */
    @Bean
    public RollupAggregator rollupAggregator(
            final RollupProperties properties,
            final FileClassifier classifier) {
        LOG.info("Tracking metrics {}, parallel={}",
                properties.getTrackedMetrics(), properties.isParallel());
        return new RollupAggregator(properties.getTrackedMetrics(),
                classifier, properties.isParallel());
    }

    /**
     * Creates the report assembler.
     *
     * @param aggregator the aggregator
     * @param costEstimator the cost estimator
     * @return the assembler
     */
    @Bean
    public RollupReportAssembler rollupReportAssembler(
            final RollupAggregator aggregator,
            final CostEstimator costEstimator) {
        return new RollupReportAssembler(aggregator, costEstimator);
    }

    /**
     * Creates the report validator.
     *
     * @param presetTable the preset table
     * @return the validator
     */
    @Bean
    public ReportValidator reportValidator(
            final CocomoPresetTable presetTable) {
        return new ReportValidator(presetTable);
    }

    /**
     * Writes JSON in snake_case.
     *
     * @return the object mapper customizer
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer snakeCaseCustomizer() {
        return builder -> builder.propertyNamingStrategy(
                PropertyNamingStrategies.SNAKE_CASE);
    }

}
