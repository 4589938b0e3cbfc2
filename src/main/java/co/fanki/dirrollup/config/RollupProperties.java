package co.fanki.dirrollup.config;

import co.fanki.dirrollup.rollup.domain.WellKnownMetrics;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Rollup settings bound from the {@code rollup} prefix.
 *
 * <pre>
 * rollup:
 *   tracked-metrics: [lines_total, lines_code]
 *   parallel: false
 *   strategy: BOTTOM_UP
 *   presets: []
 * </pre>
 *
 * <p>An empty {@code presets} list keeps the standard COCOMO table. The
 * {@code strategy} key is read by {@code RollupService} directly.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@ConfigurationProperties(prefix = "rollup")
public class RollupProperties {

    private List<String> trackedMetrics =
            new ArrayList<>(WellKnownMetrics.DEFAULTS);

    private boolean parallel;

    private List<Preset> presets = new ArrayList<>();

    public List<String> getTrackedMetrics() {
        return trackedMetrics;
    }

    public void setTrackedMetrics(final List<String> theTrackedMetrics) {
        this.trackedMetrics = theTrackedMetrics;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(final boolean isParallel) {
        this.parallel = isParallel;
    }

    public List<Preset> getPresets() {
        return presets;
    }

    public void setPresets(final List<Preset> thePresets) {
        this.presets = thePresets;
    }

    /** One COCOMO preset override. */
    public static class Preset {

        private String name;
        private double a;
        private double b;
        private double c;
        private double d;
        private double annualWage;
        private double overhead = 1.0;
        private double eaf = 1.0;
        private String description;

        public String getName() {
            return name;
        }

        public void setName(final String theName) {
            this.name = theName;
        }

        public double getA() {
            return a;
        }

        public void setA(final double theA) {
            this.a = theA;
        }

        public double getB() {
            return b;
        }

        public void setB(final double theB) {
            this.b = theB;
        }

        public double getC() {
            return c;
        }

        public void setC(final double theC) {
            this.c = theC;
        }

        public double getD() {
            return d;
        }

        public void setD(final double theD) {
            this.d = theD;
        }

        public double getAnnualWage() {
            return annualWage;
        }

        public void setAnnualWage(final double theAnnualWage) {
            this.annualWage = theAnnualWage;
        }

        public double getOverhead() {
            return overhead;
        }

        public void setOverhead(final double theOverhead) {
            this.overhead = theOverhead;
        }

        public double getEaf() {
            return eaf;
        }

        public void setEaf(final double theEaf) {
            this.eaf = theEaf;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(final String theDescription) {
            this.description = theDescription;
        }
    }

}
