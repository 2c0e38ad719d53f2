package config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Engine and analysis thresholds, read from {@code config/simulation.properties} on the classpath.
 * Settings are immutable and are passed explicitly to the components that need them.
 */
public class SimulationSettings {
    private static final Logger logger = LoggerFactory.getLogger(SimulationSettings.class);

    public static final String RESOURCE = "config/simulation.properties";

    public static final double DEFAULT_LCR_MINIMUM = 100.0;
    public static final double DEFAULT_CET1_MINIMUM = 4.5;
    public static final int DEFAULT_CREDIT_DETERIORATION_INTERVAL = 10;
    public static final double DEFAULT_CRITICAL_LCR = 110.0;
    public static final double DEFAULT_CRITICAL_CET1 = 5.5;
    public static final int DEFAULT_MAX_PERIODS = 365;
    public static final String DEFAULT_LIQUIDATION_ORDER =
        "Cash,HQLA Level 1,HQLA Level 2A,HQLA Level 2B,Other Securities,Performing Loans,Real Estate";

    private final double lcrMinimum;
    private final double cet1Minimum;
    private final int creditDeteriorationInterval;
    private final double criticalLcrThreshold;
    private final double criticalCet1Threshold;
    private final int maxPeriods;
    private final List<String> defaultLiquidationOrder;

    private SimulationSettings(Properties props) {
        this.lcrMinimum = Double.parseDouble(
            props.getProperty("lcr.minimum", String.valueOf(DEFAULT_LCR_MINIMUM)).trim());
        this.cet1Minimum = Double.parseDouble(
            props.getProperty("cet1.minimum", String.valueOf(DEFAULT_CET1_MINIMUM)).trim());
        this.creditDeteriorationInterval = Integer.parseInt(
            props.getProperty("credit.deterioration.interval",
                String.valueOf(DEFAULT_CREDIT_DETERIORATION_INTERVAL)).trim());
        this.criticalLcrThreshold = Double.parseDouble(
            props.getProperty("critical.lcr.threshold", String.valueOf(DEFAULT_CRITICAL_LCR)).trim());
        this.criticalCet1Threshold = Double.parseDouble(
            props.getProperty("critical.cet1.threshold", String.valueOf(DEFAULT_CRITICAL_CET1)).trim());
        this.maxPeriods = Integer.parseInt(
            props.getProperty("simulation.max.periods", String.valueOf(DEFAULT_MAX_PERIODS)).trim());
        this.defaultLiquidationOrder = parseList(
            props.getProperty("simulation.default.liquidation.order", DEFAULT_LIQUIDATION_ORDER));

        if (creditDeteriorationInterval <= 0) {
            throw new IllegalArgumentException(
                "credit.deterioration.interval must be positive: " + creditDeteriorationInterval);
        }
        if (maxPeriods <= 0) {
            throw new IllegalArgumentException("simulation.max.periods must be positive: " + maxPeriods);
        }
    }

    /**
     * Built-in regulatory defaults, ignoring any configuration file.
     */
    public static SimulationSettings defaults() {
        return new SimulationSettings(new Properties());
    }

    /**
     * Load settings from {@value #RESOURCE}, falling back to defaults when it is absent.
     */
    public static SimulationSettings load() {
        return fromProperties(loadProperties());
    }

    /**
     * Settings from explicit properties; keys that are absent take their defaults.
     */
    public static SimulationSettings fromProperties(Properties props) {
        return new SimulationSettings(props);
    }

    private static Properties loadProperties() {
        Properties props = new Properties();

        try (InputStream input = SimulationSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                logger.warn("{} not found, using defaults", RESOURCE);
                return props;
            }
            props.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }

        return props;
    }

    private static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return Collections.unmodifiableList(items);
    }

    public double getLcrMinimum() { return lcrMinimum; }
    public double getCet1Minimum() { return cet1Minimum; }
    public int getCreditDeteriorationInterval() { return creditDeteriorationInterval; }
    public double getCriticalLcrThreshold() { return criticalLcrThreshold; }
    public double getCriticalCet1Threshold() { return criticalCet1Threshold; }
    public int getMaxPeriods() { return maxPeriods; }
    public List<String> getDefaultLiquidationOrder() { return defaultLiquidationOrder; }

    @Override
    public String toString() {
        return String.format("SimulationSettings{lcrMin=%.1f, cet1Min=%.1f, deteriorationEvery=%d, maxPeriods=%d}",
            lcrMinimum, cet1Minimum, creditDeteriorationInterval, maxPeriods);
    }
}
