package com.jay.forecast.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.forecast.exception.InvalidConfigurationException;
import com.jay.forecast.model.enums.AssumptionKey;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads and exposes all configuration from forecast.yaml.
 * Values are read once at startup; per-run views are handed out as {@link CompanyConfig}
 * and {@link ForecastSettings}. Both carry their own copies of the bounds, fallbacks and
 * history sections, so nothing here is shared mutable state during a run.
 */
@Slf4j
@Component
public class ForecastConfig {

    @Value("${forecast.config-file:forecast.yaml}")
    private String configFile;

    private final ObjectMapper mapper = yamlMapper();
    // company sections are merged strictly so a misspelt bound is reported, not ignored
    private final ObjectMapper strictMapper = yamlMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    // ── Sections ──────────────────────────────────────────────────────────────
    private String dataDir = "data";
    private Defaults defaults = new Defaults();
    private History history = new History();
    private Bounds bounds = new Bounds();
    private Fallbacks fallbacks = new Fallbacks();
    private Check check = new Check();
    private Map<String, Company> companies = new LinkedHashMap<>();

    /** Builds a config outside Spring, e.g. for tests and tooling. */
    public static ForecastConfig fromClasspath(String resource) {
        ForecastConfig config = new ForecastConfig();
        config.configFile = resource;
        config.load();
        return config;
    }

    @PostConstruct
    public void load() {
        try {
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            if (root.getDataDir() != null) this.dataDir = root.getDataDir();
            if (root.getDefaults() != null)  this.defaults  = root.getDefaults();
            if (root.getHistory() != null)   this.history   = root.getHistory();
            if (root.getBounds() != null)    this.bounds    = root.getBounds();
            if (root.getFallbacks() != null) this.fallbacks = root.getFallbacks();
            if (root.getCheck() != null)     this.check     = root.getCheck();
            this.companies = root.getCompanies() != null ? root.getCompanies() : new LinkedHashMap<>();
            log.info("ForecastConfig loaded from '{}'. Companies: {}", configFile, companies.keySet());
        } catch (Exception e) {
            log.error("Failed to load {}, forecasts will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public String dataDir()                 { return dataDir; }
    public Defaults defaults()              { return defaults; }
    public History history()                { return history; }
    public Bounds bounds()                  { return bounds; }
    public Fallbacks fallbacks()            { return fallbacks; }
    public Check check()                    { return check; }
    public Map<String, Company> companies() { return companies; }
    public Set<String> companyKeys()        { return companies.keySet(); }

    /** Model-wide settings. Every call returns fresh copies of the mutable sections. */
    public ForecastSettings settings() {
        return new ForecastSettings(copy(bounds, Bounds.class), copy(fallbacks, Fallbacks.class),
            copy(history, History.class), check.getBalanceTolerance(), defaults.getRevenueGrowthDecay());
    }

    /** Settings for one company's run: its own bounds and fallbacks where it sets them. */
    public ForecastSettings settings(CompanyConfig company) {
        ForecastSettings base = settings();
        return new ForecastSettings(
            company.getBounds() != null ? copy(company.getBounds(), Bounds.class) : base.bounds(),
            company.getFallbacks() != null ? copy(company.getFallbacks(), Fallbacks.class) : base.fallbacks(),
            base.history(), base.balanceTolerance(), base.revenueGrowthDecay());
    }

    public CompanyConfig companyConfig(String key) {
        return companyConfig(key, null, null);
    }

    /**
     * Merges a company entry over the defaults and validates the result.
     * {@code baseYearOverride} and {@code yearsOverride} take precedence when non-null.
     */
    public CompanyConfig companyConfig(String key, Integer baseYearOverride, Integer yearsOverride) {
        Company c = companies.get(key);
        if (c == null) {
            throw new InvalidConfigurationException("Unknown company '" + key + "'. Configured: " + companies.keySet());
        }
        CompanyConfig.CompanyConfigBuilder b = CompanyConfig.builder()
            .key(key)
            .name(c.getName() != null ? c.getName() : key)
            .ticker(c.getTicker())
            .baseYear(baseYearOverride != null ? baseYearOverride : c.getBaseYear())
            .forecastYears(firstNonNull(yearsOverride, c.getNForecastYears(), defaults.getNForecastYears()))
            .inputYears(firstNonNull(c.getNInputYears(), defaults.getNInputYears()))
            .ltLoanYears(firstNonNull(c.getLtLoanYears(), defaults.getLtLoanYears()))
            .pctFinancingWithDebt(firstNonNull(c.getPctFinancingWithDebt(), defaults.getPctFinancingWithDebt()))
            .minimumCashThreshold(firstNonNull(c.getMinimumCashThreshold(), defaults.getMinimumCashThreshold()))
            .stInvestmentReturn(CompanyConfig.nominalReturn(
                firstNonNull(c.getRealInterestRate(), defaults.getRealInterestRate()),
                defaults.getInflationRate(),
                firstNonNull(c.getRiskPremiumStInvestment(), defaults.getRiskPremiumStInvestment())))
            .stInvestmentPctExcess(firstNonNull(c.getStInvestmentPctExcess(), defaults.getStInvestmentPctExcess()))
            .bounds(merge(key, "bounds", bounds, c.getBounds(), Bounds.class))
            .fallbacks(merge(key, "fallbacks", fallbacks, c.getFallbacks(), Fallbacks.class));

        if (c.getOverrides() != null) {
            c.getOverrides().forEach((name, value) -> {
                AssumptionKey k = AssumptionKey.fromConfigName(name).orElseThrow(() ->
                    new InvalidConfigurationException("Unknown assumption override '" + name + "' for " + key));
                if (value == null) {
                    throw new InvalidConfigurationException("Override '" + name + "' for " + key + " has no value");
                }
                b.override(k, value);
            });
        }
        CompanyConfig cc = b.build();
        cc.validate();
        return cc;
    }

    /** A copy of the model-wide section with the company's entries laid over it. */
    private <T> T merge(String key, String section, T global, Map<String, Object> companyEntries, Class<T> type) {
        T merged = copy(global, type);
        if (companyEntries == null || companyEntries.isEmpty()) return merged;
        try {
            return strictMapper.updateValue(merged, companyEntries);
        } catch (JsonMappingException e) {
            throw new InvalidConfigurationException("Invalid " + section + " for " + key + ": "
                + e.getOriginalMessage());
        }
    }

    private <T> T copy(T section, Class<T> type) {
        try {
            return mapper.updateValue(newInstance(type), section);
        } catch (JsonMappingException e) {
            throw new IllegalStateException("Cannot copy " + type.getSimpleName(), e);
        }
    }

    private static <T> T newInstance(Class<T> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + type.getSimpleName(), e);
        }
    }

    private static ObjectMapper yamlMapper() {
        ObjectMapper m = new ObjectMapper(new YAMLFactory());
        m.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        m.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return m;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T v : values) if (v != null) return v;
        return null;
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private String dataDir;
        private Defaults defaults;
        private History history;
        private Bounds bounds;
        private Fallbacks fallbacks;
        private Check check;
        private LinkedHashMap<String, Company> companies;
    }

    @Data public static class Defaults {
        @JsonProperty("n_forecast_years") private int nForecastYears = 2;
        @JsonProperty("n_input_years")    private int nInputYears = 3;
        private int ltLoanYears = 10;
        private double pctFinancingWithDebt = 0.70;
        private double minimumCashThreshold = 0.0;
        private double revenueGrowthDecay = 0.05;   // growth fades by this share of the base rate each year
        private double realInterestRate = 0.02;
        private double inflationRate = 0.025;
        private double riskPremiumStInvestment = -0.01;
        private double stInvestmentPctExcess = 0.50;
    }

    @Data public static class History {
        private int minGrowthYears = 2;
        private int minRatioYears = 1;
    }

    @Data public static class Bounds {
        private double minRevenueGrowth = -0.10;
        private double maxRevenueGrowth = 0.15;
        private double minTaxRate = 0.10;
        private double maxTaxRate = 0.40;
        private double minDepreciationLife = 5;
        private double maxDepreciationLife = 25;
        private double minCostOfDebt = 0.03;
        private double maxCostOfDebt = 0.15;
        private double minReturnOnCash = 0.0;
        private double maxReturnOnCash = 0.08;
        private double minPayoutRatio = 0.0;
        private double maxPayoutRatio = 1.0;
    }

    @Data public static class Fallbacks {
        private double revenueGrowth = 0.03;
        private double cogsPctRevenue = 0.60;
        private double sgaPctRevenue = 0.20;
        private double taxRate = 0.21;
        private double depreciationLife = 10;
        private double costOfDebt = 0.05;
        private double returnOnCash = 0.02;
        private double payoutRatio = 0.50;
        private double repurchasePctNetIncome = 0.0;
        private double arPctRevenue = 0.08;
        private double inventoryPctCogs = 0.05;
        private double apPctCogs = 0.10;
        private double capexPctRevenue = 0.05;
        private double minCashPctRevenue = 0.05;
    }

    @Data public static class Check {
        private double balanceTolerance = 0.01;
        private int parallelism = 4;
    }

    @Data public static class Company {
        private String name;
        private String ticker;
        private Integer baseYear;
        @JsonProperty("n_forecast_years") private Integer nForecastYears;
        @JsonProperty("n_input_years")    private Integer nInputYears;
        private Integer ltLoanYears;
        private Double pctFinancingWithDebt;
        private Double minimumCashThreshold;
        private Double realInterestRate;
        private Double riskPremiumStInvestment;
        private Double stInvestmentPctExcess;
        private Map<String, Object> bounds;
        private Map<String, Object> fallbacks;
        private Map<String, Double> overrides = new LinkedHashMap<>();
    }
}
