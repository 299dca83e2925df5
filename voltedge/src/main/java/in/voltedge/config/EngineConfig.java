package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.voltedge.service.market.SymbolUniverse;
import in.voltedge.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration. Loaded once at startup and read-only afterwards.
 *
 * Source: the file named by {@code VOLTEDGE_CONFIG}, else the classpath resource {@code engine.json}.
 * Environment overrides are applied on top (see {@link #withEnvOverrides()}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("scanner") ScannerConfig scanner,
    @JsonProperty("stochRsi") StochRsiConfig stochRsi,
    @JsonProperty("multiTimeframe") MultiTimeframeConfig multiTimeframe,
    @JsonProperty("volume") VolumeConfirmationConfig volume,
    @JsonProperty("risk") RiskConfig risk,
    @JsonProperty("execution") ExecutionConfig execution,
    @JsonProperty("trailingStops") TrailingStopsConfig trailingStops,
    @JsonProperty("loops") LoopConfig loops,
    @JsonProperty("monitoring") MonitoringConfig monitoring
) {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "engine.json";

    public EngineConfig {
        symbols = symbols == null ? List.of() : SymbolUniverse.merge(symbols, List.of());
        scanner = scanner != null ? scanner : ScannerConfig.defaults();
        stochRsi = stochRsi != null ? stochRsi : StochRsiConfig.defaults();
        multiTimeframe = multiTimeframe != null ? multiTimeframe : MultiTimeframeConfig.defaults();
        volume = volume != null ? volume : VolumeConfirmationConfig.defaults();
        risk = risk != null ? risk : RiskConfig.defaults();
        execution = execution != null ? execution : ExecutionConfig.defaults();
        trailingStops = trailingStops != null ? trailingStops : TrailingStopsConfig.defaults();
        loops = loops != null ? loops : LoopConfig.defaults();
        monitoring = monitoring != null ? monitoring : MonitoringConfig.defaults();
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
            List.of("BTCUSD", "ETHUSD", "SOLUSD", "AVAXUSD", "LINKUSD", "DOGEUSD", "LTCUSD", "UNIUSD"),
            null, null, null, null, null, null, null, null, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // LOADING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Load from {@code VOLTEDGE_CONFIG} or the bundled resource, apply env overrides, validate.
     */
    public static EngineConfig load() {
        String path = Env.get("VOLTEDGE_CONFIG", null);
        EngineConfig base = path != null ? fromFile(Path.of(path)) : fromResource(DEFAULT_RESOURCE);
        EngineConfig config = base.withEnvOverrides();
        config.validate();
        return config;
    }

    public static EngineConfig fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("[EngineConfig] Loading configuration from {}", path);
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public static EngineConfig fromResource(String resource) {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("[EngineConfig] Resource {} not found, using built-in defaults", resource);
                return defaults();
            }
            log.info("[EngineConfig] Loading configuration from classpath:{}", resource);
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse configuration resource " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * VOLTEDGE_SYMBOLS, VOLTEDGE_DRY_RUN, VOLTEDGE_CAPITAL, VOLTEDGE_RATE_LIMIT_PER_MINUTE, METRICS_PORT.
     */
    public EngineConfig withEnvOverrides() {
        List<String> mergedSymbols = SymbolUniverse.merge(symbols, Env.getList("VOLTEDGE_SYMBOLS"));
        ExecutionConfig exec = execution
            .withDryRun(Env.getBool("VOLTEDGE_DRY_RUN", execution.dryRun()))
            .withCapital(Env.getDouble("VOLTEDGE_CAPITAL", execution.capital()));
        RiskConfig riskOverride = risk.withMaxCallsPerWindow(
            Env.getInt("VOLTEDGE_RATE_LIMIT_PER_MINUTE", risk.maxCallsPerWindow()));
        MonitoringConfig mon = monitoring.withPort(Env.getInt("METRICS_PORT", monitoring.port()));
        return new EngineConfig(mergedSymbols, scanner, stochRsi, multiTimeframe, volume,
            riskOverride, exec, trailingStops, loops, mon);
    }

    public void validate() {
        if (symbols.isEmpty()) {
            throw new ConfigurationException("At least one symbol must be configured");
        }
        scanner.validate();
        stochRsi.validate();
        multiTimeframe.validate();
        volume.validate();
        risk.validate();
        execution.validate();
        trailingStops.validate();
        loops.validate();
    }
}
