package com.marketpipe.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.marketpipe.core.shm.SegmentLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared configuration for every process in the pipeline.
 * <p>
 * Read from {@code ~/.marketpipe/pipeline.yaml} (or the file named by
 * {@code -Dmarketpipe.config} / {@code MARKETPIPE_CONFIG}); network and segment
 * settings can then be overridden by system properties or environment variables.
 * All processes must agree on the symbol list and its order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);
    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);
        YAML = new ObjectMapper(factory);
    }

    public static final Path CONFIG_DIR = Path.of(System.getProperty("user.home"), ".marketpipe");
    public static final Path DEFAULT_CONFIG_FILE = CONFIG_DIR.resolve("pipeline.yaml");

    // Network
    private String host = "127.0.0.1";
    private int pricePort = 9000;
    private int newsPort = 9001;
    private int orderPort = 9002;

    // Shared memory
    private String sharedMemoryName = "trading_system_shm";
    private String sharedMemoryDir = defaultSegmentDir();
    private List<String> symbols = new ArrayList<>(List.of("AAPL", "MSFT", "GOOGL", "AMZN"));

    // Strategy
    private int shortWindow = 5;
    private int longWindow = 20;
    private int bullishThreshold = 70;
    private int bearishThreshold = 30;
    private int tradeQuantity = 10;

    // Timing
    private long priceIntervalMs = 1000;
    private long newsIntervalMs = 3000;
    private long reconnectDelayMs = 5000;

    public PipelineConfig() {
    }

    /**
     * Load from the configured YAML file (if any) and apply overrides.
     */
    public static PipelineConfig load() {
        return load(System.getenv());
    }

    static PipelineConfig load(Map<String, String> env) {
        String explicit = System.getProperty("marketpipe.config", env.get("MARKETPIPE_CONFIG"));
        Path file = explicit != null ? Path.of(explicit) : DEFAULT_CONFIG_FILE;

        PipelineConfig config = new PipelineConfig();
        if (Files.exists(file)) {
            try {
                config = fromYaml(Files.readString(file, StandardCharsets.UTF_8));
                log.info("Loaded pipeline config from {}", file);
            } catch (IOException e) {
                log.warn("Failed to load config from {}, using defaults: {}", file, e.getMessage());
            }
        } else if (explicit != null) {
            log.warn("Config file {} not found, using defaults", file);
        }

        config.applyOverrides(env);
        config.validate();
        return config;
    }

    public static PipelineConfig fromYaml(String yaml) throws IOException {
        PipelineConfig config = YAML.readValue(yaml, PipelineConfig.class);
        return config != null ? config : new PipelineConfig();
    }

    public String toYaml() throws IOException {
        return YAML.writeValueAsString(this);
    }

    /**
     * System properties win over environment variables, which win over the file.
     */
    void applyOverrides(Map<String, String> env) {
        host = System.getProperty("marketpipe.host", env.getOrDefault("MARKETPIPE_HOST", host));
        pricePort = Integer.parseInt(System.getProperty("marketpipe.price.port",
            env.getOrDefault("MARKETPIPE_PRICE_PORT", String.valueOf(pricePort))));
        newsPort = Integer.parseInt(System.getProperty("marketpipe.news.port",
            env.getOrDefault("MARKETPIPE_NEWS_PORT", String.valueOf(newsPort))));
        orderPort = Integer.parseInt(System.getProperty("marketpipe.order.port",
            env.getOrDefault("MARKETPIPE_ORDER_PORT", String.valueOf(orderPort))));
        sharedMemoryName = System.getProperty("marketpipe.shm.name",
            env.getOrDefault("TRADING_SHM_NAME", sharedMemoryName));
        sharedMemoryDir = System.getProperty("marketpipe.shm.dir",
            env.getOrDefault("MARKETPIPE_SHM_DIR", sharedMemoryDir));
    }

    /**
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public void validate() {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol must be configured");
        }
        for (String symbol : symbols) {
            SegmentLayout.checkSymbol(symbol);
        }
        if (symbols.stream().distinct().count() != symbols.size()) {
            throw new IllegalArgumentException("Duplicate symbols in " + symbols);
        }
        if (shortWindow <= 0 || longWindow <= 0) {
            throw new IllegalArgumentException("Moving average windows must be positive");
        }
        if (shortWindow > longWindow) {
            throw new IllegalArgumentException(
                "shortWindow (" + shortWindow + ") must not exceed longWindow (" + longWindow + ")");
        }
        if (bearishThreshold > bullishThreshold) {
            throw new IllegalArgumentException("bearishThreshold must not exceed bullishThreshold");
        }
        if (tradeQuantity <= 0) {
            throw new IllegalArgumentException("tradeQuantity must be positive");
        }
        if (sharedMemoryName == null || sharedMemoryName.isBlank()
                || sharedMemoryName.contains("/") || sharedMemoryName.contains("\\")) {
            throw new IllegalArgumentException("Invalid sharedMemoryName: " + sharedMemoryName);
        }
    }

    /**
     * First configured symbol; the only one the strategy trades.
     */
    @JsonIgnore
    public String getTradeSymbol() {
        return symbols.get(0);
    }

    @JsonIgnore
    public Path getSegmentDir() {
        return Path.of(sharedMemoryDir);
    }

    private static String defaultSegmentDir() {
        Path devShm = Path.of("/dev/shm");
        if (Files.isDirectory(devShm) && Files.isWritable(devShm)) {
            return devShm.toString();
        }
        return System.getProperty("java.io.tmpdir");
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPricePort() { return pricePort; }
    public void setPricePort(int pricePort) { this.pricePort = pricePort; }

    public int getNewsPort() { return newsPort; }
    public void setNewsPort(int newsPort) { this.newsPort = newsPort; }

    public int getOrderPort() { return orderPort; }
    public void setOrderPort(int orderPort) { this.orderPort = orderPort; }

    public String getSharedMemoryName() { return sharedMemoryName; }
    public void setSharedMemoryName(String sharedMemoryName) { this.sharedMemoryName = sharedMemoryName; }

    public String getSharedMemoryDir() { return sharedMemoryDir; }
    public void setSharedMemoryDir(String sharedMemoryDir) { this.sharedMemoryDir = sharedMemoryDir; }

    public List<String> getSymbols() { return symbols; }
    public void setSymbols(List<String> symbols) { this.symbols = symbols; }

    public int getShortWindow() { return shortWindow; }
    public void setShortWindow(int shortWindow) { this.shortWindow = shortWindow; }

    public int getLongWindow() { return longWindow; }
    public void setLongWindow(int longWindow) { this.longWindow = longWindow; }

    public int getBullishThreshold() { return bullishThreshold; }
    public void setBullishThreshold(int bullishThreshold) { this.bullishThreshold = bullishThreshold; }

    public int getBearishThreshold() { return bearishThreshold; }
    public void setBearishThreshold(int bearishThreshold) { this.bearishThreshold = bearishThreshold; }

    public int getTradeQuantity() { return tradeQuantity; }
    public void setTradeQuantity(int tradeQuantity) { this.tradeQuantity = tradeQuantity; }

    public long getPriceIntervalMs() { return priceIntervalMs; }
    public void setPriceIntervalMs(long priceIntervalMs) { this.priceIntervalMs = priceIntervalMs; }

    public long getNewsIntervalMs() { return newsIntervalMs; }
    public void setNewsIntervalMs(long newsIntervalMs) { this.newsIntervalMs = newsIntervalMs; }

    public long getReconnectDelayMs() { return reconnectDelayMs; }
    public void setReconnectDelayMs(long reconnectDelayMs) { this.reconnectDelayMs = reconnectDelayMs; }
}
