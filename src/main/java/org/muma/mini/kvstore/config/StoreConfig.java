package org.muma.mini.kvstore.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (kvstore.properties) > 默认值
 */
@Getter
@Setter
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "kvstore.properties";

    // --- Server ---
    private String host = "0.0.0.0";
    private int port = 7379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Storage ---
    private String storageFile = "data/kvstore.db";
    private String filePermissions = "rw-r--r--";

    // --- Save backoff (都为 0 表示同步落盘) ---
    private long saveInitialBackoffMs = 100;
    private long saveMaxBackoffMs = 10_000;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 按优先级加载: 先找 --config 指定的文件, 再套用环境变量, 最后套用命令行参数
     */
    public static StoreConfig load(String[] args, Map<String, String> env) {
        StoreConfig config = new StoreConfig();
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("StoreConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            String value = args[++i];
            switch (arg) {
                case "--config" -> this.configFilePath = value;
                case "--host" -> this.host = value;
                case "--port" -> this.port = parseInt(arg, value, this.port);
                case "--storage-file" -> this.storageFile = value;
                case "--save-initial-backoff-ms" -> this.saveInitialBackoffMs = parseLong(arg, value, this.saveInitialBackoffMs);
                case "--save-max-backoff-ms" -> this.saveMaxBackoffMs = parseLong(arg, value, this.saveMaxBackoffMs);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.host = props.getProperty("server.host", this.host);
        this.port = parseInt("server.port", props.getProperty("server.port"), this.port);
        this.workerThreads = parseInt("server.worker_threads", props.getProperty("server.worker_threads"), this.workerThreads);

        this.storageFile = props.getProperty("storage.file", this.storageFile);
        this.filePermissions = props.getProperty("storage.file_permissions", this.filePermissions);

        this.saveInitialBackoffMs = parseLong("save.initial_backoff_ms", props.getProperty("save.initial_backoff_ms"), this.saveInitialBackoffMs);
        this.saveMaxBackoffMs = parseLong("save.max_backoff_ms", props.getProperty("save.max_backoff_ms"), this.saveMaxBackoffMs);
    }

    public void applyEnvOverrides(Map<String, String> env) {
        String envHost = env.get("KVSTORE_HOST");
        if (envHost != null) {
            this.host = envHost;
            log.info("Host overridden by ENV: {}", envHost);
        }
        String envPort = env.get("KVSTORE_PORT");
        if (envPort != null) {
            this.port = parseInt("KVSTORE_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
        String envFile = env.get("KVSTORE_STORAGE_FILE");
        if (envFile != null) {
            this.storageFile = envFile;
            log.info("Storage file overridden by ENV: {}", envFile);
        }
    }

    public Duration getSaveInitialBackoff() {
        return Duration.ofMillis(saveInitialBackoffMs);
    }

    public Duration getSaveMaxBackoff() {
        return Duration.ofMillis(saveMaxBackoffMs);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading config from classpath: {}", path, e);
        }
        try (InputStream fis = new FileInputStream(path)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file not found: {}, using defaults.", path);
        }
        return props;
    }

    private int parseInt(String name, String value, int defaultValue) {
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', keeping {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String name, String value, long defaultValue) {
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', keeping {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{host=" + host + ", port=" + port + ", storageFile=" + storageFile
                + ", saveBackoff=" + saveInitialBackoffMs + "/" + saveMaxBackoffMs + "ms}";
    }
}
