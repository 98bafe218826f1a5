package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 服务器配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (resp-kv.properties) > 默认值
 */
@Getter
@Setter
public class ServerConfig {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "resp-kv.properties";

    // --- Network ---
    private int port = 6379;
    private String bindAddress = "0.0.0.0";
    private int workerThreads = 0; // 0 = Netty default
    private int backlog = 511;

    // --- Store ---
    private long sweepIntervalMs = 100; // <= 0 关闭定期删除，只保留惰性删除
    private int lockStripes = 1024;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 按优先级组装配置：先找 --config 指定的文件，再依次叠加文件、环境变量、命令行
     */
    public static ServerConfig load(String[] args, Map<String, String> env) {
        ServerConfig config = new ServerConfig();
        String path = findConfigPath(args);
        if (path != null) {
            config.configFilePath = path;
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("Server config initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring dangling argument: {}", arg);
                break;
            }
            String value = args[++i];
            switch (arg) {
                case "--config" -> this.configFilePath = value;
                case "--port" -> this.port = parseInt(arg, value, this.port);
                case "--bind" -> this.bindAddress = value;
                case "--worker-threads" -> this.workerThreads = parseInt(arg, value, this.workerThreads);
                case "--sweep-interval" -> this.sweepIntervalMs = parseLong(arg, value, this.sweepIntervalMs);
                default -> log.warn("Unknown argument: {} {}", arg, value);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "server.port", this.port);
        this.bindAddress = props.getProperty("server.bind", this.bindAddress);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.backlog = getInt(props, "server.backlog", this.backlog);

        this.sweepIntervalMs = getLong(props, "store.sweep_interval_ms", this.sweepIntervalMs);
        this.lockStripes = getInt(props, "store.lock_stripes", this.lockStripes);
    }

    public void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("KV_PORT");
        if (envPort != null) {
            this.port = parseInt("KV_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envBind = env.get("KV_BIND");
        if (envBind != null) {
            this.bindAddress = envBind;
            log.info("Bind address overridden by ENV: {}", this.bindAddress);
        }

        String envSweep = env.get("KV_SWEEP_INTERVAL_MS");
        if (envSweep != null) {
            this.sweepIntervalMs = parseLong("KV_SWEEP_INTERVAL_MS", envSweep, this.sweepIntervalMs);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 先按 classpath 资源查找
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 再作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.debug("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val.trim(), defaultValue) : defaultValue;
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseLong(key, val.trim(), defaultValue) : defaultValue;
    }

    private int parseInt(String name, String value, int defaultValue) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String name, String value, long defaultValue) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{bind=" + bindAddress + ", port=" + port + ", workerThreads=" + workerThreads
                + ", sweepIntervalMs=" + sweepIntervalMs + ", lockStripes=" + lockStripes + "}";
    }
}
