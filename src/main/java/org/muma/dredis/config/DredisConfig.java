package org.muma.dredis.config;

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
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (dredis.properties) > 默认值
 */
@Getter
@Setter
public class DredisConfig {

    private static final Logger log = LoggerFactory.getLogger(DredisConfig.class);
    private static final DredisConfig INSTANCE = new DredisConfig();

    public static final String DEFAULT_CONFIG_FILE = "dredis.properties";

    // --- Core Settings ---
    private String host = "0.0.0.0";
    private int port = 7379;
    private int workerThreads = 0; // 0 = Netty default

    // 超过该耗时的命令记 WARN 日志
    private long slowLogMillis = 10;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    DredisConfig() {
    }

    public static DredisConfig getInstance() {
        return INSTANCE;
    }

    /**
     * 完整加载流程：先找 --config，再依次应用配置文件、环境变量、命令行参数
     */
    public void load(String[] args) {
        this.configFilePath = findConfigPath(args);
        loadConfig(configFilePath);
        applyEnvOverrides(System.getenv());
        parseArgs(args);
        log.info("DredisConfig initialized: {}", this);
    }

    private String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return configFilePath;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> i++;
                case "--host" -> this.host = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i], this.port);
                case "--workers" -> this.workerThreads = parseInt("--workers", args[++i], this.workerThreads);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.host = props.getProperty("server.host", this.host);
        this.port = parseInt("server.port", props.getProperty("server.port"), this.port);
        this.workerThreads = parseInt("server.worker_threads", props.getProperty("server.worker_threads"), this.workerThreads);
        this.slowLogMillis = parseInt("slowlog.millis", props.getProperty("slowlog.millis"), (int) this.slowLogMillis);
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envHost = env.get("DREDIS_HOST");
        if (envHost != null) {
            this.host = envHost;
            log.info("Host overridden by ENV: {}", this.host);
        }

        String envPort = env.get("DREDIS_PORT");
        if (envPort != null) {
            this.port = parseInt("DREDIS_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private static int parseInt(String name, String value, int defaultValue) {
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port + ", workers=" + workerThreads
                + ", slowLogMillis=" + slowLogMillis + "}";
    }
}
