package io.navi.mq.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link BrokerConfig} from environment variables or a YAML document.
 *
 * <h3>Environment variables:</h3>
 * <ul>
 *   <li>{@code NAVI_AMQP_USERNAME}, {@code NAVI_AMQP_PASSWORD}, {@code NAVI_AMQP_HOST},
 *       {@code NAVI_AMQP_PORT} (required)</li>
 *   <li>{@code NAVI_EXCHANGE} (default "amq.topic"), {@code NAVI_EXCHANGE_TYPE} (default "topic")</li>
 *   <li>{@code NAVI_AMQP_VHOST}, {@code NAVI_AMQP_SSL}, {@code NAVI_PREFETCH_COUNT} (optional)</li>
 * </ul>
 *
 * <h3>YAML:</h3>
 * <pre>
 * navi:
 *   amqp:
 *     host: localhost
 *     port: 5672
 *     username: guest
 *     password: guest
 *     vhost: /
 *     ssl: false
 *     connection-timeout: 10000
 *     heartbeat: 30
 *   exchange:
 *     name: amq.topic
 *     type: topic
 *   prefetch-count: 10
 * </pre>
 */
public class NaviConfigLoader {

    public static final String ENV_USERNAME = "NAVI_AMQP_USERNAME";
    public static final String ENV_PASSWORD = "NAVI_AMQP_PASSWORD";
    public static final String ENV_HOST = "NAVI_AMQP_HOST";
    public static final String ENV_PORT = "NAVI_AMQP_PORT";
    public static final String ENV_VHOST = "NAVI_AMQP_VHOST";
    public static final String ENV_SSL = "NAVI_AMQP_SSL";
    public static final String ENV_EXCHANGE = "NAVI_EXCHANGE";
    public static final String ENV_EXCHANGE_TYPE = "NAVI_EXCHANGE_TYPE";
    public static final String ENV_PREFETCH_COUNT = "NAVI_PREFETCH_COUNT";

    private NaviConfigLoader() {
    }

    /**
     * Load config from the process environment.
     */
    public static BrokerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Load config from a map of environment variables.
     *
     * @throws ConfigException listing every missing or invalid entry
     */
    public static BrokerConfig fromEnvironment(Map<String, String> env) {
        List<String> invalid = new ArrayList<>();

        String username = required(env, ENV_USERNAME, invalid);
        String password = required(env, ENV_PASSWORD, invalid);
        String host = required(env, ENV_HOST, invalid);
        String rawPort = required(env, ENV_PORT, invalid);

        int port = BrokerConfig.DEFAULT_PORT;
        if (rawPort != null) {
            try {
                port = Integer.parseInt(rawPort.trim());
            } catch (NumberFormatException e) {
                invalid.add(ENV_PORT + "=" + rawPort);
            }
        }

        ExchangeType exchangeType = BrokerConfig.DEFAULT_EXCHANGE_TYPE;
        String rawType = env.get(ENV_EXCHANGE_TYPE);
        if (rawType != null) {
            try {
                exchangeType = ExchangeType.fromString(rawType);
            } catch (ConfigException e) {
                invalid.add(ENV_EXCHANGE_TYPE + "=" + rawType);
            }
        }

        int prefetchCount = BrokerConfig.DEFAULT_PREFETCH_COUNT;
        String rawPrefetch = env.get(ENV_PREFETCH_COUNT);
        if (rawPrefetch != null) {
            try {
                prefetchCount = Integer.parseInt(rawPrefetch.trim());
            } catch (NumberFormatException e) {
                invalid.add(ENV_PREFETCH_COUNT + "=" + rawPrefetch);
            }
        }

        if (!invalid.isEmpty()) {
            throw new ConfigException(invalid);
        }

        return new BrokerConfig(
                host,
                port,
                username,
                password,
                env.getOrDefault(ENV_VHOST, BrokerConfig.DEFAULT_VHOST),
                env.getOrDefault(ENV_EXCHANGE, BrokerConfig.DEFAULT_EXCHANGE),
                exchangeType,
                Boolean.parseBoolean(env.getOrDefault(ENV_SSL, "false")),
                BrokerConfig.DEFAULT_CONNECTION_TIMEOUT,
                BrokerConfig.DEFAULT_HEARTBEAT,
                prefetchCount
        );
    }

    /**
     * Load config from a YAML file path.
     */
    public static BrokerConfig fromYaml(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config from " + path, e);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static BrokerConfig fromClasspath(String resource) {
        try (InputStream is = NaviConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new ConfigException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Load config from an InputStream.
     */
    public static BrokerConfig fromYaml(InputStream is) {
        Object document;
        try {
            document = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed YAML config", e);
        }
        if (document == null) {
            throw new ConfigException("Empty YAML config");
        }
        if (!(document instanceof Map)) {
            throw new ConfigException("YAML config must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> root = (Map<String, Object>) document;

        Map<String, Object> navi = getMap(root, "navi");
        Map<String, Object> amqp = getMap(navi, "amqp");
        Map<String, Object> exchange = getMapOrEmpty(navi, "exchange");

        String exchangeType = getString(exchange, "type", BrokerConfig.DEFAULT_EXCHANGE_TYPE.name());

        return new BrokerConfig(
                getString(amqp, "host", null),
                toInt(amqp.get("port"), BrokerConfig.DEFAULT_PORT),
                getString(amqp, "username", null),
                getString(amqp, "password", null),
                getString(amqp, "vhost", BrokerConfig.DEFAULT_VHOST),
                getString(exchange, "name", BrokerConfig.DEFAULT_EXCHANGE),
                ExchangeType.fromString(exchangeType),
                Boolean.parseBoolean(getString(amqp, "ssl", "false")),
                toInt(amqp.get("connection-timeout"), BrokerConfig.DEFAULT_CONNECTION_TIMEOUT),
                toInt(amqp.get("heartbeat"), BrokerConfig.DEFAULT_HEARTBEAT),
                toInt(navi.get("prefetch-count"), BrokerConfig.DEFAULT_PREFETCH_COUNT)
        );
    }

    // ========== Utility ==========

    private static String required(Map<String, String> env, String key, List<String> invalid) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            invalid.add(key + "=" + value);
            return null;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new ConfigException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object val = map.get(key);
        return val == null ? defaultValue : String.valueOf(val);
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Not an integer: " + val, e);
        }
    }
}
