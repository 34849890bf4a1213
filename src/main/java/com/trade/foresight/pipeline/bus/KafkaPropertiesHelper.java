package com.trade.foresight.pipeline.bus;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * KafkaPropertiesHelper
 * ------------------------------------------------------------
 * Loads producer/consumer Properties from the classpath and
 * resolves bootstrap.servers from a single source of truth.
 *
 * Resolution precedence for bootstrap.servers:
 *  1) Env: KAFKA_BOOTSTRAP_SERVERS
 *  2) Sys Prop: kafka.bootstrap.servers
 *  3) application-{profile}.properties -> foresight.kafka.bootstrap-servers
 *  4) application.properties           -> foresight.kafka.bootstrap-servers
 *  5) producer/consumer.properties     -> bootstrap.servers (as-is)
 *
 * ${...} placeholders inside producer.properties / consumer.properties
 * are expanded from application*.properties, system properties and env.
 */
public final class KafkaPropertiesHelper {

    private static final String APP_PROPS = "/application.properties";
    private static final String APP_PROPS_FMT = "/application-%s.properties";
    private static final String PRODUCER_PROPS = "/producer.properties";
    private static final String CONSUMER_PROPS = "/consumer.properties";

    private static final String APP_BOOTSTRAP_KEY = "foresight.kafka.bootstrap-servers";
    private static final String BOOTSTRAP_KEY = "bootstrap.servers";
    private static final String SPRING_PROFILES_ACTIVE = "spring.profiles.active";

    private KafkaPropertiesHelper() {
    }

    public static Properties loadProducerProps() {
        Properties base = load(PRODUCER_PROPS);
        hardenProducerDefaults(base);
        return base;
    }

    /**
     * Consumer properties for one consumer group; earliest offset reset
     * unless consumer.properties says otherwise.
     */
    public static Properties loadConsumerProps(String groupId) {
        Properties base = load(CONSUMER_PROPS);
        base.setProperty("group.id", groupId);
        hardenConsumerDefaults(base);
        return base;
    }

    private static Properties load(String resource) {
        Properties base = readProps(resource);
        Properties app = loadAppProps();
        expandPlaceholders(base, app);
        String bs = resolveBootstrapServers(app);
        if (bs != null) {
            base.setProperty(BOOTSTRAP_KEY, bs);
        }
        return base;
    }

    public static String resolveBootstrapServers(Properties appProps) {
        String env = System.getenv("KAFKA_BOOTSTRAP_SERVERS");
        if (notBlank(env)) return env.trim();

        String sys = System.getProperty("kafka.bootstrap.servers");
        if (notBlank(sys)) return sys.trim();

        if (appProps != null) {
            String v = appProps.getProperty(APP_BOOTSTRAP_KEY);
            if (notBlank(v)) return v.trim();
        }
        // keep what's in producer/consumer.properties
        return null;
    }

    public static Properties loadAppProps() {
        Properties app = new Properties();

        String profile = System.getProperty(SPRING_PROFILES_ACTIVE);
        if (!notBlank(profile)) {
            profile = System.getenv(toEnvKey(SPRING_PROFILES_ACTIVE));
        }
        if (notBlank(profile)) {
            app.putAll(readProps(String.format(APP_PROPS_FMT, profile.trim())));
        }

        // profile values win over the baseline
        for (Map.Entry<Object, Object> e : readProps(APP_PROPS).entrySet()) {
            app.putIfAbsent(e.getKey(), e.getValue());
        }
        return app;
    }

    private static Properties readProps(String classpathResource) {
        Properties p = new Properties();
        try (InputStream in = KafkaPropertiesHelper.class.getResourceAsStream(classpathResource)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + classpathResource, e);
        }
        return p;
    }

    private static void expandPlaceholders(Properties target, Properties source) {
        for (String name : target.stringPropertyNames()) {
            String s = target.getProperty(name);
            String expanded = expandOne(s, source);
            if (!s.equals(expanded)) {
                target.setProperty(name, expanded);
            }
        }
    }

    private static String expandOne(String value, Properties source) {
        String out = value;
        int safety = 0;
        while (out.contains("${") && safety < 10) {
            int start = out.indexOf("${");
            int end = out.indexOf('}', start + 2);
            if (end < 0) break;
            String key = out.substring(start + 2, end);
            String fallback = "";
            int colon = key.indexOf(':');
            if (colon >= 0) {
                fallback = key.substring(colon + 1);
                key = key.substring(0, colon);
            }
            String repl = source.getProperty(key);
            if (repl == null) repl = System.getProperty(key);
            if (repl == null) repl = System.getenv(toEnvKey(key));
            if (repl == null) repl = fallback;
            out = out.substring(0, start) + repl + out.substring(end + 1);
            safety++;
        }
        return out;
    }

    private static String toEnvKey(String key) {
        // spring.profiles.active -> SPRING_PROFILES_ACTIVE
        return key.trim().toUpperCase().replace('.', '_').replace('-', '_');
    }

    private static boolean notBlank(String s) {
        return s != null && !s.trim().isEmpty();
    }

    private static void hardenProducerDefaults(Properties p) {
        putIfAbsent(p, "acks", "all");
        putIfAbsent(p, "enable.idempotence", "true");
        putIfAbsent(p, "delivery.timeout.ms", "120000");
        putIfAbsent(p, "request.timeout.ms", "30000");
        // a chunk of 1000 candles is ~150 KB of JSON
        putIfAbsent(p, "max.request.size", "1048576");
        putIfAbsent(p, "compression.type", "snappy");
        putIfAbsent(p, "key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(p, "value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(p, "client.id", "foresight-producer");
    }

    private static void hardenConsumerDefaults(Properties p) {
        putIfAbsent(p, "auto.offset.reset", "earliest");
        putIfAbsent(p, "max.poll.interval.ms", "600000");
        putIfAbsent(p, "max.poll.records", "50");
        putIfAbsent(p, "session.timeout.ms", "10000");
        putIfAbsent(p, "heartbeat.interval.ms", "3000");
        putIfAbsent(p, "key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        putIfAbsent(p, "value.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        putIfAbsent(p, "client.id", "foresight-" + p.getProperty("group.id", "consumer"));
    }

    private static void putIfAbsent(Properties p, String key, String value) {
        String cur = p.getProperty(key);
        if (cur == null || cur.trim().isEmpty()) {
            p.setProperty(key, value);
        }
    }
}
