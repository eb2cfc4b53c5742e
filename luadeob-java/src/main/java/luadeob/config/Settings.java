package luadeob.config;

import luadeob.rename.NameGenerator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Runtime settings, read from {@code luadeob.properties} on the classpath.
 * The {@code PORT} environment variable overrides the server port.
 */
public record Settings(
        String namePrefix,
        String host,
        int port,
        int threads
) {
    public static final String RESOURCE = "luadeob.properties";

    public Settings {
        if (!NameGenerator.isValidPrefix(namePrefix)) {
            throw new IllegalArgumentException("luadeob.name.prefix is not a usable identifier prefix: '" + namePrefix + "'");
        }
        if (port < 0 || port > 65535) throw new IllegalArgumentException("Port out of range: " + port);
        if (threads < 1) throw new IllegalArgumentException("luadeob.server.threads must be positive: " + threads);
    }

    public static Settings defaults() {
        return new Settings(NameGenerator.DEFAULT_PREFIX, "0.0.0.0", 8000, 4);
    }

    public static Settings load() {
        Properties props = new Properties();
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return fromProperties(props, System.getenv());
    }

    public static Settings fromProperties(Properties props, Map<String, String> env) {
        Settings d = defaults();
        String prefix = props.getProperty("luadeob.name.prefix", d.namePrefix()).trim();
        String host = props.getProperty("luadeob.server.host", d.host()).trim();
        int port = parseInt("luadeob.server.port", props.getProperty("luadeob.server.port"), d.port());
        int threads = parseInt("luadeob.server.threads", props.getProperty("luadeob.server.threads"), d.threads());

        String envPort = env.get("PORT");
        if (envPort != null && !envPort.isBlank()) port = parseInt("PORT", envPort, port);

        return new Settings(prefix, host, port, threads);
    }

    public Settings withPort(int newPort) {
        return new Settings(namePrefix, host, newPort, threads);
    }

    private static int parseInt(String key, String value, int fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }
}
