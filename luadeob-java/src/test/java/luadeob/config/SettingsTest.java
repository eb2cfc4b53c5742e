package luadeob.config;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SettingsTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    void empty_properties_give_defaults() {
        assertEquals(Settings.defaults(), Settings.fromProperties(new Properties(), Map.of()));
    }

    @Test
    void bundled_resource_matches_defaults() {
        var loaded = Settings.fromProperties(loadResource(), Map.of());
        assertEquals(Settings.defaults(), loaded);
    }

    @Test
    void properties_override_defaults() {
        var s = Settings.fromProperties(props(
                "luadeob.name.prefix", "local_",
                "luadeob.server.host", "127.0.0.1",
                "luadeob.server.port", " 9000 ",
                "luadeob.server.threads", "2"), Map.of());
        assertEquals(new Settings("local_", "127.0.0.1", 9000, 2), s);
    }

    @Test
    void port_environment_variable_wins() {
        var s = Settings.fromProperties(props("luadeob.server.port", "9000"), Map.of("PORT", "8081"));
        assertEquals(8081, s.port());
        var blank = Settings.fromProperties(props("luadeob.server.port", "9000"), Map.of("PORT", " "));
        assertEquals(9000, blank.port());
    }

    @Test
    void invalid_values_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Settings.fromProperties(props("luadeob.server.port", "http"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Settings.fromProperties(props("luadeob.server.port", "70000"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Settings.fromProperties(props("luadeob.name.prefix", "then"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Settings.fromProperties(props("luadeob.server.threads", "0"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Settings.fromProperties(new Properties(), Map.of("PORT", "x")));
    }

    @Test
    void with_port_keeps_other_values() {
        var s = Settings.defaults().withPort(1234);
        assertEquals(1234, s.port());
        assertEquals(Settings.defaults().namePrefix(), s.namePrefix());
    }

    private static Properties loadResource() {
        Properties p = new Properties();
        try (var in = SettingsTest.class.getClassLoader().getResourceAsStream(Settings.RESOURCE)) {
            assertNotNull(in, "missing " + Settings.RESOURCE);
            p.load(in);
        } catch (java.io.IOException e) {
            fail(e);
        }
        return p;
    }
}
