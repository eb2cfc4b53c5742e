package luadeob.web;

import luadeob.config.Settings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DeobfuscatorServerTest {

    private final DeobfuscatorServer server = new DeobfuscatorServer(new Settings("v", "127.0.0.1", 0, 2));

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void process_success_fills_output() {
        Page page = server.process("local a = 1 return a");
        assertNull(page.error());
        assertEquals("local v1 = 1\nreturn v1\n", page.output());
        assertEquals("local a = 1 return a", page.input());
    }

    @Test
    void process_failure_keeps_input_and_hides_output() {
        Page page = server.process("local = <script>");
        assertNotNull(page.error());
        assertTrue(page.error().startsWith("Error processing code: "), page.error());
        assertEquals("", page.output());
        assertEquals("local = <script>", page.input());

        String html = page.render();
        assertTrue(html.contains("alert-danger"));
        assertTrue(html.contains("local = &lt;script&gt;"));
        assertFalse(html.contains("<script>"));
    }

    @Test
    void process_empty_input_renders_blank_form() {
        assertEquals(Page.empty(), server.process(null));
        assertEquals(Page.empty(), server.process(""));
        assertFalse(Page.empty().render().contains("alert-danger"));
    }

    @Test
    void parse_form_decodes_fields() {
        var form = DeobfuscatorServer.parseForm("input_code=local+x+%3D+1%0Areturn+x&flag");
        assertEquals("local x = 1\nreturn x", form.get("input_code"));
        assertEquals("", form.get("flag"));
        assertTrue(DeobfuscatorServer.parseForm("").isEmpty());
    }

    @Test
    void process_deeply_nested_input_renders_error() {
        String input = "return " + "(".repeat(20000) + "1" + ")".repeat(20000);
        Page page = server.process(input);
        assertNotNull(page.error());
        assertTrue(page.error().contains("Nesting deeper than"), page.error());
        assertEquals("", page.output());
    }

    @Test
    void parse_form_rejects_bad_percent_escape() {
        assertThrows(IllegalArgumentException.class, () -> DeobfuscatorServer.parseForm("input_code=%zz"));
    }

    @Test
    void escape_html() {
        assertEquals("a &lt; b &amp;&amp; c &gt; &quot;d&quot; &#39;e&#39;", Page.escapeHtml("a < b && c > \"d\" 'e'"));
    }

    @Test
    void serves_form_over_http() throws Exception {
        server.start();
        HttpClient client = HttpClient.newHttpClient();
        String base = "http://127.0.0.1:" + server.port();

        var get = client.send(HttpRequest.newBuilder(URI.create(base + "/")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, get.statusCode());
        assertTrue(get.body().contains("name=\"input_code\""));

        String form = "input_code=" + URLEncoder.encode(
                "local function add(a, b) return a + b end return add(1, 2)", StandardCharsets.UTF_8);
        var post = client.send(HttpRequest.newBuilder(URI.create(base + "/"))
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString(form))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, post.statusCode());
        assertTrue(post.body().contains("local function v1(v2, v3)"), post.body());
        assertTrue(post.body().contains("return v2 + v3"));

        var health = client.send(HttpRequest.newBuilder(URI.create(base + "/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals("ok", health.body());

        var missing = client.send(HttpRequest.newBuilder(URI.create(base + "/nope")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(404, missing.statusCode());

        var put = client.send(HttpRequest.newBuilder(URI.create(base + "/"))
                        .PUT(HttpRequest.BodyPublishers.ofString("x")).build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(405, put.statusCode());
    }

    @Test
    void undecodable_form_gets_error_page() throws Exception {
        server.start();
        HttpClient client = HttpClient.newHttpClient();
        var post = client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/"))
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString("input_code=%zz"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(400, post.statusCode());
        assertTrue(post.body().contains("alert-danger"), post.body());
        assertTrue(post.body().contains("Error reading form"), post.body());
    }
}
