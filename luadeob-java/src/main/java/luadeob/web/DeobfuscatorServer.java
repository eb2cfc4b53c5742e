package luadeob.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import luadeob.DeobfuscationException;
import luadeob.Deobfuscator;
import luadeob.config.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Single-page form: paste obfuscated Lua, get the renamed program back.
 * Each POST runs its own deobfuscation; on failure the page shows the
 * error, keeps the submitted input and leaves the output empty.
 */
public final class DeobfuscatorServer {
    private static final Logger logger = LoggerFactory.getLogger(DeobfuscatorServer.class);

    static final String INPUT_FIELD = "input_code";

    private final Settings settings;
    private final Deobfuscator deobfuscator;
    private HttpServer server;
    private ExecutorService executor;

    public DeobfuscatorServer(Settings settings) {
        this.settings = settings;
        this.deobfuscator = new Deobfuscator(settings);
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(settings.host(), settings.port()), 0);

        server.createContext("/health", exchange -> respond(exchange, 200, "text/plain", "ok"));

        server.createContext("/", exchange -> {
            if (!exchange.getRequestURI().getPath().equals("/")) {
                respond(exchange, 404, "text/plain", "not found");
                return;
            }
            String method = exchange.getRequestMethod();
            if ("GET".equalsIgnoreCase(method)) {
                respond(exchange, 200, "text/html", Page.empty().render());
            } else if ("POST".equalsIgnoreCase(method)) {
                Map<String, String> form;
                try {
                    form = parseForm(readBody(exchange));
                } catch (IllegalArgumentException e) {
                    logger.warn("Rejected undecodable form: {}", e.getMessage());
                    respond(exchange, 400, "text/html", Page.failure("", "Error reading form: " + e.getMessage()).render());
                    return;
                }
                respond(exchange, 200, "text/html", process(form.get(INPUT_FIELD)).render());
            } else {
                exchange.getResponseHeaders().set("Allow", "GET, POST");
                respond(exchange, 405, "text/plain", "method not allowed");
            }
        });

        executor = Executors.newFixedThreadPool(settings.threads());
        server.setExecutor(executor);
        server.start();
        logger.info("Deobfuscator form listening on http://{}:{}/", settings.host(), port());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int port() {
        return server.getAddress().getPort();
    }

    Page process(String input) {
        if (input == null || input.isEmpty()) return Page.empty();
        try {
            return Page.success(input, deobfuscator.deobfuscate(input).output());
        } catch (DeobfuscationException e) {
            logger.warn("Rejected submission: {}", e.getMessage());
            return Page.failure(input, "Error processing code: " + e.getMessage());
        }
    }

    // ---------- http helpers ----------

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType + "; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static Map<String, String> parseForm(String body) {
        Map<String, String> m = new HashMap<>();
        if (body == null || body.isEmpty()) return m;
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            m.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return m;
    }
}
