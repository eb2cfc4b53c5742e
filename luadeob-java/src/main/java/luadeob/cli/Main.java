package luadeob.cli;

import luadeob.DeobfuscationException;
import luadeob.Deobfuscator;
import luadeob.config.Settings;
import luadeob.web.DeobfuscatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = """
            Usage: luadeob <input.lua | -> [output.lua]
                   luadeob --serve [port]""";

    // returned by run() when the web server keeps the JVM alive
    static final int SERVING = -1;

    public static void main(String[] args) throws Exception {
        int status = run(args);
        if (status != SERVING) System.exit(status);
    }

    static int run(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2) {
            System.err.println(USAGE);
            return 2;
        }

        Settings settings = Settings.load();

        if (args[0].equals("--serve")) {
            if (args.length == 2) {
                try {
                    settings = settings.withPort(Integer.parseInt(args[1]));
                } catch (IllegalArgumentException e) {
                    System.err.println("error: invalid port '" + args[1] + "'");
                    return 2;
                }
            }
            DeobfuscatorServer server = new DeobfuscatorServer(settings);
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
            return SERVING;
        }

        try {
            // 1. read
            String source;
            if (args[0].equals("-")) {
                source = StandardCharsets.UTF_8.newDecoder()
                        .decode(ByteBuffer.wrap(System.in.readAllBytes()))
                        .toString();
                logger.info("[1/3] Reading: <stdin>");
            } else {
                Path input = Path.of(args[0]);
                source = Files.readString(input);
                logger.info("[1/3] Reading: {}", input);
            }

            // 2. lex, parse, rename, print
            Deobfuscator.Result result = new Deobfuscator(settings).deobfuscate(source);
            logger.info("[2/3] Renamed {} locals, {} references", result.declarations(), result.rewrites());

            // 3. write
            if (args.length == 2) {
                Path output = Path.of(args[1]);
                Files.writeString(output, result.output());
                logger.info("[3/3] Written: {}", output);
            } else {
                System.out.print(result.output());
                System.out.flush();
                logger.info("[3/3] Written: <stdout>");
            }
        } catch (DeobfuscationException e) {
            logger.warn("Deobfuscation failed: {}", e.getMessage());
            System.err.println("error: " + e.getMessage());
            return 1;
        } catch (InvalidPathException e) {
            System.err.println("error: invalid path: " + e.getInput());
            return 1;
        } catch (IOException e) {
            logger.warn("I/O failed: {}", describe(e));
            System.err.println("error: " + describe(e));
            return 1;
        }
        return 0;
    }

    // NoSuchFileException and friends carry only the path as their message
    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) return "no such file: " + e.getMessage();
        if (e instanceof AccessDeniedException) return "access denied: " + e.getMessage();
        if (e instanceof CharacterCodingException) return "input is not valid UTF-8";
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
