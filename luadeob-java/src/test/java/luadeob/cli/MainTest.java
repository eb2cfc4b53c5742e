package luadeob.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    @Test
    void renames_file_to_output_file() throws Exception {
        Path in = dir.resolve("in.lua");
        Path out = dir.resolve("out.lua");
        Files.writeString(in, "local x = 1\nreturn x\n");

        assertEquals(0, Main.run(new String[]{in.toString(), out.toString()}));
        assertEquals("local v1 = 1\nreturn v1\n", Files.readString(out));
    }

    @Test
    void invalid_source_writes_nothing() throws Exception {
        Path in = dir.resolve("bad.lua");
        Path out = dir.resolve("out.lua");
        Files.writeString(in, "local function (");

        assertEquals(1, Main.run(new String[]{in.toString(), out.toString()}));
        assertFalse(Files.exists(out));
    }

    @Test
    void usage_errors() throws Exception {
        assertEquals(2, Main.run(new String[0]));
        assertEquals(2, Main.run(new String[]{"a", "b", "c"}));
        assertEquals(2, Main.run(new String[]{"--serve", "not-a-port"}));
    }

    @Test
    void missing_input_file_reports_error() throws Exception {
        String err = captureStderr(() -> assertEquals(1, Main.run(new String[]{dir.resolve("nope.lua").toString()})));
        assertTrue(err.contains("error: no such file"), err);
    }

    @Test
    void non_utf8_input_reports_error() throws Exception {
        Path in = dir.resolve("latin1.lua");
        Files.write(in, new byte[]{'l', 'o', 'c', 'a', 'l', ' ', 'x', ' ', '=', ' ', '\'', (byte) 0xFF, '\''});

        String err = captureStderr(() -> assertEquals(1, Main.run(new String[]{in.toString()})));
        assertTrue(err.contains("error: input is not valid UTF-8"), err);
    }

    @Test
    void unwritable_output_reports_error() throws Exception {
        Path in = dir.resolve("in.lua");
        Files.writeString(in, "local x = 1\n");
        Path out = dir.resolve("missing-dir").resolve("out.lua");

        String err = captureStderr(() -> assertEquals(1, Main.run(new String[]{in.toString(), out.toString()})));
        assertTrue(err.contains("error: "), err);
        assertFalse(Files.exists(out));
    }

    @Test
    void reads_stdin_and_writes_stdout() throws Exception {
        InputStream oldIn = System.in;
        PrintStream oldOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setIn(new ByteArrayInputStream("local y = 2 return y".getBytes(StandardCharsets.UTF_8)));
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            assertEquals(0, Main.run(new String[]{"-"}));
        } finally {
            System.setIn(oldIn);
            System.setOut(oldOut);
        }
        assertEquals("local v1 = 2\nreturn v1\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void non_utf8_stdin_reports_error() throws Exception {
        InputStream oldIn = System.in;
        try {
            System.setIn(new ByteArrayInputStream(new byte[]{'x', (byte) 0xC3}));
            String err = captureStderr(() -> assertEquals(1, Main.run(new String[]{"-"})));
            assertTrue(err.contains("error: input is not valid UTF-8"), err);
        } finally {
            System.setIn(oldIn);
        }
    }

    private interface CliCall {
        void run() throws Exception;
    }

    private static String captureStderr(CliCall call) throws Exception {
        PrintStream old = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            call.run();
        } finally {
            System.setErr(old);
        }
        return err.toString(StandardCharsets.UTF_8);
    }
}
