package org.jsondb;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownFlushIntegrationTest {

    private static final String EXPECTED = "{\n  \"events\": [\n    \"started\"\n  ],\n  \"clean\": false\n}";

    @TempDir Path tmp;

    @Test
    void unsavedDocumentIsWrittenWhenMainReturns() throws Exception {
        Path file = tmp.resolve("state.json");

        Result r = runChild(file.toString());

        assertEquals(0, r.exitCode, r.output);
        assertEquals(EXPECTED, Files.readString(file, StandardCharsets.UTF_8));
        assertFalse(Files.exists(file.resolveSibling("state.json.tmp")));
    }

    @Test
    void unsavedDocumentIsWrittenOnSystemExit() throws Exception {
        Path file = tmp.resolve("exit.json");

        Result r = runChild(file.toString(), "3");

        assertEquals(3, r.exitCode, r.output);
        assertEquals(EXPECTED, Files.readString(file, StandardCharsets.UTF_8));
    }

    // ---------- helpers ----------

    private record Result(int exitCode, String output) {}

    private static String resolveJavaExe() {
        String bin = System.getProperty("java.home") + File.separator + "bin" + File.separator + "java";
        if (System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win")) bin += ".exe";
        return bin;
    }

    private static Result runChild(String... args) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder();
        pb.command(resolveJavaExe(), "-cp", System.getProperty("java.class.path"), ShutdownFlushMain.class.getName());
        for (String a : args) pb.command().add(a);
        pb.redirectErrorStream(true);
        Process p = pb.start();
        String out = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (!p.waitFor(30, TimeUnit.SECONDS)) {
            p.destroyForcibly();
            fail("child JVM did not exit:\n" + out);
        }
        return new Result(p.exitValue(), out);
    }
}
