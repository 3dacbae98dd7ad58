package com.aura.edge.monitor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Asks System Events for the frontmost process and its fullscreen attribute (macOS).
 */
public class OsascriptForegroundProbe implements ForegroundWindowProbe {

    private static final String FRONT_PROCESS =
        "tell application \"System Events\" to get name of first process whose frontmost is true";
    private static final String FRONT_FULLSCREEN =
        "tell application \"System Events\" to get value of attribute \"AXFullScreen\" "
            + "of first window of first process whose frontmost is true";
    private static final long TIMEOUT_MILLIS = 1000;

    @Override
    public ForegroundWindow probe() throws IOException, InterruptedException {
        String process = run(FRONT_PROCESS);
        if (process.isEmpty()) {
            return ForegroundWindow.UNKNOWN;
        }
        boolean fullscreen = "true".equalsIgnoreCase(run(FRONT_FULLSCREEN));
        return new ForegroundWindow(process, fullscreen);
    }

    private String run(String script) throws IOException, InterruptedException {
        Process process = new ProcessBuilder("osascript", "-e", script)
            .redirectErrorStream(true)
            .start();
        if (!process.waitFor(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("osascript timed out");
        }
        if (process.exitValue() != 0) {
            return "";
        }
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            return line == null ? "" : line.trim();
        }
    }
}
