package com.aura.edge.gateway;

import com.aura.shared.protocol.Command;
import com.aura.shared.protocol.Event;
import com.aura.shared.protocol.EventType;
import com.aura.shared.protocol.Payloads;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Newline-delimited JSON over a pair of streams: commands in, events out. In production
 * these are the process's stdin and stdout, so nothing else may write to stdout.
 */
@Slf4j
public class JsonLineTransport implements EventSink {

    private final InputStream in;
    private final PrintStream out;
    private final ObjectMapper mapper;

    public JsonLineTransport(InputStream in, OutputStream out, ObjectMapper mapper) {
        this.in = in;
        this.out = new PrintStream(out, false, StandardCharsets.UTF_8);
        this.mapper = mapper;
    }

    /**
     * Starts the reader thread.
     *
     * @param commands receives every well-formed command
     * @param onClose  runs once the input stream ends
     */
    public void start(Consumer<Command> commands, Runnable onClose) {
        Thread reader = new Thread(() -> readLoop(commands, onClose), "aura-stdin");
        reader.setDaemon(true);
        reader.start();
    }

    void readLoop(Consumer<Command> commands, Runnable onClose) {
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                handleLine(line, commands);
            }
            log.info("Command stream closed");
        } catch (IOException e) {
            log.error("Command stream failed: {}", e.getMessage());
        } finally {
            onClose.run();
        }
    }

    void handleLine(String line, Consumer<Command> commands) {
        if (line.isBlank()) {
            return;
        }
        Command command;
        try {
            command = ProtocolMapper.readCommand(mapper, line);
        } catch (CommandRejectedException e) {
            log.warn("Rejected input line: {}", e.getMessage());
            emit(Event.of(EventType.ERROR, new Payloads.ErrorMessage(e.getMessage())));
            return;
        }
        commands.accept(command);
    }

    @Override
    public synchronized void emit(Event event) {
        out.println(ProtocolMapper.writeEvent(mapper, event));
        out.flush();
    }
}
