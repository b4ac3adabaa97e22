package com.panelkit.panel.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes each live update as one JSON line, for a parent process reading this
 * process's stdout (or any other stream it hands in).
 */
@Slf4j
public class JsonLinesIpcChannel implements LiveUpdateChannel {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Writer writer;

    public JsonLinesIpcChannel(OutputStream out) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    public JsonLinesIpcChannel(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void send(LiveUpdateMessage message) {
        try {
            String line = mapper.writeValueAsString(message);
            synchronized (writer) {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            }
        } catch (IOException e) {
            log.error("Error sending IPC live update for {}: {}", message.data().panelId(), e.getMessage());
        }
    }
}
