package com.obsidx.cli;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Renders command results either as plain text or as a JSON
 * {@link Envelope} on stdout.
 */
public class OutputPrinter {
    public static final String NOT_FOUND = "NOT_FOUND";

    private final PrintWriter out;
    private final PrintWriter err;
    private final boolean json;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    public OutputPrinter(PrintWriter out, PrintWriter err, boolean json) {
        this.out = out;
        this.err = err;
        this.json = json;
    }

    public void success(String command, Object data, Consumer<PrintWriter> text) {
        if (json) {
            write(Envelope.success(command, data));
        } else {
            text.accept(out);
        }
        out.flush();
    }

    public void failure(String command, String kind, String message) {
        if (json) {
            write(Envelope.failure(command, kind, message));
            out.flush();
        } else {
            err.println(kind.toLowerCase(Locale.ROOT).replace('_', ' ') + ": " + message);
            err.flush();
        }
    }

    public void notFound(String command, String message) {
        failure(command, NOT_FOUND, message);
    }

    private void write(Envelope envelope) {
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result of " + envelope.command(), e);
        }
    }
}
