package com.obsidx.cli;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(boolean ok, String command, Object data, ErrorBody error) {

    public static Envelope success(String command, Object data) {
        return new Envelope(true, command, data, null);
    }

    public static Envelope failure(String command, String kind, String message) {
        return new Envelope(false, command, null, new ErrorBody(kind, message));
    }

    public record ErrorBody(String kind, String message) {
    }
}
