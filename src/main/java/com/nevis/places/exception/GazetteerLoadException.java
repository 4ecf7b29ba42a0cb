package com.nevis.places.exception;

import lombok.Getter;

@Getter
public class GazetteerLoadException extends RuntimeException {
    private final String source;

    public GazetteerLoadException(String source, String reason) {
        super("Unable to load gazetteer from " + source + ": " + reason);
        this.source = source;
    }

    public GazetteerLoadException(String source, Throwable cause) {
        super("Unable to load gazetteer from " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }
}
