package com.nevis.places.exception;

import lombok.Getter;

@Getter
public class MalformedRecordException extends RuntimeException {
    private final int lineNumber;

    public MalformedRecordException(int lineNumber, String reason) {
        super("Line " + lineNumber + ": " + reason);
        this.lineNumber = lineNumber;
    }
}
