package com.nevis.places.exception;

import lombok.Getter;

@Getter
public class MissingParameterException extends RuntimeException {
    private final String parameterName;

    public MissingParameterException(String parameterName) {
        super(String.format("Parameter '%s' is missing", parameterName));
        this.parameterName = parameterName;
    }
}
