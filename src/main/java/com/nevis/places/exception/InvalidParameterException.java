package com.nevis.places.exception;

import lombok.Getter;

@Getter
public class InvalidParameterException extends RuntimeException {
    private final String parameterName;

    public InvalidParameterException(String parameterName, String value) {
        super(String.format("Invalid value '%s' for parameter '%s'", value, parameterName));
        this.parameterName = parameterName;
    }
}
