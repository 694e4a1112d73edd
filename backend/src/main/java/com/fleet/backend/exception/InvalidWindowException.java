package com.fleet.backend.exception;

import lombok.Getter;

@Getter
public class InvalidWindowException extends RuntimeException {

    private final int requested;

    public InvalidWindowException(int requested, int min, int max) {
        super("limit must be between " + min + " and " + max + " (got " + requested + ")");
        this.requested = requested;
    }
}
