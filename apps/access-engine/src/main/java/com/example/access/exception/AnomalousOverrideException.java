package com.example.access.exception;

import lombok.Getter;

import java.util.List;

/**
 * Overrides reference privilege codes missing from the catalog while the
 * override policy is {@code STRICT}.
 */
@Getter
public class AnomalousOverrideException extends RuntimeException {

    private final List<String> unknownCodes;

    public AnomalousOverrideException(List<String> unknownCodes) {
        super("Overrides reference unknown privilege codes: " + unknownCodes);
        this.unknownCodes = List.copyOf(unknownCodes);
    }
}
