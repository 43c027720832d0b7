/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

/**
 * Common base of all failures raised by the pitch and scale conversions. Each subclass names exactly one violated
 * constraint and keeps the offending input accessible
 */
public abstract class PitchException extends RuntimeException {
    protected PitchException(String message) {
        super(message);
    }
}
