/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

/**
 * Thrown if a text does not have the form letter, optional accidental and signed octave (e.g. C3, F#4, Bb-1)
 */
public class InvalidPitchNameException extends PitchException {
    private final String text;

    public InvalidPitchNameException(String text) {
        super("Invalid pitch name ["+text+"]. Expected a letter A-G, an optional # or b and a signed octave, e.g. C3, F#4 or Bb-1");
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
