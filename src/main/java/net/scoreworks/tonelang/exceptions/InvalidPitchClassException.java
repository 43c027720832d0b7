/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

/**
 * Thrown if a text is not one of the recognized pitch class spellings (naturals, sharps and flats)
 */
public class InvalidPitchClassException extends PitchException {
    private final String name;

    public InvalidPitchClassException(String name) {
        super("Invalid pitch class name ["+name+"]. Expected a natural, sharp or flat spelling like C, C#, Db or Bb");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
