/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

public class InvalidPitchClassNumberException extends PitchException {
    private final int number;

    public InvalidPitchClassNumberException(int number) {
        super("Invalid pitch class number ["+number+"]. Must be in range 0-11");
        this.number = number;
    }

    public int getNumber() {
        return number;
    }
}
