/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

public class InvalidMidiException extends PitchException {
    private final int midi;

    public InvalidMidiException(int midi) {
        super("Invalid MIDI pitch ["+midi+"]. Must be in range 0-127");
        this.midi = midi;
    }

    public int getMidi() {
        return midi;
    }
}
