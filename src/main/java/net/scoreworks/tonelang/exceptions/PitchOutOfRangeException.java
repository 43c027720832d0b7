/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

/**
 * Thrown if a well-formed pitch name denotes a pitch below MIDI 0 or above MIDI 127. This is deliberately distinct
 * from {@link InvalidPitchNameException}, which covers malformed text
 */
public class PitchOutOfRangeException extends PitchException {
    private final String text;

    /** computed MIDI value, null if the octave was too large to compute one */
    private final Long midi;

    public PitchOutOfRangeException(String text, long midi) {
        super("Pitch ["+text+"] resolves to MIDI "+midi+" which is outside valid range 0-127");
        this.text = text;
        this.midi = midi;
    }

    public PitchOutOfRangeException(String text) {
        super("Pitch ["+text+"] is outside valid range 0-127");
        this.text = text;
        this.midi = null;
    }

    public String getText() {
        return text;
    }

    public Long getMidi() {
        return midi;
    }
}
