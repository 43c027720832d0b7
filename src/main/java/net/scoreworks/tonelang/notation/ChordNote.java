/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.Validate;

import java.util.Objects;


/**
 * Pitch inside a {@link Chord}. It may override the chord's velocity and duration, the chord alone moves the cursor
 * so a chord note never has a time-until-next
 */
public final class ChordNote {
    private final int pitch;
    private final Modifiers modifiers;

    public ChordNote(int pitch) {
        this(pitch, Modifiers.NONE);
    }

    public ChordNote(int pitch, Modifiers modifiers) {
        Validate.notNull(modifiers, "modifiers");
        Validate.isTrue(modifiers.getTimeUntilNext() == null, "A chord note can not have a time until next");
        this.pitch = pitch;
        this.modifiers = modifiers;
    }

    public int getPitch() {
        return pitch;
    }

    public Modifiers getModifiers() {
        return modifiers;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ChordNote)) {
            return false;
        }
        ChordNote other = (ChordNote) o;
        return pitch == other.pitch && modifiers.equals(other.modifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pitch, modifiers);
    }

    @Override
    public String toString() {
        return pitch+modifiers.toString();
    }
}
