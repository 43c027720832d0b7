/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import java.util.Objects;


/**
 * A single pitch. The pitch is taken as given, range checks belong to whoever builds the tree
 */
public final class Note extends SequenceElement {
    private final int pitch;

    public Note(int pitch) {
        this(pitch, Modifiers.NONE);
    }

    public Note(int pitch, Modifiers modifiers) {
        super(modifiers);
        this.pitch = pitch;
    }

    public int getPitch() {
        return pitch;
    }

    @Override
    public <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument) {
        return visitor.visitNote(this, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Note)) {
            return false;
        }
        Note other = (Note) o;
        return pitch == other.pitch && getModifiers().equals(other.getModifiers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(pitch, getModifiers());
    }

    @Override
    public String toString() {
        return "Note("+pitch+getModifiers()+")";
    }
}
