/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;


/**
 * Pitches that start together. The chord moves the cursor once, by its time-until-next or else by its longest note
 */
public final class Chord extends SequenceElement {
    private final List<ChordNote> notes;

    public Chord(List<ChordNote> notes, Modifiers modifiers) {
        super(modifiers);
        Validate.notEmpty(notes, "A chord needs at least one note");
        Validate.noNullElements(notes, "Chord note at index %d is null");
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public Chord(List<ChordNote> notes) {
        this(notes, Modifiers.NONE);
    }

    /** chord of plain pitches without own modifiers on the notes */
    public static Chord of(Modifiers modifiers, int... pitches) {
        List<ChordNote> notes = new ArrayList<>(pitches.length);
        for (int pitch : pitches) {
            notes.add(new ChordNote(pitch));
        }
        return new Chord(notes, modifiers);
    }

    public static Chord of(Modifiers modifiers, ChordNote... notes) {
        return new Chord(Arrays.asList(notes), modifiers);
    }

    public List<ChordNote> getNotes() {
        return notes;
    }

    @Override
    public <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument) {
        return visitor.visitChord(this, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Chord)) {
            return false;
        }
        Chord other = (Chord) o;
        return notes.equals(other.notes) && getModifiers().equals(other.getModifiers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(notes, getModifiers());
    }

    @Override
    public String toString() {
        return "Chord["+StringUtils.join(notes, " ")+"]"+getModifiers();
    }
}
