/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

/**
 * One method per kind of {@link SequenceElement}
 * @param <R> result of visiting an element
 * @param <A> argument passed down to the element
 */
public interface SequenceElementVisitor<R, A> {

    R visitNote(Note note, A argument);

    R visitChord(Chord chord, A argument);

    R visitRest(Rest rest, A argument);

    R visitGrouping(Grouping grouping, A argument);

    R visitRepetition(Repetition repetition, A argument);
}
