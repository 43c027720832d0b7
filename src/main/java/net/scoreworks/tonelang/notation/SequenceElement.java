/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.Validate;


/**
 * Node of a voice tree. The set of subclasses is closed ({@link Note}, {@link Chord}, {@link Rest}, {@link Grouping}
 * and {@link Repetition}), operations on the tree are written as a {@link SequenceElementVisitor}.
 * Nodes are immutable
 */
public abstract class SequenceElement {
    private final Modifiers modifiers;

    SequenceElement(Modifiers modifiers) {
        this.modifiers = Validate.notNull(modifiers, "modifiers");
    }

    /** modifiers given on this element, not including inherited ones */
    public Modifiers getModifiers() {
        return modifiers;
    }

    public abstract <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument);
}
