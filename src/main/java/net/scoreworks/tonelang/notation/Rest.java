/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.numbers.fraction.BigFraction;

import java.util.Objects;


/**
 * Silence that moves the cursor by its duration. Only a duration can be set on a rest
 */
public final class Rest extends SequenceElement {

    public Rest() {
        super(Modifiers.NONE);
    }

    public Rest(BigFraction duration) {
        super(Modifiers.duration(duration));
    }

    @Override
    public <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument) {
        return visitor.visitRest(this, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Rest)) {
            return false;
        }
        Rest other = (Rest) o;
        return getModifiers().equals(other.getModifiers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(Rest.class, getModifiers());
    }

    @Override
    public String toString() {
        return "Rest("+getModifiers()+")";
    }
}
