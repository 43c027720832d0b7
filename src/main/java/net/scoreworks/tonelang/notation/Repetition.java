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
 * Content played {@code repeat} times back to back. Modifiers are inherited by the content like in a {@link Grouping}
 */
public final class Repetition extends SequenceElement {
    private final List<SequenceElement> content;
    private final int repeat;

    public Repetition(List<SequenceElement> content, int repeat, Modifiers modifiers) {
        super(modifiers);
        Validate.notNull(content, "content");
        Validate.noNullElements(content, "Element at index %d is null");
        Validate.isTrue(repeat >= 1, "Repeat count must be at least 1, got %d", repeat);
        this.content = Collections.unmodifiableList(new ArrayList<>(content));
        this.repeat = repeat;
    }

    public static Repetition of(int repeat, Modifiers modifiers, SequenceElement... content) {
        return new Repetition(Arrays.asList(content), repeat, modifiers);
    }

    public List<SequenceElement> getContent() {
        return content;
    }

    public int getRepeat() {
        return repeat;
    }

    @Override
    public <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument) {
        return visitor.visitRepetition(this, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Repetition)) {
            return false;
        }
        Repetition other = (Repetition) o;
        return repeat == other.repeat && content.equals(other.content) && getModifiers().equals(other.getModifiers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, repeat, getModifiers());
    }

    @Override
    public String toString() {
        return "Repetition("+StringUtils.join(content, " ")+")"+getModifiers()+"*"+repeat;
    }
}
