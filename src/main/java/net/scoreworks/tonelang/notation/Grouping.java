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
 * Sequence of elements that share the grouping's modifiers as inherited defaults. A grouping always advances the
 * cursor by the time its content takes; its own time-until-next only reaches the content
 */
public final class Grouping extends SequenceElement {
    private final List<SequenceElement> content;

    public Grouping(List<SequenceElement> content, Modifiers modifiers) {
        super(modifiers);
        Validate.notNull(content, "content");
        Validate.noNullElements(content, "Element at index %d is null");
        this.content = Collections.unmodifiableList(new ArrayList<>(content));
    }

    public static Grouping of(Modifiers modifiers, SequenceElement... content) {
        return new Grouping(Arrays.asList(content), modifiers);
    }

    public List<SequenceElement> getContent() {
        return content;
    }

    @Override
    public <R, A> R accept(SequenceElementVisitor<R, A> visitor, A argument) {
        return visitor.visitGrouping(this, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Grouping)) {
            return false;
        }
        Grouping other = (Grouping) o;
        return content.equals(other.content) && getModifiers().equals(other.getModifiers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, getModifiers());
    }

    @Override
    public String toString() {
        return "Grouping("+StringUtils.join(content, " ")+")"+getModifiers();
    }
}
