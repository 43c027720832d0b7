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


/**
 * One musical line: elements played one after another starting at beat 0
 */
public final class Voice {
    private final List<SequenceElement> elements;

    public Voice(List<SequenceElement> elements) {
        Validate.notNull(elements, "elements");
        Validate.noNullElements(elements, "Element at index %d is null");
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static Voice of(SequenceElement... elements) {
        return new Voice(Arrays.asList(elements));
    }

    public List<SequenceElement> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Voice)) {
            return false;
        }
        Voice other = (Voice) o;
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Voice["+StringUtils.join(elements, " ")+"]";
    }
}
