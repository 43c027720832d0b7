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
 * Voices performed simultaneously, each one timed from beat 0
 */
public final class Score {
    public static final Score EMPTY = new Score(Collections.<Voice>emptyList());

    private final List<Voice> voices;

    public Score(List<Voice> voices) {
        Validate.notNull(voices, "voices");
        Validate.noNullElements(voices, "Voice at index %d is null");
        this.voices = Collections.unmodifiableList(new ArrayList<>(voices));
    }

    public static Score of(Voice... voices) {
        return new Score(Arrays.asList(voices));
    }

    /** single voice score */
    public static Score of(SequenceElement... elements) {
        return of(Voice.of(elements));
    }

    public List<Voice> getVoices() {
        return voices;
    }

    public boolean isEmpty() {
        return voices.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Score)) {
            return false;
        }
        Score other = (Score) o;
        return voices.equals(other.voices);
    }

    @Override
    public int hashCode() {
        return voices.hashCode();
    }

    @Override
    public String toString() {
        return "Score{"+StringUtils.join(voices, "; ")+"}";
    }
}
