/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.pitch;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;


/**
 * Named scales as semitone intervals from the root
 */
public enum Scale {
    MAJOR(0, 2, 4, 5, 7, 9, 11),
    MINOR(0, 2, 3, 5, 7, 8, 10),
    DORIAN(0, 2, 3, 5, 7, 9, 10),
    PHRYGIAN(0, 1, 3, 5, 7, 8, 10),
    LYDIAN(0, 2, 4, 6, 7, 9, 11),
    MIXOLYDIAN(0, 2, 4, 5, 7, 9, 10),
    AEOLIAN(0, 2, 3, 5, 7, 8, 10),
    LOCRIAN(0, 1, 3, 5, 6, 8, 10),
    MAJOR_PENTATONIC(0, 2, 4, 7, 9),
    MINOR_PENTATONIC(0, 3, 5, 7, 10),
    BLUES(0, 3, 5, 6, 7, 10),
    WHOLE_TONE(0, 2, 4, 6, 8, 10),
    HARMONIC_MINOR(0, 2, 3, 5, 7, 8, 11),
    MELODIC_MINOR(0, 2, 3, 5, 7, 9, 11),
    CHROMATIC(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);

    private final int[] intervals;

    Scale(int... intervals) {
        this.intervals = intervals;
    }

    /**
     * Look up a scale by name. Case, surrounding whitespace and the separator between words (space, '-' or '_')
     * do not matter, so "Minor Pentatonic", "minor-pentatonic" and "MINOR_PENTATONIC" are the same scale
     * @throws IllegalArgumentException if no scale has this name
     */
    public static Scale fromName(String name) {
        if (name != null) {
            String normalized = StringUtils.upperCase(name.trim()).replaceAll("[\\s\\-_]+", "_");
            for (Scale scale : values()) {
                if (scale.name().equals(normalized))
                    return scale;
            }
        }
        List<String> supported = new ArrayList<>();
        for (Scale scale : values()) {
            supported.add(scale.getDisplayName());
        }
        throw new IllegalArgumentException("Unknown scale ["+name+"]. Supported: "+StringUtils.join(supported, ", "));
    }

    public int[] getIntervals() {
        return intervals.clone();
    }

    /** e.g. "Minor Pentatonic" */
    public String getDisplayName() {
        String[] words = StringUtils.split(name().toLowerCase(), '_');
        for (int i=0; i<words.length; i++) {
            words[i] = StringUtils.capitalize(words[i]);
        }
        return StringUtils.join(words, ' ');
    }

    public ScaleMask mask(int root) {
        return ScaleMask.of(root, intervals);
    }

    /**
     * Canonical names of the scale's pitch classes in interval order, e.g. D DORIAN -> D, E, F, G, A, B, C
     */
    public List<String> pitchClassNames(int root) {
        return Pitch.intervalsToPitchClasses(root, intervals);
    }
}
