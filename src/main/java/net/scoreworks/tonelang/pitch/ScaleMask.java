/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.pitch;

import net.scoreworks.tonelang.exceptions.InvalidPitchClassNumberException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static net.scoreworks.tonelang.pitch.Pitch.MAX_MIDI;
import static net.scoreworks.tonelang.pitch.Pitch.MIN_MIDI;
import static net.scoreworks.tonelang.pitch.Pitch.PITCH_CLASS_COUNT;


/**
 * Set of in-scale pitch classes stored as a 12-bit value: bit N set means pitch class N belongs to the scale.
 * A mask always contains at least one pitch class, so quantizing against it always finds a pitch in 0-127.
 */
public final class ScaleMask {
    private static final int ALL_BITS = (1 << PITCH_CLASS_COUNT) - 1;

    public static final ScaleMask CHROMATIC = new ScaleMask(ALL_BITS);

    //searches starting further out than this land outside 0-127 on every candidate, so they are equivalent to these
    private static final int LOWEST_SEARCH_START = MIN_MIDI - PITCH_CLASS_COUNT;
    private static final int HIGHEST_SEARCH_START = MAX_MIDI + PITCH_CLASS_COUNT;

    private final int bits;

    private ScaleMask(int bits) {
        this.bits = bits;
    }

    /**
     * Build the mask of a scale rooted on a pitch class. Sets bit {@code (root + interval) mod 12} for every interval,
     * negative intervals wrap around and duplicates collapse.
     * @param root pitch class of the root (0-11)
     * @param intervals signed semitone offsets from the root, at least one
     */
    public static ScaleMask of(int root, int... intervals) {
        if (root < 0 || root >= PITCH_CLASS_COUNT)
            throw new InvalidPitchClassNumberException(root);
        Validate.isTrue(intervals.length > 0, "A scale needs at least one interval");
        int bits = 0;
        for (int interval : intervals) {
            bits |= 1 << Pitch.pitchClassOf(root + interval);
        }
        return new ScaleMask(bits);
    }

    public static ScaleMask of(int root, List<Integer> intervals) {
        int[] array = new int[intervals.size()];
        for (int i=0; i<array.length; i++) {
            array[i] = intervals.get(i);
        }
        return of(root, array);
    }

    /**
     * Wrap an existing 12-bit value
     * @throws IllegalArgumentException if no bit is set or a bit above bit 11 is set
     */
    public static ScaleMask fromBits(int bits) {
        Validate.isTrue(bits > 0 && bits <= ALL_BITS, "Scale mask must set at least one of the low 12 bits, got %s", bits);
        return new ScaleMask(bits);
    }

    public int getBits() {
        return bits;
    }

    /**
     * @param pitch any integer pitch, its pitch class is tested
     */
    public boolean contains(int pitch) {
        return ((bits >> Pitch.pitchClassOf(pitch)) & 1) != 0;
    }

    /**
     * In-scale pitch classes in ascending order
     */
    public List<Integer> pitchClasses() {
        List<Integer> pitchClasses = new ArrayList<>();
        for (int pc=0; pc<PITCH_CLASS_COUNT; pc++) {
            if (contains(pc))
                pitchClasses.add(pc);
        }
        return Collections.unmodifiableList(pitchClasses);
    }

    /**
     * Snap a pitch to the nearest in-scale pitch. The pitch is rounded to the nearest integer first (halves round up).
     * Candidates are tested outwards by distance, the higher one before the lower one, so ties resolve upwards.
     * A candidate outside 0-127 is replaced by the in-scale pitch closest to the boundary it crossed.
     * @return in-scale MIDI pitch in 0-127
     */
    public int quantize(double pitch) {
        Validate.isTrue(Double.isFinite(pitch), "Pitch must be finite, got %s", pitch);
        int rounded = (int) Math.max(LOWEST_SEARCH_START, Math.min(HIGHEST_SEARCH_START, Math.round(pitch)));
        for (int distance=0; distance<PITCH_CLASS_COUNT; distance++) {
            int higher = rounded + distance;
            if (contains(higher))
                return clampToRange(higher);
            int lower = rounded - distance;
            if (distance > 0 && contains(lower))
                return clampToRange(lower);
        }
        //twelve consecutive pitches cover every pitch class, and a mask is never empty
        throw new IllegalStateException("No pitch class found in "+this);
    }

    /**
     * Move a pitch by a number of scale steps. The pitch is quantized first, then walked one semitone at a time in
     * the direction of {@code steps}, counting only in-scale pitches. Walking past 0 or 127 stops at the in-scale
     * pitch closest to that boundary.
     * @return in-scale MIDI pitch in 0-127
     */
    public int step(double basePitch, int steps) {
        int current = quantize(basePitch);
        int direction = Integer.signum(steps);
        long remaining = Math.abs((long) steps);
        while (remaining > 0) {
            current += direction;
            if (current < MIN_MIDI || current > MAX_MIDI)
                return clampToRange(current);
            if (contains(current))
                remaining--;
        }
        return current;
    }

    private int clampToRange(int pitch) {
        if (pitch > MAX_MIDI) {
            for (int p=MAX_MIDI; p>=MIN_MIDI; p--) {
                if (contains(p))
                    return p;
            }
        }
        else if (pitch < MIN_MIDI) {
            for (int p=MIN_MIDI; p<=MAX_MIDI; p++) {
                if (contains(p))
                    return p;
            }
        }
        return pitch;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ScaleMask)) {
            return false;
        }
        ScaleMask other = (ScaleMask) o;
        return this.bits == other.bits;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    @Override
    public String toString() {
        return "ScaleMask["+StringUtils.leftPad(Integer.toBinaryString(bits), PITCH_CLASS_COUNT, '0')+"]";
    }
}
