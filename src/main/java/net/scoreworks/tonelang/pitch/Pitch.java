/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.pitch;

import net.scoreworks.tonelang.exceptions.InvalidMidiException;
import net.scoreworks.tonelang.exceptions.InvalidPitchClassException;
import net.scoreworks.tonelang.exceptions.InvalidPitchClassNumberException;
import net.scoreworks.tonelang.exceptions.InvalidPitchNameException;
import net.scoreworks.tonelang.exceptions.PitchOutOfRangeException;
import org.apache.commons.collections4.BidiMap;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.collections4.bidimap.DualHashBidiMap;
import org.apache.commons.collections4.bidimap.UnmodifiableBidiMap;
import org.apache.commons.collections4.map.CaseInsensitiveMap;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Conversions between pitch class names, pitch class numbers (semitones above C) and MIDI pitches.
 * Pitch classes are plain integers everywhere; names only appear at this boundary. Input accepts sharps and flats in
 * any case, output always uses the flat-biased canonical names. MIDI 60 is "C3", so the octave of a MIDI pitch
 * is {@code floor(midi / 12) - 2}.
 */
public final class Pitch {
    public static final int MIN_MIDI = 0;
    public static final int MAX_MIDI = 127;
    public static final int PITCH_CLASS_COUNT = 12;

    /** semitone -> canonical name. The inverse view resolves canonical spellings */
    private static final BidiMap<Integer, String> CANONICAL_NAMES;

    /** every accepted spelling -> semitone, looked up case-insensitively */
    private static final Map<String, Integer> INPUT_NAMES;

    private static final Pattern NOTE_NAME = Pattern.compile("^([A-Ga-g][#Bb]?)(-?)(\\d+)$");

    static {
        BidiMap<Integer, String> canonical = new DualHashBidiMap<>();
        String[] names = {"C", "Db", "D", "Eb", "E", "F", "Gb", "G", "Ab", "A", "Bb", "B"};
        for (int i=0; i<names.length; i++) {
            canonical.put(i, names[i]);
        }
        CANONICAL_NAMES = UnmodifiableBidiMap.unmodifiableBidiMap(canonical);

        Map<String, Integer> input = new CaseInsensitiveMap<>(canonical.inverseBidiMap());
        input.put("C#", 1);
        input.put("D#", 3);
        input.put("F#", 6);
        input.put("G#", 8);
        input.put("A#", 10);
        INPUT_NAMES = MapUtils.unmodifiableMap(input);
    }

    private Pitch() {}

    /**
     * @param name pitch class spelling such as "C", "f#" or " Bb ". Surrounding whitespace is ignored
     * @return semitones above C (0-11)
     * @throws InvalidPitchClassException if the name is not a recognized spelling
     */
    public static int nameToSemitone(String name) {
        if (name == null)
            throw new InvalidPitchClassException(null);
        Integer semitone = INPUT_NAMES.get(name.trim());
        if (semitone == null)
            throw new InvalidPitchClassException(name);
        return semitone;
    }

    /**
     * @param semitone pitch class number 0-11
     * @return canonical (flat) name of the pitch class
     * @throws InvalidPitchClassNumberException if the number is not in 0-11
     */
    public static @NotNull String semitoneToName(int semitone) {
        if (semitone < 0 || semitone >= PITCH_CLASS_COUNT)
            throw new InvalidPitchClassNumberException(semitone);
        return CANONICAL_NAMES.get(semitone);
    }

    /**
     * @return name with octave, e.g. 60 -> "C3", 0 -> "C-2", 127 -> "G8"
     * @throws InvalidMidiException if midi is not in 0-127
     */
    public static @NotNull String midiToName(int midi) {
        if (!isValidMidi(midi))
            throw new InvalidMidiException(midi);
        return semitoneToName(midi % PITCH_CLASS_COUNT) + (midi / PITCH_CLASS_COUNT - 2);
    }

    /**
     * Parse a pitch name of the form letter, optional accidental and signed octave.
     * @param text e.g. "C3", "F#4", "bb-1"
     * @return the MIDI pitch
     * @throws InvalidPitchNameException if the text is malformed
     * @throws PitchOutOfRangeException if the text is well-formed but lies outside 0-127
     */
    public static int nameToMidi(String text) {
        if (text == null)
            throw new InvalidPitchNameException(null);
        Matcher matcher = NOTE_NAME.matcher(text);
        if (!matcher.matches())
            throw new InvalidPitchNameException(text);
        Integer pitchClass = INPUT_NAMES.get(matcher.group(1));
        if (pitchClass == null)     //letter and accidental that do not form a supported spelling, e.g. Cb or E#
            throw new InvalidPitchNameException(text);

        String digits = StringUtils.stripStart(matcher.group(3), "0");
        //no octave with more than three digits can be in range, and parsing it could overflow
        if (digits.length() > 3)
            throw new PitchOutOfRangeException(text);
        int octave = digits.isEmpty() ? 0 : Integer.parseInt(digits);
        if (!matcher.group(2).isEmpty())
            octave = -octave;

        long midi = (octave + 2L) * PITCH_CLASS_COUNT + pitchClass;
        if (midi < MIN_MIDI || midi > MAX_MIDI)
            throw new PitchOutOfRangeException(text, midi);
        return (int) midi;
    }

    /**
     * Canonical names of the pitch classes {@code (root + interval) mod 12}, in the order of the intervals
     */
    public static List<String> intervalsToPitchClasses(int root, int... intervals) {
        if (root < 0 || root >= PITCH_CLASS_COUNT)
            throw new InvalidPitchClassNumberException(root);
        List<String> names = new ArrayList<>(intervals.length);
        for (int interval : intervals) {
            names.add(CANONICAL_NAMES.get(Math.floorMod(root + interval, PITCH_CLASS_COUNT)));
        }
        return Collections.unmodifiableList(names);
    }

    public static boolean isValidMidi(int midi) {
        return midi >= MIN_MIDI && midi <= MAX_MIDI;
    }

    /**
     * True if the text is a well-formed pitch name with a supported spelling. The octave is not range checked
     */
    public static boolean isValidNoteName(String text) {
        if (text == null)
            return false;
        Matcher matcher = NOTE_NAME.matcher(text);
        return matcher.matches() && INPUT_NAMES.containsKey(matcher.group(1));
    }

    public static boolean isValidPitchClassName(String name) {
        return name != null && INPUT_NAMES.containsKey(name.trim());
    }

    /**
     * True if the name is one of the twelve names produced on output (case-sensitive)
     */
    public static boolean isCanonicalName(String name) {
        return CANONICAL_NAMES.containsValue(name);
    }

    /**
     * Pitch class of any integer pitch, including negative ones
     */
    public static int pitchClassOf(int pitch) {
        return Math.floorMod(pitch, PITCH_CLASS_COUNT);
    }
}
