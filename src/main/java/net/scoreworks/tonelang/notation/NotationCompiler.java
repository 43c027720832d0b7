/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.Validate;
import org.apache.commons.numbers.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Turns a {@link Score} into a list of {@link Event}s. Compilation runs in two passes:
 *
 * <ol>
 *  <li>modifier resolution: velocity, duration and time-until-next are inherited top-down, an element's own value
 *  always wins over the values of its ancestors</li>
 *  <li>flattening: a cursor walks each voice from beat 0 in textual order, notes and chords emit events at the
 *  cursor, repetitions replay the events of their first pass shifted in time</li>
 * </ol>
 *
 * Values that are set nowhere fall back to the compiler's default duration and velocity. Pitches and velocities are
 * passed through without range checks. A compiler is immutable and can be shared
 */
public final class NotationCompiler {
    private static final Logger LOGGER = LogManager.getLogger(NotationCompiler.class);

    public static final BigFraction DEFAULT_DURATION = BigFraction.ONE;
    public static final int DEFAULT_VELOCITY = 70;

    private final BigFraction defaultDuration;
    private final int defaultVelocity;

    public NotationCompiler() {
        this(DEFAULT_DURATION, DEFAULT_VELOCITY);
    }

    /**
     * @param defaultDuration duration in beats of notes and rests without one, must be positive
     * @param defaultVelocity velocity of notes without one
     */
    public NotationCompiler(BigFraction defaultDuration, int defaultVelocity) {
        Validate.notNull(defaultDuration, "defaultDuration");
        Validate.isTrue(defaultDuration.compareTo(BigFraction.ZERO) > 0, "Default duration must be positive, got %s", defaultDuration);
        this.defaultDuration = defaultDuration;
        this.defaultVelocity = defaultVelocity;
    }

    public BigFraction getDefaultDuration() {
        return defaultDuration;
    }

    public int getDefaultVelocity() {
        return defaultVelocity;
    }

    /**
     * Compile all voices. Each voice is timed from beat 0, the result holds the events of the first voice, then the
     * events of the second voice and so on
     */
    public List<Event> compile(Score score) {
        List<Event> events = new ArrayList<>();
        for (List<Event> voiceEvents : compileVoices(score)) {
            events.addAll(voiceEvents);
        }
        return events;
    }

    /**
     * Compile all voices into separate lists, in voice order
     */
    public List<List<Event>> compileVoices(Score score) {
        Validate.notNull(score, "score");
        LOGGER.debug("Compiling score with {} voice(s)", score.getVoices().size());
        List<List<Event>> voices = new ArrayList<>(score.getVoices().size());
        for (Voice voice : score.getVoices()) {
            voices.add(compile(voice));
        }
        return voices;
    }

    public List<Event> compile(Voice voice) {
        Validate.notNull(voice, "voice");
        TimelineFlattener flattener = new TimelineFlattener(defaultDuration, defaultVelocity);
        BigFraction end = flattener.flatten(resolve(voice).getElements(), BigFraction.ZERO);
        LOGGER.debug("Compiled voice of {} element(s) into {} event(s) spanning {} beat(s)",
                voice.getElements().size(), flattener.getEvents().size(), end);
        return new ArrayList<>(flattener.getEvents());
    }

    /**
     * Run only the first pass. The returned voice has the same structure, every element carrying its effective
     * modifiers; values set nowhere in the tree stay unset
     */
    public Voice resolve(Voice voice) {
        return ModifierResolver.INSTANCE.resolve(voice);
    }

    /**
     * Length of a voice in beats: the cursor position after its last element
     */
    public BigFraction span(Voice voice) {
        Validate.notNull(voice, "voice");
        TimelineFlattener flattener = new TimelineFlattener(defaultDuration, defaultVelocity);
        return flattener.flatten(resolve(voice).getElements(), BigFraction.ZERO);
    }

    /** unmodifiable view of the events in time order */
    public static List<Event> sorted(List<Event> events) {
        List<Event> copy = new ArrayList<>(events);
        Collections.sort(copy);
        return Collections.unmodifiableList(copy);
    }
}
