/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.numbers.fraction.BigFraction;

import java.util.ArrayList;
import java.util.List;


/**
 * Second compiler pass. Walks a resolved tree with a time cursor and appends one {@link Event} per sounding note.
 * Every visit receives the cursor position at which the element starts and returns the position after it.
 * Instances collect events and are used for a single voice only
 */
final class TimelineFlattener implements SequenceElementVisitor<BigFraction, BigFraction> {
    private final BigFraction defaultDuration;
    private final int defaultVelocity;
    private final List<Event> events = new ArrayList<>();

    TimelineFlattener(BigFraction defaultDuration, int defaultVelocity) {
        this.defaultDuration = defaultDuration;
        this.defaultVelocity = defaultVelocity;
    }

    /**
     * @return the time after the last element
     */
    BigFraction flatten(List<SequenceElement> elements, BigFraction start) {
        BigFraction cursor = start;
        for (SequenceElement element : elements) {
            cursor = element.accept(this, cursor);
        }
        return cursor;
    }

    List<Event> getEvents() {
        return events;
    }

    private BigFraction durationOf(Modifiers modifiers) {
        return modifiers.getDuration() != null ? modifiers.getDuration() : defaultDuration;
    }

    private int velocityOf(Modifiers modifiers) {
        return modifiers.getVelocity() != null ? modifiers.getVelocity() : defaultVelocity;
    }

    @Override
    public BigFraction visitNote(Note note, BigFraction start) {
        Modifiers modifiers = note.getModifiers();
        BigFraction duration = durationOf(modifiers);
        events.add(new Event(note.getPitch(), start, duration, velocityOf(modifiers)));
        BigFraction advance = modifiers.getTimeUntilNext() != null ? modifiers.getTimeUntilNext() : duration;
        return start.add(advance);
    }

    @Override
    public BigFraction visitChord(Chord chord, BigFraction start) {
        BigFraction longest = chord.getModifiers().getDuration();
        for (ChordNote note : chord.getNotes()) {
            BigFraction duration = durationOf(note.getModifiers());
            events.add(new Event(note.getPitch(), start, duration, velocityOf(note.getModifiers())));
            if (longest == null || duration.compareTo(longest) > 0)
                longest = duration;
        }
        BigFraction advance = chord.getModifiers().getTimeUntilNext() != null ? chord.getModifiers().getTimeUntilNext() : longest;
        return start.add(advance);
    }

    @Override
    public BigFraction visitRest(Rest rest, BigFraction start) {
        return start.add(durationOf(rest.getModifiers()));
    }

    @Override
    public BigFraction visitGrouping(Grouping grouping, BigFraction start) {
        //the grouping's time until next was handed to its content, here only the content's own span counts
        return flatten(grouping.getContent(), start);
    }

    @Override
    public BigFraction visitRepetition(Repetition repetition, BigFraction start) {
        int firstPass = events.size();
        BigFraction end = flatten(repetition.getContent(), start);
        BigFraction span = end.subtract(start);
        int lastPass = events.size();
        for (int i=1; i<repetition.getRepeat(); i++) {
            BigFraction offset = span.multiply(i);
            for (int e=firstPass; e<lastPass; e++) {
                events.add(events.get(e).shiftedBy(offset));
            }
        }
        return start.add(span.multiply(repetition.getRepeat()));
    }
}
