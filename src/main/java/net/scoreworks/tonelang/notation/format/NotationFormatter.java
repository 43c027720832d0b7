/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation.format;

import net.scoreworks.tonelang.notation.Event;
import net.scoreworks.tonelang.notation.NotationCompiler;
import net.scoreworks.tonelang.pitch.Pitch;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.numbers.fraction.BigFraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * Writes events back as ToneLang text, the inverse of parsing and compiling.
 * Events starting together become a chord, every element carries {@code v} and {@code n} only where they differ from
 * the defaults, and {@code t} only where the next element does not start right after the element ends.
 * A first start time after beat 0 is written as a leading rest
 */
public final class NotationFormatter {
    private static final BigInteger FIVE = BigInteger.valueOf(5);

    private final BigFraction defaultDuration;
    private final int defaultVelocity;

    public NotationFormatter() {
        this(NotationCompiler.DEFAULT_DURATION, NotationCompiler.DEFAULT_VELOCITY);
    }

    /**
     * @param defaultDuration duration that is left out of the text
     * @param defaultVelocity velocity that is left out of the text
     */
    public NotationFormatter(BigFraction defaultDuration, int defaultVelocity) {
        this.defaultDuration = Validate.notNull(defaultDuration, "defaultDuration");
        this.defaultVelocity = defaultVelocity;
    }

    public String format(List<Event> events, boolean drumTrack) {
        return drumTrack ? formatDrums(events) : format(events);
    }

    /**
     * Single voice layout, events in any order
     * @return the text, empty for no events
     */
    public String format(List<Event> events) {
        if (events == null || events.isEmpty())
            return "";
        //start time -> events starting then, lowest pitch first
        TreeMap<BigFraction, List<Event>> byStart = new TreeMap<>();
        for (Event event : NotationCompiler.sorted(events)) {
            List<Event> slot = byStart.get(event.getStartTime());
            if (slot == null) {
                slot = new ArrayList<>();
                byStart.put(event.getStartTime(), slot);
            }
            slot.add(event);
        }

        List<String> elements = new ArrayList<>();
        BigFraction firstStart = byStart.firstKey();
        if (firstStart.compareTo(BigFraction.ZERO) > 0)
            elements.add("R"+formatBeats(firstStart));
        for (Map.Entry<BigFraction, List<Event>> entry : byStart.entrySet()) {
            BigFraction next = byStart.higherKey(entry.getKey());
            BigFraction gap = next == null ? null : next.subtract(entry.getKey());
            elements.add(formatSlot(entry.getValue(), gap));
        }
        return StringUtils.join(elements, " ");
    }

    /**
     * One voice per pitch in ascending pitch order, separated by "; "
     */
    public String formatDrums(List<Event> events) {
        if (events == null || events.isEmpty())
            return "";
        TreeMap<Integer, List<Event>> byPitch = new TreeMap<>();
        for (Event event : events) {
            List<Event> voice = byPitch.get(event.getPitch());
            if (voice == null) {
                voice = new ArrayList<>();
                byPitch.put(event.getPitch(), voice);
            }
            voice.add(event);
        }
        List<String> voices = new ArrayList<>();
        for (List<Event> voice : byPitch.values()) {
            voices.add(format(voice));
        }
        return StringUtils.join(voices, "; ");
    }

    /**
     * @param gap distance to the next start time, null for the last slot
     */
    private String formatSlot(List<Event> slot, BigFraction gap) {
        StringBuilder strb = new StringBuilder();
        BigFraction natural = slot.get(0).getDuration();
        for (Event event : slot) {
            if (event.getDuration().compareTo(natural) > 0)
                natural = event.getDuration();
        }

        if (slot.size() == 1) {
            Event event = slot.get(0);
            strb.append(Pitch.midiToName(event.getPitch()));
            appendVelocity(strb, event.getVelocity());
            appendDuration(strb, event.getDuration());
        }
        else {
            //values shared by all notes are written once on the chord
            Integer sharedVelocity = slot.get(0).getVelocity();
            BigFraction sharedDuration = slot.get(0).getDuration();
            for (Event event : slot) {
                if (sharedVelocity != null && event.getVelocity() != sharedVelocity)
                    sharedVelocity = null;
                if (sharedDuration != null && !event.getDuration().equals(sharedDuration))
                    sharedDuration = null;
            }
            List<String> notes = new ArrayList<>(slot.size());
            for (Event event : slot) {
                StringBuilder note = new StringBuilder(Pitch.midiToName(event.getPitch()));
                if (sharedVelocity == null)
                    appendVelocity(note, event.getVelocity());
                if (sharedDuration == null)
                    appendDuration(note, event.getDuration());
                notes.add(note.toString());
            }
            strb.append("[").append(StringUtils.join(notes, " ")).append("]");
            if (sharedVelocity != null)
                appendVelocity(strb, sharedVelocity);
            if (sharedDuration != null)
                appendDuration(strb, sharedDuration);
        }

        if (gap != null && !gap.equals(natural))
            strb.append("t").append(formatBeats(gap));
        return strb.toString();
    }

    private void appendVelocity(StringBuilder strb, int velocity) {
        if (velocity != defaultVelocity)
            strb.append("v").append(velocity);
    }

    private void appendDuration(StringBuilder strb, BigFraction duration) {
        if (!duration.equals(defaultDuration))
            strb.append("n").append(formatBeats(duration));
    }

    /**
     * Shortest text for a beat value that reads back to the same value: a decimal if one exists (2, 0.25, 2.5),
     * otherwise numerator/denominator (1/3)
     */
    public static String formatBeats(BigFraction beats) {
        BigInteger denominator = beats.getDenominator();
        while (!denominator.testBit(0))
            denominator = denominator.shiftRight(1);
        while (denominator.mod(FIVE).signum() == 0)
            denominator = denominator.divide(FIVE);
        if (!denominator.equals(BigInteger.ONE))
            return beats.getNumerator()+"/"+beats.getDenominator();
        BigDecimal decimal = new BigDecimal(beats.getNumerator()).divide(new BigDecimal(beats.getDenominator()));
        return decimal.stripTrailingZeros().toPlainString();
    }
}
