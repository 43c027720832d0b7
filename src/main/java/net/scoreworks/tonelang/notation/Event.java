/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.Validate;
import org.apache.commons.numbers.fraction.BigFraction;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;


/**
 * A note on the timeline, the output of {@link NotationCompiler}. Times are in beats. Two events are equal if all
 * their fields are equal
 */
public final class Event implements Comparable<Event> {
    private final int pitch;
    private final BigFraction startTime;
    private final BigFraction duration;
    private final int velocity;

    public Event(int pitch, BigFraction startTime, BigFraction duration, int velocity) {
        Validate.notNull(startTime, "startTime");
        Validate.notNull(duration, "duration");
        Validate.isTrue(startTime.compareTo(BigFraction.ZERO) >= 0, "Start time must not be negative, got %s", startTime);
        Validate.isTrue(duration.compareTo(BigFraction.ZERO) > 0, "Duration must be positive, got %s", duration);
        this.pitch = pitch;
        this.startTime = startTime;
        this.duration = duration;
        this.velocity = velocity;
    }

    public int getPitch() {
        return pitch;
    }

    public BigFraction getStartTime() {
        return startTime;
    }

    public BigFraction getDuration() {
        return duration;
    }

    public int getVelocity() {
        return velocity;
    }

    public BigFraction getEndTime() {
        return startTime.add(duration);
    }

    public double getStartTimeAsDouble() {
        return startTime.doubleValue();
    }

    public double getDurationAsDouble() {
        return duration.doubleValue();
    }

    public Event shiftedBy(BigFraction offset) {
        return new Event(pitch, startTime.add(offset), duration, velocity);
    }

    //ordered by start time, then pitch, so chords come out bottom up
    @Override
    public int compareTo(@NotNull Event right) {
        int c = startTime.compareTo(right.startTime);
        if (c != 0)
            return c;
        c = Integer.compare(pitch, right.pitch);
        if (c != 0)
            return c;
        c = duration.compareTo(right.duration);
        if (c != 0)
            return c;
        return Integer.compare(velocity, right.velocity);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Event)) {
            return false;
        }
        Event other = (Event) o;
        return pitch == other.pitch && velocity == other.velocity &&
                startTime.equals(other.startTime) && duration.equals(other.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pitch, startTime, duration, velocity);
    }

    @Override
    public String toString() {
        return "Event{pitch="+pitch+", start="+startTime+", duration="+duration+", velocity="+velocity+"}";
    }
}
