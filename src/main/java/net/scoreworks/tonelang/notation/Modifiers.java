/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import org.apache.commons.lang3.Validate;
import org.apache.commons.numbers.fraction.BigFraction;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;


/**
 * Optional velocity, duration and time-until-next of a {@link SequenceElement}. A null field means the value is not
 * given on this element and is taken from the enclosing element, or from the compiler defaults at the top.
 * Instances are immutable, every modification returns a copy
 */
public final class Modifiers {
    public static final Modifiers NONE = new Modifiers(null, null, null);

    private final Integer velocity;
    /** how long the note sounds, in beats */
    private final BigFraction duration;
    /** how far the cursor moves after the element, in beats. May be shorter than the duration */
    private final BigFraction timeUntilNext;

    private Modifiers(Integer velocity, BigFraction duration, BigFraction timeUntilNext) {
        if (duration != null)
            Validate.isTrue(duration.compareTo(BigFraction.ZERO) > 0, "Duration must be positive, got %s", duration);
        if (timeUntilNext != null)
            Validate.isTrue(timeUntilNext.compareTo(BigFraction.ZERO) > 0, "Time until next must be positive, got %s", timeUntilNext);
        this.velocity = velocity;
        this.duration = duration == null ? null : duration;
        this.timeUntilNext = timeUntilNext == null ? null : timeUntilNext;
    }

    public static Modifiers of(@Nullable Integer velocity, @Nullable BigFraction duration, @Nullable BigFraction timeUntilNext) {
        if (velocity == null && duration == null && timeUntilNext == null)
            return NONE;
        return new Modifiers(velocity, duration, timeUntilNext);
    }

    public static Modifiers velocity(int velocity) {
        return of(velocity, null, null);
    }

    public static Modifiers duration(BigFraction duration) {
        return of(null, duration, null);
    }

    public static Modifiers timeUntilNext(BigFraction timeUntilNext) {
        return of(null, null, timeUntilNext);
    }

    public @Nullable Integer getVelocity() {
        return velocity;
    }

    public @Nullable BigFraction getDuration() {
        return duration;
    }

    public @Nullable BigFraction getTimeUntilNext() {
        return timeUntilNext;
    }

    public boolean isEmpty() {
        return velocity == null && duration == null && timeUntilNext == null;
    }

    public Modifiers withVelocity(@Nullable Integer velocity) {
        return of(velocity, duration, timeUntilNext);
    }

    public Modifiers withDuration(@Nullable BigFraction duration) {
        return of(velocity, duration, timeUntilNext);
    }

    public Modifiers withTimeUntilNext(@Nullable BigFraction timeUntilNext) {
        return of(velocity, duration, timeUntilNext);
    }

    public Modifiers withoutTimeUntilNext() {
        return withTimeUntilNext(null);
    }

    /** keeps the duration only, the single modifier a rest carries */
    public Modifiers onlyDuration() {
        return of(null, duration, null);
    }

    /**
     * Fill every missing value of this set from an enclosing set. Own values always win
     * @param inherited resolved modifiers of the enclosing element
     */
    public Modifiers inheritFrom(Modifiers inherited) {
        return of(
                velocity != null ? velocity : inherited.velocity,
                duration != null ? duration : inherited.duration,
                timeUntilNext != null ? timeUntilNext : inherited.timeUntilNext);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Modifiers)) {
            return false;
        }
        Modifiers other = (Modifiers) o;
        return Objects.equals(velocity, other.velocity) &&
                Objects.equals(duration, other.duration) &&
                Objects.equals(timeUntilNext, other.timeUntilNext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(velocity, duration, timeUntilNext);
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        if (velocity != null)
            strb.append("v").append(velocity);
        if (duration != null)
            strb.append("n").append(duration);
        if (timeUntilNext != null)
            strb.append("t").append(timeUntilNext);
        return strb.toString();
    }
}
