package net.scoreworks.tonelang.notation;

import org.apache.commons.numbers.fraction.BigFraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class NotationCompilerTests {
    NotationCompiler compiler;

    @BeforeEach
    public void createCompiler() {
        compiler = new NotationCompiler();
    }

    private static BigFraction f(int numerator, int denominator) {
        return BigFraction.of(numerator, denominator);
    }

    private static BigFraction f(int whole) {
        return BigFraction.of(whole, 1);
    }

    private static Event event(int pitch, BigFraction start, BigFraction duration, int velocity) {
        return new Event(pitch, start, duration, velocity);
    }

    @Test
    public void testEmptyScore() {
        Assertions.assertTrue(compiler.compile(Score.EMPTY).isEmpty());
        Assertions.assertTrue(compiler.compile(Voice.of()).isEmpty());
    }

    @Test
    public void testSequenceOfNotes() {
        List<Event> events = compiler.compile(Voice.of(new Note(60), new Note(62), new Note(64)));
        Assertions.assertEquals(Arrays.asList(
                event(60, f(0), f(1), 70),
                event(62, f(1), f(1), 70),
                event(64, f(2), f(1), 70)), events);
    }

    @Test
    public void testRestAdvancesCursor() {
        List<Event> events = compiler.compile(Voice.of(new Note(60), new Rest(f(1)), new Note(64, Modifiers.duration(f(2)))));
        Assertions.assertEquals(Arrays.asList(
                event(60, f(0), f(1), 70),
                event(64, f(2), f(2), 70)), events);
        Assertions.assertTrue(compiler.compile(Voice.of(new Rest())).isEmpty());
    }

    @Test
    public void testGroupingVelocityIsInherited() {
        Grouping grouping = Grouping.of(Modifiers.velocity(90), new Note(60), new Note(62, Modifiers.velocity(40)));
        List<Event> events = compiler.compile(Voice.of(grouping));
        Assertions.assertEquals(90, events.get(0).getVelocity());
        Assertions.assertEquals(40, events.get(1).getVelocity());
    }

    @Test
    public void testExplicitValueWinsAtAnyDepth() {
        SequenceElement deep = Grouping.of(Modifiers.velocity(100),
                Grouping.of(Modifiers.NONE,
                        Grouping.of(Modifiers.velocity(20),
                                new Note(60),
                                new Note(62, Modifiers.velocity(5)))),
                new Note(64));
        List<Event> events = compiler.compile(Voice.of(deep));
        Assertions.assertEquals(20, events.get(0).getVelocity());
        Assertions.assertEquals(5, events.get(1).getVelocity());
        Assertions.assertEquals(100, events.get(2).getVelocity());
    }

    @Test
    public void testChordSharesStartAndDuration() {
        List<Event> events = compiler.compile(Voice.of(Chord.of(Modifiers.duration(f(2)), 60, 64, 67), new Note(72)));
        Assertions.assertEquals(4, events.size());
        for (int i=0; i<3; i++) {
            Assertions.assertEquals(f(0), events.get(i).getStartTime());
            Assertions.assertEquals(f(2), events.get(i).getDuration());
        }
        Assertions.assertEquals(f(2), events.get(3).getStartTime());
    }

    @Test
    public void testChordNotesOverrideChord() {
        Chord chord = Chord.of(Modifiers.of(80, f(2), null),
                new ChordNote(60, Modifiers.of(100, f(3), null)),
                new ChordNote(64, Modifiers.velocity(90)),
                new ChordNote(67, Modifiers.duration(f(1, 2))));
        List<Event> events = compiler.compile(Voice.of(chord, new Note(72)));
        Assertions.assertEquals(event(60, f(0), f(3), 100), events.get(0));
        Assertions.assertEquals(event(64, f(0), f(2), 90), events.get(1));
        Assertions.assertEquals(event(67, f(0), f(1, 2), 80), events.get(2));
        //advance by the longest note
        Assertions.assertEquals(f(3), events.get(3).getStartTime());
    }

    @Test
    public void testChordAdvanceKeepsChordDurationWhenNotesAreShorter() {
        Chord chord = Chord.of(Modifiers.duration(f(2)),
                new ChordNote(60, Modifiers.duration(f(1, 2))),
                new ChordNote(64, Modifiers.duration(f(1, 4))));
        List<Event> events = compiler.compile(Voice.of(chord, new Note(72)));
        Assertions.assertEquals(f(2), events.get(2).getStartTime());
    }

    @Test
    public void testChordTimeUntilNext() {
        Voice voice = Voice.of(
                Chord.of(Modifiers.of(null, f(2), f(3)), 60, 64, 67),
                Chord.of(Modifiers.duration(f(2)), 62, 65, 69));
        List<Event> events = compiler.compile(voice);
        Assertions.assertEquals(f(0), events.get(0).getStartTime());
        Assertions.assertEquals(f(3), events.get(3).getStartTime());
        Assertions.assertEquals(f(2), events.get(0).getDuration());
    }

    @Test
    public void testTimeUntilNextOverlaps() {
        Modifiers overlapping = Modifiers.of(null, f(4), f(2));
        List<Event> events = compiler.compile(Voice.of(new Note(72, overlapping), new Note(74, overlapping), new Note(76, Modifiers.duration(f(4)))));
        Assertions.assertEquals(f(0), events.get(0).getStartTime());
        Assertions.assertEquals(f(2), events.get(1).getStartTime());
        Assertions.assertEquals(f(4), events.get(2).getStartTime());
        Assertions.assertEquals(f(4), events.get(2).getDuration());
    }

    @Test
    public void testGroupingTimeUntilNextReachesContentOnly() {
        //(C3 D3)t5 G3
        Voice voice = Voice.of(Grouping.of(Modifiers.timeUntilNext(f(5)), new Note(60), new Note(62)), new Note(67));
        List<Event> events = compiler.compile(voice);
        Assertions.assertEquals(f(0), events.get(0).getStartTime());
        Assertions.assertEquals(f(5), events.get(1).getStartTime());
        Assertions.assertEquals(f(10), events.get(2).getStartTime());
    }

    @Test
    public void testGroupingAdvancesByContentSpan() {
        Voice voice = Voice.of(
                Grouping.of(Modifiers.NONE,
                        new Note(60, Modifiers.duration(f(1))),
                        new Note(62, Modifiers.duration(f(2))),
                        new Note(64, Modifiers.duration(f(3)))),
                new Note(65));
        Assertions.assertEquals(f(6), compiler.compile(voice).get(3).getStartTime());
        Assertions.assertEquals(f(7), compiler.span(voice));
    }

    @Test
    public void testRestInheritsDurationButNotVelocity() {
        Voice voice = Voice.of(Grouping.of(Modifiers.of(30, f(1, 2), null), new Rest(), new Note(60)));
        List<Event> events = compiler.compile(voice);
        Assertions.assertEquals(Collections.singletonList(event(60, f(1, 2), f(1, 2), 30)), events);
    }

    @Test
    public void testRepetition() {
        //(C3 D3)*2
        List<Event> events = compiler.compile(Voice.of(Repetition.of(2, Modifiers.NONE, new Note(60), new Note(62))));
        Assertions.assertEquals(Arrays.asList(
                event(60, f(0), f(1), 70),
                event(62, f(1), f(1), 70),
                event(60, f(2), f(1), 70),
                event(62, f(3), f(1), 70)), events);
    }

    @Test
    public void testRepetitionOfSingleNote() {
        //C4v80n2*3
        List<Event> events = compiler.compile(Voice.of(Repetition.of(3, Modifiers.NONE, new Note(72, Modifiers.of(80, f(2), null))), new Note(74)));
        Assertions.assertEquals(4, events.size());
        Assertions.assertEquals(f(4), events.get(2).getStartTime());
        Assertions.assertEquals(f(6), events.get(3).getStartTime());
        Assertions.assertEquals(80, events.get(2).getVelocity());
    }

    @Test
    public void testRestRepetition() {
        //R0.5*4 C3
        List<Event> events = compiler.compile(Voice.of(Repetition.of(4, Modifiers.NONE, new Rest(f(1, 2))), new Note(60)));
        Assertions.assertEquals(Collections.singletonList(event(60, f(2), f(1), 70)), events);
    }

    @Test
    public void testNestedRepetition() {
        //((C3 D3)*2 E3)*3
        Repetition inner = Repetition.of(2, Modifiers.NONE, new Note(60), new Note(62));
        Repetition outer = Repetition.of(3, Modifiers.NONE, inner, new Note(64));
        List<Event> events = compiler.compile(Voice.of(outer));
        Assertions.assertEquals(15, events.size());
        Assertions.assertEquals(64, events.get(4).getPitch());
        Assertions.assertEquals(f(4), events.get(4).getStartTime());
        Assertions.assertEquals(60, events.get(5).getPitch());
        Assertions.assertEquals(f(5), events.get(5).getStartTime());
        Assertions.assertEquals(60, events.get(10).getPitch());
        Assertions.assertEquals(f(14), events.get(14).getStartTime());
    }

    @Test
    public void testRepetitionWithMixedContent() {
        //(C3 [E3 G3] R)*2
        Repetition repetition = Repetition.of(2, Modifiers.NONE, new Note(60), Chord.of(Modifiers.NONE, 64, 67), new Rest());
        List<Event> events = compiler.compile(Voice.of(repetition));
        Assertions.assertEquals(6, events.size());
        Assertions.assertEquals(f(1), events.get(1).getStartTime());
        Assertions.assertEquals(f(3), events.get(3).getStartTime());
    }

    @Test
    public void testRepetitionEqualsGroupingOfCopies() {
        List<SequenceElement> content = Arrays.asList(
                new Note(60, Modifiers.timeUntilNext(f(1, 3))),
                Chord.of(Modifiers.duration(f(3, 2)), 64, 67),
                new Rest(f(1, 4)),
                Repetition.of(2, Modifiers.velocity(99), new Note(70, Modifiers.duration(f(1, 8)))));
        for (Modifiers modifiers : Arrays.asList(Modifiers.NONE, Modifiers.of(50, f(2), null), Modifiers.of(null, null, f(1, 2)))) {
            for (int repeat=1; repeat<=4; repeat++) {
                List<SequenceElement> copies = new ArrayList<>();
                for (int i=0; i<repeat; i++) {
                    copies.addAll(content);
                }
                List<Event> replayed = compiler.compile(Voice.of(new Repetition(content, repeat, modifiers), new Note(1)));
                List<Event> recomputed = compiler.compile(Voice.of(new Grouping(copies, modifiers), new Note(1)));
                Assertions.assertEquals(recomputed, replayed, "repeat "+repeat+" modifiers "+modifiers);
            }
        }
    }

    @Test
    public void testMultipleVoicesStartAtZero() {
        Score score = Score.of(Voice.of(new Note(60), new Note(62)), Voice.of(new Note(67), new Note(69)));
        List<Event> events = compiler.compile(score);
        Assertions.assertEquals(Arrays.asList(
                event(60, f(0), f(1), 70),
                event(62, f(1), f(1), 70),
                event(67, f(0), f(1), 70),
                event(69, f(1), f(1), 70)), events);

        List<List<Event>> voices = compiler.compileVoices(score);
        Assertions.assertEquals(2, voices.size());
        Assertions.assertEquals(events.subList(2, 4), voices.get(1));
    }

    @Test
    public void testCompilingTwiceGivesSameEvents() {
        Score score = Score.of(
                Grouping.of(Modifiers.velocity(90), new Note(60), Chord.of(Modifiers.duration(f(1, 3)), 64, 67)),
                Repetition.of(3, Modifiers.timeUntilNext(f(1, 2)), new Note(72), new Rest()));
        Assertions.assertEquals(compiler.compile(score), compiler.compile(score));
    }

    @Test
    public void testValuesArePassedThroughUnchecked() {
        List<Event> events = compiler.compile(Voice.of(new Note(200, Modifiers.velocity(0))));
        Assertions.assertEquals(200, events.get(0).getPitch());
        Assertions.assertEquals(0, events.get(0).getVelocity());
    }

    @Test
    public void testCustomDefaults() {
        NotationCompiler custom = new NotationCompiler(f(1, 4), 100);
        List<Event> events = custom.compile(Voice.of(new Note(60), new Rest(), new Note(62, Modifiers.velocity(10))));
        Assertions.assertEquals(Arrays.asList(
                event(60, f(0), f(1, 4), 100),
                event(62, f(1, 2), f(1, 4), 10)), events);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new NotationCompiler(BigFraction.ZERO, 70));
    }

    @Test
    public void testResolveFillsInheritedModifiers() {
        Voice voice = Voice.of(Grouping.of(Modifiers.of(90, f(2), f(1)),
                new Note(60),
                Chord.of(Modifiers.NONE, new ChordNote(64), new ChordNote(67, Modifiers.velocity(10))),
                new Rest()));
        Voice resolved = compiler.resolve(voice);
        Grouping grouping = (Grouping) resolved.getElements().get(0);
        Assertions.assertEquals(Modifiers.of(90, f(2), f(1)), grouping.getContent().get(0).getModifiers());

        Chord chord = (Chord) grouping.getContent().get(1);
        Assertions.assertEquals(Modifiers.of(90, f(2), f(1)), chord.getModifiers());
        Assertions.assertEquals(Modifiers.of(90, f(2), null), chord.getNotes().get(0).getModifiers());
        Assertions.assertEquals(Modifiers.of(10, f(2), null), chord.getNotes().get(1).getModifiers());

        Assertions.assertEquals(new Rest(f(2)), grouping.getContent().get(2));
        //the input tree is untouched
        Assertions.assertEquals(Modifiers.NONE, ((Grouping) voice.getElements().get(0)).getContent().get(0).getModifiers());
    }

    @Test
    public void testExactRationalTiming() {
        Modifiers third = Modifiers.duration(f(1, 3));
        List<Event> events = compiler.compile(Voice.of(new Note(60, third), new Note(62, third), new Note(64, third), new Note(65)));
        Assertions.assertEquals(f(1), events.get(3).getStartTime());
        Assertions.assertEquals(1.0, events.get(3).getStartTimeAsDouble());
    }

    @Test
    public void testFineDurationLateInPiece() {
        Voice voice = Voice.of(new Rest(f(2200)), new Note(60, Modifiers.duration(f(1, 1000000))), new Note(62));
        List<Event> events = compiler.compile(voice);
        Assertions.assertEquals(f(2200), events.get(0).getStartTime());
        Assertions.assertEquals(BigFraction.of(2200000001L, 1000000L), events.get(1).getStartTime());
        Assertions.assertEquals(BigFraction.of(2201000001L, 1000000L), compiler.span(voice));
    }

    @Test
    public void testDenominatorsBeyondIntRange() {
        //the common denominator of these durations does not fit into an int
        List<SequenceElement> elements = new ArrayList<>();
        for (int prime : new int[] {7, 11, 13, 17, 19, 23, 29, 31}) {
            elements.add(new Note(60, Modifiers.duration(f(1, prime))));
        }
        elements.add(new Note(72));
        List<Event> events = compiler.compile(new Voice(elements));
        Assertions.assertEquals(9, events.size());
        BigFraction expected = BigFraction.of(new BigInteger("3559036170"), new BigInteger("6685349671"));
        Assertions.assertEquals(expected, events.get(8).getStartTime());

        //replaying shifts by multiples of that span
        events = compiler.compile(Voice.of(Repetition.of(3, Modifiers.NONE, elements.toArray(new SequenceElement[0]))));
        Assertions.assertEquals(27, events.size());
        Assertions.assertEquals(expected.add(BigFraction.ONE).multiply(2), events.get(18).getStartTime());
    }

    @Test
    public void testNodeConstructionChecks() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Chord(Collections.<ChordNote>emptyList()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Repetition.of(0, Modifiers.NONE, new Note(60)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Modifiers.duration(BigFraction.ZERO));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Modifiers.timeUntilNext(f(-1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ChordNote(60, Modifiers.timeUntilNext(f(1))));
        Assertions.assertThrows(NullPointerException.class, () -> new Grouping(null, Modifiers.NONE));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Event(60, f(-1), f(1), 70));
    }

    @Test
    public void testSortedOrdersByStartThenPitch() {
        List<Event> events = Arrays.asList(event(67, f(1), f(1), 70), event(64, f(0), f(1), 70), event(60, f(0), f(1), 70));
        List<Event> sorted = NotationCompiler.sorted(events);
        Assertions.assertEquals(Arrays.asList(60, 64, 67), Arrays.asList(sorted.get(0).getPitch(), sorted.get(1).getPitch(), sorted.get(2).getPitch()));
    }
}
