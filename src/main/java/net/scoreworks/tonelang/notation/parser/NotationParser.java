/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation.parser;

import net.scoreworks.tonelang.exceptions.NotationSyntaxException;
import net.scoreworks.tonelang.exceptions.NotationSyntaxException.Kind;
import net.scoreworks.tonelang.notation.Chord;
import net.scoreworks.tonelang.notation.ChordNote;
import net.scoreworks.tonelang.notation.Grouping;
import net.scoreworks.tonelang.notation.Modifiers;
import net.scoreworks.tonelang.notation.Note;
import net.scoreworks.tonelang.notation.Repetition;
import net.scoreworks.tonelang.notation.Rest;
import net.scoreworks.tonelang.notation.Score;
import net.scoreworks.tonelang.notation.SequenceElement;
import net.scoreworks.tonelang.notation.Voice;
import net.scoreworks.tonelang.pitch.Pitch;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.numbers.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Reads ToneLang text into a {@link Score}. Elements are separated by whitespace, voices by ';'. A voice may be empty.
 *
 * <ul>
 *  <li>note:       pitch name with octave, e.g. {@code C3}, {@code F#4}, {@code Bb-1}</li>
 *  <li>chord:      notes in brackets, e.g. {@code [C3 E3v90 G3n2]}. Notes in a chord take v and n only</li>
 *  <li>rest:       {@code R} with an optional duration, e.g. {@code R}, {@code R0.5}</li>
 *  <li>grouping:   elements in parentheses sharing their modifiers, e.g. {@code (C3 D3)v90}</li>
 *  <li>modifiers:  {@code v} velocity 1-127, {@code n} duration, {@code t} time until next, each at most once and
 *  written directly after the note, chord or grouping</li>
 *  <li>repetition: {@code *N} after any element, e.g. {@code (C3 D3)*2}</li>
 * </ul>
 *
 * Durations are written as integers, decimals ({@code 0.5}, {@code .5}) or fractions ({@code 1/3}) and kept exact.
 * Pitch names are resolved with {@link Pitch#nameToMidi(String)}, its exceptions are not wrapped
 */
public final class NotationParser {
    private static final Logger LOGGER = LogManager.getLogger(NotationParser.class);

    private static final String DIGITS = "0123456789";
    private static final String VALID_CONSTRUCTS = "Expected a note (C3, F#4, Bb-1), a chord [..], a rest R, " +
            "a grouping (..), a modifier v/n/t directly after an element, a repetition *N or ';' between voices";

    private NotationParser() {}

    /**
     * @param text ToneLang source, null or blank gives an empty score
     * @throws NotationSyntaxException if the text is not valid ToneLang
     */
    public static Score parse(String text) {
        if (StringUtils.isBlank(text))
            return Score.EMPTY;
        Score score = new Parsing(text).parseScore();
        LOGGER.debug("Parsed {} voice(s) from {} character(s)", score.getVoices().size(), text.length());
        return score;
    }

    private static class Parsing {
        private final String source;
        /** offset of the next unread character */
        private int pos;

        Parsing(String source) {
            this.source = source;
        }

        Score parseScore() {
            List<Voice> voices = new ArrayList<>();
            while (true) {
                voices.add(new Voice(parseSequence(-1)));
                if (atEnd())
                    break;
                pos++;  //';'
            }
            return new Score(voices);
        }

        /**
         * Read elements until the end of a voice or, inside a grouping, until the closing ')' which is left unread
         * @param openOffset offset of the '(' of the enclosing grouping, -1 at voice level
         */
        private List<SequenceElement> parseSequence(int openOffset) {
            boolean inGrouping = openOffset >= 0;
            List<SequenceElement> elements = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    if (inGrouping)
                        throw error(Kind.UNEXPECTED_END, "Unclosed '(' opened at "+describePosition(openOffset), openOffset, openOffset+1);
                    return elements;
                }
                char c = peek();
                if (c == ';') {
                    if (inGrouping)
                        throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected ';' inside a grouping, voices can only be separated at top level", pos, pos+1);
                    return elements;
                }
                if (c == ')') {
                    if (!inGrouping)
                        throw error(Kind.UNEXPECTED_CHARACTER, "Unmatched ')'", pos, pos+1);
                    return elements;
                }
                elements.add(parseElement());
                requireSeparator();
            }
        }

        //an element directly followed by the start of another one, e.g. C3D3
        private void requireSeparator() {
            if (atEnd())
                return;
            char c = peek();
            if (isPitchLetter(c) || c == '[' || c == 'R' || c == 'r' || c == '(')
                throw error(Kind.UNEXPECTED_CHARACTER, "Missing whitespace before '"+c+"', elements must be separated", pos, pos+1);
        }

        private SequenceElement parseElement() {
            char c = peek();
            SequenceElement primary;
            if (isPitchLetter(c))
                primary = parseNote();
            else if (c == '[')
                primary = parseChord();
            else if (c == 'R' || c == 'r')
                primary = parseRest();
            else if (c == '(')
                primary = parseGrouping();
            else
                throw unexpected();

            if (!atEnd() && peek() == '*') {
                pos++;
                int start = pos;
                int repeat = parseWholeNumber(readNumber("repeat count"), "Repeat count", start);
                if (repeat < 1)
                    throw error(Kind.INVALID_VALUE, "Repeat count must be at least 1, got "+repeat, start, pos);
                //a repeated grouping keeps its modifiers, anything else is wrapped as it is
                if (primary instanceof Grouping) {
                    Grouping grouping = (Grouping) primary;
                    return new Repetition(grouping.getContent(), repeat, grouping.getModifiers());
                }
                return new Repetition(Collections.singletonList(primary), repeat, Modifiers.NONE);
            }
            return primary;
        }

        private Note parseNote() {
            int pitch = parsePitch();
            return new Note(pitch, parseModifiers(true));
        }

        private Chord parseChord() {
            int start = pos;
            pos++;  //'['
            List<ChordNote> notes = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (atEnd())
                    throw error(Kind.UNEXPECTED_END, "Unclosed '[' opened at "+describePosition(start), start, start+1);
                char c = peek();
                if (c == ']')
                    break;
                if (!isPitchLetter(c)) {
                    if (isDigit(c) || c == '.' || c == '-')
                        throw unexpected();
                    throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected '"+c+"' inside a chord, only notes are allowed between [ and ]", pos, pos+1);
                }
                int pitch = parsePitch();
                notes.add(new ChordNote(pitch, parseModifiers(false)));
                requireSeparator();
            }
            pos++;  //']'
            if (notes.isEmpty())
                throw error(Kind.INVALID_VALUE, "A chord needs at least one note", start, pos);
            return new Chord(notes, parseModifiers(true));
        }

        private Rest parseRest() {
            pos++;  //'R'
            if (!atEnd() && (isDigit(peek()) || peek() == '.')) {
                int start = pos;
                return new Rest(parsePositive(readNumber("rest duration"), "Rest duration", start));
            }
            return new Rest();
        }

        private Grouping parseGrouping() {
            int start = pos;
            pos++;  //'('
            List<SequenceElement> content = parseSequence(start);
            pos++;  //')'
            return new Grouping(content, parseModifiers(true));
        }

        /**
         * Letter, optional accidental and signed octave, resolved to MIDI
         */
        private int parsePitch() {
            int start = pos;
            pos++;
            if (!atEnd() && (peek() == '#' || peek() == 'b'))
                pos++;
            if (!atEnd() && peek() == '-')
                pos++;
            int digits = pos;
            while (!atEnd() && isDigit(peek()))
                pos++;
            if (pos == digits) {
                String name = source.substring(start, pos);
                Kind kind = atEnd() ? Kind.UNEXPECTED_END : Kind.UNEXPECTED_CHARACTER;
                throw error(kind, "Pitch '"+name+"' needs an octave, e.g. "+name.replace("-", "")+"3", start, pos);
            }
            return Pitch.nameToMidi(source.substring(start, pos));
        }

        private Modifiers parseModifiers(boolean allowTimeUntilNext) {
            Integer velocity = null;
            BigFraction duration = null;
            BigFraction timeUntilNext = null;
            while (!atEnd()) {
                char c = peek();
                int start = pos;
                if (c == 'v') {
                    if (velocity != null)
                        throw duplicate(c);
                    pos++;
                    int value = parseWholeNumber(readNumber("velocity"), "Velocity", start+1);
                    if (value < 1 || value > 127)
                        throw error(Kind.INVALID_VALUE, "Velocity "+value+" outside valid range 1-127", start, pos);
                    velocity = value;
                }
                else if (c == 'n') {
                    if (duration != null)
                        throw duplicate(c);
                    pos++;
                    duration = parsePositive(readNumber("duration"), "Duration", start+1);
                }
                else if (c == 't') {
                    if (!allowTimeUntilNext)
                        throw error(Kind.UNEXPECTED_CHARACTER, "Notes inside a chord can not have a time until next, put 't' after the closing ']'", pos, pos+1);
                    if (timeUntilNext != null)
                        throw duplicate(c);
                    pos++;
                    timeUntilNext = parsePositive(readNumber("time until next"), "Time until next", start+1);
                }
                else
                    break;
            }
            return Modifiers.of(velocity, duration, timeUntilNext);
        }

        /**
         * Scan an unsigned number: digits with an optional decimal part, a decimal part alone, or digits/digits
         * @param what name of the value for error messages
         */
        private String readNumber(String what) {
            int start = pos;
            if (atEnd())
                throw error(Kind.UNEXPECTED_END, "Expected a "+what+" at the end of the input", pos, pos);
            char c = peek();
            if (c == '-')
                throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected '-', a "+what+" can not be negative", pos, pos+1);
            if (isDigit(c)) {
                skipDigits();
                if (!atEnd() && peek() == '.') {
                    pos++;
                    skipDigits();
                }
                else if (!atEnd() && peek() == '/') {
                    pos++;
                    int denominator = pos;
                    skipDigits();
                    if (pos == denominator)
                        throw error(Kind.INVALID_VALUE, "BigFraction '"+source.substring(start, pos)+"' needs a denominator", start, pos);
                }
            }
            else if (c == '.') {
                pos++;
                if (atEnd() || !isDigit(peek()))
                    throw error(Kind.BARE_DECIMAL_POINT, "A decimal point must be followed by digits, e.g. .5 or 0.5", start, pos);
                skipDigits();
            }
            else
                throw error(Kind.UNEXPECTED_CHARACTER, "Expected a "+what+" but found '"+c+"'", pos, pos+1);
            return source.substring(start, pos);
        }

        private int parseWholeNumber(String token, String what, int start) {
            if (!StringUtils.containsOnly(token, DIGITS))
                throw error(Kind.INVALID_VALUE, what+" must be a whole number, got "+token, start, pos);
            String digits = StringUtils.stripStart(token, "0");
            if (digits.length() > 9)
                throw error(Kind.INVALID_VALUE, what+" "+token+" is too large", start, pos);
            return digits.isEmpty() ? 0 : Integer.parseInt(digits);
        }

        private BigFraction parsePositive(String token, String what, int start) {
            BigFraction value;
            try {
                value = toFraction(token);
            } catch (ArithmeticException e) {
                throw error(Kind.INVALID_VALUE, what+" '"+token+"' can not be represented", start, pos, e);
            }
            if (value.compareTo(BigFraction.ZERO) <= 0)
                throw error(Kind.INVALID_VALUE, what+" must be positive, got "+token, start, pos);
            return value;
        }

        //decimals are converted digit by digit so that 0.1 stays exactly 1/10
        private static BigFraction toFraction(String token) {
            int slash = token.indexOf('/');
            if (slash >= 0)
                return BigFraction.of(new BigInteger(token.substring(0, slash)), new BigInteger(token.substring(slash+1)));
            int point = token.indexOf('.');
            if (point < 0)
                return BigFraction.of(new BigInteger(token));
            String decimals = StringUtils.stripEnd(token.substring(point+1), "0");
            String whole = token.substring(0, point);
            BigInteger numerator = new BigInteger((whole.isEmpty() ? "0" : whole) + decimals);
            return BigFraction.of(numerator, BigInteger.TEN.pow(decimals.length()));
        }

        private NotationSyntaxException unexpected() {
            char c = peek();
            int start = pos;
            if (isDigit(c) || (c == '.' && pos+1 < source.length() && isDigit(source.charAt(pos+1)))) {
                String number = readNumber("number");
                return error(Kind.NUMBER_WITHOUT_MODIFIER, "Number '"+number+"' must directly follow a modifier: " +
                        "v (velocity), n (duration) or t (time until next), e.g. C3n"+number, start, pos);
            }
            if (c == '.')
                return error(Kind.BARE_DECIMAL_POINT, "A decimal point must be part of a number, e.g. n0.5 or n.5", start, start+1);
            if (c == '-')
                return error(Kind.UNEXPECTED_CHARACTER, "Unexpected '-'. A negative octave follows the pitch name directly (C-1), other values can not be negative", start, start+1);
            return error(Kind.UNEXPECTED_CHARACTER, "Unexpected '"+c+"'. "+VALID_CONSTRUCTS, start, start+1);
        }

        private NotationSyntaxException duplicate(char modifier) {
            return error(Kind.DUPLICATE_MODIFIER, "Duplicate modifier '"+modifier+"', each of v, n and t may be given once per element", pos, pos+1);
        }

        private NotationSyntaxException error(Kind kind, String detail, int start, int end) {
            return error(kind, detail, start, end, null);
        }

        private NotationSyntaxException error(Kind kind, String detail, int start, int end, Throwable cause) {
            String token = source.substring(start, Math.min(Math.max(end, start), source.length()));
            return new NotationSyntaxException(kind, detail, token, start, lineOf(start), columnOf(start), cause);
        }

        private String describePosition(int offset) {
            return "line "+lineOf(offset)+", column "+columnOf(offset);
        }

        private int lineOf(int offset) {
            return StringUtils.countMatches(source.substring(0, offset), '\n') + 1;
        }

        private int columnOf(int offset) {
            return offset - source.lastIndexOf('\n', offset-1);
        }

        private boolean atEnd() {
            return pos >= source.length();
        }

        private char peek() {
            return source.charAt(pos);
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek()))
                pos++;
        }

        private void skipDigits() {
            while (!atEnd() && isDigit(peek()))
                pos++;
        }

        //ASCII only, other Unicode digits are not part of a number
        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isPitchLetter(char c) {
            return (c >= 'A' && c <= 'G') || (c >= 'a' && c <= 'g');
        }
    }
}
