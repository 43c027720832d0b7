/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.exceptions;

/**
 * Thrown by {@link net.scoreworks.tonelang.notation.parser.NotationParser} if the notation text can not be turned into
 * a tree. Carries the offending token, its position in the source and a {@link Kind} that selects the hint given in
 * the message
 */
public class NotationSyntaxException extends RuntimeException {

    public enum Kind {
        /** a number appeared where only a modifier prefix (v, n, t) may introduce one */
        NUMBER_WITHOUT_MODIFIER,
        /** a '.' that is not part of a number */
        BARE_DECIMAL_POINT,
        /** the same modifier was given twice on one element */
        DUPLICATE_MODIFIER,
        /** a syntactically complete value that violates its allowed range */
        INVALID_VALUE,
        /** the text ended inside an unfinished construct */
        UNEXPECTED_END,
        /** anything else */
        UNEXPECTED_CHARACTER
    }

    private final Kind kind;
    private final String token;
    private final int offset;
    private final int line;
    private final int column;

    public NotationSyntaxException(Kind kind, String detail, String token, int offset, int line, int column) {
        this(kind, detail, token, offset, line, column, null);
    }

    public NotationSyntaxException(Kind kind, String detail, String token, int offset, int line, int column, Throwable cause) {
        super("Syntax error at line "+line+", column "+column+": "+detail, cause);
        this.kind = kind;
        this.token = token;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public Kind getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    /** zero-based character offset into the source */
    public int getOffset() {
        return offset;
    }

    /** one-based line */
    public int getLine() {
        return line;
    }

    /** one-based column */
    public int getColumn() {
        return column;
    }
}
