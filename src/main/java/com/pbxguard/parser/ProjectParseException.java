package com.pbxguard.parser;

/**
 * Fatal problem in the project text. Carries the 1-based line and column and the
 * 0-based byte offset into the UTF-8 input where it was detected.
 */
public class ProjectParseException extends Exception {
    private final int line;
    private final int column;
    private final int offset;

    public ProjectParseException(String message, int line, int column, int offset) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public ProjectParseException(String message, Token token) {
        this(message, token.getLine(), token.getColumn(), token.getOffset());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }
}
