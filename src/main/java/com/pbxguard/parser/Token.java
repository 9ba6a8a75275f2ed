package com.pbxguard.parser;

/**
 * One lexical token with the position of its first character.
 * {@code text} holds the unescaped content for strings, the raw word for
 * barewords and the inner text for comments.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String text, int line, int column, int offset) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
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

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public String describe() {
        switch (type) {
            case STRING:
                return "string \"" + text + "\"";
            case BAREWORD:
                return "'" + text + "'";
            case COMMENT:
                return "comment";
            case EOF:
                return "end of input";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "") + "@" + line + ":" + column;
    }
}
