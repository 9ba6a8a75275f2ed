package com.pbxguard.parser;

import com.pbxguard.value.Document;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits project text into tokens. Whitespace and {@code //} line comments are
 * dropped; {@code /* ... *&#47;} comments are kept as COMMENT tokens so the parser
 * can attach them to the preceding scalar or read section markers from them.
 */
public class Tokenizer {

    private final String source;
    private final boolean expectHeader;
    private int pos;
    private int line = 1;
    private int column = 1;
    private int byteOffset;

    public Tokenizer(String source, boolean expectHeader) {
        this.source = source;
        this.expectHeader = expectHeader;
    }

    public static String decode(byte[] bytes) throws ProjectParseException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new ProjectParseException("Input is not valid UTF-8", 1, 1, 0);
        }
    }

    public List<Token> tokenize() throws ProjectParseException {
        List<Token> tokens = new ArrayList<>();
        if (expectHeader) {
            readHeader();
        }
        while (true) {
            skipTrivia();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, null, line, column, byteOffset));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void readHeader() throws ProjectParseException {
        if (!source.isEmpty() && source.charAt(0) == '\uFEFF') {
            throw new ProjectParseException("Byte order mark before header", 1, 1, 0);
        }
        int end = source.indexOf('\n');
        String first = end >= 0 ? source.substring(0, end) : source;
        if (first.endsWith("\r")) {
            first = first.substring(0, first.length() - 1);
        }
        if (!Document.MAGIC_HEADER.equals(first)) {
            throw new ProjectParseException(
                "Missing or altered header line (expected \"" + Document.MAGIC_HEADER + "\")", 1, 1, 0);
        }
        if (end < 0) {
            advance(source.length());
        } else {
            advance(end + 1);
        }
    }

    private Token next() throws ProjectParseException {
        char c = source.charAt(pos);
        int startLine = line;
        int startColumn = column;
        int startOffset = byteOffset;
        switch (c) {
            case '{':
                advance(1);
                return new Token(TokenType.LBRACE, "{", startLine, startColumn, startOffset);
            case '}':
                advance(1);
                return new Token(TokenType.RBRACE, "}", startLine, startColumn, startOffset);
            case '(':
                advance(1);
                return new Token(TokenType.LPAREN, "(", startLine, startColumn, startOffset);
            case ')':
                advance(1);
                return new Token(TokenType.RPAREN, ")", startLine, startColumn, startOffset);
            case '=':
                advance(1);
                return new Token(TokenType.EQUALS, "=", startLine, startColumn, startOffset);
            case ';':
                advance(1);
                return new Token(TokenType.SEMI, ";", startLine, startColumn, startOffset);
            case ',':
                advance(1);
                return new Token(TokenType.COMMA, ",", startLine, startColumn, startOffset);
            case '"':
            case '\'':
                return readString(c, startLine, startColumn, startOffset);
            default:
                break;
        }
        if (c == '/' && peek(1) == '*') {
            return readComment(startLine, startColumn, startOffset);
        }
        if (isBarewordChar(c)) {
            int start = pos;
            while (pos < source.length() && isBarewordChar(source.charAt(pos)) && !startsComment(pos)) {
                advance(1);
            }
            return new Token(TokenType.BAREWORD, source.substring(start, pos), startLine, startColumn, startOffset);
        }
        throw new ProjectParseException("Unexpected character '" + printable(c) + "'", startLine, startColumn, startOffset);
    }

    private Token readComment(int startLine, int startColumn, int startOffset) throws ProjectParseException {
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
            throw new ProjectParseException("Unterminated comment", startLine, startColumn, startOffset);
        }
        String text = source.substring(pos + 2, close).trim();
        advance(close + 2 - pos);
        return new Token(TokenType.COMMENT, text, startLine, startColumn, startOffset);
    }

    private Token readString(char quote, int startLine, int startColumn, int startOffset) throws ProjectParseException {
        advance(1);
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new ProjectParseException("Unterminated string", startLine, startColumn, startOffset);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                advance(1);
                return new Token(TokenType.STRING, sb.toString(), startLine, startColumn, startOffset);
            }
            if (c == '\\') {
                sb.append(readEscape());
                continue;
            }
            sb.append(c);
            advance(1);
        }
    }

    private char readEscape() throws ProjectParseException {
        int escLine = line;
        int escColumn = column;
        int escOffset = byteOffset;
        if (pos + 1 >= source.length()) {
            throw new ProjectParseException("Unterminated string", escLine, escColumn, escOffset);
        }
        char e = source.charAt(pos + 1);
        switch (e) {
            case '\\':
            case '"':
            case '\'':
                advance(2);
                return e;
            case 'n':
                advance(2);
                return '\n';
            case 't':
                advance(2);
                return '\t';
            case 'r':
                advance(2);
                return '\r';
            case '0':
                advance(2);
                return '\0';
            case 'U':
                if (pos + 6 > source.length()) {
                    throw new ProjectParseException("Truncated \\U escape", escLine, escColumn, escOffset);
                }
                String hex = source.substring(pos + 2, pos + 6);
                try {
                    char decoded = (char) Integer.parseInt(hex, 16);
                    advance(6);
                    return decoded;
                } catch (NumberFormatException ex) {
                    throw new ProjectParseException("Invalid \\U escape", escLine, escColumn, escOffset);
                }
            default:
                throw new ProjectParseException("Unknown escape '\\" + printable(e) + "'", escLine, escColumn, escOffset);
        }
    }

    private void skipTrivia() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                advance(1);
            } else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance(1);
                }
            } else {
                return;
            }
        }
    }

    private boolean startsComment(int at) {
        return source.charAt(at) == '/' && at + 1 < source.length()
            && (source.charAt(at + 1) == '*' || source.charAt(at + 1) == '/');
    }

    private char peek(int ahead) {
        int at = pos + ahead;
        return at < source.length() ? source.charAt(at) : '\0';
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            byteOffset += utf8Width(source.charAt(pos));
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    // a surrogate pair is 4 bytes, counted on the high half
    private static int utf8Width(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        if (Character.isHighSurrogate(c)) {
            return 4;
        }
        return Character.isLowSurrogate(c) ? 0 : 3;
    }

    static boolean isBarewordChar(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || c == '_' || c == '$' || c == '+' || c == '/'
            || c == ':' || c == '.' || c == '-' || c == '~';
    }

    private static String printable(char c) {
        if (c < 0x20 || c == 0x7F) {
            return String.format("\\u%04x", (int) c);
        }
        return String.valueOf(c);
    }
}
