package com.pbxguard.parser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private List<Token> tokenize(String body) throws ProjectParseException {
        return new Tokenizer("// !$*UTF8*$!\n" + body, true).tokenize();
    }

    @Test
    void splitsPunctuationBarewordsAndComments() throws Exception {
        List<Token> tokens = tokenize("{ key /* note */ = (a, b); }");
        assertEquals(List.of(TokenType.LBRACE, TokenType.BAREWORD, TokenType.COMMENT, TokenType.EQUALS,
                TokenType.LPAREN, TokenType.BAREWORD, TokenType.COMMA, TokenType.BAREWORD, TokenType.RPAREN,
                TokenType.SEMI, TokenType.RBRACE, TokenType.EOF),
            tokens.stream().map(Token::getType).toList());
        assertEquals("note", tokens.get(2).getText());
    }

    @Test
    void tracksLinesAndColumns() throws Exception {
        List<Token> tokens = tokenize("{\n\tname = x;\n}");
        Token name = tokens.get(1);
        assertEquals("name", name.getText());
        assertEquals(3, name.getLine());
        assertEquals(2, name.getColumn());
    }

    @Test
    void errorOffsetsCountUtf8Bytes() {
        ProjectParseException e = assertThrows(ProjectParseException.class,
            () -> tokenize("{ a = \"\u00e9\"; b = @ }"));
        assertEquals(2, e.getLine());
        assertEquals(16, e.getColumn());
        assertEquals(30, e.getOffset());
    }

    @Test
    void barewordStopsBeforeComment() throws Exception {
        List<Token> tokens = tokenize("path/to/file/*c*/");
        assertEquals("path/to/file", tokens.get(0).getText());
        assertEquals(TokenType.COMMENT, tokens.get(1).getType());
        assertEquals("c", tokens.get(1).getText());
    }

    @Test
    void dropsLineComments() throws Exception {
        List<Token> tokens = tokenize("// first\n{ // trailing\n}");
        assertEquals(TokenType.LBRACE, tokens.get(0).getType());
        assertEquals(TokenType.RBRACE, tokens.get(1).getType());
    }

    @Test
    void decodesStringEscapes() throws Exception {
        List<Token> tokens = tokenize("\"a\\\"b\\\\c\\n\\t\\U0041\"");
        assertEquals(TokenType.STRING, tokens.get(0).getType());
        assertEquals("a\"b\\c\n\tA", tokens.get(0).getText());
    }

    @Test
    void acceptsSingleQuotedStrings() throws Exception {
        assertEquals("it's", tokenize("'it\\'s'").get(0).getText());
    }

    @Test
    void rejectsUnknownEscape() {
        ProjectParseException e = assertThrows(ProjectParseException.class, () -> tokenize("\"bad\\q\""));
        assertEquals(2, e.getLine());
    }

    @Test
    void rejectsUnterminatedString() {
        assertThrows(ProjectParseException.class, () -> tokenize("\"open"));
    }

    @Test
    void rejectsUnterminatedComment() {
        assertThrows(ProjectParseException.class, () -> tokenize("/* never closed"));
    }

    @Test
    void rejectsMissingHeader() {
        ProjectParseException e = assertThrows(ProjectParseException.class,
            () -> new Tokenizer("\uFEFF// !$*UTF8*$!\n{}", true).tokenize());
    }

    @Test
    void rejectsInvalidUtf8() {
        byte[] bytes = "// !$*UTF8*$!\n{}".getBytes(StandardCharsets.UTF_8);
        byte[] broken = new byte[bytes.length + 1];
        System.arraycopy(bytes, 0, broken, 0, bytes.length);
        broken[bytes.length] = (byte) 0xC3;
        assertThrows(ProjectParseException.class, () -> Tokenizer.decode(broken));
    }

    @Test
    void headerNotRequiredForValues() throws Exception {
        List<Token> tokens = new Tokenizer("\"<group>\"", false).tokenize();
        assertEquals("<group>", tokens.get(0).getText());
    }
}
