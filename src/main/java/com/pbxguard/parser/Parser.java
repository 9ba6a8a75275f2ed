package com.pbxguard.parser;

import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.Identifiers;
import com.pbxguard.value.StringValue;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the project file. All-or-nothing: the first
 * problem raises {@link ProjectParseException} and no partial tree is returned.
 */
public class Parser {

    private static final Pattern BEGIN_SECTION = Pattern.compile("Begin (\\S+) section");
    private static final Pattern END_SECTION = Pattern.compile("End (\\S+) section");

    private final List<Token> tokens;
    private final List<String> misnestedSections = new ArrayList<>();
    private int index;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Document parseDocument(byte[] bytes) throws ProjectParseException {
        return parseDocument(Tokenizer.decode(bytes));
    }

    public static Document parseDocument(String text) throws ProjectParseException {
        Parser parser = new Parser(new Tokenizer(text, true).tokenize());
        parser.skipStandaloneComments();
        Token open = parser.expect(TokenType.LBRACE, "'{' opening the root dictionary");
        DictValue root = parser.parseDict(open, true, false);
        parser.expectEnd();
        return new Document(root, parser.misnestedSections);
    }

    /**
     * Parses a single value written in project syntax, e.g. {@code (A, B)} or
     * {@code "<group>"}. Used for values given on the command line.
     */
    public static Value parseValue(String text) throws ProjectParseException {
        Parser parser = new Parser(new Tokenizer(text, false).tokenize());
        Value value = parser.parseValue();
        parser.expectEnd();
        return value;
    }

    private DictValue parseDict(Token open, boolean root, boolean allowDuplicateKeys) throws ProjectParseException {
        DictValue dict = new DictValue();
        String section = null;
        while (true) {
            Token token = peek();
            switch (token.getType()) {
                case RBRACE:
                    index++;
                    if (section != null) {
                        misnestedSections.add(section);
                    }
                    return dict;
                case COMMENT:
                    index++;
                    section = applySectionMarker(token.getText(), section);
                    break;
                case STRING:
                case BAREWORD:
                    readEntry(dict, root, allowDuplicateKeys, section);
                    break;
                case EOF:
                    throw new ProjectParseException(
                        "Unbalanced '{' opened at line " + open.getLine() + ": reached end of input", token);
                default:
                    throw new ProjectParseException(
                        "Expected a key or '}' but found " + token.describe()
                            + " (dictionary opened at line " + open.getLine() + ")", token);
            }
        }
    }

    private void readEntry(DictValue dict, boolean root, boolean allowDuplicateKeys, String section)
            throws ProjectParseException {
        Token keyToken = tokens.get(index++);
        String keyComment = optionalComment();
        expect(TokenType.EQUALS, "'=' after key '" + keyToken.getText() + "'");
        String key = keyToken.getText();
        Value value;
        if (root && Document.OBJECTS_KEY.equals(key) && peek().is(TokenType.LBRACE)) {
            Token open = tokens.get(index++);
            value = parseDict(open, false, true);
        } else {
            value = parseValue();
        }
        expect(TokenType.SEMI, "';' after value of '" + key + "'");
        if (!allowDuplicateKeys && dict.containsKey(key)) {
            throw new ProjectParseException("Duplicate key '" + key + "'", keyToken);
        }
        dict.append(key, keyComment, value, section);
    }

    private Value parseValue() throws ProjectParseException {
        Token token = peek();
        switch (token.getType()) {
            case LBRACE:
                index++;
                return parseDict(token, false, false);
            case LPAREN:
                index++;
                return parseArray(token);
            case STRING:
                index++;
                optionalComment();
                return new StringValue(token.getText());
            case BAREWORD:
                index++;
                String comment = optionalComment();
                if (Identifiers.isWellFormed(token.getText())) {
                    return new IdentValue(token.getText(), comment);
                }
                return new StringValue(token.getText());
            case RBRACE:
            case RPAREN:
                throw new ProjectParseException("Unbalanced " + token.describe() + " where a value was expected", token);
            case EOF:
                throw new ProjectParseException("Expected a value but reached end of input", token);
            default:
                throw new ProjectParseException("Expected a value but found " + token.describe(), token);
        }
    }

    private ArrayValue parseArray(Token open) throws ProjectParseException {
        ArrayValue array = new ArrayValue();
        while (true) {
            skipStandaloneComments();
            Token token = peek();
            if (token.is(TokenType.RPAREN)) {
                index++;
                return array;
            }
            if (token.is(TokenType.EOF)) {
                throw new ProjectParseException(
                    "Unbalanced '(' opened at line " + open.getLine() + ": reached end of input", token);
            }
            array.add(parseValue());
            skipStandaloneComments();
            Token separator = peek();
            if (separator.is(TokenType.COMMA)) {
                index++;
            } else if (separator.is(TokenType.RPAREN)) {
                index++;
                return array;
            } else {
                throw new ProjectParseException(
                    "Expected ',' or ')' but found " + separator.describe()
                        + " (list opened at line " + open.getLine() + ")", separator);
            }
        }
    }

    private String applySectionMarker(String comment, String current) {
        Matcher begin = BEGIN_SECTION.matcher(comment);
        if (begin.matches()) {
            if (current != null) {
                misnestedSections.add(current);
            }
            return begin.group(1);
        }
        Matcher end = END_SECTION.matcher(comment);
        if (end.matches()) {
            if (!end.group(1).equals(current)) {
                misnestedSections.add(end.group(1));
            }
            return null;
        }
        return current;
    }

    private String optionalComment() {
        if (peek().is(TokenType.COMMENT)) {
            return tokens.get(index++).getText();
        }
        return null;
    }

    private void skipStandaloneComments() {
        while (peek().is(TokenType.COMMENT)) {
            index++;
        }
    }

    private Token expect(TokenType type, String what) throws ProjectParseException {
        Token token = peek();
        if (!token.is(type)) {
            throw new ProjectParseException("Expected " + what + " but found " + token.describe(), token);
        }
        index++;
        return token;
    }

    private void expectEnd() throws ProjectParseException {
        skipStandaloneComments();
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            throw new ProjectParseException("Unexpected " + token.describe() + " after the end of the document", token);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }
}
