package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens.
 *
 * Identifier-like runs are classified in a fixed order: a sheet prefix (run followed
 * by '!'), then a cell reference, then a function name, then TRUE/FALSE, then a
 * plain name. A reference-shaped run directly followed by '(' is a function name
 * (LOG10(...)); otherwise a reference-shaped run is always a reference, so
 * out-of-range columns such as XYZ999 surface as #REF! instead of an unknown name.
 */
public class FormulaTokenizer {

    private static final String[] ERROR_CODES = {
            "#DIV/0!", "#REF!", "#NAME?", "#VALUE!", "#CIRC!", "#NUM!", "#ERROR!"
    };

    private final String input;
    // offset of input[0] in the text the caller sees, for error positions
    private final int baseOffset;
    private int pos;

    public FormulaTokenizer(String input) {
        this(input, 0);
    }

    public FormulaTokenizer(String input, int baseOffset) {
        this.input = input;
        this.baseOffset = baseOffset;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", baseOffset + pos));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() {
        int start = pos;
        char c = input.charAt(pos);

        if (isAsciiDigit(c) || (c == '.' && pos + 1 < input.length() && isAsciiDigit(input.charAt(pos + 1)))) {
            return readNumber();
        }
        if (c == '"') {
            return readString();
        }
        if (c == '#') {
            return readErrorLiteral();
        }
        if (c == '$') {
            return readDollarReference();
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier();
        }

        pos++;
        switch (c) {
            case '+':
                return token(TokenType.PLUS, "+", start);
            case '-':
                return token(TokenType.MINUS, "-", start);
            case '*':
                return token(TokenType.STAR, "*", start);
            case '/':
                return token(TokenType.SLASH, "/", start);
            case '^':
                return token(TokenType.CARET, "^", start);
            case '%':
                return token(TokenType.PERCENT, "%", start);
            case '&':
                return token(TokenType.AMPERSAND, "&", start);
            case '(':
                return token(TokenType.LPAREN, "(", start);
            case ')':
                return token(TokenType.RPAREN, ")", start);
            case ',':
                return token(TokenType.COMMA, ",", start);
            case ':':
                return token(TokenType.COLON, ":", start);
            case '=':
                return token(TokenType.EQUAL, "=", start);
            case '<':
                if (match('=')) {
                    return token(TokenType.LESS_THAN_OR_EQUAL, "<=", start);
                }
                if (match('>')) {
                    return token(TokenType.NOT_EQUAL, "<>", start);
                }
                return token(TokenType.LESS_THAN, "<", start);
            case '>':
                if (match('=')) {
                    return token(TokenType.GREATER_THAN_OR_EQUAL, ">=", start);
                }
                return token(TokenType.GREATER_THAN, ">", start);
            default:
                throw new FormulaParseException("Unexpected character '" + c + "'", baseOffset + start);
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < input.length() && isAsciiDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && isAsciiDigit(input.charAt(pos))) {
                pos++;
            }
        }
        return token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                if (pos + 1 < input.length() && input.charAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated string literal", baseOffset + start);
    }

    private Token readErrorLiteral() {
        int start = pos;
        for (String code : ERROR_CODES) {
            if (input.regionMatches(true, pos, code, 0, code.length())) {
                pos += code.length();
                return token(TokenType.ERROR, ErrorType.fromCode(code).name(), start);
            }
        }
        throw new FormulaParseException("Unknown error literal", baseOffset + start);
    }

    // $A$1, $A1: a leading '$' can only start a reference
    private Token readDollarReference() {
        int start = pos;
        int end = scanReference(pos);
        if (end < 0) {
            throw new FormulaParseException("Invalid cell reference", baseOffset + start);
        }
        pos = end;
        return token(TokenType.CELL_REF, input.substring(start, end).toUpperCase(), start);
    }

    private Token readIdentifier() {
        int start = pos;

        // A$1 style references break the identifier run at the '$'
        int refEnd = scanReference(start);
        int runEnd = start;
        while (runEnd < input.length() && isIdentifierChar(input.charAt(runEnd))) {
            runEnd++;
        }
        String run = input.substring(start, runEnd);

        if (runEnd < input.length() && input.charAt(runEnd) == '!') {
            pos = runEnd + 1;
            return token(TokenType.SHEET_PREFIX, run, start);
        }
        if (refEnd > 0 && refEnd >= runEnd) {
            if (nextNonSpace(refEnd) != '(') {
                pos = refEnd;
                return token(TokenType.CELL_REF, input.substring(start, refEnd).toUpperCase(), start);
            }
        }
        pos = runEnd;
        if (nextNonSpace(runEnd) == '(') {
            return token(TokenType.FUNCTION_NAME, run.toUpperCase(), start);
        }
        if ("TRUE".equalsIgnoreCase(run) || "FALSE".equalsIgnoreCase(run)) {
            return token(TokenType.BOOLEAN, run.toUpperCase(), start);
        }
        return token(TokenType.NAME, run, start);
    }

    /**
     * Matches [$]LETTERS[$]DIGITS starting at {@code from}.
     *
     * @return the end offset of the match, or -1 if there is none
     */
    private int scanReference(int from) {
        int i = from;
        if (i < input.length() && input.charAt(i) == '$') {
            i++;
        }
        int lettersStart = i;
        while (i < input.length() && isAsciiLetter(input.charAt(i))) {
            i++;
        }
        if (i == lettersStart) {
            return -1;
        }
        if (i < input.length() && input.charAt(i) == '$') {
            i++;
        }
        int digitsStart = i;
        while (i < input.length() && isAsciiDigit(input.charAt(i))) {
            i++;
        }
        if (i == digitsStart) {
            return -1;
        }
        // LOG10X or A1_B are names, not references
        if (i < input.length() && isIdentifierChar(input.charAt(i))) {
            return -1;
        }
        return i;
    }

    private char nextNonSpace(int from) {
        int i = from;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private boolean match(char expected) {
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private Token token(TokenType type, String text, int start) {
        return new Token(type, text, baseOffset + start);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    // 0-9 only; other Unicode digits are plain text
    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
