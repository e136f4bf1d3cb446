package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.InvalidAddressException;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-precedence (Pratt) parser turning formula text into an {@link Expr} tree.
 *
 * Binding powers, low to high: &amp; (0), comparisons (1), + - (2), * / (3),
 * ^ (4, right-associative), prefix - (5), postfix % (6).
 *
 * The parser is stateless between calls and can be shared.
 */
public class FormulaParser {

    /**
     * Parses a formula. A leading '=' is optional.
     *
     * @throws FormulaParseException on malformed input, or its subclass
     *         InvalidReferenceException for a reference past the sheet edge
     */
    public Expr parse(String formula) {
        if (formula == null) {
            throw new FormulaParseException("Empty formula");
        }
        String body = formula;
        int offset = 0;
        int firstNonSpace = 0;
        while (firstNonSpace < body.length() && Character.isWhitespace(body.charAt(firstNonSpace))) {
            firstNonSpace++;
        }
        if (firstNonSpace < body.length() && body.charAt(firstNonSpace) == '=') {
            offset = firstNonSpace + 1;
            body = body.substring(offset);
        }
        List<Token> tokens = new FormulaTokenizer(body, offset).tokenize();
        return new Parse(tokens).parseFormula();
    }

    /**
     * Cursor over one token list.
     */
    private static final class Parse {

        private final List<Token> tokens;
        private int current;

        Parse(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expr parseFormula() {
            if (peek().getType() == TokenType.EOF) {
                throw new FormulaParseException("Empty formula", peek().getPosition());
            }
            Expr expr = parseExpression(0);
            Token trailing = peek();
            if (trailing.getType() != TokenType.EOF) {
                throw new FormulaParseException("Unexpected '" + trailing.getText() + "'", trailing.getPosition());
            }
            return expr;
        }

        private Expr parseExpression(int minPrecedence) {
            Expr left = parsePrefix();
            while (true) {
                Token token = peek();
                if (token.getType() == TokenType.PERCENT) {
                    if (BinaryOperator.PERCENT_PRECEDENCE < minPrecedence) {
                        break;
                    }
                    advance();
                    left = new UnaryOpExpr(UnaryOperator.PERCENT, left);
                    continue;
                }
                BinaryOperator op = toBinaryOperator(token.getType());
                if (op == null || op.getPrecedence() < minPrecedence) {
                    break;
                }
                advance();
                int nextMin = op.isRightAssociative() ? op.getPrecedence() : op.getPrecedence() + 1;
                Expr right = parseExpression(nextMin);
                left = new BinaryOpExpr(op, left, right);
            }
            return left;
        }

        private Expr parsePrefix() {
            Token token = advance();
            switch (token.getType()) {
                case MINUS:
                    return new UnaryOpExpr(UnaryOperator.NEGATE, parseExpression(BinaryOperator.NEGATE_PRECEDENCE));
                case PLUS:
                    return parseExpression(BinaryOperator.NEGATE_PRECEDENCE);
                case NUMBER:
                    return new LiteralExpr(CellValue.number(parseNumber(token)));
                case STRING:
                    return new LiteralExpr(CellValue.string(token.getText()));
                case BOOLEAN:
                    return new LiteralExpr(CellValue.bool("TRUE".equals(token.getText())));
                case ERROR:
                    return new LiteralExpr(CellValue.error(ErrorType.valueOf(token.getText())));
                case SHEET_PREFIX:
                    Token target = advance();
                    if (target.getType() != TokenType.CELL_REF) {
                        throw new FormulaParseException("Expected a cell reference after '"
                                + token.getText() + "!'", target.getPosition());
                    }
                    return parseReferenceOrRange(target, token.getText());
                case CELL_REF:
                    return parseReferenceOrRange(token, null);
                case FUNCTION_NAME:
                    return parseFunctionCall(token);
                case LPAREN:
                    Expr inner = parseExpression(0);
                    expect(TokenType.RPAREN, "Missing closing parenthesis");
                    return inner;
                case NAME:
                    throw new FormulaParseException("Unknown name '" + token.getText() + "'", token.getPosition());
                case EOF:
                    throw new FormulaParseException("Unexpected end of formula", token.getPosition());
                default:
                    throw new FormulaParseException("Unexpected '" + token.getText() + "'", token.getPosition());
            }
        }

        private Expr parseFunctionCall(Token name) {
            expect(TokenType.LPAREN, "Expected '(' after " + name.getText());
            List<Expr> args = new ArrayList<>();
            if (peek().getType() == TokenType.RPAREN) {
                advance();
                return new FunctionCallExpr(name.getText(), args);
            }
            while (true) {
                args.add(parseExpression(0));
                if (peek().getType() == TokenType.COMMA) {
                    advance();
                    // trailing comma: SUM(A1,)
                    if (peek().getType() == TokenType.RPAREN) {
                        break;
                    }
                    continue;
                }
                break;
            }
            expect(TokenType.RPAREN, "Missing closing parenthesis for " + name.getText());
            return new FunctionCallExpr(name.getText(), args);
        }

        private Expr parseReferenceOrRange(Token first, String sheetName) {
            RefParts start = RefParts.of(first);
            if (peek().getType() != TokenType.COLON) {
                return new ReferenceExpr(start.address, start.absoluteCol, start.absoluteRow, sheetName);
            }
            advance();
            Token second = advance();
            if (second.getType() != TokenType.CELL_REF) {
                throw new FormulaParseException("Expected a cell reference after ':'", second.getPosition());
            }
            RefParts end = RefParts.of(second);

            // B2:A1 is accepted and normalized; each '$' flag follows its coordinate
            RefParts leftCol = start.address.getCol() <= end.address.getCol() ? start : end;
            RefParts rightCol = leftCol == start ? end : start;
            RefParts topRow = start.address.getRow() <= end.address.getRow() ? start : end;
            RefParts bottomRow = topRow == start ? end : start;
            CellRange range = CellRange.spanning(start.address, end.address);
            return new RangeExpr(range, leftCol.absoluteCol, topRow.absoluteRow,
                    rightCol.absoluteCol, bottomRow.absoluteRow, sheetName);
        }

        private double parseNumber(Token token) {
            try {
                return Double.parseDouble(token.getText());
            } catch (NumberFormatException e) {
                throw new FormulaParseException("Invalid number '" + token.getText() + "'", token.getPosition());
            }
        }

        private BinaryOperator toBinaryOperator(TokenType type) {
            switch (type) {
                case AMPERSAND:
                    return BinaryOperator.CONCAT;
                case EQUAL:
                    return BinaryOperator.EQUAL;
                case NOT_EQUAL:
                    return BinaryOperator.NOT_EQUAL;
                case LESS_THAN:
                    return BinaryOperator.LESS_THAN;
                case LESS_THAN_OR_EQUAL:
                    return BinaryOperator.LESS_THAN_OR_EQUAL;
                case GREATER_THAN:
                    return BinaryOperator.GREATER_THAN;
                case GREATER_THAN_OR_EQUAL:
                    return BinaryOperator.GREATER_THAN_OR_EQUAL;
                case PLUS:
                    return BinaryOperator.ADD;
                case MINUS:
                    return BinaryOperator.SUBTRACT;
                case STAR:
                    return BinaryOperator.MULTIPLY;
                case SLASH:
                    return BinaryOperator.DIVIDE;
                case CARET:
                    return BinaryOperator.POWER;
                default:
                    return null;
            }
        }

        private Token peek() {
            return tokens.get(current);
        }

        private Token advance() {
            Token token = tokens.get(current);
            if (token.getType() != TokenType.EOF) {
                current++;
            }
            return token;
        }

        private void expect(TokenType type, String message) {
            Token token = peek();
            if (token.getType() != type) {
                throw new FormulaParseException(message, token.getPosition());
            }
            advance();
        }
    }

    /**
     * A CELL_REF token broken into its address and '$' markers.
     */
    private static final class RefParts {
        final CellAddress address;
        final boolean absoluteCol;
        final boolean absoluteRow;

        private RefParts(CellAddress address, boolean absoluteCol, boolean absoluteRow) {
            this.address = address;
            this.absoluteCol = absoluteCol;
            this.absoluteRow = absoluteRow;
        }

        static RefParts of(Token token) {
            String text = token.getText();
            boolean absoluteCol = text.startsWith("$");
            String rest = absoluteCol ? text.substring(1) : text;
            int dollar = rest.indexOf('$');
            boolean absoluteRow = dollar >= 0;
            String plain = absoluteRow ? rest.substring(0, dollar) + rest.substring(dollar + 1) : rest;
            try {
                return new RefParts(CellAddress.fromA1(plain), absoluteCol, absoluteRow);
            } catch (InvalidAddressException e) {
                throw new FormulaParseException("Invalid cell reference '" + text + "'", token.getPosition());
            }
        }
    }
}
