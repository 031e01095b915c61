package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaLexException;
import com.spreadsheet.formula.models.CellReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns formula text into tokens. Stateless and reusable.
 */
public class FormulaTokenizer {

    /**
     * Tokenizes a formula, dropping one leading '=' if present.
     *
     * @throws FormulaLexException on a character that can't start a token,
     *                             an unterminated string, or a malformed range
     */
    public List<Token> tokenize(String formula) {
        String source = stripEquals(formula);
        List<Token> tokens = new ArrayList<>();
        int i = 0;

        while (i < source.length()) {
            char c = source.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // Numbers: digits with at most one '.', optionally starting with '.'
            if (isDigit(c) || (c == '.' && i + 1 < source.length() && isDigit(source.charAt(i + 1)))) {
                int start = i;
                boolean seenDot = false;
                while (i < source.length()) {
                    char d = source.charAt(i);
                    if (isDigit(d)) {
                        i++;
                    } else if (d == '.' && !seenDot) {
                        seenDot = true;
                        i++;
                    } else {
                        break;
                    }
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i)));
                continue;
            }

            // Strings have no escapes: the next quote always closes them
            if (c == '"') {
                int close = source.indexOf('"', i + 1);
                if (close < 0) {
                    throw new FormulaLexException("Unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, source.substring(i + 1, close)));
                i = close + 1;
                continue;
            }

            if ("+-*/^&=<>".indexOf(c) >= 0) {
                String op = String.valueOf(c);
                char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
                if ((c == '<' || c == '>') && next == '=') {
                    op += next;
                } else if (c == '<' && next == '>') {
                    op += next;
                }
                tokens.add(new Token(TokenType.OPERATOR, op));
                i += op.length();
                continue;
            }

            if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
                continue;
            }
            if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
                continue;
            }
            if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ","));
                i++;
                continue;
            }

            if (isLetter(c)) {
                int start = i;
                while (i < source.length() && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                String identifier = source.substring(start, i).toUpperCase();

                if (identifier.equals("TRUE") || identifier.equals("FALSE")) {
                    tokens.add(new Token(TokenType.BOOLEAN, identifier));
                    continue;
                }

                if (i < source.length() && source.charAt(i) == '(') {
                    tokens.add(new Token(TokenType.FUNCTION, identifier));
                    continue;
                }

                if (i < source.length() && source.charAt(i) == ':') {
                    i++;
                    int endStart = i;
                    while (i < source.length() && isIdentifierPart(source.charAt(i))) {
                        i++;
                    }
                    String rangeEnd = source.substring(endStart, i).toUpperCase();
                    if (!CellReference.isCellReference(identifier) || !CellReference.isCellReference(rangeEnd)) {
                        throw new FormulaLexException("Invalid range: " + identifier + ":" + rangeEnd);
                    }
                    tokens.add(new Token(TokenType.RANGE, identifier + ":" + rangeEnd));
                    continue;
                }

                if (CellReference.isCellReference(identifier)) {
                    tokens.add(new Token(TokenType.CELL, identifier));
                } else {
                    // A bare name; the parser rejects it when no '(' follows
                    tokens.add(new Token(TokenType.FUNCTION, identifier));
                }
                continue;
            }

            throw new FormulaLexException("Unexpected character: " + c);
        }

        return tokens;
    }

    private static String stripEquals(String formula) {
        String trimmed = formula == null ? "" : formula.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }
}
