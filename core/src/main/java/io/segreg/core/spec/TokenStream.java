package io.segreg.core.spec;

import java.util.ArrayList;
import java.util.List;

/**
 * Token cursor shared by the formula, expression and prior parsers. Names may contain dots
 * and underscores (R style); numbers accept a fraction and an exponent.
 */
final class TokenStream {

    enum Type {
        NUMBER,
        NAME,
        SYMBOL,
        END
    }

    record Token(Type type, String text, int position) {

        boolean isSymbol(String symbol) {
            return type == Type.SYMBOL && text.equals(symbol);
        }

        boolean isName(String name) {
            return type == Type.NAME && text.equals(name);
        }

        double numericValue() {
            return Double.parseDouble(text);
        }
    }

    private static final String SYMBOLS = "~+-*/^(),|";

    private final List<Token> tokens;
    private int index;

    TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Splits {@code text} into tokens, appending an {@link Type#END} token.
     *
     * @throws ExpressionSyntaxException on a character that starts no token
     */
    static TokenStream tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                int start = i;
                while (i < n && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
                    int mark = i;
                    i++;
                    if (i < n && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
                        i++;
                    }
                    if (i < n && Character.isDigit(text.charAt(i))) {
                        while (i < n && Character.isDigit(text.charAt(i))) {
                            i++;
                        }
                    } else {
                        i = mark;
                    }
                }
                String number = text.substring(start, i);
                try {
                    Double.parseDouble(number);
                } catch (NumberFormatException e) {
                    throw new ExpressionSyntaxException("Malformed number '" + number + "'", start);
                }
                tokens.add(new Token(Type.NUMBER, number, start));
            } else if (Character.isLetter(c) || c == '_' || c == '.') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(Type.NAME, text.substring(start, i), start));
            } else if (SYMBOLS.indexOf(c) >= 0) {
                tokens.add(new Token(Type.SYMBOL, String.valueOf(c), i));
                i++;
            } else {
                throw new ExpressionSyntaxException("Unexpected character '" + c + "'", i);
            }
        }
        tokens.add(new Token(Type.END, "", n));
        return new TokenStream(tokens);
    }

    /** Returns a stream over {@code tokens[from, to)} terminated by an END token at {@code endPosition}. */
    TokenStream slice(int from, int to, int endPosition) {
        List<Token> part = new ArrayList<>(tokens.subList(from, to));
        part.add(new Token(Type.END, "", endPosition));
        return new TokenStream(part);
    }

    /** All tokens including the trailing END token. */
    List<Token> tokens() {
        return tokens;
    }

    Token peek() {
        return tokens.get(index);
    }

    Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    Token next() {
        Token token = tokens.get(index);
        if (token.type() != Type.END) {
            index++;
        }
        return token;
    }

    boolean atEnd() {
        return peek().type() == Type.END;
    }

    /** Consumes the next token if it is {@code symbol}. */
    boolean accept(String symbol) {
        if (peek().isSymbol(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    /**
     * Consumes {@code symbol} or fails.
     *
     * @throws ExpressionSyntaxException if the next token is something else
     */
    Token expect(String symbol) {
        Token token = peek();
        if (!token.isSymbol(symbol)) {
            throw new ExpressionSyntaxException("Expected '" + symbol + "' but found " + describe(token), token.position());
        }
        index++;
        return token;
    }

    static String describe(Token token) {
        return token.type() == Type.END ? "end of input" : "'" + token.text() + "'";
    }
}
