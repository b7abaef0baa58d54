package work.pupt.kernel.formula;

import java.util.ArrayList;
import java.util.List;

final class FormulaLexer {
    private final String source;
    private int pos;

    FormulaLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Kind.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '(' -> {
                pos++;
                return new Token(Token.Kind.LPAREN, "(", start);
            }
            case ')' -> {
                pos++;
                return new Token(Token.Kind.RPAREN, ")", start);
            }
            case ',' -> {
                pos++;
                return new Token(Token.Kind.COMMA, ",", start);
            }
            case '=' -> {
                pos++;
                return new Token(Token.Kind.OPERATOR, "=", start);
            }
            case '<', '>' -> {
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '=' || (c == '<' && source.charAt(pos) == '>'))) {
                    pos++;
                }
                return new Token(Token.Kind.OPERATOR, source.substring(start, pos), start);
            }
            case '"', '\'' -> {
                return string(c);
            }
            default -> {
                if (Character.isDigit(c) || (c == '-' || c == '.') && nextIsDigit()) {
                    return number();
                }
                if (Character.isLetter(c) || c == '_') {
                    return identifier();
                }
                throw new FormulaException(source, start, "Unexpected character '" + c + "'");
            }
        }
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                if (pos < source.length() && source.charAt(pos) == quote) {
                    value.append(quote);
                    pos++;
                    continue;
                }
                return new Token(Token.Kind.STRING, value.toString(), start);
            }
            value.append(c);
        }
        throw new FormulaException(source, start, "Unterminated string literal");
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '-') {
            pos++;
        }
        boolean dot = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !dot) {
                dot = true;
                pos++;
            } else {
                break;
            }
        }
        return new Token(Token.Kind.NUMBER, source.substring(start, pos), start);
    }

    private Token identifier() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        return new Token(Token.Kind.IDENT, source.substring(start, pos), start);
    }

    private boolean nextIsDigit() {
        return pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
