package org.ontodsl.compiler.frontend.lexer;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced lazily. Every call to {@link #iterator()} starts a fresh scan from the
 * beginning of the source, so the token sequence can be restarted. Whitespace and {@code #}
 * line comments are skipped. The first unrecognized character is reported to the
 * {@link DiagnosticsEngine} and ends the scan.
 */
public class Lexer implements Iterable<Token> {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    /**
     * One pass over the source. Holds all cursor state so that passes are independent.
     */
    private final class Scanner implements Iterator<Token> {
        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int lineStart = 0;
        private int tokenLine = 1;
        private int tokenColumn = 1;
        private boolean finished = false;

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException();
            }
            Token token = scanToken();
            if (token.type() == TokenType.END_OF_FILE) {
                finished = true;
            }
            return token;
        }

        private Token scanToken() {
            skipWhitespaceAndComments();
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            if (isAtEnd()) {
                return make(TokenType.END_OF_FILE, "", null);
            }

            char c = advance();
            switch (c) {
                case '{': return simple(TokenType.LEFT_BRACE);
                case '}': return simple(TokenType.RIGHT_BRACE);
                case '[': return simple(TokenType.LEFT_BRACKET);
                case ']': return simple(TokenType.RIGHT_BRACKET);
                case '(': return simple(TokenType.LEFT_PAREN);
                case ')': return simple(TokenType.RIGHT_PAREN);
                case ':': return simple(TokenType.COLON);
                case ',': return simple(TokenType.COMMA);
                case '.': return simple(TokenType.DOT);
                case '+': return simple(TokenType.PLUS);
                case '*': return simple(TokenType.STAR);
                case '/': return simple(TokenType.SLASH);
                case '-':
                    if (peek() == '>') {
                        advance();
                        return simple(TokenType.ARROW);
                    }
                    return simple(TokenType.MINUS);
                case '"':
                    return string();
                default:
                    if (isDigit(c)) {
                        return number();
                    }
                    if (isAlpha(c)) {
                        return identifier();
                    }
                    return fail(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'.");
            }
        }

        private void skipWhitespaceAndComments() {
            while (!isAtEnd()) {
                char c = peek();
                if (c == ' ' || c == '\t' || c == '\r') {
                    advance();
                } else if (c == '\n') {
                    advance();
                    line++;
                    lineStart = current;
                } else if (c == '#') {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    return;
                }
            }
        }

        private Token identifier() {
            while (isAlphaNumeric(peek()) || (peek() == '-' && peekNext() != '>')) advance();
            String text = source.substring(start, current);
            TokenType type = TokenType.keyword(text).orElse(TokenType.IDENTIFIER);
            return make(type, text, null);
        }

        private Token number() {
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance(); // consume the '.'
                while (isDigit(peek())) advance();
            }
            String text = source.substring(start, current);
            return make(TokenType.NUMBER, text, new BigDecimal(text));
        }

        private Token string() {
            StringBuilder value = new StringBuilder();
            while (peek() != '"' && !isAtEnd()) {
                char c = advance();
                if (c == '\\' && !isAtEnd()) {
                    value.append(unescape(advance()));
                } else {
                    if (c == '\n') {
                        line++;
                        lineStart = current;
                    }
                    value.append(c);
                }
            }

            if (isAtEnd()) {
                return fail(CompilerErrorCode.UNTERMINATED_STRING,
                        "Unterminated string " + source.substring(start, Math.min(current, start + 20)) + ".");
            }

            // The closing "
            advance();
            // The text of the token is the string *with* quotes, the value is the content.
            return make(TokenType.STRING, source.substring(start, current), value.toString());
        }

        private char unescape(char escaped) {
            return switch (escaped) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                default -> escaped;
            };
        }

        private Token fail(CompilerErrorCode code, String message) {
            diagnostics.reportError(code, message, new SourceInfo(logicalFileName, tokenLine, tokenColumn));
            return make(TokenType.END_OF_FILE, "", null);
        }

        private Token simple(TokenType type) {
            return make(type, source.substring(start, current), null);
        }

        private Token make(TokenType type, String text, Object value) {
            return new Token(type, text, value, tokenLine, tokenColumn, logicalFileName);
        }

        private char advance() {
            return source.charAt(current++);
        }

        private boolean isAtEnd() {
            return current >= source.length();
        }

        private char peek() {
            if (isAtEnd()) return '\0';
            return source.charAt(current);
        }

        private char peekNext() {
            if (current + 1 >= source.length()) return '\0';
            return source.charAt(current + 1);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
