package org.ontodsl.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Every reserved keyword has its own constant so the parser can dispatch on it.
 */
public enum TokenType {
    // Keywords.
    LOAD_CSV(Category.KEYWORD),
    MAP_COLUMNS(Category.KEYWORD),
    NORMALIZE(Category.KEYWORD),
    AGGREGATE(Category.KEYWORD),
    BY(Category.KEYWORD),
    INTO(Category.KEYWORD),
    AGG_SUM(Category.KEYWORD),
    TAKE_FIRST(Category.KEYWORD),
    AGG_COUNT(Category.KEYWORD),
    TIME_WINDOW(Category.KEYWORD),
    FROM(Category.KEYWORD),
    UNIT_CONVERT(Category.KEYWORD),
    TO(Category.KEYWORD),
    USING(Category.KEYWORD),
    ENRICH(Category.KEYWORD),
    WITH(Category.KEYWORD),
    MATCH(Category.KEYWORD),
    ON(Category.KEYWORD),
    OUTPUT(Category.KEYWORD),
    AS(Category.KEYWORD),
    COMPUTE(Category.KEYWORD),
    FOR(Category.KEYWORD),
    GROUP(Category.KEYWORD),
    VALIDATE(Category.KEYWORD),

    // Literals.
    /** An identifier, such as an alias or field name. */
    IDENTIFIER(Category.IDENTIFIER),
    /** A double-quoted string literal. */
    STRING(Category.STRING),
    /** An unsigned integer or decimal literal. */
    NUMBER(Category.NUMBER),

    // Operators.
    /** The '->' column mapping arrow. */
    ARROW(Category.OPERATOR, "->"),
    PLUS(Category.OPERATOR, "+"),
    MINUS(Category.OPERATOR, "-"),
    STAR(Category.OPERATOR, "*"),
    SLASH(Category.OPERATOR, "/"),

    // Punctuation.
    LEFT_BRACE(Category.PUNCTUATION, "{"),
    RIGHT_BRACE(Category.PUNCTUATION, "}"),
    LEFT_BRACKET(Category.PUNCTUATION, "["),
    RIGHT_BRACKET(Category.PUNCTUATION, "]"),
    LEFT_PAREN(Category.PUNCTUATION, "("),
    RIGHT_PAREN(Category.PUNCTUATION, ")"),
    COLON(Category.PUNCTUATION, ":"),
    COMMA(Category.PUNCTUATION, ","),
    DOT(Category.PUNCTUATION, "."),

    /** Represents the end of the source. */
    END_OF_FILE(Category.END);

    /**
     * The coarse token kinds of the DSL.
     */
    public enum Category {
        KEYWORD, IDENTIFIER, STRING, NUMBER, OPERATOR, PUNCTUATION, END
    }

    private static final Map<String, TokenType> KEYWORDS = Arrays.stream(values())
            .filter(TokenType::isKeyword)
            .collect(Collectors.toUnmodifiableMap(TokenType::name, Function.identity()));

    private final Category category;
    private final String symbol;

    TokenType(Category category) {
        this(category, null);
    }

    TokenType(Category category, String symbol) {
        this.category = category;
        this.symbol = symbol;
    }

    /**
     * @return The category of this token type.
     */
    public Category category() {
        return category;
    }

    /**
     * @return True for reserved keywords.
     */
    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    /**
     * @return The spelling used in error messages.
     */
    public String displayName() {
        if (isKeyword()) return "keyword " + name();
        if (symbol != null) return "'" + symbol + "'";
        return switch (category) {
            case IDENTIFIER -> "identifier";
            case STRING -> "string";
            case NUMBER -> "number";
            default -> "end of input";
        };
    }

    /**
     * Looks up a reserved keyword. The match is exact and case-sensitive.
     * @param text The identifier text.
     * @return The keyword type, or empty if {@code text} is not reserved.
     */
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }
}
