package com.verolang.core.selection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Boolean expression over scenario tags, e.g. {@code @smoke and (@login or not @slow)}.
 *
 * <p>{@code not} binds tighter than {@code and}, which binds tighter than {@code or}. Tags may
 * be written with or without {@code @} and compare case-insensitively.
 */
public sealed interface TagExpression {

    /**
     * Evaluates the expression against normalized tags (lowercase, no {@code @}).
     */
    boolean matches(Set<String> tags);

    record Tag(String name) implements TagExpression {
        @Override
        public boolean matches(Set<String> tags) {
            return tags.contains(name);
        }
    }

    record Not(TagExpression operand) implements TagExpression {
        @Override
        public boolean matches(Set<String> tags) {
            return !operand.matches(tags);
        }
    }

    record And(TagExpression left, TagExpression right) implements TagExpression {
        @Override
        public boolean matches(Set<String> tags) {
            return left.matches(tags) && right.matches(tags);
        }
    }

    record Or(TagExpression left, TagExpression right) implements TagExpression {
        @Override
        public boolean matches(Set<String> tags) {
            return left.matches(tags) || right.matches(tags);
        }
    }

    /**
     * Parses an expression.
     *
     * @throws ScenarioSelectionException when the expression is malformed
     */
    static TagExpression parse(String expression) {
        return new Parser(expression).parse();
    }

    /**
     * {@code @Smoke} and {@code smoke} both become {@code smoke}.
     */
    static String normalizeTag(String tag) {
        String trimmed = tag.trim();
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == '@') {
            start++;
        }
        return trimmed.substring(start).toLowerCase(Locale.ROOT);
    }

    final class Parser {

        private enum Kind { LPAREN, RPAREN, AND, OR, NOT, TAG, EOF }

        private record Token(Kind kind, String value, int index) {}

        private final List<Token> tokens;
        private int current;

        private Parser(String expression) {
            this.tokens = tokenize(expression);
        }

        private TagExpression parse() {
            TagExpression result = or();
            expect(Kind.EOF, "Unexpected trailing content in tag expression");
            return result;
        }

        private TagExpression or() {
            TagExpression left = and();
            while (match(Kind.OR)) {
                left = new Or(left, and());
            }
            return left;
        }

        private TagExpression and() {
            TagExpression left = unary();
            while (match(Kind.AND)) {
                left = new And(left, unary());
            }
            return left;
        }

        private TagExpression unary() {
            if (match(Kind.NOT)) {
                return new Not(unary());
            }
            return primary();
        }

        private TagExpression primary() {
            if (match(Kind.LPAREN)) {
                TagExpression inner = or();
                expect(Kind.RPAREN, "Expected ')' to close tag expression group");
                return inner;
            }
            Token token = tokens.get(current);
            if (token.kind() == Kind.TAG) {
                current++;
                return new Tag(normalizeTag(token.value()));
            }
            throw new ScenarioSelectionException(
                "Invalid tag expression near index " + token.index() + ": expected a tag or '('");
        }

        private boolean match(Kind kind) {
            if (tokens.get(current).kind() != kind) {
                return false;
            }
            current++;
            return true;
        }

        private void expect(Kind kind, String message) {
            Token token = tokens.get(current);
            if (token.kind() != kind) {
                throw new ScenarioSelectionException(message + " at index " + token.index());
            }
            current++;
        }

        private static List<Token> tokenize(String expression) {
            List<Token> tokens = new ArrayList<>();
            int index = 0;
            while (index < expression.length()) {
                char c = expression.charAt(index);
                if (Character.isWhitespace(c)) {
                    index++;
                } else if (c == '(') {
                    tokens.add(new Token(Kind.LPAREN, "(", index++));
                } else if (c == ')') {
                    tokens.add(new Token(Kind.RPAREN, ")", index++));
                } else if (c == '@') {
                    int end = wordEnd(expression, index + 1);
                    if (end == index + 1) {
                        throw new ScenarioSelectionException(
                            "Invalid tag expression near index " + index + ": expected tag after '@'");
                    }
                    tokens.add(new Token(Kind.TAG, expression.substring(index + 1, end), index));
                    index = end;
                } else if (isWordChar(c)) {
                    int end = wordEnd(expression, index);
                    String word = expression.substring(index, end);
                    Kind kind = switch (word.toLowerCase(Locale.ROOT)) {
                        case "and" -> Kind.AND;
                        case "or" -> Kind.OR;
                        case "not" -> Kind.NOT;
                        default -> Kind.TAG;
                    };
                    tokens.add(new Token(kind, word, index));
                    index = end;
                } else {
                    throw new ScenarioSelectionException(
                        "Invalid tag expression near index " + index + ": unexpected character '" + c + "'");
                }
            }
            tokens.add(new Token(Kind.EOF, "", expression.length()));
            return tokens;
        }

        private static int wordEnd(String input, int start) {
            int index = start;
            while (index < input.length() && isWordChar(input.charAt(index))) {
                index++;
            }
            return index;
        }

        private static boolean isWordChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-';
        }
    }
}
