package uk.gegc.aegis.features.questionnaire.infra.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses legacy condition strings such as {@code age < 18 || pregnant === 'Yes'} into a
 * {@link LegacyExpression} tree.
 *
 * <p>Grammar:</p>
 * <pre>
 * or         := and ( '||' and )*
 * and        := unary ( '&amp;&amp;' unary )*
 * unary      := '!' unary | primary
 * primary    := '(' or ')' | comparison
 * comparison := operand ( op operand )?
 * operand    := identifier | number | string | true | false
 * op         := == | === | != | !== | &lt; | &lt;= | &gt; | &gt;=
 * </pre>
 * A bare identifier means {@code identifier == true}. Every comparison needs exactly one
 * identifier side. Any other input is rejected; nothing is ever executed.
 */
@Component
public class ConditionExpressionParser {

    static final int MAX_NESTING = 64;

    private static final Map<String, String> FLIPPED = Map.of(
            "==", "==", "!=", "!=", "<", ">", ">", "<", "<=", ">=", ">=", "<=");

    public LegacyExpression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new RulesetConfigurationException("Condition expression is empty");
        }
        Parser parser = new Parser(source, tokenize(source));
        LegacyExpression expression = parser.parseOr();
        if (!parser.atEnd()) {
            throw parser.error("unexpected '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private enum Kind { IDENTIFIER, NUMBER, STRING, BOOLEAN, OPERATOR, AND, OR, NOT, LPAREN, RPAREN }

    private record Token(Kind kind, String text, int position) {
    }

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length() && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                String text = source.substring(start, i);
                if (text.startsWith(".") || text.endsWith(".") || text.contains("..")) {
                    throw syntaxError(source, start, "malformed identifier '" + text + "'");
                }
                boolean keyword = text.equals("true") || text.equals("false");
                tokens.add(new Token(keyword ? Kind.BOOLEAN : Kind.IDENTIFIER, text, start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1))
                    && startsOperand(tokens))) {
                int start = i;
                i++;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, source.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                StringBuilder value = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < source.length()) {
                    char s = source.charAt(i);
                    if (s == '\\' && i + 1 < source.length()) {
                        value.append(source.charAt(i + 1));
                        i += 2;
                    } else if (s == c) {
                        closed = true;
                        i++;
                        break;
                    } else {
                        value.append(s);
                        i++;
                    }
                }
                if (!closed) {
                    throw syntaxError(source, start, "unterminated string");
                }
                tokens.add(new Token(Kind.STRING, value.toString(), start));
            } else if (source.startsWith("&&", i)) {
                tokens.add(new Token(Kind.AND, "&&", i));
                i += 2;
            } else if (source.startsWith("||", i)) {
                tokens.add(new Token(Kind.OR, "||", i));
                i += 2;
            } else if (source.startsWith("===", i) || source.startsWith("!==", i)) {
                tokens.add(new Token(Kind.OPERATOR, source.substring(i, i + 2), i));
                i += 3;
            } else if (source.startsWith("==", i) || source.startsWith("!=", i)
                    || source.startsWith("<=", i) || source.startsWith(">=", i)) {
                tokens.add(new Token(Kind.OPERATOR, source.substring(i, i + 2), i));
                i += 2;
            } else if (c == '<' || c == '>') {
                tokens.add(new Token(Kind.OPERATOR, String.valueOf(c), i));
                i++;
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, "!", i));
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", i));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", i));
                i++;
            } else {
                throw syntaxError(source, i, "unsupported character '" + c + "'");
            }
        }
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private static boolean startsOperand(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        Kind previous = tokens.get(tokens.size() - 1).kind();
        return previous != Kind.IDENTIFIER && previous != Kind.NUMBER && previous != Kind.STRING
                && previous != Kind.BOOLEAN && previous != Kind.RPAREN;
    }

    private static RulesetConfigurationException syntaxError(String source, int position, String reason) {
        return new RulesetConfigurationException(
                "Cannot parse condition \"%s\" at position %d: %s".formatted(source, position, reason));
    }

    private static final class Parser {
        private final String source;
        private final List<Token> tokens;
        private int index;
        private int depth;

        private Parser(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        LegacyExpression parseOr() {
            LegacyExpression left = parseAnd();
            while (match(Kind.OR)) {
                left = new LegacyExpression.Or(left, parseAnd());
            }
            return left;
        }

        private LegacyExpression parseAnd() {
            LegacyExpression left = parseUnary();
            while (match(Kind.AND)) {
                left = new LegacyExpression.And(left, parseUnary());
            }
            return left;
        }

        private LegacyExpression parseUnary() {
            if (match(Kind.NOT)) {
                enter();
                LegacyExpression operand = parseUnary();
                depth--;
                return new LegacyExpression.Not(operand);
            }
            return parsePrimary();
        }

        private LegacyExpression parsePrimary() {
            if (match(Kind.LPAREN)) {
                enter();
                LegacyExpression inner = parseOr();
                if (!match(Kind.RPAREN)) {
                    throw error("missing ')'");
                }
                depth--;
                return inner;
            }
            return parseComparison();
        }

        // counts both '!' and '(' levels
        private void enter() {
            if (++depth > MAX_NESTING) {
                throw error("nesting deeper than " + MAX_NESTING + " levels");
            }
        }

        private LegacyExpression parseComparison() {
            Token left = operand();
            if (atEnd() || peek().kind() != Kind.OPERATOR) {
                if (left.kind() != Kind.IDENTIFIER) {
                    throw error("a literal on its own is not a condition");
                }
                return new LegacyExpression.Comparison(left.text(), "==", BooleanNode.TRUE);
            }
            String operator = next().text();
            Token right = operand();

            if (left.kind() == Kind.IDENTIFIER && right.kind() != Kind.IDENTIFIER) {
                return new LegacyExpression.Comparison(left.text(), operator, literal(right));
            }
            if (right.kind() == Kind.IDENTIFIER && left.kind() != Kind.IDENTIFIER) {
                return new LegacyExpression.Comparison(right.text(), FLIPPED.get(operator), literal(left));
            }
            throw error("a comparison needs exactly one question reference");
        }

        private Token operand() {
            if (atEnd()) {
                throw error("unexpected end of expression");
            }
            Token token = next();
            if (token.kind() != Kind.IDENTIFIER && token.kind() != Kind.NUMBER
                    && token.kind() != Kind.STRING && token.kind() != Kind.BOOLEAN) {
                throw error("unexpected '" + token.text() + "'");
            }
            return token;
        }

        private JsonNode literal(Token token) {
            if (token.kind() == Kind.STRING) {
                return TextNode.valueOf(token.text());
            }
            if (token.kind() == Kind.BOOLEAN) {
                return BooleanNode.valueOf(Boolean.parseBoolean(token.text()));
            }
            try {
                return DecimalNode.valueOf(new BigDecimal(token.text()));
            } catch (NumberFormatException e) {
                throw error("malformed number '" + token.text() + "'");
            }
        }

        private boolean match(Kind kind) {
            if (!atEnd() && peek().kind() == kind) {
                index++;
                return true;
            }
            return false;
        }

        private Token next() {
            return tokens.get(index++);
        }

        Token peek() {
            return tokens.get(index);
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        RulesetConfigurationException error(String reason) {
            int position = atEnd() ? source.length() : peek().position();
            return syntaxError(source, position, reason);
        }
    }
}
