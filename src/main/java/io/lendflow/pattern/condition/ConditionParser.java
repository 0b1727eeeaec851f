package io.lendflow.pattern.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for step conditions.
 *
 * <pre>
 * expr       := or
 * or         := and (("or" | "||") and)*
 * and        := unary (("and" | "&amp;&amp;") unary)*
 * unary      := ("not" | "!") unary | comparison
 * comparison := primary (("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "in" | "not in") primary)?
 * primary    := number | string | true | false | null | path | "[" list "]" | "(" expr ")"
 * path       := identifier ("." identifier)*
 * </pre>
 *
 * Python spellings of the constants ({@code True}, {@code False}, {@code None}) are
 * accepted so existing pattern files keep working.
 */
public final class ConditionParser {
    private final String source;
    private final List<Token> tokens;
    private int index;

    private ConditionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
        this.index = 0;
    }

    public static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ConditionSyntaxException("Condition must not be blank", 0);
        }
        ConditionParser parser = new ConditionParser(source);
        Expression expr = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.EOF) {
            throw new ConditionSyntaxException("Unexpected token '" + trailing.text() + "'", trailing.position());
        }
        return expr;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (matchKeyword("or") || matchOperator("||")) {
            left = new Or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseUnary();
        while (matchKeyword("and") || matchOperator("&&")) {
            left = new And(left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (matchKeyword("not") || matchOperator("!")) {
            return new Not(parseUnary());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();
        Comparison.Operator op = comparisonOperator();
        if (op == null) {
            return left;
        }
        return new Comparison(op, left, parsePrimary());
    }

    private Comparison.Operator comparisonOperator() {
        Token t = peek();
        if (t.kind() == Kind.OPERATOR) {
            Comparison.Operator op = switch (t.text()) {
                case "==" -> Comparison.Operator.EQ;
                case "!=" -> Comparison.Operator.NE;
                case "<" -> Comparison.Operator.LT;
                case "<=" -> Comparison.Operator.LE;
                case ">" -> Comparison.Operator.GT;
                case ">=" -> Comparison.Operator.GE;
                default -> null;
            };
            if (op != null) {
                index++;
            }
            return op;
        }
        if (isKeyword(t, "in")) {
            index++;
            return Comparison.Operator.IN;
        }
        if (isKeyword(t, "not") && isKeyword(peekAhead(1), "in")) {
            index += 2;
            return Comparison.Operator.NOT_IN;
        }
        return null;
    }

    private Expression parsePrimary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER:
                return new Literal(number(t.text()));
            case STRING:
                return new Literal(t.text());
            case LPAREN: {
                Expression inner = parseOr();
                expect(Kind.RPAREN, ")");
                return inner;
            }
            case LBRACKET:
                return parseList();
            case OPERATOR:
                if ("-".equals(t.text()) && peek().kind() == Kind.NUMBER) {
                    return new Literal(number("-" + next().text()));
                }
                throw new ConditionSyntaxException("Unexpected operator '" + t.text() + "'", t.position());
            case IDENTIFIER:
                return identifier(t);
            default:
                throw new ConditionSyntaxException("Unexpected end of condition", t.position());
        }
    }

    private Expression parseList() {
        List<Expression> elements = new ArrayList<>();
        if (peek().kind() == Kind.RBRACKET) {
            index++;
            return new ListLiteral(elements);
        }
        do {
            elements.add(parsePrimary());
        } while (match(Kind.COMMA));
        expect(Kind.RBRACKET, "]");
        return new ListLiteral(elements);
    }

    private Expression identifier(Token t) {
        String text = t.text();
        switch (text) {
            case "true":
            case "True":
                return new Literal(Boolean.TRUE);
            case "false":
            case "False":
                return new Literal(Boolean.FALSE);
            case "null":
            case "None":
                return new Literal(null);
            default:
                break;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("and") || lower.equals("or") || lower.equals("not") || lower.equals("in")) {
            throw new ConditionSyntaxException("Unexpected keyword '" + text + "'", t.position());
        }
        return new ContextRef(Arrays.asList(text.split("\\.")));
    }

    private static Object number(String text) {
        BigDecimal value = new BigDecimal(text);
        if (value.scale() <= 0) {
            try {
                return value.longValueExact();
            } catch (ArithmeticException e) {
                return value;
            }
        }
        return value;
    }

    private boolean matchKeyword(String keyword) {
        if (isKeyword(peek(), keyword)) {
            // "not in" belongs to comparison, never to a boolean connective.
            if (keyword.equals("not") && isKeyword(peekAhead(1), "in")) {
                return false;
            }
            index++;
            return true;
        }
        return false;
    }

    private boolean matchOperator(String op) {
        Token t = peek();
        if (t.kind() == Kind.OPERATOR && t.text().equals(op)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean match(Kind kind) {
        if (peek().kind() == kind) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(Kind kind, String text) {
        Token t = next();
        if (t.kind() != kind) {
            throw new ConditionSyntaxException("Expected '" + text + "' in condition '" + source + "'", t.position());
        }
    }

    private static boolean isKeyword(Token t, String keyword) {
        return t.kind() == Kind.IDENTIFIER && t.text().equals(keyword);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.kind() != Kind.EOF) {
            index++;
        }
        return t;
    }

    private static List<Token> tokenize(String source) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.' || source.charAt(i) == '_')) {
                    i++;
                }
                String raw = source.substring(start, i).replace("_", "");
                if (raw.endsWith(".") || raw.indexOf('.') != raw.lastIndexOf('.')) {
                    throw new ConditionSyntaxException("Malformed number '" + raw + "'", start);
                }
                out.add(new Token(Kind.NUMBER, raw, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n) {
                    char d = source.charAt(i);
                    boolean dottedSegment = d == '.' && i + 1 < n
                            && (Character.isLetter(source.charAt(i + 1)) || source.charAt(i + 1) == '_');
                    if (Character.isLetterOrDigit(d) || d == '_' || dottedSegment) {
                        i++;
                    } else {
                        break;
                    }
                }
                out.add(new Token(Kind.IDENTIFIER, source.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char d = source.charAt(i);
                    if (d == '\\' && i + 1 < n) {
                        sb.append(source.charAt(i + 1));
                        i += 2;
                    } else if (d == c) {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(d);
                        i++;
                    }
                }
                if (!closed) {
                    throw new ConditionSyntaxException("Unterminated string literal", start);
                }
                out.add(new Token(Kind.STRING, sb.toString(), start));
            } else if (c == '(') {
                out.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                out.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == '[') {
                out.add(new Token(Kind.LBRACKET, "[", i++));
            } else if (c == ']') {
                out.add(new Token(Kind.RBRACKET, "]", i++));
            } else if (c == ',') {
                out.add(new Token(Kind.COMMA, ",", i++));
            } else {
                String two = i + 1 < n ? source.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                        || two.equals("&&") || two.equals("||")) {
                    out.add(new Token(Kind.OPERATOR, two, i));
                    i += 2;
                } else if (c == '<' || c == '>' || c == '!' || c == '-') {
                    out.add(new Token(Kind.OPERATOR, String.valueOf(c), i++));
                } else {
                    throw new ConditionSyntaxException("Unexpected character '" + c + "'", i);
                }
            }
        }
        out.add(new Token(Kind.EOF, "", n));
        return out;
    }

    private enum Kind {
        NUMBER, STRING, IDENTIFIER, OPERATOR, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, EOF
    }

    private record Token(Kind kind, String text, int position) {
    }
}
