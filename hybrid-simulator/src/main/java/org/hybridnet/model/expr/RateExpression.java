package org.hybridnet.model.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hybridnet.model.ModelConfigurationException;
import org.hybridnet.model.RateContext;
import org.hybridnet.model.RateFunction;

/**
 * Arithmetic expression over place markings, used as a continuous rate
 * function or as a guard.
 *
 * <p>Supported syntax: numbers, {@code + - * / % ^} (also {@code **}),
 * comparisons, {@code && || !}, parentheses and calls to the
 * {@link FunctionCatalog}. A name resolves, in order, to a place marking, a
 * named parameter, the current time ({@code t} or {@code time}) or the
 * constants {@code pi} and {@code e}. Comparisons and logical operators yield
 * 1 or 0.
 */
public class RateExpression implements RateFunction {

    private interface Node {
        double eval(RateContext context);
    }

    private final String text;
    private final Map<String, Double> parameters;
    private final Node root;
    private final Set<String> names = new LinkedHashSet<>();

    private RateExpression(String text, Map<String, Double> parameters) {
        this.text = text;
        this.parameters = Collections.unmodifiableMap(new HashMap<>(parameters));
        Parser parser = new Parser(text);
        this.root = parser.parseAll();
    }

    /**
     * @throws ModelConfigurationException if the text is not a valid expression
     */
    public static RateExpression parse(String text) {
        return parse(text, Collections.emptyMap());
    }

    public static RateExpression parse(String text, Map<String, Double> parameters) {
        if (text == null || text.trim().isEmpty()) {
            throw new ModelConfigurationException("Empty rate expression");
        }
        return new RateExpression(text, parameters);
    }

    @Override
    public double evaluate(RateContext context) {
        double value = root.eval(context);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ExpressionException("Expression '" + text + "' evaluated to " + value);
        }
        return value;
    }

    public String getText() {
        return text;
    }

    public Map<String, Double> getParameters() {
        return parameters;
    }

    /**
     * Every variable name the expression mentions, function names excluded.
     */
    public Set<String> getReferencedNames() {
        return Collections.unmodifiableSet(names);
    }

    @Override
    public String toString() {
        return text;
    }

    private double resolve(String name, RateContext context) {
        if (context.hasPlace(name)) {
            return context.getMarking(name);
        }
        Double parameter = parameters.get(name);
        if (parameter != null) {
            return parameter;
        }
        switch (name) {
            case "t":
            case "time":
                return context.getTime();
            case "pi":
                return Math.PI;
            case "e":
                return Math.E;
            default:
                throw new ExpressionException("Unknown name '" + name + "' in expression '" + text + "'");
        }
    }

    private static boolean truth(double value) {
        return value != 0.0;
    }

    private static double bool(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private final class Parser {

        private final String source;
        private int pos = 0;

        Parser(String source) {
            this.source = source;
        }

        Node parseAll() {
            Node node = parseOr();
            skipSpaces();
            if (pos < source.length()) {
                throw error("Unexpected '" + source.charAt(pos) + "'");
            }
            return node;
        }

        private Node parseOr() {
            Node left = parseAnd();
            while (true) {
                if (accept("||") || acceptWord("or")) {
                    Node l = left;
                    Node r = parseAnd();
                    left = c -> bool(truth(l.eval(c)) || truth(r.eval(c)));
                } else {
                    return left;
                }
            }
        }

        private Node parseAnd() {
            Node left = parseComparison();
            while (true) {
                if (accept("&&") || acceptWord("and")) {
                    Node l = left;
                    Node r = parseComparison();
                    left = c -> bool(truth(l.eval(c)) && truth(r.eval(c)));
                } else {
                    return left;
                }
            }
        }

        private Node parseComparison() {
            Node left = parseAdditive();
            Node l = left;
            if (accept("<=")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) <= r.eval(c));
            }
            if (accept(">=")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) >= r.eval(c));
            }
            if (accept("==")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) == r.eval(c));
            }
            if (accept("!=")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) != r.eval(c));
            }
            if (accept("<")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) < r.eval(c));
            }
            if (accept(">")) {
                Node r = parseAdditive();
                return c -> bool(l.eval(c) > r.eval(c));
            }
            return left;
        }

        private Node parseAdditive() {
            Node left = parseMultiplicative();
            while (true) {
                Node l = left;
                if (accept("+")) {
                    Node r = parseMultiplicative();
                    left = c -> l.eval(c) + r.eval(c);
                } else if (accept("-")) {
                    Node r = parseMultiplicative();
                    left = c -> l.eval(c) - r.eval(c);
                } else {
                    return left;
                }
            }
        }

        private Node parseMultiplicative() {
            Node left = parseUnary();
            while (true) {
                Node l = left;
                if (accept("*")) {
                    Node r = parseUnary();
                    left = c -> l.eval(c) * r.eval(c);
                } else if (accept("/")) {
                    Node r = parseUnary();
                    left = c -> {
                        double divisor = r.eval(c);
                        if (divisor == 0.0) {
                            throw new ExpressionException("Division by zero in expression '" + text + "'");
                        }
                        return l.eval(c) / divisor;
                    };
                } else if (accept("%")) {
                    Node r = parseUnary();
                    left = c -> l.eval(c) % r.eval(c);
                } else {
                    return left;
                }
            }
        }

        private Node parseUnary() {
            if (accept("-")) {
                Node operand = parseUnary();
                return c -> -operand.eval(c);
            }
            if (accept("+")) {
                return parseUnary();
            }
            if (peek("!") && !peek("!=")) {
                accept("!");
                Node operand = parseUnary();
                return c -> bool(!truth(operand.eval(c)));
            }
            return parsePower();
        }

        private Node parsePower() {
            Node base = parsePrimary();
            if (accept("^") || accept("**")) {
                Node exponent = parseUnary();
                return c -> Math.pow(base.eval(c), exponent.eval(c));
            }
            return base;
        }

        private Node parsePrimary() {
            skipSpaces();
            if (pos >= source.length()) {
                throw error("Unexpected end of expression");
            }
            char ch = source.charAt(pos);
            if (ch == '(') {
                pos++;
                Node inner = parseOr();
                expect(")");
                return inner;
            }
            if (Character.isDigit(ch) || ch == '.') {
                double value = parseNumber();
                return c -> value;
            }
            if (Character.isLetter(ch) || ch == '_') {
                String name = parseName();
                if (accept("(")) {
                    return parseCall(name);
                }
                names.add(name);
                return c -> resolve(name, c);
            }
            throw error("Unexpected '" + ch + "'");
        }

        private Node parseCall(String name) {
            if (!FunctionCatalog.contains(name)) {
                throw error("Unknown function '" + name + "'");
            }
            List<Node> args = new ArrayList<>();
            if (!accept(")")) {
                do {
                    args.add(parseOr());
                } while (accept(","));
                expect(")");
            }
            Node[] argNodes = args.toArray(new Node[0]);
            return c -> {
                double[] values = new double[argNodes.length];
                for (int i = 0; i < argNodes.length; i++) {
                    values[i] = argNodes[i].eval(c);
                }
                return FunctionCatalog.call(name, values);
            };
        }

        private double parseNumber() {
            int start = pos;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                pos++;
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                        pos++;
                    }
                } else {
                    pos = mark;
                }
            }
            try {
                return Double.parseDouble(source.substring(start, pos));
            } catch (NumberFormatException e) {
                throw error("Malformed number '" + source.substring(start, pos) + "'");
            }
        }

        private String parseName() {
            int start = pos;
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return source.substring(start, pos);
        }

        private boolean peek(String token) {
            skipSpaces();
            return source.startsWith(token, pos);
        }

        private boolean accept(String token) {
            if (peek(token)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        private boolean acceptWord(String word) {
            skipSpaces();
            int end = pos + word.length();
            if (source.startsWith(word, pos)
                    && (end >= source.length() || !Character.isLetterOrDigit(source.charAt(end)))) {
                pos = end;
                return true;
            }
            return false;
        }

        private void expect(String token) {
            if (!accept(token)) {
                throw error("Expected '" + token + "'");
            }
        }

        private void skipSpaces() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }

        private ModelConfigurationException error(String message) {
            return new ModelConfigurationException(message + " at position " + pos + " in '" + source + "'");
        }
    }
}
