package com.purchasingpower.orchestrator.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Arithmetic expression evaluator for the calculator capability.
 *
 * Recursive descent over a closed grammar: numbers, the constants pi and e,
 * {@code + - * / % ^}, parentheses, unary minus and a fixed function whitelist.
 * Nothing is ever handed to a script engine.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '%') factor)*
 * factor     := unary ('^' factor)?
 * unary      := '-' unary | '+' unary | primary
 * primary    := number | constant | function '(' args ')' | '(' expression ')'
 * </pre>
 */
final class ExpressionEvaluator {

    private static final int MAX_LENGTH = 500;

    private final String input;
    private int pos;

    private ExpressionEvaluator(String input) {
        this.input = input;
    }

    static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is empty");
        }
        if (expression.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Expression longer than " + MAX_LENGTH + " characters");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(normalize(expression));
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < evaluator.input.length()) {
            throw new IllegalArgumentException("Unexpected '" + evaluator.input.charAt(evaluator.pos)
                    + "' at position " + evaluator.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Expression has no finite result");
        }
        return value;
    }

    private static String normalize(String expression) {
        return expression.toLowerCase(Locale.ROOT)
                .replace('×', '*')
                .replace('÷', '/')
                .replace("**", "^");
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseFactor();
        while (true) {
            if (consume('*')) {
                value *= parseFactor();
            } else if (consume('/')) {
                double divisor = parseFactor();
                if (divisor == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = parseFactor();
                if (divisor == 0) {
                    throw new IllegalArgumentException("Modulo by zero");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    // Unary sign binds looser than '^': -2^2 = -(2^2)
    private double parseFactor() {
        if (consume('-')) {
            return -parseFactor();
        }
        if (consume('+')) {
            return parseFactor();
        }
        return parsePower();
    }

    private double parsePower() {
        double base = parsePrimary();
        if (consume('^')) {
            // right associative: 2^3^2 = 2^9; the exponent may carry a sign: 2^-1
            return Math.pow(base, parseFactor());
        }
        return base;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (consume('(')) {
            double value = parseExpression();
            expect(')');
            return value;
        }
        if (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            return parseNumber();
        }
        if (pos < input.length() && Character.isLetter(input.charAt(pos))) {
            String name = parseIdentifier();
            if ("pi".equals(name)) {
                return Math.PI;
            }
            if ("e".equals(name)) {
                return Math.E;
            }
            expect('(');
            List<Double> args = new ArrayList<>();
            if (!consume(')')) {
                do {
                    args.add(parseExpression());
                } while (consume(','));
                expect(')');
            }
            return applyFunction(name, args);
        }
        throw new IllegalArgumentException(pos < input.length()
                ? "Unexpected '" + input.charAt(pos) + "' at position " + pos
                : "Unexpected end of expression");
    }

    private double applyFunction(String name, List<Double> args) {
        switch (name) {
            case "sqrt":
                double radicand = single(name, args);
                if (radicand < 0) {
                    throw new IllegalArgumentException("Square root of a negative number");
                }
                return Math.sqrt(radicand);
            case "abs":
                return Math.abs(single(name, args));
            case "round":
                return Math.round(single(name, args));
            case "floor":
                return Math.floor(single(name, args));
            case "ceil":
                return Math.ceil(single(name, args));
            case "ln":
                return Math.log(positive(name, single(name, args)));
            case "log":
                return Math.log10(positive(name, single(name, args)));
            case "sin":
                return Math.sin(single(name, args));
            case "cos":
                return Math.cos(single(name, args));
            case "tan":
                return Math.tan(single(name, args));
            case "pow":
                requireArgs(name, args, 2);
                return Math.pow(args.get(0), args.get(1));
            case "min":
                requireAtLeastOne(name, args);
                return args.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
            case "max":
                requireAtLeastOne(name, args);
                return args.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
            default:
                throw new IllegalArgumentException("Unknown function: " + name);
        }
    }

    private static double single(String name, List<Double> args) {
        requireArgs(name, args, 1);
        return args.get(0);
    }

    private static double positive(String name, double value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " needs a positive argument");
        }
        return value;
    }

    private static void requireArgs(String name, List<Double> args, int count) {
        if (args.size() != count) {
            throw new IllegalArgumentException(name + " takes " + count + " argument(s), got " + args.size());
        }
    }

    private static void requireAtLeastOne(String name, List<Double> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name + " needs at least one argument");
        }
    }

    private double parseNumber() {
        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        try {
            return Double.parseDouble(input.substring(start, pos));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed number: " + input.substring(start, pos), e);
        }
    }

    private String parseIdentifier() {
        int start = pos;
        while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!consume(expected)) {
            throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
