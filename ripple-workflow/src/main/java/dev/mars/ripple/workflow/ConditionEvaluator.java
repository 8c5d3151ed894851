/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ripple.workflow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Evaluates trigger conditions against an {@link ExecutionContext}.
 *
 * <p>Grammar:</p>
 * <pre>
 * condition := operand | operand operator operand
 * operator  := '==' | '!='            (see {@link ComparisonOperator})
 * operand   := path | string | number | 'true' | 'false' | 'null'
 * path      := name ('.' segment)*    e.g. event.transaction_type
 * string    := '...' | "..."          backslash escapes the next character
 * </pre>
 *
 * <p>A path that cannot be resolved reads as {@code null}, so a comparison against a
 * missing field simply does not match. A lone operand is true unless it is null,
 * false, zero or empty. The most recently used parsed conditions are cached, so a
 * registered trigger condition is tokenized once.</p>
 */
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private static final Pattern PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z0-9_]+)*");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    static final int DEFAULT_MAX_CACHED_CONDITIONS = 256;

    private final Map<String, Condition> cache;

    public ConditionEvaluator() {
        this(DEFAULT_MAX_CACHED_CONDITIONS);
    }

    ConditionEvaluator(int maxCachedConditions) {
        if (maxCachedConditions < 1) {
            throw new IllegalArgumentException("Condition cache size must be positive");
        }
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Condition> eldest) {
                return size() > maxCachedConditions;
            }
        };
    }

    /**
     * Evaluates an expression. A null or blank expression is always true.
     *
     * @throws ConditionException if the expression is malformed
     */
    public boolean evaluate(String expression, ExecutionContext context) {
        Objects.requireNonNull(context, "Execution context cannot be null");
        if (expression == null || expression.isBlank()) {
            return true;
        }
        boolean result = parse(expression).test(context.toTemplateScope());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Condition [" + expression + "] evaluated to " + result +
                    " for event " + context.getEvent().getId());
        }
        return result;
    }

    /**
     * Parses an expression without evaluating it.
     *
     * @throws ConditionException if the expression is malformed
     */
    public Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConditionException(String.valueOf(expression), "Condition is empty");
        }
        String key = expression.trim();
        synchronized (cache) {
            Condition cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
        }
        Condition compiled = compile(key);
        synchronized (cache) {
            cache.put(key, compiled);
        }
        return compiled;
    }

    int cachedConditionCount() {
        synchronized (cache) {
            return cache.size();
        }
    }

    /**
     * Returns the reason an expression is malformed, or empty if it parses.
     */
    public Optional<String> validate(String expression) {
        try {
            parse(expression);
            return Optional.empty();
        } catch (ConditionException e) {
            return Optional.of(e.getMessage());
        }
    }

    private static Condition compile(String expression) {
        List<String> tokens = tokenize(expression);
        if (tokens.size() == 1) {
            return new Condition(expression, operand(expression, tokens.get(0)), null, null);
        }
        if (tokens.size() == 3) {
            ComparisonOperator operator = ComparisonOperator.fromSymbol(tokens.get(1))
                    .orElseThrow(() -> new ConditionException(expression,
                            "Expected comparison operator but found '" + tokens.get(1) + "'"));
            return new Condition(expression, operand(expression, tokens.get(0)), operator,
                    operand(expression, tokens.get(2)));
        }
        throw new ConditionException(expression,
                "Expected '<operand>' or '<operand> <operator> <operand>' but found " + tokens.size() + " tokens");
    }

    private static List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int length = expression.length();
        while (i < length) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '\'' || c == '"') {
                i = readQuoted(expression, i, tokens);
                continue;
            }
            String symbol = operatorAt(expression, i);
            if (symbol != null) {
                tokens.add(symbol);
                i += symbol.length();
                continue;
            }
            if (isOperatorChar(c)) {
                throw new ConditionException(expression, "Unknown operator at position " + i);
            }
            int start = i;
            while (i < length && !Character.isWhitespace(expression.charAt(i))
                    && expression.charAt(i) != '\'' && expression.charAt(i) != '"'
                    && !isOperatorChar(expression.charAt(i))) {
                i++;
            }
            tokens.add(expression.substring(start, i));
        }
        return tokens;
    }

    private static int readQuoted(String expression, int start, List<String> tokens) {
        char quote = expression.charAt(start);
        StringBuilder token = new StringBuilder().append(quote);
        int i = start + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\\' && i + 1 < expression.length()) {
                token.append(expression.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == quote) {
                token.append(quote);
                tokens.add(token.toString());
                return i + 1;
            }
            token.append(c);
            i++;
        }
        throw new ConditionException(expression, "Unterminated string literal at position " + start);
    }

    private static String operatorAt(String expression, int index) {
        String longest = null;
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            String symbol = operator.getSymbol();
            if (expression.startsWith(symbol, index) && (longest == null || symbol.length() > longest.length())) {
                longest = symbol;
            }
        }
        return longest;
    }

    private static boolean isOperatorChar(char c) {
        return c == '=' || c == '!' || c == '<' || c == '>';
    }

    private static Operand operand(String expression, String token) {
        char first = token.charAt(0);
        if (first == '\'' || first == '"') {
            return Operand.literal(token.substring(1, token.length() - 1));
        }
        switch (token) {
            case "true":
                return Operand.literal(Boolean.TRUE);
            case "false":
                return Operand.literal(Boolean.FALSE);
            case "null":
                return Operand.literal(null);
            default:
                break;
        }
        if (NUMBER.matcher(token).matches()) {
            return Operand.literal(new BigDecimal(token));
        }
        if (PATH.matcher(token).matches()) {
            return Operand.path(token);
        }
        throw new ConditionException(expression, "Invalid operand '" + token + "'");
    }

    /**
     * A parsed condition, ready to be tested against a template scope.
     */
    public static final class Condition {

        private final String expression;
        private final Operand left;
        private final ComparisonOperator operator;
        private final Operand right;

        private Condition(String expression, Operand left, ComparisonOperator operator, Operand right) {
            this.expression = expression;
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public String getExpression() {
            return expression;
        }

        public Optional<ComparisonOperator> getOperator() {
            return Optional.ofNullable(operator);
        }

        boolean test(Map<String, Object> scope) {
            Object leftValue = left.value(scope);
            if (operator == null) {
                return isTruthy(leftValue);
            }
            return operator.apply(leftValue, right.value(scope));
        }

        private static boolean isTruthy(Object value) {
            if (value == null) {
                return false;
            }
            if (value instanceof Boolean b) {
                return b;
            }
            if (value instanceof Number n) {
                return !ComparisonOperator.valuesEqual(n, BigDecimal.ZERO);
            }
            if (value instanceof CharSequence s) {
                return s.length() > 0;
            }
            if (value instanceof Collection<?> c) {
                return !c.isEmpty();
            }
            if (value instanceof Map<?, ?> m) {
                return !m.isEmpty();
            }
            return true;
        }

        @Override
        public String toString() {
            return expression;
        }
    }

    private static final class Operand {

        private final String path;
        private final Object literal;

        private Operand(String path, Object literal) {
            this.path = path;
            this.literal = literal;
        }

        static Operand path(String path) {
            return new Operand(path, null);
        }

        static Operand literal(Object value) {
            return new Operand(null, value);
        }

        Object value(Map<String, Object> scope) {
            return path != null ? ContextPathResolver.resolve(scope, path) : literal;
        }
    }
}
