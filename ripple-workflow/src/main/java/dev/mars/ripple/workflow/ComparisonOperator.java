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
import java.util.Objects;
import java.util.Optional;

/**
 * Binary operators understood by the {@link ConditionEvaluator}. New operators are
 * added here together with their symbol; the tokenizer picks them up from this table.
 */
public enum ComparisonOperator {

    EQUALS("==") {
        @Override
        public boolean apply(Object left, Object right) {
            return valuesEqual(left, right);
        }
    },

    NOT_EQUALS("!=") {
        @Override
        public boolean apply(Object left, Object right) {
            return !valuesEqual(left, right);
        }
    };

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public abstract boolean apply(Object left, Object right);

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * Numbers compare by value regardless of their boxed type; everything else uses
     * {@link Objects#equals}. There is no coercion between strings and numbers.
     */
    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            BigDecimal a = toBigDecimal(l);
            BigDecimal b = toBigDecimal(r);
            if (a != null && b != null) {
                return a.compareTo(b) == 0;
            }
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            // NaN and infinities
            return null;
        }
    }
}
