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

package dev.mars.ripple.examples;

import dev.mars.ripple.core.Event;
import dev.mars.ripple.event.EventBus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Publishes financial transaction events, enriched with {@code processed_at} and an
 * {@code amount_range} bucket ({@code small} below 100, {@code medium} below 1000,
 * {@code large} otherwise).
 */
public class TransactionEventPublisher {

    private static final Logger logger = Logger.getLogger(TransactionEventPublisher.class.getName());

    public static final String TRANSACTION_COMPLETED = "financial_business.transaction.completed";

    private static final BigDecimal MEDIUM_THRESHOLD = BigDecimal.valueOf(100);
    private static final BigDecimal LARGE_THRESHOLD = BigDecimal.valueOf(1000);

    private final EventBus eventBus;

    public TransactionEventPublisher(EventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    public Event transactionCompleted(Map<String, Object> transaction) {
        Map<String, Object> payload = new LinkedHashMap<>(transaction);
        payload.put("processed_at", Instant.now().toString());
        payload.put("amount_range", amountRange(transaction.get("amount")));
        logger.info("Publishing completion of transaction " + transaction.get("transaction_id"));
        return eventBus.publish(TRANSACTION_COMPLETED, payload);
    }

    static String amountRange(Object amount) {
        BigDecimal value;
        if (amount instanceof Number) {
            value = new BigDecimal(amount.toString());
        } else if (amount instanceof String) {
            try {
                value = new BigDecimal((String) amount);
            } catch (NumberFormatException e) {
                value = BigDecimal.ZERO;
            }
        } else {
            value = BigDecimal.ZERO;
        }

        if (value.compareTo(MEDIUM_THRESHOLD) < 0) {
            return "small";
        }
        return value.compareTo(LARGE_THRESHOLD) < 0 ? "medium" : "large";
    }
}
