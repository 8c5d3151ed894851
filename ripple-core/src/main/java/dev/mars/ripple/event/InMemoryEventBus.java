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

package dev.mars.ripple.event;

import dev.mars.ripple.config.RippleConfiguration;
import dev.mars.ripple.core.Event;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local {@link EventBus} backed by a single dispatcher thread.
 *
 * <p>The dispatcher queue is unbounded so {@link #publish} returns immediately;
 * back-pressure is applied downstream by subscribers that bound their own work
 * (the workflow engine runs invocations on a bounded pool).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger logger = Logger.getLogger(InMemoryEventBus.class.getName());

    private final int historySize;
    private final Map<String, List<EventListener>> subscribers = new ConcurrentHashMap<>();
    private final List<EventListener> globalSubscribers = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Event>> history = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryEventBus() {
        this(100);
    }

    public InMemoryEventBus(RippleConfiguration configuration) {
        this(configuration.getBusHistorySize());
    }

    public InMemoryEventBus(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative: " + historySize);
        }
        this.historySize = historySize;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ripple-event-bus");
            t.setDaemon(true);
            return t;
        });
        logger.info("InMemoryEventBus initialized with history size " + historySize);
    }

    @Override
    public Event publish(String eventType, Map<String, ?> payload) {
        Event event = Event.of(eventType, payload);
        publish(event);
        return event;
    }

    @Override
    public void publish(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (closed.get()) {
            throw new IllegalStateException("Event bus is closed");
        }

        remember(event);

        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Event bus is closed", e);
        }
        logger.fine("Published event " + event.getType() + " (" + event.getId() + ")");
    }

    @Override
    public void subscribe(String topic, EventListener listener) {
        Objects.requireNonNull(topic, "Topic cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");
        subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void subscribeAll(EventListener listener) {
        globalSubscribers.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public boolean unsubscribe(String topic, EventListener listener) {
        List<EventListener> listeners = subscribers.get(topic);
        return listeners != null && listeners.remove(listener);
    }

    @Override
    public boolean unsubscribeAll(EventListener listener) {
        return globalSubscribers.remove(listener);
    }

    @Override
    public List<Event> poll(String topic) {
        Deque<Event> events = history.get(topic);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    @Override
    public List<Event> poll(String topic, Instant since) {
        if (since == null) {
            return poll(topic);
        }
        List<Event> result = new ArrayList<>();
        for (Event event : poll(topic)) {
            if (event.getTimestamp().isAfter(since)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public void clearHistory(String topic) {
        Deque<Event> events = history.get(topic);
        if (events != null) {
            synchronized (events) {
                events.clear();
            }
        }
    }

    @Override
    public void clearHistory() {
        history.clear();
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Event bus dispatcher did not drain in time, forcing shutdown");
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("InMemoryEventBus closed");
    }

    private void remember(Event event) {
        if (historySize == 0) {
            return;
        }
        Deque<Event> events = history.computeIfAbsent(event.getType(), k -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > historySize) {
                events.removeFirst();
            }
        }
    }

    private void deliver(Event event) {
        List<EventListener> topicListeners = subscribers.getOrDefault(event.getType(), List.of());
        for (EventListener listener : topicListeners) {
            notifyListener(listener, event);
        }
        for (EventListener listener : globalSubscribers) {
            notifyListener(listener, event);
        }
    }

    private void notifyListener(EventListener listener, Event event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error in subscriber for event " + event.getType() + ": " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Subscriber exception details for event " + event.getId(), e);
            }
        }
    }
}
