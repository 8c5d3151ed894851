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

import dev.mars.ripple.workflow.ActionHandler;
import dev.mars.ripple.workflow.ActionResult;
import dev.mars.ripple.workflow.ActionSpec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.logging.Logger;

/**
 * Handles {@code notification} actions by appending to an in-memory outbox.
 *
 * <p>The message is {@code data.message}, falling back to the action's resolved
 * {@code template}. The recipient is the action's {@code channel}, else its
 * {@code target}. An action with neither a recipient nor a message fails.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NotificationActionHandler implements ActionHandler {

    private static final Logger logger = Logger.getLogger(NotificationActionHandler.class.getName());

    public static final String ACTION_TYPE = "notification";

    private final List<Notification> outbox = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ActionResult handle(ActionSpec spec, Map<String, Object> data) {
        String channel = spec.getChannel().or(spec::getTarget)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Notification '" + spec.getId() + "' has no channel or target"));
        Object message = data.get("message");
        if (message == null || message.toString().isEmpty()) {
            message = spec.getTemplate().orElse(null);
        }
        if (message == null || message.toString().isEmpty()) {
            throw new IllegalArgumentException("Notification '" + spec.getId() + "' has no message");
        }

        Notification notification = new Notification("ntf-" + sequence.incrementAndGet(), channel,
                message.toString(), data.get("priority"), Instant.now());
        outbox.add(notification);
        logger.info("Notification " + notification.getId() + " queued for channel '" + channel + "'");

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("notification_id", notification.getId());
        output.put("channel", channel);
        output.put("message", notification.getMessage());
        return ActionResult.success(spec.getId(), output);
    }

    /**
     * Notifications queued so far, oldest first.
     */
    public List<Notification> getOutbox() {
        synchronized (outbox) {
            return List.copyOf(outbox);
        }
    }

    public List<Notification> getOutbox(String channel) {
        synchronized (outbox) {
            return outbox.stream().filter(n -> n.getChannel().equals(channel)).collect(Collectors.toList());
        }
    }

    public void clear() {
        outbox.clear();
    }

    /**
     * One queued notification.
     */
    public static class Notification {
        private final String id;
        private final String channel;
        private final String message;
        private final Object priority;
        private final Instant queuedAt;

        public Notification(String id, String channel, String message, Object priority, Instant queuedAt) {
            this.id = Objects.requireNonNull(id, "Notification id cannot be null");
            this.channel = Objects.requireNonNull(channel, "Channel cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
            this.priority = priority;
            this.queuedAt = Objects.requireNonNull(queuedAt, "Queued time cannot be null");
        }

        public String getId() {
            return id;
        }

        public String getChannel() {
            return channel;
        }

        public String getMessage() {
            return message;
        }

        public Object getPriority() {
            return priority;
        }

        public Instant getQueuedAt() {
            return queuedAt;
        }

        @Override
        public String toString() {
            return "Notification{" +
                   "id='" + id + '\'' +
                   ", channel='" + channel + '\'' +
                   ", message='" + message + '\'' +
                   '}';
        }
    }
}
