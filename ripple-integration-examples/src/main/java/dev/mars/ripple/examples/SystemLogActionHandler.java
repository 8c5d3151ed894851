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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Handles {@code system} actions by writing an entry to a named log sink, the action's
 * {@code target} ({@code audit_log} when absent). Entries carry the resolved data.
 *
 * <p>A sink can be taken offline to exercise a workflow's error handler.</p>
 */
public class SystemLogActionHandler implements ActionHandler {

    private static final Logger logger = Logger.getLogger(SystemLogActionHandler.class.getName());

    public static final String ACTION_TYPE = "system";
    public static final String DEFAULT_SINK = "audit_log";

    private final Map<String, List<Map<String, Object>>> sinks = new ConcurrentHashMap<>();
    private final Set<String> offlineSinks = ConcurrentHashMap.newKeySet();

    @Override
    public ActionResult handle(ActionSpec spec, Map<String, Object> data) {
        String sink = spec.getTarget().orElse(DEFAULT_SINK);
        if (offlineSinks.contains(sink)) {
            throw new IllegalStateException("Log sink '" + sink + "' is unavailable");
        }

        Map<String, Object> entry = new LinkedHashMap<>(data);
        entry.put("action_id", spec.getId());
        entry.put("logged_at", Instant.now().toString());
        List<Map<String, Object>> entries = sinks.computeIfAbsent(sink, key -> new ArrayList<>());
        int position;
        synchronized (entries) {
            entries.add(entry);
            position = entries.size();
        }
        logger.info("[" + sink + "] " + data.getOrDefault("message", spec.getId()));

        return ActionResult.success(spec.getId(), Map.of("sink", sink, "entry", position));
    }

    public List<Map<String, Object>> getEntries(String sink) {
        List<Map<String, Object>> entries = sinks.get(sink);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void setOffline(String sink, boolean offline) {
        if (offline) {
            offlineSinks.add(sink);
        } else {
            offlineSinks.remove(sink);
        }
    }
}
