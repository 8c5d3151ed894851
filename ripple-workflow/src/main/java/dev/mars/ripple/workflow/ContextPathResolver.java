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

import java.util.List;
import java.util.Map;

/**
 * Walks dotted paths such as {@code results.log_transaction.output.id} through nested
 * maps and lists. Integer segments index into lists. Anything that cannot be walked
 * resolves to {@code null}.
 */
final class ContextPathResolver {

    private ContextPathResolver() {
    }

    static Object resolve(Map<String, Object> scope, String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        Object current = scope;
        for (String segment : path.trim().split("\\.", -1)) {
            if (segment.isEmpty()) {
                return null;
            }
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
