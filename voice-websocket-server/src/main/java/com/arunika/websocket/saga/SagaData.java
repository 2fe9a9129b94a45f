package com.arunika.websocket.saga;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value bag shared by the steps of one saga instance. Steps run one at a
 * time; the map is concurrent so snapshots can be read while a step writes.
 * Null values are not stored.
 */
public class SagaData {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public SagaData put(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("saga data '" + key + "' is " + value.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    public <T> T require(String key, Class<T> type) {
        return get(key, type)
                .orElseThrow(() -> new IllegalStateException("saga data '" + key + "' is missing"));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new HashMap<>(values));
    }
}
