package io.constraintengine.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.spi.DataCache;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe {@link DataCache} holding deep copies of the cached values, keyed by target and
 * {@code /}-separated path.
 */
public final class InMemoryDataCache implements DataCache {

    private final Map<String, NavigableMap<String, JsonNode>> byTarget = new ConcurrentHashMap<>();

    @Override
    public void add(String target, String key, JsonNode value) {
        Objects.requireNonNull(value, "value must not be null");
        byTarget.computeIfAbsent(target, t -> new ConcurrentSkipListMap<>()).put(key, value.deepCopy());
    }

    @Override
    public void remove(String target, String key) {
        NavigableMap<String, JsonNode> data = byTarget.get(target);
        if (data == null) {
            return;
        }
        if (key.isEmpty()) {
            data.clear();
            return;
        }
        String prefix = key + "/";
        data.keySet().removeIf(k -> k.equals(key) || k.startsWith(prefix));
    }

    /** Returns a copy of the value cached under {@code key}. */
    public Optional<JsonNode> get(String target, String key) {
        NavigableMap<String, JsonNode> data = byTarget.get(target);
        if (data == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(data.get(key)).map(JsonNode::deepCopy);
    }

    /** Point-in-time copy of everything cached for {@code target}, sorted by key. */
    public NavigableMap<String, JsonNode> snapshot(String target) {
        NavigableMap<String, JsonNode> data = byTarget.get(target);
        return data == null
                ? Collections.emptyNavigableMap()
                : Collections.unmodifiableNavigableMap(new TreeMap<>(data));
    }

    public int size(String target) {
        NavigableMap<String, JsonNode> data = byTarget.get(target);
        return data == null ? 0 : data.size();
    }
}
