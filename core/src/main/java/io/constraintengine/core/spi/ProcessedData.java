package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Storage form of a piece of referential data.
 *
 * @param key {@code /}-separated storage path; empty means the whole target
 * @param value the value to store; {@code null} when only the key is meaningful (removal)
 */
public record ProcessedData(String key, JsonNode value) {

    public ProcessedData {
        Objects.requireNonNull(key, "key must not be null");
    }

    public boolean isWipe() {
        return key.isEmpty();
    }
}
