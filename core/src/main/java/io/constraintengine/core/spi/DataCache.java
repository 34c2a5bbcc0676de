package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Optional cache of referential data kept alongside driver storage, per target. The engine writes
 * the cache before the drivers and removes from it after them.
 */
public interface DataCache {

    void add(String target, String key, JsonNode value);

    /** Removes {@code key} and everything below it; an empty key clears the target. */
    void remove(String target, String key);
}
