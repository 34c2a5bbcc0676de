package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/** Decides whether a constraint applies to a review payload. */
@FunctionalInterface
public interface Matcher {

    /**
     * @throws io.constraintengine.core.error.TargetHandlerException if the review lacks
     *     information needed to decide; the engine turns this into an automatic rejection
     */
    boolean match(JsonNode review);
}
