package io.constraintengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Objects;

/**
 * A single violation reported for one constraint against one reviewed object.
 *
 * <p>Instances are immutable; {@link #withEnforcement} and {@link #withResource} return copies.
 */
public final class Result {

    private final String target;
    private final String msg;
    private final JsonNode metadata;
    private final Constraint constraint;
    private final String enforcementAction;
    private final List<String> scopedEnforcementActions;
    private final JsonNode review;
    private final JsonNode resource;

    private Result(Builder b) {
        this.target = Objects.requireNonNull(b.target, "target must not be null");
        this.msg = Objects.requireNonNull(b.msg, "msg must not be null");
        this.metadata = b.metadata == null ? JsonNodeFactory.instance.objectNode() : b.metadata.deepCopy();
        this.constraint = b.constraint;
        this.enforcementAction = b.enforcementAction;
        this.scopedEnforcementActions =
                b.scopedEnforcementActions == null ? List.of() : List.copyOf(b.scopedEnforcementActions);
        this.review = b.review;
        this.resource = b.resource;
    }

    public static Builder builder(String target, String msg) {
        return new Builder(target, msg);
    }

    public String target() {
        return target;
    }

    public String msg() {
        return msg;
    }

    /** Driver-supplied details; never {@code null}. */
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /** The violated constraint, or {@code null} if the driver did not identify one. */
    public Constraint constraint() {
        return constraint;
    }

    public String enforcementAction() {
        return enforcementAction;
    }

    /** Actions for the queried enforcement points when the constraint is {@code scoped}. */
    public List<String> scopedEnforcementActions() {
        return scopedEnforcementActions;
    }

    /** The review payload that produced the violation; {@code null} when not recorded. */
    public JsonNode review() {
        return review;
    }

    /** The offending object as attached by the target handler; {@code null} until then. */
    public JsonNode resource() {
        return resource;
    }

    /** Returns a copy carrying the given enforcement settings. */
    public Result withEnforcement(String action, List<String> scopedActions) {
        return toBuilder().enforcementAction(action).scopedEnforcementActions(scopedActions).build();
    }

    public Result withResource(JsonNode resource) {
        return toBuilder().resource(resource).build();
    }

    public Builder toBuilder() {
        return new Builder(target, msg)
                .metadata(metadata)
                .constraint(constraint)
                .enforcementAction(enforcementAction)
                .scopedEnforcementActions(scopedEnforcementActions)
                .review(review)
                .resource(resource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result r)) {
            return false;
        }
        return target.equals(r.target)
                && msg.equals(r.msg)
                && metadata.equals(r.metadata)
                && Objects.equals(constraint, r.constraint)
                && Objects.equals(enforcementAction, r.enforcementAction)
                && scopedEnforcementActions.equals(r.scopedEnforcementActions)
                && Objects.equals(review, r.review)
                && Objects.equals(resource, r.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, msg, metadata, constraint, enforcementAction, scopedEnforcementActions);
    }

    @Override
    public String toString() {
        return "Result[target=" + target + ", constraint=" + (constraint == null ? null : constraint.key())
                + ", action=" + enforcementAction + ", msg=" + msg + "]";
    }

    /** Builder for {@link Result}. */
    public static final class Builder {
        private final String target;
        private final String msg;
        private JsonNode metadata;
        private Constraint constraint;
        private String enforcementAction;
        private List<String> scopedEnforcementActions;
        private JsonNode review;
        private JsonNode resource;

        private Builder(String target, String msg) {
            this.target = target;
            this.msg = msg;
        }

        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }

        /** Convenience for {@code metadata({"details": details})}. */
        public Builder details(JsonNode details) {
            this.metadata = JsonNodeFactory.instance.objectNode().set("details", details);
            return this;
        }

        public Builder constraint(Constraint constraint) {
            this.constraint = constraint;
            return this;
        }

        public Builder enforcementAction(String enforcementAction) {
            this.enforcementAction = enforcementAction;
            return this;
        }

        public Builder scopedEnforcementActions(List<String> scopedEnforcementActions) {
            this.scopedEnforcementActions = scopedEnforcementActions;
            return this;
        }

        public Builder review(JsonNode review) {
            this.review = review;
            return this;
        }

        public Builder resource(JsonNode resource) {
            this.resource = resource;
            return this;
        }

        public Result build() {
            return new Result(this);
        }
    }
}
