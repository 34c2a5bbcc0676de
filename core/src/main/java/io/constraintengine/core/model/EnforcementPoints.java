package io.constraintengine.core.model;

import java.util.List;

/** Well-known enforcement point names. */
public final class EnforcementPoints {

    /** The admission webhook. */
    public static final String WEBHOOK = "validation.gatekeeper.sh";

    /** Periodic audit of ingested objects. */
    public static final String AUDIT = "audit.gatekeeper.sh";

    /** Offline policy testing. */
    public static final String GATOR = "gator.gatekeeper.sh";

    /** Wildcard accepted in {@code scopedEnforcementActions} to mean every point. */
    public static final String ALL = "*";

    /** Enforcement points served when the engine is not configured otherwise. */
    public static final List<String> DEFAULTS = List.of(WEBHOOK, AUDIT, GATOR);

    private EnforcementPoints() {}
}
