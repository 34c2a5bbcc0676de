package io.constraintengine.core.model;

import java.util.Set;

/** The fixed API group and versions every constraint must declare. */
public final class ConstraintsApi {

    public static final String GROUP = "constraints.gatekeeper.sh";

    public static final Set<String> SUPPORTED_VERSIONS = Set.of("v1alpha1", "v1beta1", "v1");

    private ConstraintsApi() {}
}
