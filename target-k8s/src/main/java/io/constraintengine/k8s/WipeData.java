package io.constraintengine.k8s;

/** Passed to {@code removeData} to remove every object stored for the Kubernetes target. */
public record WipeData() {}
