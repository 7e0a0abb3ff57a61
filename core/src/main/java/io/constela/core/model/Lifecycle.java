package io.constela.core.model;

/** Page lifecycle hooks. Each field names an action, or is {@code null}. */
public record Lifecycle(String onMount, String onUnmount, String onRouteEnter, String onRouteLeave) {}
