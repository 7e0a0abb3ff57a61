package io.constela.core.model;

/** Intersection-observer options carried by {@code intersect} handlers. Every field is optional. */
public record EventOptions(Double threshold, String rootMargin, Boolean once) {}
