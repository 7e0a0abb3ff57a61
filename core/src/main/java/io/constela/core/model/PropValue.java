package io.constela.core.model;

/** A value bound to an element or component prop: either an expression or an event handler. */
public sealed interface PropValue permits Expression, EventHandler {}
