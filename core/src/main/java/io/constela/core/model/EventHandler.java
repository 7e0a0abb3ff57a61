package io.constela.core.model;

import java.util.Objects;

/**
 * Binds a DOM event to an action.
 *
 * @param event    DOM event name ({@code click}, {@code input}, {@code intersect}, ...)
 * @param action   name of the action to dispatch
 * @param payload  optional payload, or {@code null}
 * @param debounce optional debounce in milliseconds, or {@code null}
 * @param throttle optional throttle in milliseconds, or {@code null}
 * @param options  optional observer options for {@code intersect}, or {@code null}
 */
public record EventHandler(
        String event, String action, EventPayload payload, Integer debounce, Integer throttle, EventOptions options)
        implements PropValue {

    public EventHandler {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
