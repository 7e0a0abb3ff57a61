package io.constela.core.model;

import java.util.Objects;

/**
 * CSS transition classes applied when an {@code if} or {@code each} node mounts and unmounts.
 * Opaque to the compiler beyond validation.
 *
 * @param duration milliseconds as written in the source (integral or fractional), or {@code null}
 *                 when omitted (see {@link #effectiveDuration()})
 */
public record TransitionConfig(String enter, String enterActive, String exit, String exitActive, Number duration) {

    /** Duration used by the runtime when none is declared. */
    public static final int DEFAULT_DURATION_MS = 300;

    public TransitionConfig {
        Objects.requireNonNull(enter, "enter must not be null");
        Objects.requireNonNull(enterActive, "enterActive must not be null");
        Objects.requireNonNull(exit, "exit must not be null");
        Objects.requireNonNull(exitActive, "exitActive must not be null");
        if (duration != null && !(duration.doubleValue() >= 0)) {
            throw new IllegalArgumentException("duration must be a non-negative number, got: " + duration);
        }
    }

    public double effectiveDuration() {
        return duration == null ? DEFAULT_DURATION_MS : duration.doubleValue();
    }
}
