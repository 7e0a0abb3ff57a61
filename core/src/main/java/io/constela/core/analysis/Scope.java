package io.constela.core.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lexical variable scope. Each {@code each} body or lambda pushes a frame; frames are immutable,
 * so leaving a subtree simply means continuing with the parent instance.
 */
final class Scope {

    private static final Scope EMPTY = new Scope(null, Set.of());

    private final Scope parent;
    private final Set<String> names;

    private Scope(Scope parent, Set<String> names) {
        this.parent = parent;
        this.names = names;
    }

    static Scope empty() {
        return EMPTY;
    }

    /** Returns a child scope binding the non-null {@code bound} names. */
    Scope push(String... bound) {
        Set<String> frame = new LinkedHashSet<>();
        for (String name : bound) {
            if (name != null) {
                frame.add(name);
            }
        }
        return new Scope(this, frame);
    }

    boolean contains(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /** Visible names, innermost first. */
    List<String> visibleNames() {
        Set<String> all = new LinkedHashSet<>();
        for (Scope s = this; s != null; s = s.parent) {
            all.addAll(s.names);
        }
        return new ArrayList<>(all);
    }
}
