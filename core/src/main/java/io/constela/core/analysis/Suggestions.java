package io.constela.core.analysis;

import io.constela.core.error.ConstelaError;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * "Did you mean" hints for unresolved names. Picks the candidate with the smallest edit distance
 * within {@code maxDistance}; failing that, the first candidate the name is a prefix of
 * ({@code incr} suggests {@code increment}). Ties keep candidate order.
 */
public final class Suggestions {

    private final int maxDistance;

    public Suggestions(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must not be negative, got: " + maxDistance);
        }
        this.maxDistance = maxDistance;
    }

    public Optional<String> closest(String name, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int d = Levenshtein.distance(name, candidate);
            if (d <= maxDistance && d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        if (best != null) {
            return Optional.of(best);
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream().filter(c -> c.startsWith(name)).findFirst();
    }

    /**
     * Returns {@code error} with a suggestion for {@code name} (when one exists) and the candidate
     * list under {@code context.availableNames}.
     */
    public ConstelaError decorate(ConstelaError error, String name, Collection<String> candidates) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (error.context() != null) {
            context.putAll(error.context());
        }
        List<String> available = new ArrayList<>(candidates);
        context.put("availableNames", available);
        String suggestion = closest(name, candidates).map(c -> "Did you mean '" + c + "'?").orElse(null);
        return error.withHint(suggestion, context);
    }
}
