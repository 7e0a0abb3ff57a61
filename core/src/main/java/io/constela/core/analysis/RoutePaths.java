package io.constela.core.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts parameter names from a route pattern. {@code :name} segments bind {@code name}; a final
 * {@code *} segment binds {@code *}, and a final {@code *rest} segment binds {@code rest}.
 */
public final class RoutePaths {

    /** Name bound by an anonymous trailing wildcard. */
    public static final String WILDCARD = "*";

    private RoutePaths() {}

    public static List<String> extractParams(String path) {
        List<String> params = new ArrayList<>();
        String[] segments = path.split("/");
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.startsWith(":") && segment.length() > 1) {
                params.add(segment.substring(1));
            } else if (segment.startsWith("*") && i == segments.length - 1) {
                params.add(segment.length() == 1 ? WILDCARD : segment.substring(1));
            }
        }
        return params;
    }
}
