package io.constela.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Page routing and head metadata. Everything but {@code path} is optional.
 *
 * @param path           route pattern such as {@code /users/:id}
 * @param title          page title expression
 * @param layout         name of the layout wrapping this page
 * @param layoutParams   expressions handed to the layout
 * @param meta           meta tag expressions keyed by name
 * @param canonical      canonical URL expression
 * @param jsonLd         structured data block
 * @param getStaticPaths static path generation for SSG
 */
public record RouteDef(
        String path,
        Expression title,
        String layout,
        Map<String, Expression> layoutParams,
        Map<String, Expression> meta,
        Expression canonical,
        JsonLd jsonLd,
        StaticPaths getStaticPaths) {

    public RouteDef {
        Objects.requireNonNull(path, "path must not be null");
        layoutParams = Immutables.orderedMap(layoutParams);
        meta = Immutables.orderedMap(meta);
    }

    /** A JSON-LD block: schema.org type plus expression-valued properties. */
    public record JsonLd(String type, Map<String, Expression> properties) {
        public JsonLd {
            Objects.requireNonNull(type, "type must not be null");
            properties = Immutables.orderedMap(Objects.requireNonNull(properties, "properties must not be null"));
        }
    }

    /** Enumerates static paths from a named data source. */
    public record StaticPaths(String source, Map<String, Expression> params) {
        public StaticPaths {
            Objects.requireNonNull(source, "source must not be null");
            params = Immutables.orderedMap(Objects.requireNonNull(params, "params must not be null"));
        }
    }
}
