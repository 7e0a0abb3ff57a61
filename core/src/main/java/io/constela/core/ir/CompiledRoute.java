package io.constela.core.ir;

import io.constela.core.model.Expression;
import io.constela.core.model.Immutables;
import io.constela.core.model.RouteDef;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Lowered route: the source route plus the path-parameter names extracted from {@code path}. */
public record CompiledRoute(
        String path,
        List<String> params,
        Expression title,
        String layout,
        Map<String, Expression> layoutParams,
        Map<String, Expression> meta,
        Expression canonical,
        RouteDef.JsonLd jsonLd,
        RouteDef.StaticPaths getStaticPaths) {

    public CompiledRoute {
        Objects.requireNonNull(path, "path must not be null");
        params = List.copyOf(params);
        layoutParams = Immutables.orderedMap(layoutParams);
        meta = Immutables.orderedMap(meta);
    }
}
