package io.constela.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RoutePathsTest {

    @Test
    void extractsNamedSegmentsInOrder() {
        assertThat(RoutePaths.extractParams("/users/:id/posts/:postId")).containsExactly("id", "postId");
    }

    @Test
    void staticPathHasNoParams() {
        assertThat(RoutePaths.extractParams("/about")).isEmpty();
        assertThat(RoutePaths.extractParams("/")).isEmpty();
    }

    @Test
    void trailingWildcardBindsStarOrItsName() {
        assertThat(RoutePaths.extractParams("/docs/*")).containsExactly(RoutePaths.WILDCARD);
        assertThat(RoutePaths.extractParams("/docs/:section/*rest")).containsExactly("section", "rest");
    }
}
