package io.constela.core.model;

import java.util.Objects;

/**
 * A build-time data source loaded by the static site generator.
 *
 * @param type      {@code glob}, {@code file} or {@code api}
 * @param pattern   glob pattern, for {@code glob}
 * @param path      file path, for {@code file}
 * @param url       endpoint, for {@code api}
 * @param transform {@code mdx}, {@code yaml} or {@code csv}, or {@code null}
 */
public record DataSource(String type, String pattern, String path, String url, String transform) {

    public DataSource {
        Objects.requireNonNull(type, "type must not be null");
    }
}
