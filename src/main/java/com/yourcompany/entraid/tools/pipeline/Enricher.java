package com.yourcompany.entraid.tools.pipeline;

/**
 * Fetches the secondary, per-record resource of an audit.
 *
 * @param <R> Primary record type.
 * @param <V> Secondary value type.
 */
@FunctionalInterface
public interface Enricher<R, V> {

    V enrich(R record) throws Exception;
}
