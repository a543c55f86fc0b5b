package com.yourcompany.entraid.tools.pipeline;

import java.util.List;

import com.yourcompany.entraid.tools.FetchException;

/**
 * Produces the complete, ordered primary record set of an audit.
 *
 * @param <R> Record type.
 */
@FunctionalInterface
public interface PrimarySource<R> {

    /**
     * @return Every record, in discovery order.
     * @throws FetchException if any part of the listing failed; nothing is returned in that case.
     */
    List<R> fetch();
}
