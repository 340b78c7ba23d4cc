package com.spanlens.engine;

import com.spanlens.exception.StoreConnectionException;
import com.spanlens.model.SpanDocument;
import com.spanlens.model.SpanQuery;

import java.util.List;

/**
 * Connection to a span store, scoped to a single run.
 */
public interface StoreSession extends AutoCloseable {

    /**
     * Documents matching the query, in store order. Missing fields are simply absent.
     *
     * @throws StoreConnectionException on transport failure or an unreadable response
     */
    List<SpanDocument> search(SpanQuery query);

    @Override
    void close();
}
