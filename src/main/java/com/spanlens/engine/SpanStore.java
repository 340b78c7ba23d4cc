package com.spanlens.engine;

import com.spanlens.exception.StoreConnectionException;

/**
 * Backend holding the span documents to analyse.
 * Supports Elasticsearch and JSON exports on disk.
 */
public interface SpanStore {

    /**
     * Open a session for one analysis run. The caller closes it when the run ends.
     *
     * @throws StoreConnectionException when the backend cannot be reached
     */
    StoreSession connect();

    // Engine type identifier
    String getEngineType();
}
