package com.streamfirst.history.ports;

import com.streamfirst.history.domain.FetchProgress;

/**
 * Receives progress snapshots while a retrieval runs. Purely informational: a listener
 * cannot pause or redirect the fetch, and exceptions it throws are logged and ignored.
 * With concurrent channel processing it may be called from several threads.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(FetchProgress progress);
}
