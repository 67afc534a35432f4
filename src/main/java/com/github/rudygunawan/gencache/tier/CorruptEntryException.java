package com.github.rudygunawan.gencache.tier;

import java.io.IOException;

/**
 * Thrown when an entry file parses as JSON but does not have the shape of a cache entry.
 */
class CorruptEntryException extends IOException {

    private static final long serialVersionUID = 1L;

    CorruptEntryException(String message) {
        super(message);
    }
}
