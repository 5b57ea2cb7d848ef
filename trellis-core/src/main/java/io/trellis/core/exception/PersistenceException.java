package io.trellis.core.exception;

import java.io.Serial;

/// Unchecked exception for registry or catalog file failures.
///
/// Store implementations wrap {@link java.io.IOException} and parse errors in
/// this type. The registry and catalog catch it, log it and keep their
/// in-memory state, so it never terminates the process.
///
/// @see io.trellis.core.registry.RegistryStore
/// @see io.trellis.core.catalog.CatalogStore
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2318842277510096115L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
