package io.trellis.core.connection;

/// Lifecycle of a {@link LiveSession}.
///
/// `connecting -> connected -> closed`, `connecting -> failed`; a failed or
/// closed server can be connected again, which starts a new session.
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    FAILED,
    CLOSED;

    /// Returns whether a session in this state counts as active.
    ///
    /// @return true for `CONNECTING` and `CONNECTED`
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED;
    }
}
