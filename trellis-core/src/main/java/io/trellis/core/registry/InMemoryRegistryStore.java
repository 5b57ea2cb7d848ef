package io.trellis.core.registry;

import java.util.Objects;

/// Registry store kept in memory only.
///
/// Thread-safe, no external dependencies. Useful for tests and for running
/// without a configuration file.
public final class InMemoryRegistryStore implements RegistryStore {

    private volatile RegistrySnapshot snapshot;
    private volatile int saveCount;

    /// Creates an empty store.
    public InMemoryRegistryStore() {
        this(RegistrySnapshot.empty());
    }

    /// Creates a store pre-populated with the given snapshot.
    ///
    /// @param initial initial content, not null
    public InMemoryRegistryStore(RegistrySnapshot initial) {
        this.snapshot = Objects.requireNonNull(initial, "initial must not be null");
    }

    @Override
    public RegistrySnapshot load() {
        return snapshot;
    }

    @Override
    public synchronized void save(RegistrySnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
        saveCount++;
    }

    /// Returns how many times {@link #save} was called (useful for testing).
    public int saveCount() {
        return saveCount;
    }
}
