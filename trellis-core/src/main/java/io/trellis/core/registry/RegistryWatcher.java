package io.trellis.core.registry;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reloads a {@link ServerRegistry} when its backing file is edited externally.
///
/// Watches the parent directory of the store's file and, for every create or
/// modify event on that file, reloads the registry and hands the refreshed
/// server map to a single callback. Best-effort: a missed event only delays
/// the refresh until the next one, and {@link ServerRegistry#reload()} can
/// always be called directly.
///
/// ### Usage
/// {@snippet :
/// try (RegistryWatcher watcher = RegistryWatcher.start(registry, configFile, servers -> {
///     log.info("servers changed: " + servers.keySet());
/// })) {
///     // ...
/// }
/// }
public final class RegistryWatcher implements Closeable {

    private static final Logger logger = Logger.getLogger(RegistryWatcher.class.getName());

    private final ServerRegistry registry;
    private final Path file;
    private final Consumer<Map<String, ServerDefinition>> onChanged;
    private final WatchService watchService;
    private final Thread thread;
    private volatile boolean running = true;

    private RegistryWatcher(
            ServerRegistry registry,
            Path file,
            Consumer<Map<String, ServerDefinition>> onChanged,
            WatchService watchService) {
        this.registry = registry;
        this.file = file;
        this.onChanged = onChanged;
        this.watchService = watchService;
        this.thread = new Thread(this::watchLoop, "trellis-registry-watcher");
        this.thread.setDaemon(true);
    }

    /// Starts watching the given file.
    ///
    /// @param registry the registry to reload, not null
    /// @param file the registry file; its parent directory must exist, not null
    /// @param onChanged receives the refreshed server map after each reload, not null
    /// @return running watcher, never null
    /// @throws IOException if the watch service cannot be registered
    public static RegistryWatcher start(
            ServerRegistry registry, Path file, Consumer<Map<String, ServerDefinition>> onChanged)
            throws IOException {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(onChanged, "onChanged must not be null");

        Path absolute = file.toAbsolutePath();
        WatchService service = FileSystems.getDefault().newWatchService();
        absolute.getParent()
                .register(
                        service,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY);

        RegistryWatcher watcher = new RegistryWatcher(registry, absolute, onChanged, service);
        watcher.thread.start();
        logger.fine("Watching " + absolute + " for changes");
        return watcher;
    }

    private void watchLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path changedPath
                        && file.getFileName().equals(changedPath)) {
                    changed = true;
                }
            }
            key.reset();

            if (changed) {
                refresh();
            }
        }
    }

    void refresh() {
        registry.reload();
        try {
            onChanged.accept(registry.serverMap());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Registry change callback failed", e);
        }
    }

    /// Returns whether the watch thread is still running.
    ///
    /// @return true until {@link #close()} is called
    public boolean isRunning() {
        return running && thread.isAlive();
    }

    @Override
    public void close() throws IOException {
        running = false;
        watchService.close();
        thread.interrupt();
    }
}
