package org.foxesworld.strider.engine.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardWatchEventKinds.*;

/**
 * Watches one directory (non-recursive) for created or modified files with the given extensions.
 */
public final class HotReloadWatcher implements Closeable {

    private static final Logger log = LogManager.getLogger(HotReloadWatcher.class);

    private final Path root;
    private final WatchService watchService;
    private final Set<String> exts;

    // changed file names (relative to root)
    private final Set<String> changed = ConcurrentHashMap.newKeySet();

    public HotReloadWatcher(Path directory) {
        this(directory, Set.of(".js", ".json"));
    }

    public HotReloadWatcher(Path directory, Set<String> extensions) {
        this.root = directory.toAbsolutePath().normalize();
        this.exts = extensions;
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
            root.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to watch " + root, e);
        }
        log.info("HotReloadWatcher watching: {}", root);
    }

    public Path root() {
        return root;
    }

    private boolean isInteresting(Path rel) {
        String name = rel.toString().toLowerCase(Locale.ROOT);
        for (String e : exts) {
            if (name.endsWith(e)) return true;
        }
        return false;
    }

    /**
     * Call in update(): returns the file names changed since the previous call.
     */
    public Set<String> pollChanged() {
        WatchKey key;
        while ((key = watchService.poll()) != null) {
            for (WatchEvent<?> ev : key.pollEvents()) {
                if (ev.kind() == OVERFLOW) continue;

                @SuppressWarnings("unchecked")
                WatchEvent<Path> pev = (WatchEvent<Path>) ev;
                Path rel = pev.context();
                if (isInteresting(rel)) {
                    changed.add(rel.toString().replace('\\', '/'));
                    log.debug("HotReload change: {} {}", ev.kind().name(), rel);
                }
            }
            if (!key.reset()) {
                log.warn("HotReloadWatcher: {} is no longer watchable", root);
            }
        }

        if (changed.isEmpty()) return Set.of();
        HashSet<String> out = new HashSet<>(changed);
        changed.clear();
        return Collections.unmodifiableSet(out);
    }

    @Override
    public void close() {
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("HotReloadWatcher close failed", e);
        }
        changed.clear();
    }
}
