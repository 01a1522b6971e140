package com.obsidx.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WatchService} over a whole vault. Every non-hidden directory is
 * registered, including directories created later. Only note files and new
 * directories are reported.
 */
public class WatchServiceEventSource implements ChangeEventSource {
    private static final Logger log = LoggerFactory.getLogger(WatchServiceEventSource.class);

    private final WatchService watchService;
    private final Path root;
    private final Path excluded;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private final Deque<Path> pending = new ArrayDeque<>();

    private WatchServiceEventSource(WatchService watchService, Path root, Path excluded) {
        this.watchService = watchService;
        this.root = root;
        this.excluded = excluded;
    }

    public static WatchServiceEventSource open(Path root, Path excluded) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedExcluded = excluded == null ? null : excluded.toAbsolutePath().normalize();
        WatchService watchService = FileSystems.getDefault().newWatchService();
        WatchServiceEventSource source = new WatchServiceEventSource(watchService, normalizedRoot, normalizedExcluded);
        try {
            source.registerTree(normalizedRoot);
        } catch (IOException e) {
            watchService.close();
            throw e;
        }
        log.debug("watch.registered root={} directories={}", normalizedRoot, source.directories.size());
        return source;
    }

    @Override
    public Path take() throws InterruptedException {
        while (pending.isEmpty()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                return null;
            }
            process(key);
        }
        return pending.poll();
    }

    @Override
    public Path poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (pending.isEmpty()) {
            WatchKey key;
            try {
                key = watchService.poll(timeout, unit);
            } catch (ClosedWatchServiceException e) {
                return null;
            }
            if (key != null) {
                process(key);
            }
        }
        return pending.poll();
    }

    @Override
    public void close() throws IOException {
        watchService.close();
    }

    private void process(WatchKey key) {
        Path dir = directories.get(key);
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == OVERFLOW || dir == null) {
                pending.add(root);
                continue;
            }
            Path changed = dir.resolve((Path) event.context());
            if (event.kind() == ENTRY_CREATE && Files.isDirectory(changed)) {
                if (shouldWatch(changed)) {
                    try {
                        registerTree(changed);
                        pending.add(changed);
                    } catch (IOException e) {
                        log.warn("watch.register.failed path={} reason={}", changed, e.getMessage());
                    }
                }
            } else if (isNote(changed)) {
                pending.add(changed);
            }
        }
        if (!key.reset()) {
            directories.remove(key);
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && !shouldWatch(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                directories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private boolean shouldWatch(Path dir) {
        Path name = dir.getFileName();
        if (name != null && name.toString().startsWith(".")) {
            return false;
        }
        return excluded == null || !dir.toAbsolutePath().normalize().startsWith(excluded);
    }

    private static boolean isNote(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".markdown");
    }
}
