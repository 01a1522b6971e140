package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsidx.Main;
import com.obsidx.index.VaultIndexer;
import com.obsidx.runtime.CollectionScope;
import com.obsidx.watch.ChangeWatcher;
import com.obsidx.watch.WatchServiceEventSource;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "watch", description = "Reindex incrementally whenever notes change.")
public class WatchCommand extends AbstractCommand {
    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @Option(names = "--vault", description = "Vault root directory (required unless --collection is given)")
    Path vault;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Option(names = "--collection", description = "Registered collection to watch")
    String collection;

    @Option(names = "--debounce-ms", description = "Quiet window before a reindex (default from config)")
    Long debounceMs;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        Main main = root();
        CollectionScope scope = main.registry().resolve(collection, vault);
        Path location = main.indexLocation(index);
        long window = debounceMs != null ? debounceMs : main.config().getWatch().getDebounceMs();
        if (window < 0) {
            throw new IllegalArgumentException("--debounce-ms must be >= 0");
        }
        VaultIndexer indexer = new VaultIndexer(main.embeddingService(), main.chunkParams());

        WatchServiceEventSource source = WatchServiceEventSource.open(scope.root(), location);
        ChangeWatcher watcher = new ChangeWatcher(source, Duration.ofMillis(window),
                () -> indexer.index(scope, location, true));
        Thread shutdown = new Thread(() -> {
            watcher.requestStop();
            try {
                source.close();
            } catch (IOException e) {
                log.warn("watch.close.failed reason={}", e.getMessage());
            }
        }, "obsidx-watch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdown);

        indexer.index(scope, location, true);
        output.success(commandName(), null, out -> out.printf("Watching %s (collection '%s'); press Ctrl-C to stop%n",
                scope.root().toAbsolutePath().normalize(), scope.collection()));
        try {
            watcher.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            source.close();
        }

        if (!json) {
            spec.commandLine().getOut().printf("Stopped after %d reindex cycles (%d failed)%n",
                    watcher.completedCycles(), watcher.failedCycles());
            spec.commandLine().getOut().flush();
        }
        return Main.EXIT_OK;
    }
}
