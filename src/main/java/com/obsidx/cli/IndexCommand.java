package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;

import com.obsidx.Main;
import com.obsidx.index.IndexReport;
import com.obsidx.index.VaultIndexer;
import com.obsidx.runtime.CollectionScope;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "index", description = "Scan a vault and build or update the index.")
public class IndexCommand extends AbstractCommand {
    @Option(names = "--vault", description = "Vault root directory (required unless --collection is given)")
    Path vault;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Option(names = "--incremental", description = "Only reindex notes whose mtime advanced")
    boolean incremental;

    @Option(names = "--collection", description = "Registered collection to index")
    String collection;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        Main main = root();
        CollectionScope scope = main.registry().resolve(collection, vault);
        VaultIndexer indexer = new VaultIndexer(main.embeddingService(), main.chunkParams());
        IndexReport report = indexer.index(scope, main.indexLocation(index), incremental);

        output.success(commandName(), report, out -> {
            out.printf("Indexed %d files into collection '%s' (%s)%n",
                    report.scannedFiles(), report.collection(), report.incremental() ? "incremental" : "full");
            out.printf("  lexical: %d written, %d skipped%n", report.lexicalWritten(), report.lexicalSkipped());
            out.printf("  vectors: %d written, %d skipped, %d chunks total%n",
                    report.vectorWritten(), report.vectorSkipped(), report.totalChunks());
            if (report.failedFiles() > 0) {
                out.printf("  %d files could not be read (see log)%n", report.failedFiles());
            }
            if (report.incremental()) {
                out.println("  note: deleted files stay indexed until the next full run");
            }
        });
        return Main.EXIT_OK;
    }
}
