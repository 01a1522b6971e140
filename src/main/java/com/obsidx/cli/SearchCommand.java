package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.obsidx.Main;
import com.obsidx.retrieval.FusionRetriever;
import com.obsidx.retrieval.SearchMode;
import com.obsidx.retrieval.SearchResult;
import com.obsidx.retrieval.SearchService;
import com.obsidx.runtime.AppConfig;
import com.obsidx.runtime.CollectionScope;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;
import com.obsidx.vector.JsonVectorStore;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "search", description = "Rank notes for a query.")
public class SearchCommand extends AbstractCommand {
    @Option(names = { "-q", "--query" }, required = true, description = "Query text")
    String query;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Option(names = { "-n", "--limit" }, description = "Maximum number of results (default from config)")
    Integer limit;

    @Option(names = "--mode", defaultValue = "hybrid", description = "lexical, semantic or hybrid (default: ${DEFAULT-VALUE})")
    SearchMode mode;

    @Option(names = "--collection", description = "Only return notes from this collection")
    String collection;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        Main main = root();
        AppConfig.SearchConfig searchConfig = main.config().getSearch();
        int effectiveLimit = limit != null ? limit : searchConfig.getDefaultLimit();
        if (effectiveLimit < 0) {
            throw new IllegalArgumentException("--limit must be >= 0");
        }
        if (collection != null && !CollectionScope.DEFAULT_COLLECTION.equals(collection)) {
            main.registry().resolve(collection, null);
        }

        Path location = main.indexLocation(index);
        List<SearchResult> results;
        try (TextIndex textIndex = LuceneTextIndex.openReadOnly(location)) {
            SearchService service = new SearchService(
                    textIndex,
                    JsonVectorStore.openOrCreate(location, main.embeddingService()),
                    new FusionRetriever(searchConfig.getRrfK()));
            results = service.search(query, mode, effectiveLimit, collection);
        }

        output.success(commandName(), results, out -> {
            if (results.isEmpty()) {
                out.println("No results.");
            }
            for (SearchResult result : results) {
                out.printf("%.4f  %s%n", result.score(), result.path());
                if (!result.snippet().isEmpty()) {
                    out.println("        " + result.snippet());
                }
            }
        });
        return Main.EXIT_OK;
    }
}
