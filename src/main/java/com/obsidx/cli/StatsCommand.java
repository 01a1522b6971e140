package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.obsidx.Main;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;
import com.obsidx.vector.JsonVectorStore;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "stats", description = "Summarize index contents.")
public class StatsCommand extends AbstractCommand {
    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        Path location = root().indexLocation(index);
        Map<String, Object> data = new LinkedHashMap<>();
        try (TextIndex textIndex = LuceneTextIndex.openReadOnly(location)) {
            data.put("notes", textIndex.documentCount());
            data.put("tags", textIndex.tagCounts().size());
        }
        JsonVectorStore vectorStore = JsonVectorStore.openOrCreate(location, root().embeddingService());
        data.put("chunks", vectorStore.chunkCount());
        data.put("index", location.toAbsolutePath().normalize().toString());

        output.success(commandName(), data, out -> data.forEach((key, value) -> out.printf("%-7s %s%n", key + ":", value)));
        return Main.EXIT_OK;
    }
}
