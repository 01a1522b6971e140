package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.obsidx.Main;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;
import com.obsidx.vector.JsonVectorStore;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create empty lexical and vector stores.")
public class InitCommand extends AbstractCommand {
    @Option(names = "--vault", required = true, description = "Vault root directory")
    Path vault;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        if (!Files.isDirectory(vault)) {
            throw new IllegalArgumentException("Vault directory does not exist: " + vault);
        }
        Path location = root().indexLocation(index);
        try (TextIndex ignored = LuceneTextIndex.openOrCreate(location)) {
            JsonVectorStore.openOrCreate(location, root().embeddingService()).save();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("vault", vault.toAbsolutePath().normalize().toString());
        data.put("index", location.toAbsolutePath().normalize().toString());
        output.success(commandName(), data, out -> out.println("Initialized index at " + data.get("index")));
        return Main.EXIT_OK;
    }
}
