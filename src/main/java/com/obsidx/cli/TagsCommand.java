package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.SortedMap;

import com.obsidx.Main;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tags", description = "List tags with the number of notes carrying each.")
public class TagsCommand extends AbstractCommand {
    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        SortedMap<String, Integer> counts;
        try (TextIndex textIndex = LuceneTextIndex.openReadOnly(root().indexLocation(index))) {
            counts = textIndex.tagCounts();
        }
        output.success(commandName(), counts, out -> counts.forEach((tag, count) -> out.printf("%5d  #%s%n", count, tag)));
        return Main.EXIT_OK;
    }
}
