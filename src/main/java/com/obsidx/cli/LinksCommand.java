package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.obsidx.Main;
import com.obsidx.note.Note;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "links", description = "Show outbound links of a note, or the notes linking to a target.")
public class LinksCommand extends AbstractCommand {
    @ArgGroup(exclusive = true, multiplicity = "1")
    Direction direction;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    static class Direction {
        @Option(names = "--from", description = "Vault-relative path of the linking note")
        String from;

        @Option(names = "--to", description = "Link target to find backlinks for")
        String to;
    }

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        try (TextIndex textIndex = LuceneTextIndex.openReadOnly(root().indexLocation(index))) {
            if (direction.from != null) {
                Optional<Note> note = textIndex.exactLookup(LuceneTextIndex.PATH, direction.from);
                if (note.isEmpty()) {
                    output.notFound(commandName(), "No note stored at " + direction.from);
                    return Main.EXIT_NOT_FOUND;
                }
                print(output, "from", direction.from, note.get().links());
            } else {
                print(output, "to", direction.to, textIndex.backlinks(direction.to));
            }
        }
        return Main.EXIT_OK;
    }

    private void print(OutputPrinter output, String key, String subject, List<String> paths) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, subject);
        data.put("links", paths);
        output.success(commandName(), data, out -> paths.forEach(out::println));
    }
}
