package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import com.obsidx.Main;
import com.obsidx.note.Note;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "get", description = "Print a stored note by its vault-relative path.")
public class GetCommand extends AbstractCommand {
    @Option(names = { "-p", "--path" }, required = true, description = "Vault-relative note path")
    String path;

    @Option(names = "--index", description = "Index location (default from config)")
    Path index;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        Optional<Note> found;
        try (TextIndex textIndex = LuceneTextIndex.openReadOnly(root().indexLocation(index))) {
            found = textIndex.exactLookup(LuceneTextIndex.PATH, path);
        }
        if (found.isEmpty()) {
            output.notFound(commandName(), "No note stored at " + path);
            return Main.EXIT_NOT_FOUND;
        }

        Note note = found.get();
        output.success(commandName(), note, out -> {
            out.println("# " + note.title());
            out.println("path:       " + note.path());
            out.println("collection: " + note.collection());
            out.println("tags:       " + String.join(", ", note.tags()));
            out.println("links:      " + String.join(", ", note.links()));
            out.println();
            out.println(note.body());
        });
        return Main.EXIT_OK;
    }
}
