package com.obsidx.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.obsidx.Main;
import com.obsidx.runtime.CollectionScope;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "new", description = "Create a note file in a vault.")
public class NewCommand extends AbstractCommand {
    @Option(names = "--vault", description = "Vault root directory (required unless --collection is given)")
    Path vault;

    @Option(names = { "-t", "--title" }, required = true, description = "Note title, also used for the file name")
    String title;

    @Option(names = { "-b", "--body" }, defaultValue = "", description = "Note body")
    String body;

    @Option(names = "--tag", description = "Frontmatter tag (repeatable)")
    List<String> tags = new ArrayList<>();

    @Option(names = "--collection", description = "Registered collection to write into")
    String collection;

    @Override
    protected int execute(OutputPrinter output) throws IOException {
        CollectionScope scope = root().registry().resolve(collection, vault);
        String slug = slug(title);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Title '" + title + "' yields an empty file name");
        }
        Path file = scope.root().resolve(slug + ".md");
        try {
            Files.writeString(file, render(title, tags, body), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (FileAlreadyExistsException e) {
            output.failure(commandName(), "ALREADY_EXISTS", "Note already exists: " + file);
            return Main.EXIT_FAILURE;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", slug + ".md");
        data.put("file", file.toAbsolutePath().normalize().toString());
        data.put("collection", scope.collection());
        output.success(commandName(), data, out -> out.println("Created " + data.get("file")));
        return Main.EXIT_OK;
    }

    static String slug(String title) {
        String ascii = Normalizer.normalize(title, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    static String render(String title, List<String> tags, String body) {
        StringBuilder text = new StringBuilder();
        if (!tags.isEmpty()) {
            text.append("---\ntags:\n");
            for (String tag : tags) {
                text.append("  - ").append(tag.startsWith("#") ? tag.substring(1) : tag).append('\n');
            }
            text.append("---\n");
        }
        text.append("# ").append(title).append("\n\n");
        if (!body.isEmpty()) {
            text.append(body).append('\n');
        }
        return text.toString();
    }
}
