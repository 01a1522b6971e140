package com.obsidx.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import com.obsidx.Main;
import com.obsidx.runtime.ErrorKind;
import com.obsidx.runtime.JsonCollectionRegistry;
import com.obsidx.runtime.ObsidxException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "collections",
        description = "Manage named vault collections.",
        subcommands = {
                CollectionsCommand.Add.class,
                CollectionsCommand.ListCollections.class,
                CollectionsCommand.Remove.class
        })
public class CollectionsCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return Main.EXIT_USAGE_ERROR;
    }

    @Command(name = "add", description = "Register a vault root under a name.")
    static class Add extends AbstractCommand {
        @Option(names = "--name", required = true)
        String name;

        @Option(names = "--path", required = true)
        Path path;

        @Override
        protected int execute(OutputPrinter output) throws IOException {
            if (!Files.isDirectory(path)) {
                throw new IllegalArgumentException("Collection root is not a directory: " + path);
            }
            JsonCollectionRegistry registry = root().registry();
            registry.put(name, path);
            registry.save();
            Path stored = registry.lookup(name).orElseThrow();

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("name", name);
            data.put("path", stored.toString());
            output.success(commandName(), data, out -> out.println("Registered " + name + " -> " + stored));
            return Main.EXIT_OK;
        }
    }

    @Command(name = "list", description = "List registered collections.")
    static class ListCollections extends AbstractCommand {
        @Override
        protected int execute(OutputPrinter output) throws IOException {
            Map<String, String> data = new LinkedHashMap<>();
            root().registry().entries().forEach((name, dir) -> data.put(name, dir.toString()));
            output.success(commandName(), data, out -> data.forEach((name, dir) -> out.println(name + "\t" + dir)));
            return Main.EXIT_OK;
        }
    }

    @Command(name = "remove", description = "Forget a registered collection. Indexed notes are kept.")
    static class Remove extends AbstractCommand {
        @Option(names = "--name", required = true)
        String name;

        @Override
        protected int execute(OutputPrinter output) throws IOException {
            JsonCollectionRegistry registry = root().registry();
            if (!registry.remove(name)) {
                throw new ObsidxException(ErrorKind.UNKNOWN_COLLECTION, "Unknown collection '" + name + "'");
            }
            registry.save();
            output.success(commandName(), Map.of("name", name), out -> out.println("Removed " + name));
            return Main.EXIT_OK;
        }
    }
}
