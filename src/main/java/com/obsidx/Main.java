package com.obsidx;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.obsidx.cli.CollectionsCommand;
import com.obsidx.cli.GetCommand;
import com.obsidx.cli.IndexCommand;
import com.obsidx.cli.InitCommand;
import com.obsidx.cli.LinksCommand;
import com.obsidx.cli.NewCommand;
import com.obsidx.cli.SearchCommand;
import com.obsidx.cli.StatsCommand;
import com.obsidx.cli.TagsCommand;
import com.obsidx.cli.WatchCommand;
import com.obsidx.runtime.AppConfig;
import com.obsidx.runtime.ErrorKind;
import com.obsidx.runtime.JsonCollectionRegistry;
import com.obsidx.vector.ChunkParams;
import com.obsidx.vector.EmbeddingService;
import com.obsidx.vector.EmbeddingServices;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "obsidx",
        mixinStandardHelpOptions = true,
        version = "obsidx 0.1.0",
        description = "Markdown vault indexer with lexical, similarity and fused search.",
        subcommands = {
                InitCommand.class,
                IndexCommand.class,
                SearchCommand.class,
                GetCommand.class,
                TagsCommand.class,
                LinksCommand.class,
                StatsCommand.class,
                WatchCommand.class,
                NewCommand.class,
                CollectionsCommand.class
        })
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE_ERROR = 2;
    public static final int EXIT_NOT_FOUND = 3;
    public static final int EXIT_STORE_UNAVAILABLE = 4;
    public static final int EXIT_MALFORMED_INDEX = 5;
    public static final int EXIT_INVALID_QUERY = 6;
    public static final int EXIT_UNKNOWN_COLLECTION = 7;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "obsidx.yml")
    Path configPath;

    @Spec
    CommandSpec spec;

    private final OkHttpClient httpClient = new OkHttpClient();
    private AppConfig config;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE_ERROR;
    }

    public static int exitCodeFor(ErrorKind kind) {
        return switch (kind) {
            case STORE_UNAVAILABLE -> EXIT_STORE_UNAVAILABLE;
            case MALFORMED_INDEX -> EXIT_MALFORMED_INDEX;
            case INVALID_QUERY -> EXIT_INVALID_QUERY;
            case UNKNOWN_COLLECTION -> EXIT_UNKNOWN_COLLECTION;
        };
    }

    public AppConfig config() throws IOException {
        if (config == null) {
            config = loadConfig(configPath);
            log.debug("Using config file: {} (exists={})", configPath, Files.exists(configPath));
        }
        return config;
    }

    public Path indexLocation(Path override) throws IOException {
        return override != null ? override : Path.of(config().getIndex().getLocation());
    }

    public JsonCollectionRegistry registry() throws IOException {
        return JsonCollectionRegistry.load(Path.of(config().getIndex().getRegistryPath()));
    }

    public EmbeddingService embeddingService() throws IOException {
        return EmbeddingServices.fromEnvironment(httpClient, config().getEmbedding().getDimension());
    }

    public ChunkParams chunkParams() throws IOException {
        AppConfig.ChunkingConfig chunking = config().getChunking();
        return new ChunkParams(chunking.getMaxChars(), chunking.getOverlap());
    }

    static AppConfig loadConfig(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(path.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
