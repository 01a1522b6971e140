package com.obsidx.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsidx.Main;
import com.obsidx.runtime.ObsidxException;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Shared error handling for subcommands: store and query failures become a
 * reportable result and an exit code instead of a stack trace.
 */
public abstract class AbstractCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AbstractCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--json", description = "Print a JSON envelope instead of text")
    boolean json;

    @Override
    public final Integer call() {
        OutputPrinter output = new OutputPrinter(spec.commandLine().getOut(), spec.commandLine().getErr(), json);
        String command = spec.name();
        try {
            return execute(output);
        } catch (ObsidxException e) {
            log.debug("command.failed command={} kind={}", command, e.kind(), e);
            output.failure(command, e.kind().name(), e.getMessage());
            return Main.exitCodeFor(e.kind());
        } catch (IllegalArgumentException e) {
            output.failure(command, "USAGE", e.getMessage());
            return Main.EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("command.failed command={} reason={}", command, e.getMessage(), e);
            output.failure(command, "IO_ERROR", e.toString());
            return Main.EXIT_FAILURE;
        }
    }

    protected abstract int execute(OutputPrinter output) throws IOException;

    protected Main root() {
        return (Main) spec.root().userObject();
    }

    protected String commandName() {
        return spec.name();
    }
}
