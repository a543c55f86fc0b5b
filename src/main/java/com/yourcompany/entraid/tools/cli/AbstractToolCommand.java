package com.yourcompany.entraid.tools.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base of every tool. Results go to the command's output stream, diagnostics
 * to its error stream.
 */
public abstract class AbstractToolCommand implements Callable<Integer> {

    // strong reference, java.util.logging drops levels of collected loggers
    private static final Logger TOOLS_LOGGER = Logger.getLogger("com.yourcompany.entraid.tools");

    @ParentCommand
    EntraIDToolsCli parent;

    @Spec
    CommandSpec spec;

    @Option(names = { "-v", "--verbose" }, description = "Print per-record diagnostics and stack traces")
    boolean verbose;

    public boolean isVerbose() {
        return verbose;
    }

    protected GraphSession openSession() {
        return parent.openSession();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Renders picocli markup such as {@code @|green text|@} with the active color scheme.
     */
    protected String ansi(String markup) {
        return spec.commandLine().getColorScheme().ansi().string(markup);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            TOOLS_LOGGER.setLevel(Level.FINE);
        }
        int exitCode = run();
        out().flush();
        err().flush();
        return exitCode;
    }

    protected abstract int run() throws Exception;
}
