package com.yourcompany.entraid.tools.cli;

import java.io.PrintWriter;
import java.util.concurrent.CancellationException;

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;

import com.yourcompany.entraid.tools.AuthenticationException;
import com.yourcompany.entraid.tools.FetchException;
import com.yourcompany.entraid.tools.GraphRequestException;

import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Turns a failed tool into an error line and an exit code.
 */
public class ToolExceptionHandler implements IExecutionExceptionHandler {

    private static final Log LOG = Log.getLog(ToolExceptionHandler.class);

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_AUTHENTICATION = 3;
    public static final int EXIT_REMOTE = 4;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText("Error: " + ex.getMessage()));

        Object command = commandLine.getCommand();
        if (command instanceof AbstractToolCommand && ((AbstractToolCommand) command).isVerbose()) {
            ex.printStackTrace(err);
        }
        err.flush();

        int exitCode = exitCodeOf(ex);
        LOG.error(ex, "{0} failed with exit code {1}", commandLine.getCommandName(), exitCode);
        return exitCode;
    }

    static int exitCodeOf(Exception ex) {
        if (ex instanceof ConfigurationException) {
            return EXIT_CONFIGURATION;
        }
        if (ex instanceof AuthenticationException) {
            return EXIT_AUTHENTICATION;
        }
        if (ex instanceof FetchException || ex instanceof GraphRequestException) {
            return EXIT_REMOTE;
        }
        if (ex instanceof CancellationException) {
            LOG.warn("Run cancelled: {0}", ex.getMessage());
        }
        return EXIT_FAILURE;
    }
}
