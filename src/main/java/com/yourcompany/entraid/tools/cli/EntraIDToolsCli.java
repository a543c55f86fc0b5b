package com.yourcompany.entraid.tools.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.LogManager;

import com.yourcompany.entraid.tools.EntraIDConfiguration;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Entry point: one subcommand per administration tool.
 */
@Command(name = "entraid-graph-tools", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Microsoft Entra ID administration and audit tools",
        subcommands = {
                AuditLicensesCommand.class,
                AuditAdminRolesCommand.class,
                AuditBlockStatusCommand.class,
                RevokeSessionsCommand.class,
                RevokeMfaRegistrationsCommand.class,
                RemoveLicensesCommand.class,
                SendEmailCommand.class,
                GetEmailCommand.class,
                LicenseAvailabilityCommand.class,
                TokenCommand.class,
                CheckCommand.class
        })
public class EntraIDToolsCli implements Runnable {

    static final String LOG_SPI_PROPERTY = "org.identityconnectors.common.logging.class";
    static final String JDK_LOG_SPI = "org.identityconnectors.common.logging.impl.JDKLogger";

    @Spec
    CommandSpec spec;

    @Option(names = "--env-file",
            description = "Dotenv file with TENANT_ID, CLIENT_ID and CLIENT_SECRET (default: ./.env)")
    Path envFile;

    private final GraphSessionFactory sessionFactory;

    public EntraIDToolsCli() {
        this(new DefaultGraphSessionFactory());
    }

    public EntraIDToolsCli(GraphSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    GraphSession openSession() {
        return sessionFactory.open(envFile);
    }

    EntraIDConfiguration loadConfiguration() {
        return DefaultGraphSessionFactory.loadConfiguration(envFile);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static CommandLine newCommandLine(GraphSessionFactory sessionFactory) {
        return new CommandLine(new EntraIDToolsCli(sessionFactory))
                .setExecutionExceptionHandler(new ToolExceptionHandler());
    }

    /**
     * Routes ConnId logging to java.util.logging on stderr. Must run before
     * the first {@code Log.getLog}.
     */
    static void configureLogging() {
        if (System.getProperty(LOG_SPI_PROPERTY) == null) {
            System.setProperty(LOG_SPI_PROPERTY, JDK_LOG_SPI);
        }
        try (InputStream in = EntraIDToolsCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not read logging configuration: " + e.getMessage());
        }
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(newCommandLine(new DefaultGraphSessionFactory()).execute(args));
    }
}
