package com.yourcompany.entraid.tools.cli;

import picocli.CommandLine.Command;

@Command(name = "token", description = "Print a freshly acquired Graph access token")
public class TokenCommand extends AbstractToolCommand {

    @Override
    protected int run() {
        GraphSession session = openSession();
        if (verbose) {
            err().println("Token expires at " + session.getToken().getExpiresAt());
        }
        out().println(session.getToken().getValue());
        return 0;
    }
}
