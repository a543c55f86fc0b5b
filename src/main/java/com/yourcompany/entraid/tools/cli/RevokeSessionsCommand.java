package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.operations.UserRemediation;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "revoke-sessions", description = "Revoke all sign-in sessions of a user")
public class RevokeSessionsCommand extends AbstractToolCommand {

    @Option(names = { "-u", "--user" }, required = true, description = "User principal name")
    String user;

    @Override
    protected int run() {
        new UserRemediation(openSession().getClient()).revokeSignInSessions(user);
        out().println("Sign-in sessions revoked successfully for user " + user);
        return 0;
    }
}
