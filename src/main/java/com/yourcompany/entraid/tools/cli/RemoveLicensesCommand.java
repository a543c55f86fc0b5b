package com.yourcompany.entraid.tools.cli;

import java.util.List;

import com.yourcompany.entraid.tools.operations.UserRemediation;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "remove-licenses", description = "Remove every license assigned to a user")
public class RemoveLicensesCommand extends AbstractToolCommand {

    @Option(names = { "-u", "--user" }, required = true, description = "User principal name")
    String user;

    @Override
    protected int run() {
        List<String> removed = new UserRemediation(openSession().getClient()).removeAllLicenses(user);
        if (removed.isEmpty()) {
            out().println("No licenses found to remove.");
        } else {
            out().println("Removed licenses from user " + user + ": " + String.join(", ", removed));
        }
        return 0;
    }
}
