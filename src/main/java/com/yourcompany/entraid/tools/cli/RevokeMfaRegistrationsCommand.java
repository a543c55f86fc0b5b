package com.yourcompany.entraid.tools.cli;

import java.util.List;

import com.yourcompany.entraid.tools.model.AuthenticationMethod;
import com.yourcompany.entraid.tools.operations.UserRemediation;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "revoke-mfa-registrations",
        description = "Delete the authenticator app registrations of a user so MFA must be set up again")
public class RevokeMfaRegistrationsCommand extends AbstractToolCommand {

    @Option(names = { "-u", "--user" }, required = true, description = "User principal name")
    String user;

    @Override
    protected int run() {
        List<AuthenticationMethod> deleted = new UserRemediation(openSession().getClient())
                .requireMfaReregistration(user);
        if (verbose) {
            for (AuthenticationMethod method : deleted) {
                err().println("Deleted authentication method " + method.getId());
            }
        }
        out().println("MFA re-registration required for user " + user + ": " + deleted.size()
                + " authentication methods deleted");
        return 0;
    }
}
