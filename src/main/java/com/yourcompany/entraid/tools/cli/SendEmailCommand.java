package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.operations.MailOperations;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "send-email", description = "Send a plain-text email on behalf of a mailbox")
public class SendEmailCommand extends AbstractToolCommand {

    @Option(names = { "-e", "--email" }, required = true, converter = EmailAddressConverter.class,
            description = "Recipient address")
    String recipient;

    @Option(names = { "-s", "--subject" }, required = true, description = "Subject")
    String subject;

    @Option(names = { "-b", "--body" }, required = true, description = "Plain-text body")
    String body;

    @Option(names = { "-u", "--user" }, required = true, description = "Sending mailbox")
    String sender;

    @Override
    protected int run() {
        new MailOperations(openSession().getClient()).sendMail(sender, recipient, subject, body);
        out().println("Email sent successfully to " + recipient);
        return 0;
    }
}
