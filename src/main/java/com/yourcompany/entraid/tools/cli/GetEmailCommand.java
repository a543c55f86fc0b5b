package com.yourcompany.entraid.tools.cli;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourcompany.entraid.tools.operations.MailOperations;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "get-email", description = "Search a mailbox by subject")
public class GetEmailCommand extends AbstractToolCommand {

    @Option(names = { "-u", "--user" }, required = true, description = "Mailbox to search")
    String mailbox;

    @Option(names = { "-s", "--subject" }, required = true, description = "Subject to search for")
    String subject;

    @Option(names = "--spoofed", description = "Compare reply-to, sender and from of each message")
    boolean spoofed;

    @Override
    protected int run() throws Exception {
        GraphSession session = openSession();
        List<JsonNode> messages = new MailOperations(session.getClient()).searchBySubject(mailbox, subject);
        if (spoofed) {
            for (JsonNode message : messages) {
                printSpoofCheck(message);
            }
            return 0;
        }
        ObjectMapper mapper = session.getClient().getObjectMapper();
        out().println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(messages));
        return 0;
    }

    private void printSpoofCheck(JsonNode message) {
        String from = address(message.path("from"));
        String sender = address(message.path("sender"));

        List<String> replyTo = new ArrayList<>();
        for (JsonNode recipient : message.path("replyTo")) {
            String address = address(recipient);
            replyTo.add(address.equalsIgnoreCase(from) ? ansi("@|green " + address + "|@")
                    : ansi("@|red " + address + "|@"));
        }

        out().println("Subject: " + message.path("subject").asText(""));
        out().println("Reply-To: " + (replyTo.isEmpty() ? "None" : String.join(", ", replyTo)));
        if (sender.equalsIgnoreCase(from)) {
            out().println(ansi("Sender: @|green " + sender + "|@, From: @|green " + from + "|@"));
        } else {
            out().println(ansi("Sender: @|red " + sender + "|@, From: @|red " + from + "|@"));
            out().println(ansi("@|bold,red WARNING: sender and from addresses differ|@"));
        }
        out().println();
    }

    private static String address(JsonNode recipient) {
        return recipient.path("emailAddress").path("address").asText("");
    }
}
