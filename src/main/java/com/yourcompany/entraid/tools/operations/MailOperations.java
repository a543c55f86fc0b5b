package com.yourcompany.entraid.tools.operations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.identityconnectors.common.logging.Log;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourcompany.entraid.tools.GraphRestClient;
import com.yourcompany.entraid.tools.pipeline.CancellationSignal;
import com.yourcompany.entraid.tools.pipeline.PaginatedFetcher;

/**
 * Sending and searching mail on behalf of a mailbox.
 */
public class MailOperations {

    private static final Log LOG = Log.getLog(MailOperations.class);

    private final GraphRestClient client;

    public MailOperations(GraphRestClient client) {
        this.client = client;
    }

    /**
     * Sends a plain-text message from {@code sender} to one recipient and keeps
     * a copy in the sender's Sent Items.
     */
    public void sendMail(String sender, String recipient, String subject, String body) {
        LOG.ok("Preparing message from {0} to {1}", sender, recipient);
        client.post("/users/" + GraphRestClient.segment(sender) + "/sendMail",
                messagePayload(recipient, subject, body));
        LOG.info("Email sent successfully to {0}", recipient);
    }

    static Map<String, Object> messagePayload(String recipient, String subject, String body) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("contentType", "Text");
        content.put("content", body);

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("subject", subject);
        message.put("body", content);
        message.put("toRecipients", List.of(Map.of("emailAddress", Map.of("address", recipient))));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("saveToSentItems", true);
        return payload;
    }

    /**
     * Searches a mailbox by subject. {@code $search} needs eventual consistency.
     *
     * @return The raw message resources, every page included.
     */
    public List<JsonNode> searchBySubject(String mailbox, String subject) {
        String path = "/users/" + GraphRestClient.segment(mailbox) + "/messages?$search="
                + GraphRestClient.queryValue("\"subject:" + subject + "\"");
        LOG.ok("Searching email messages with {0}", path);
        return new PaginatedFetcher<>(client, JsonNode.class, new CancellationSignal(), true)
                .fetchAll(path);
    }
}
