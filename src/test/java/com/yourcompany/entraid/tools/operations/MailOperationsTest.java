package com.yourcompany.entraid.tools.operations;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourcompany.entraid.tools.GraphMockSupport;
import com.yourcompany.entraid.tools.GraphRequestException;

public class MailOperationsTest extends GraphMockSupport {

    @Test
    public void sendsPlainTextMessageAndSavesCopy() {
        graph.stubFor(post(urlPathEqualTo("/v1.0/users/helpdesk@contoso.com/sendMail"))
                .willReturn(aResponse().withStatus(202)));

        new MailOperations(client()).sendMail("helpdesk@contoso.com", "bob@contoso.com", "Password reset",
                "Your password was reset.");

        graph.verify(postRequestedFor(urlPathEqualTo("/v1.0/users/helpdesk@contoso.com/sendMail"))
                .withRequestBody(equalToJson("{\"message\":{\"subject\":\"Password reset\","
                        + "\"body\":{\"contentType\":\"Text\",\"content\":\"Your password was reset.\"},"
                        + "\"toRecipients\":[{\"emailAddress\":{\"address\":\"bob@contoso.com\"}}]},"
                        + "\"saveToSentItems\":true}")));
    }

    @Test
    public void sendFailureIsFatal() {
        graph.stubFor(post(urlPathEqualTo("/v1.0/users/helpdesk@contoso.com/sendMail"))
                .willReturn(aResponse().withStatus(400).withBody("ErrorInvalidRecipients")));

        assertThatThrownBy(() -> new MailOperations(client()).sendMail("helpdesk@contoso.com", "bob@contoso.com",
                "s", "b")).isInstanceOf(GraphRequestException.class).hasMessageContaining("400");
    }

    @Test
    public void searchesBySubjectWithEventualConsistency() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users/bob@contoso.com/messages"))
                .withQueryParam("$search", equalTo("\"subject:Invoice 42\""))
                .willReturn(okJson(page(null,
                        "{\"id\":\"m1\",\"subject\":\"Invoice 42\"}",
                        "{\"id\":\"m2\",\"subject\":\"RE: Invoice 42\"}"))));

        List<JsonNode> messages = new MailOperations(client()).searchBySubject("bob@contoso.com", "Invoice 42");

        assertThat(messages).extracting(message -> message.get("id").asText()).containsExactly("m1", "m2");
        graph.verify(getRequestedFor(urlPathEqualTo("/v1.0/users/bob@contoso.com/messages"))
                .withHeader("ConsistencyLevel", equalTo("eventual")));
    }
}
