package com.yourcompany.entraid.tools.audit;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.yourcompany.entraid.tools.FetchException;
import com.yourcompany.entraid.tools.GraphMockSupport;
import com.yourcompany.entraid.tools.model.DirectoryUser;
import com.yourcompany.entraid.tools.model.RoleAssignment;
import com.yourcompany.entraid.tools.pipeline.AuditReport;
import com.yourcompany.entraid.tools.pipeline.AuditRun;
import com.yourcompany.entraid.tools.pipeline.CancellationSignal;
import com.yourcompany.entraid.tools.pipeline.EnrichmentDispatcher;
import com.yourcompany.entraid.tools.pipeline.EnrichmentRetryPolicy;
import com.yourcompany.entraid.tools.pipeline.UndeterminedRecord;

public class MailboxAuditsTest extends GraphMockSupport {

    private static final String SKU = "6fd2c87f-b296-42f0-b197-1e91e994b900";

    private MailboxAudits audits() {
        CancellationSignal cancellation = new CancellationSignal();
        return new MailboxAudits(client(),
                new EnrichmentDispatcher(4, EnrichmentRetryPolicy.noRetry(), cancellation), cancellation);
    }

    private void stubPurpose(String upn, String purpose) {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users/" + upn + "/mailboxSettings"))
                .willReturn(okJson(purpose == null ? "{}" : "{\"userPurpose\":\"" + purpose + "\"}")));
    }

    @Test
    public void licensedSharedMailboxesAcrossPages() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).withQueryParam("$skiptoken", absent())
                .willReturn(okJson(page(link("/users?$skiptoken=2"),
                        user("alice@contoso.com", true, SKU),
                        user("bob@contoso.com", true, SKU)))));
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).withQueryParam("$skiptoken", equalTo("2"))
                .willReturn(okJson(page(null,
                        user("carol@contoso.com", true, SKU),
                        user("dave@contoso.com", true)))));
        stubPurpose("alice@contoso.com", "shared");
        stubPurpose("bob@contoso.com", "user");
        stubPurpose("carol@contoso.com", "shared");

        AuditRun<DirectoryUser, ?> run = audits().licensedSharedMailboxes();
        AuditReport<DirectoryUser> report = run.execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com", "carol@contoso.com");
        assertThat(report.getExaminedCount()).isEqualTo(4);
        assertThat(report.getEnrichedCount()).isEqualTo(3);
        graph.verify(0, getRequestedFor(urlPathEqualTo("/v1.0/users/dave@contoso.com/mailboxSettings")));
    }

    @Test
    public void licenseAuditMatchesExactPurposeOnly() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).willReturn(okJson(page(null,
                user("alice@contoso.com", true, SKU),
                user("erin@contoso.com", true, SKU),
                user("frank@contoso.com", true, SKU)))));
        stubPurpose("alice@contoso.com", "shared");
        stubPurpose("erin@contoso.com", "Shared");
        stubPurpose("frank@contoso.com", null);

        AuditReport<DirectoryUser> report = audits().licensedSharedMailboxes().execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com");
        assertThat(report.getUndetermined()).isEmpty();
    }

    @Test
    public void failedMailboxSettingsAreUndetermined() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).willReturn(okJson(page(null,
                user("alice@contoso.com", true, SKU),
                user("bob@contoso.com", true, SKU),
                user("carol@contoso.com", true, SKU)))));
        stubPurpose("alice@contoso.com", "shared");
        graph.stubFor(get(urlPathEqualTo("/v1.0/users/bob@contoso.com/mailboxSettings"))
                .willReturn(aResponse().withStatus(404).withBody("{\"error\":{\"code\":\"MailboxNotEnabled\"}}")));
        stubPurpose("carol@contoso.com", "shared");

        AuditReport<DirectoryUser> report = audits().licensedSharedMailboxes().execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com", "carol@contoso.com");
        assertThat(report.getUndetermined()).extracting(UndeterminedRecord::getKey)
                .containsExactly("bob@contoso.com");
        assertThat(report.getUndetermined().get(0).getReason()).contains("404");
    }

    @Test
    public void userWithoutPrincipalNameDoesNotAbortTheAudit() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).willReturn(okJson(page(null,
                user("alice@contoso.com", true, SKU),
                "{\"id\":\"x\",\"accountEnabled\":true,\"assignedLicenses\":[{\"skuId\":\"" + SKU + "\"}]}"))));
        stubPurpose("alice@contoso.com", "shared");

        AuditReport<DirectoryUser> report = audits().licensedSharedMailboxes().execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com");
        assertThat(report.getExaminedCount()).isEqualTo(2);
        assertThat(report.getEnrichedCount()).isEqualTo(1);
    }

    @Test
    public void failedUserListingFailsTheAudit() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).willReturn(aResponse().withStatus(401).withBody("nope")));
        AuditRun<DirectoryUser, ?> run = audits().licensedSharedMailboxes();

        assertThatThrownBy(run::execute).isInstanceOf(FetchException.class);
        assertThat(run.getState()).isEqualTo(AuditRun.State.FAILED);
    }

    @Test
    public void unblockedSharedMailboxesSkipsBlockedAccounts() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/users")).willReturn(okJson(page(null,
                user("alice@contoso.com", true),
                user("bob@contoso.com", false),
                user("carol@contoso.com", true)))));
        stubPurpose("alice@contoso.com", "Shared");
        stubPurpose("carol@contoso.com", "user");

        AuditReport<DirectoryUser> report = audits().unblockedSharedMailboxes().execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com");
        graph.verify(0, getRequestedFor(urlPathEqualTo("/v1.0/users/bob@contoso.com/mailboxSettings")));
    }

    @Test
    public void adminRoleSharedMailboxes() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/directoryRoles")).willReturn(okJson(page(null,
                "{\"id\":\"r1\",\"displayName\":\"Global Administrator\"}",
                "{\"id\":\"r2\",\"displayName\":\"Exchange Administrator\"}"))));
        graph.stubFor(get(urlPathEqualTo("/v1.0/directoryRoles/r1/members")).willReturn(okJson(page(null,
                "{\"@odata.type\":\"#microsoft.graph.user\",\"id\":\"u1\",\"displayName\":\"Alice\","
                        + "\"userPrincipalName\":\"alice@contoso.com\"}",
                "{\"@odata.type\":\"#microsoft.graph.servicePrincipal\",\"id\":\"sp1\",\"displayName\":\"App\"}"))));
        graph.stubFor(get(urlPathEqualTo("/v1.0/directoryRoles/r2/members")).willReturn(okJson(page(null,
                "{\"id\":\"u1\",\"displayName\":\"Alice\",\"userPrincipalName\":\"alice@contoso.com\"}",
                "{\"id\":\"u2\",\"displayName\":\"Bob\",\"userPrincipalName\":\"bob@contoso.com\"}"))));
        stubPurpose("alice@contoso.com", "shared");
        stubPurpose("bob@contoso.com", "user");

        Map<String, Integer> listedRoles = new LinkedHashMap<>();
        AuditReport<RoleAssignment> report = audits()
                .adminRoleSharedMailboxes((role, members) -> listedRoles.put(role.getDisplayName(), members.size()))
                .execute();

        assertThat(listedRoles).containsExactly(Map.entry("Global Administrator", 2),
                Map.entry("Exchange Administrator", 2));
        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com");
        assertThat(report.getMatches()).extracting(assignment -> assignment.getRole().getDisplayName())
                .containsExactly("Global Administrator", "Exchange Administrator");
        // alice holds two roles but her mailbox is read once
        graph.verify(1, getRequestedFor(urlPathEqualTo("/v1.0/users/alice@contoso.com/mailboxSettings")));
    }

    @Test
    public void memberPathsAreScopedToTheRole() {
        assertThat(DirectoryRoleSource.membersPath("r 1"))
                .isEqualTo("/directoryRoles/r%201/members?$select=id,displayName,userPrincipalName");
        assertThat(MailboxAudits.mailboxSettingsPath("alice@contoso.com"))
                .isEqualTo("/users/alice@contoso.com/mailboxSettings");
        assertThat(MailboxAudits.USERS_PATH).startsWith("/users?$select=");
    }
}
