package com.yourcompany.entraid.tools.audit;

import java.util.List;
import java.util.function.BiConsumer;

import com.yourcompany.entraid.tools.GraphRestClient;
import com.yourcompany.entraid.tools.model.DirectoryMember;
import com.yourcompany.entraid.tools.model.DirectoryRole;
import com.yourcompany.entraid.tools.model.DirectoryUser;
import com.yourcompany.entraid.tools.model.MailboxSettings;
import com.yourcompany.entraid.tools.model.RoleAssignment;
import com.yourcompany.entraid.tools.pipeline.AuditRun;
import com.yourcompany.entraid.tools.pipeline.CancellationSignal;
import com.yourcompany.entraid.tools.pipeline.EnrichmentDispatcher;
import com.yourcompany.entraid.tools.pipeline.PaginatedFetcher;

/**
 * The shared-mailbox audits. Each one lists directory objects, reads the
 * mailbox settings of the interesting ones and keeps the shared mailboxes.
 */
public class MailboxAudits {

    static final String USERS_PATH = "/users?$select=" + DirectoryUser.SELECT + "&$top=999";

    private final GraphRestClient client;
    private final EnrichmentDispatcher dispatcher;
    private final CancellationSignal cancellation;

    public MailboxAudits(GraphRestClient client, EnrichmentDispatcher dispatcher, CancellationSignal cancellation) {
        this.client = client;
        this.dispatcher = dispatcher;
        this.cancellation = cancellation;
    }

    static String mailboxSettingsPath(String userPrincipalName) {
        return "/users/" + GraphRestClient.segment(userPrincipalName) + "/mailboxSettings";
    }

    /**
     * Reads the mailbox settings of one user.
     */
    public MailboxSettings mailboxSettings(String userPrincipalName) {
        return client.getJson(mailboxSettingsPath(userPrincipalName), MailboxSettings.class);
    }

    /**
     * Licensed users whose mailbox is a shared mailbox; shared mailboxes do not
     * need a license of their own.
     */
    public AuditRun<DirectoryUser, MailboxSettings> licensedSharedMailboxes() {
        return AuditRun.<DirectoryUser, MailboxSettings>builder("audit-licenses")
                .source(this::listUsers)
                .key(DirectoryUser::getUserPrincipalName)
                .preFilter(DirectoryUser::hasLicenses)
                .enricher(user -> mailboxSettings(user.getUserPrincipalName()))
                .predicate((user, settings) -> settings != null
                        && MailboxSettings.PURPOSE_SHARED.equals(settings.getUserPurpose()))
                .dispatcher(dispatcher)
                .cancellation(cancellation)
                .build();
    }

    /**
     * Shared mailboxes whose account can still sign in interactively.
     */
    public AuditRun<DirectoryUser, MailboxSettings> unblockedSharedMailboxes() {
        return AuditRun.<DirectoryUser, MailboxSettings>builder("audit-block-status")
                .source(this::listUsers)
                .key(DirectoryUser::getUserPrincipalName)
                .preFilter(DirectoryUser::isSignInEnabled)
                .enricher(user -> mailboxSettings(user.getUserPrincipalName()))
                .predicate((user, settings) -> settings != null && settings.isShared())
                .dispatcher(dispatcher)
                .cancellation(cancellation)
                .build();
    }

    /**
     * Shared mailboxes holding a directory role.
     *
     * @param roleListener Receives every role and its members as they are listed.
     */
    public AuditRun<RoleAssignment, MailboxSettings> adminRoleSharedMailboxes(
            BiConsumer<DirectoryRole, List<DirectoryMember>> roleListener) {
        return AuditRun.<RoleAssignment, MailboxSettings>builder("audit-admin-roles")
                .source(new DirectoryRoleSource(client, cancellation, roleListener))
                .key(RoleAssignment::getMemberKey)
                .preFilter(assignment -> assignment.getMember().hasUserPrincipalName())
                .enricher(assignment -> mailboxSettings(assignment.getMember().getUserPrincipalName()))
                .predicate((assignment, settings) -> settings != null && settings.isShared())
                .dispatcher(dispatcher)
                .cancellation(cancellation)
                .build();
    }

    private List<DirectoryUser> listUsers() {
        return new PaginatedFetcher<>(client, DirectoryUser.class, cancellation, false).fetchAll(USERS_PATH);
    }
}
