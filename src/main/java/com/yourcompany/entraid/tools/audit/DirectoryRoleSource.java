package com.yourcompany.entraid.tools.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

import org.identityconnectors.common.logging.Log;

import com.yourcompany.entraid.tools.GraphRestClient;
import com.yourcompany.entraid.tools.model.DirectoryMember;
import com.yourcompany.entraid.tools.model.DirectoryRole;
import com.yourcompany.entraid.tools.model.RoleAssignment;
import com.yourcompany.entraid.tools.pipeline.CancellationSignal;
import com.yourcompany.entraid.tools.pipeline.PaginatedFetcher;
import com.yourcompany.entraid.tools.pipeline.PrimarySource;

/**
 * Lists every activated directory role and then, role by role, its members.
 * The result is flattened into one {@link RoleAssignment} per (role, member).
 */
public class DirectoryRoleSource implements PrimarySource<RoleAssignment> {

    private static final Log LOG = Log.getLog(DirectoryRoleSource.class);

    static final String ROLES_PATH = "/directoryRoles?$select=id,displayName";
    private static final String MEMBER_SELECT = "$select=id,displayName,userPrincipalName";

    private final PaginatedFetcher<DirectoryRole> roleFetcher;
    private final PaginatedFetcher<DirectoryMember> memberFetcher;
    private final BiConsumer<DirectoryRole, List<DirectoryMember>> roleListener;

    /**
     * @param roleListener Called once per role, in order, with its members.
     */
    public DirectoryRoleSource(GraphRestClient client, CancellationSignal cancellation,
            BiConsumer<DirectoryRole, List<DirectoryMember>> roleListener) {
        this.roleFetcher = new PaginatedFetcher<>(client, DirectoryRole.class, cancellation, false);
        this.memberFetcher = new PaginatedFetcher<>(client, DirectoryMember.class, cancellation, false);
        this.roleListener = roleListener;
    }

    static String membersPath(String roleId) {
        return "/directoryRoles/" + GraphRestClient.segment(roleId) + "/members?" + MEMBER_SELECT;
    }

    @Override
    public List<RoleAssignment> fetch() {
        List<DirectoryRole> roles = roleFetcher.fetchAll(ROLES_PATH);
        LOG.info("Fetched {0} directory roles", roles.size());

        List<RoleAssignment> assignments = new ArrayList<>();
        for (DirectoryRole role : roles) {
            List<DirectoryMember> members = memberFetcher.fetchAll(membersPath(role.getId()));
            LOG.ok("Role {0} has {1} members", role.getDisplayName(), members.size());
            roleListener.accept(role, members);
            for (DirectoryMember member : members) {
                assignments.add(new RoleAssignment(role, member));
            }
        }
        return assignments;
    }
}
