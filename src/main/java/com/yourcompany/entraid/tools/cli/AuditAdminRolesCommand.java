package com.yourcompany.entraid.tools.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.yourcompany.entraid.tools.audit.MailboxAudits;
import com.yourcompany.entraid.tools.model.DirectoryMember;
import com.yourcompany.entraid.tools.model.DirectoryRole;
import com.yourcompany.entraid.tools.model.RoleAssignment;
import com.yourcompany.entraid.tools.pipeline.AuditReport;

import picocli.CommandLine.Command;

@Command(name = "audit-admin-roles", description = "List shared mailboxes that hold a directory role")
public class AuditAdminRolesCommand extends AbstractAuditCommand {

    @Override
    protected int audit(MailboxAudits audits) {
        AuditReport<RoleAssignment> report = audits.adminRoleSharedMailboxes(this::printRole).execute();

        Map<String, List<String>> rolesByMember = new LinkedHashMap<>();
        for (RoleAssignment assignment : report.getMatches()) {
            rolesByMember.computeIfAbsent(assignment.getMemberKey(), key -> new ArrayList<>())
                    .add(assignment.getRole().getDisplayName());
        }
        for (Map.Entry<String, List<String>> entry : rolesByMember.entrySet()) {
            out().println(entry.getKey() + " is a shared mailbox with an admin role: "
                    + String.join(", ", entry.getValue()));
        }
        out().println("Total number of shared mailboxes with admin roles: " + report.getMatchCount());
        printUndetermined(report);
        return 0;
    }

    private void printRole(DirectoryRole role, List<DirectoryMember> members) {
        out().println("Role: " + role.getDisplayName());
        for (DirectoryMember member : members) {
            String upn = member.hasUserPrincipalName() ? member.getUserPrincipalName() : "no UPN";
            out().println("  Member: " + member.getDisplayName() + " (" + upn + ")");
        }
    }
}
