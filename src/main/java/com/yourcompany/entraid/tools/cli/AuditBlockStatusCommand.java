package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.audit.MailboxAudits;
import com.yourcompany.entraid.tools.model.DirectoryUser;
import com.yourcompany.entraid.tools.pipeline.AuditReport;

import picocli.CommandLine.Command;

@Command(name = "audit-block-status", description = "List shared mailboxes whose sign-in is not blocked")
public class AuditBlockStatusCommand extends AbstractAuditCommand {

    @Override
    protected int audit(MailboxAudits audits) {
        AuditReport<DirectoryUser> report = audits.unblockedSharedMailboxes().execute();
        for (String upn : report.getMatchedKeys()) {
            out().println("Shared mailbox with sign-in enabled: " + upn);
        }
        out().println("Total number of shared mailboxes with sign-in enabled: " + report.getMatchCount());
        printUndetermined(report);
        return 0;
    }
}
