package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.audit.MailboxAudits;
import com.yourcompany.entraid.tools.model.DirectoryUser;
import com.yourcompany.entraid.tools.pipeline.AuditReport;

import picocli.CommandLine.Command;

@Command(name = "audit-licenses", description = "List licensed users whose mailbox is a shared mailbox")
public class AuditLicensesCommand extends AbstractAuditCommand {

    @Override
    protected int audit(MailboxAudits audits) {
        AuditReport<DirectoryUser> report = audits.licensedSharedMailboxes().execute();
        for (String upn : report.getMatchedKeys()) {
            out().println("User with shared purpose and licenses: " + upn);
        }
        out().println("Total number of users with shared purpose and licenses: " + report.getMatchCount());
        printUndetermined(report);
        return 0;
    }
}
