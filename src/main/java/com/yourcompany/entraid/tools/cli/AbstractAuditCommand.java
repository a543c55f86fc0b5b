package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.EntraIDConfiguration;
import com.yourcompany.entraid.tools.audit.MailboxAudits;
import com.yourcompany.entraid.tools.pipeline.AuditReport;
import com.yourcompany.entraid.tools.pipeline.CancellationSignal;
import com.yourcompany.entraid.tools.pipeline.EnrichmentDispatcher;
import com.yourcompany.entraid.tools.pipeline.EnrichmentRetryPolicy;
import com.yourcompany.entraid.tools.pipeline.UndeterminedRecord;

/**
 * Base of the read-only audits.
 */
public abstract class AbstractAuditCommand extends AbstractToolCommand {

    private final CancellationSignal cancellation = new CancellationSignal();

    @Override
    protected int run() {
        GraphSession session = openSession();
        EntraIDConfiguration configuration = session.getConfiguration();
        EnrichmentDispatcher dispatcher = new EnrichmentDispatcher(configuration.getMaxConcurrency(),
                EnrichmentRetryPolicy.fromConfiguration(configuration), cancellation);

        Thread cancelOnShutdown = new Thread(cancellation::cancel, "audit-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        try {
            return audit(new MailboxAudits(session.getClient(), dispatcher, cancellation));
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(cancelOnShutdown);
            } catch (IllegalStateException e) {
                // JVM already shutting down
            }
        }
    }

    protected abstract int audit(MailboxAudits audits);

    /**
     * Reports the records that could be neither confirmed nor ruled out.
     */
    protected void printUndetermined(AuditReport<?> report) {
        if (verbose) {
            err().println("Examined " + report.getExaminedCount() + " records, enriched "
                    + report.getEnrichedCount());
        }
        err().println("Records that could not be checked: " + report.getUndetermined().size());
        if (verbose) {
            for (UndeterminedRecord record : report.getUndetermined()) {
                err().println("  " + record.getKey() + ": " + record.getReason());
            }
        }
    }
}
