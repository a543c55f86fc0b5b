package com.yourcompany.entraid.tools.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import com.yourcompany.entraid.tools.GraphRequestException;

public class AuditRunTest {

    private static final Map<String, String> PURPOSES = Map.of(
            "alice@contoso.com", "shared",
            "bob@contoso.com", "user",
            "carol@contoso.com", "shared");

    private static AuditRun.Builder<String, String> sharedMailboxAudit(List<String> users) {
        return AuditRun.<String, String>builder("shared-mailboxes")
                .source(() -> users)
                .key(Function.identity())
                .enricher(PURPOSES::get)
                .predicate((user, purpose) -> "shared".equals(purpose))
                .dispatcher(new EnrichmentDispatcher(2, EnrichmentRetryPolicy.noRetry(), new CancellationSignal()));
    }

    @Test
    public void reportsSharedMailboxesInDiscoveryOrder() {
        AuditRun<String, String> run = sharedMailboxAudit(
                List.of("alice@contoso.com", "bob@contoso.com", "carol@contoso.com")).build();

        AuditReport<String> report = run.execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com", "carol@contoso.com");
        assertThat(report.getMatchCount()).isEqualTo(2);
        assertThat(run.getState()).isEqualTo(AuditRun.State.REPORTED);
    }

    @Test
    public void failedEnrichmentLeavesOtherMatchesIntact() {
        AuditRun<String, String> run = AuditRun.<String, String>builder("shared-mailboxes")
                .source(() -> List.of("alice@contoso.com", "bob@contoso.com", "carol@contoso.com"))
                .key(Function.identity())
                .enricher(user -> {
                    if (user.startsWith("bob")) {
                        throw new GraphRequestException("GET bob failed: 500 - oops", 500, "oops");
                    }
                    return PURPOSES.get(user);
                })
                .predicate((user, purpose) -> "shared".equals(purpose))
                .dispatcher(new EnrichmentDispatcher(4, EnrichmentRetryPolicy.noRetry(), new CancellationSignal()))
                .build();

        AuditReport<String> report = run.execute();

        assertThat(report.getMatchedKeys()).containsExactly("alice@contoso.com", "carol@contoso.com");
        assertThat(report.getUndetermined()).extracting(UndeterminedRecord::getKey).containsExactly("bob@contoso.com");
    }

    @Test
    public void identicalInputsGiveIdenticalReports() {
        List<String> users = List.of("carol@contoso.com", "bob@contoso.com", "alice@contoso.com");

        AuditReport<String> first = sharedMailboxAudit(users).build().execute();
        AuditReport<String> second = sharedMailboxAudit(users).build().execute();

        assertThat(second.getMatchedKeys()).isEqualTo(first.getMatchedKeys());
        assertThat(second.getMatches()).isEqualTo(first.getMatches());
    }

    @Test
    public void preFilterKeepsRecordsOutOfEnrichment() {
        List<String> enriched = new ArrayList<>();
        AuditRun<String, String> run = sharedMailboxAudit(List.of("alice@contoso.com", "carol@contoso.com"))
                .preFilter(user -> user.startsWith("carol"))
                .enricher(user -> {
                    enriched.add(user);
                    return PURPOSES.get(user);
                })
                .dispatcher(new EnrichmentDispatcher(1, EnrichmentRetryPolicy.noRetry(), new CancellationSignal()))
                .build();

        AuditReport<String> report = run.execute();

        assertThat(enriched).containsExactly("carol@contoso.com");
        assertThat(report.getMatchedKeys()).containsExactly("carol@contoso.com");
    }

    @Test
    public void executesOnlyOnce() {
        AuditRun<String, String> run = sharedMailboxAudit(List.of("alice@contoso.com")).build();
        run.execute();

        assertThatThrownBy(run::execute).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void failedListingFailsTheRun() {
        AuditRun<String, String> run = sharedMailboxAudit(List.of())
                .source(() -> {
                    throw new IllegalStateException("listing failed");
                })
                .build();

        assertThatThrownBy(run::execute).hasMessage("listing failed");
        assertThat(run.getState()).isEqualTo(AuditRun.State.FAILED);
    }

    @Test
    public void cancelledRunDoesNotReport() {
        CancellationSignal cancellation = new CancellationSignal();
        AuditRun<String, String> run = sharedMailboxAudit(List.of("alice@contoso.com"))
                .source(() -> {
                    cancellation.cancel();
                    return List.of("alice@contoso.com");
                })
                .cancellation(cancellation)
                .build();

        assertThatThrownBy(run::execute).isInstanceOf(CancellationException.class);
        assertThat(run.getState()).isEqualTo(AuditRun.State.FAILED);
    }

    @Test
    public void startsIdle() {
        assertThat(sharedMailboxAudit(List.of()).build().getState()).isEqualTo(AuditRun.State.IDLE);
    }
}
