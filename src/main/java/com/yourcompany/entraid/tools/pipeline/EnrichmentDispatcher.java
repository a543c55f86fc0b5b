package com.yourcompany.entraid.tools.pipeline;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

import org.identityconnectors.common.logging.Log;

import io.github.resilience4j.retry.Retry;

/**
 * Fans a per-record secondary fetch out over a fixed pool of workers.
 * <p>
 * At most {@code maxConcurrency} enrichment calls are in flight at any time.
 * A failed record, including one whose enricher threw an {@link Error}
 * other than a {@link VirtualMachineError}, is logged and recorded as a
 * failure outcome; it never affects sibling records nor the dispatch as a
 * whole. Records without a key are not enriched. {@link #dispatch}
 * returns only once every started task has completed.
 * </p>
 */
public class EnrichmentDispatcher {

    private static final Log LOG = Log.getLog(EnrichmentDispatcher.class);

    private final int maxConcurrency;
    private final EnrichmentRetryPolicy retryPolicy;
    private final CancellationSignal cancellation;

    public EnrichmentDispatcher(int maxConcurrency, EnrichmentRetryPolicy retryPolicy,
            CancellationSignal cancellation) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.retryPolicy = retryPolicy;
        this.cancellation = cancellation;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Enriches every record accepted by {@code preFilter}.
     *
     * @param records     The complete primary record set, in discovery order.
     * @param keyFunction Identity of a record; a key is dispatched at most once.
     * @param preFilter   Cheap synchronous eligibility check.
     * @param enricher    The secondary fetch.
     * @return One outcome per dispatched key; skipped records have no entry.
     */
    public <R, V> EnrichmentMap<V> dispatch(List<R> records, Function<? super R, String> keyFunction,
            Predicate<? super R> preFilter, Enricher<? super R, ? extends V> enricher) {
        EnrichmentMap<V> outcomes = new EnrichmentMap<>();

        List<R> eligible = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (R record : records) {
            if (!preFilter.test(record)) {
                continue;
            }
            String key = keyFunction.apply(record);
            if (key == null) {
                LOG.ok("Record {0} has no key, skipping enrichment", record);
                continue;
            }
            if (!seen.add(key)) {
                LOG.ok("Record {0} already dispatched, skipping duplicate", key);
                continue;
            }
            eligible.add(record);
        }

        LOG.info("Dispatching enrichment for {0} of {1} records with up to {2} concurrent requests",
                eligible.size(), records.size(), maxConcurrency);
        if (eligible.isEmpty()) {
            return outcomes;
        }

        Retry retry = retryPolicy.toRetry("enrichment");
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxConcurrency, eligible.size()),
                new WorkerThreadFactory());
        try {
            List<CompletableFuture<Void>> tasks = new ArrayList<>(eligible.size());
            for (R record : eligible) {
                if (cancellation.isCancelled()) {
                    LOG.warn("Run cancelled, {0} of {1} enrichment tasks submitted", tasks.size(), eligible.size());
                    break;
                }
                String key = keyFunction.apply(record);
                tasks.add(CompletableFuture.runAsync(() -> enrichOne(record, key, enricher, retry, outcomes),
                        executor));
            }
            // completion barrier: aggregation must not see a partially written map
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();
        } finally {
            executor.shutdown();
        }

        LOG.info("Enrichment finished: {0} outcomes, {1} failures", outcomes.size(), outcomes.failures().size());
        return outcomes;
    }

    private <R, V> void enrichOne(R record, String key, Enricher<? super R, ? extends V> enricher, Retry retry,
            EnrichmentMap<V> outcomes) {
        if (cancellation.isCancelled()) {
            LOG.ok("Run cancelled, not enriching {0}", key);
            return;
        }

        EnrichmentOutcome<V> outcome;
        try {
            V value = retry.executeCallable(() -> enricher.enrich(record));
            outcome = EnrichmentOutcome.success(value);
            LOG.ok("Enriched {0}: {1}", key, value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = EnrichmentOutcome.failure("interrupted");
            LOG.ok("Enrichment of {0} interrupted", key);
        } catch (Exception e) {
            outcome = EnrichmentOutcome.failure(e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            LOG.ok("Error fetching enrichment for {0}: {1}", key, outcome.getFailureMessage());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            outcome = EnrichmentOutcome.failure(e.toString());
            LOG.warn(e, "Enricher failed with an error for {0}", key);
        }
        outcomes.record(key, outcome);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "graph-enrich-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
