package com.yourcompany.entraid.tools.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

import org.identityconnectors.common.logging.Log;

/**
 * One fetch, enrich and aggregate pass.
 * <p>
 * Stages run strictly one after another: enrichment starts only once the
 * whole primary set is in memory, and aggregation only once every enrichment
 * task has completed. A run executes once.
 * </p>
 *
 * @param <R> Primary record type.
 * @param <V> Secondary value type.
 */
public final class AuditRun<R, V> {

    private static final Log LOG = Log.getLog(AuditRun.class);

    public enum State {
        IDLE, FETCHING, ENRICHING, AGGREGATING, REPORTED, FAILED
    }

    private final String name;
    private final PrimarySource<R> source;
    private final Function<? super R, String> keyFunction;
    private final Predicate<? super R> preFilter;
    private final Enricher<? super R, ? extends V> enricher;
    private final BiPredicate<? super R, ? super V> predicate;
    private final EnrichmentDispatcher dispatcher;
    private final ResultAggregator aggregator;
    private final CancellationSignal cancellation;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private AuditRun(Builder<R, V> builder) {
        this.name = builder.name;
        this.source = Objects.requireNonNull(builder.source, "source");
        this.keyFunction = Objects.requireNonNull(builder.keyFunction, "keyFunction");
        this.preFilter = builder.preFilter == null ? record -> true : builder.preFilter;
        this.enricher = Objects.requireNonNull(builder.enricher, "enricher");
        this.predicate = Objects.requireNonNull(builder.predicate, "predicate");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.aggregator = builder.aggregator == null ? new ResultAggregator() : builder.aggregator;
        this.cancellation = builder.cancellation == null ? new CancellationSignal() : builder.cancellation;
    }

    public static <R, V> Builder<R, V> builder(String name) {
        return new Builder<>(name);
    }

    public State getState() {
        return state.get();
    }

    /**
     * Runs every stage and returns the report.
     *
     * @throws com.yourcompany.entraid.tools.FetchException if the primary listing failed.
     * @throws java.util.concurrent.CancellationException  if the run was cancelled.
     * @throws IllegalStateException                       if the run was already executed.
     */
    public AuditReport<R> execute() {
        transition(State.IDLE, State.FETCHING);
        try {
            LOG.info("{0}: fetching primary records", name);
            List<R> records = List.copyOf(source.fetch());
            LOG.info("{0}: fetched {1} records", name, records.size());

            cancellation.throwIfCancelled("enrichment");
            transition(State.FETCHING, State.ENRICHING);
            EnrichmentMap<V> outcomes = dispatcher.dispatch(records, keyFunction, preFilter, enricher);

            cancellation.throwIfCancelled("aggregation");
            transition(State.ENRICHING, State.AGGREGATING);
            AuditReport<R> report = aggregator.aggregate(records, keyFunction, outcomes, predicate);

            transition(State.AGGREGATING, State.REPORTED);
            LOG.info("{0}: {1} matches, {2} undetermined", name, report.getMatchCount(),
                    report.getUndetermined().size());
            return report;
        } catch (RuntimeException e) {
            state.set(State.FAILED);
            throw e;
        }
    }

    private void transition(State from, State to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException(name + ": cannot move to " + to + " from " + state.get());
        }
        LOG.ok("{0}: {1} -> {2}", name, from, to);
    }

    public static final class Builder<R, V> {

        private final String name;
        private PrimarySource<R> source;
        private Function<? super R, String> keyFunction;
        private Predicate<? super R> preFilter;
        private Enricher<? super R, ? extends V> enricher;
        private BiPredicate<? super R, ? super V> predicate;
        private EnrichmentDispatcher dispatcher;
        private ResultAggregator aggregator;
        private CancellationSignal cancellation;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<R, V> source(PrimarySource<R> source) {
            this.source = source;
            return this;
        }

        public Builder<R, V> key(Function<? super R, String> keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder<R, V> preFilter(Predicate<? super R> preFilter) {
            this.preFilter = preFilter;
            return this;
        }

        public Builder<R, V> enricher(Enricher<? super R, ? extends V> enricher) {
            this.enricher = enricher;
            return this;
        }

        public Builder<R, V> predicate(BiPredicate<? super R, ? super V> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder<R, V> dispatcher(EnrichmentDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder<R, V> aggregator(ResultAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder<R, V> cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public AuditRun<R, V> build() {
            return new AuditRun<>(this);
        }
    }
}
