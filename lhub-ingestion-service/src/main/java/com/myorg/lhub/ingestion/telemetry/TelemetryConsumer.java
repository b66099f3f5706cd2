package com.myorg.lhub.ingestion.telemetry;

import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import com.myorg.lhub.contracts.validation.EventValidator;
import com.myorg.lhub.contracts.validation.ValidationResult;
import com.myorg.lhub.eventing.retry.BoundedRetry;
import com.myorg.lhub.eventing.retry.RetryExhaustedException;
import com.myorg.lhub.eventing.retry.RetryListener;
import com.myorg.lhub.ingestion.support.DeadLetterRecorder;
import com.myorg.lhub.kafka.HubDlqReason;
import com.myorg.lhub.observability.HubMdc;
import com.myorg.lhub.observability.HubMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Batches telemetry records from one topic and writes each batch to the time-series store in a
 * single bulk insert. A batch is flushed as soon as it holds {@code maxCount} records or its oldest
 * record is {@code maxAge} old, whichever comes first; offsets are committed after the flush.
 *
 * <p>One instance per telemetry topic, each on its own thread with its own consumer group.
 */
@Slf4j
public class TelemetryConsumer implements SmartLifecycle, DisposableBean {

    public enum State {
        IDLE,
        ACCUMULATING,
        COUNT_THRESHOLD_MET,
        TIMER_EXPIRED,
        FLUSHING,
        SHUTTING_DOWN,
        TERMINAL
    }

    /** Batch bounds and loop timing. */
    public record Settings(int maxCount, Duration maxAge, Duration checkInterval, Duration shutdownTimeout) {
        public Settings {
            if (maxCount <= 0) throw new IllegalArgumentException("maxCount must be > 0");
            if (maxAge.isNegative() || maxAge.isZero()) throw new IllegalArgumentException("maxAge must be > 0");
            if (checkInterval.isNegative() || checkInterval.isZero()) throw new IllegalArgumentException("checkInterval must be > 0");
        }
    }

    private final String name;
    private final Supplier<Consumer<String, byte[]>> consumerFactory;
    private final String topic;
    private final PayloadKind kind;
    private final String table;
    private final TelemetryRowMapper rowMapper;
    private final EnvelopeCodec codec;
    private final EventValidator validator;
    private final TimeSeriesStore store;
    private final BoundedRetry retry;
    private final DeadLetterRecorder deadLetters;
    private final HubMetrics metrics; // nullable
    private final boolean mdcEnabled;
    private final Settings settings;
    private final Clock clock;

    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final TelemetryBatch batch = new TelemetryBatch(); // loop thread only
    private volatile State state = State.IDLE;
    private volatile Consumer<String, byte[]> consumer;
    private volatile boolean running;
    private volatile boolean interrupted;
    private volatile Thread thread;
    private CountDownLatch finished = new CountDownLatch(0);

    public TelemetryConsumer(String name,
                             Supplier<Consumer<String, byte[]>> consumerFactory,
                             String topic,
                             PayloadKind kind,
                             String table,
                             TelemetryRowMapper rowMapper,
                             EnvelopeCodec codec,
                             EventValidator validator,
                             TimeSeriesStore store,
                             BoundedRetry retry,
                             DeadLetterRecorder deadLetters,
                             HubMetrics metrics,
                             boolean mdcEnabled,
                             Settings settings,
                             Clock clock) {
        this.name = name;
        this.consumerFactory = consumerFactory;
        this.topic = topic;
        this.kind = kind;
        this.table = table;
        this.rowMapper = rowMapper;
        this.codec = codec;
        this.validator = validator;
        this.store = store;
        this.retry = retry;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.mdcEnabled = mdcEnabled;
        this.settings = settings;
        this.clock = clock;
    }

    public State state() {
        return state;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        shutdown.set(false);
        interrupted = false;
        finished = new CountDownLatch(1);
        consumer = consumerFactory.get();
        running = true;
        thread = new Thread(this::runLoop, name);
        thread.start();
        log.info("Telemetry consumer started name={} topic={} table={} maxCount={} maxAge={}",
                name, topic, table, settings.maxCount(), settings.maxAge());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        shutdown.set(true);
        Consumer<String, byte[]> c = consumer;
        if (c != null) c.wakeup();
        try {
            if (!finished.await(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Telemetry consumer name={} did not stop within {}; interrupting", name, settings.shutdownTimeout());
                thread.interrupt();
                finished.await(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = false;
        log.info("Telemetry consumer stopped name={} state={}", name, state);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Releases the retry workers; the loop cannot be started again afterwards. */
    @Override
    public void destroy() {
        stop();
        retry.close();
    }

    private void runLoop() {
        Consumer<String, byte[]> c = consumer;
        try {
            c.subscribe(List.of(topic), new FlushOnRevoke(c));
            while (!shutdown.get() && !interrupted) {
                state = State.ACCUMULATING;
                ConsumerRecords<String, byte[]> records;
                try {
                    records = c.poll(nextPollTimeout());
                } catch (WakeupException e) {
                    if (shutdown.get()) break;
                    continue;
                }
                for (ConsumerRecord<String, byte[]> rec : records) {
                    batch.add(rec, clock.instant());
                    if (batch.size() >= settings.maxCount()) {
                        state = State.COUNT_THRESHOLD_MET;
                        if (!flush(c, "count")) break;
                    }
                }
                if (!interrupted && !batch.isEmpty() && batch.age(clock.instant()).compareTo(settings.maxAge()) >= 0) {
                    state = State.TIMER_EXPIRED;
                    flush(c, "age");
                }
            }
        } catch (RuntimeException e) {
            log.error("Telemetry consumer loop failed name={} topic={}", name, topic, e);
        } finally {
            state = State.SHUTTING_DOWN;
            try {
                if (!interrupted) flush(c, "shutdown");
                c.close();
            } catch (RuntimeException e) {
                log.warn("Error closing telemetry consumer name={}: {}", name, e.toString());
            }
            state = State.TERMINAL;
            // a loop that died on its own must be restartable
            if (thread == Thread.currentThread()) running = false;
            finished.countDown();
        }
    }

    /** min(check interval, time left until the oldest entry reaches maxAge) */
    Duration nextPollTimeout() {
        if (batch.isEmpty()) return settings.checkInterval();
        Duration left = settings.maxAge().minus(batch.age(clock.instant()));
        if (left.isNegative()) return Duration.ZERO;
        return left.compareTo(settings.checkInterval()) < 0 ? left : settings.checkInterval();
    }

    /**
     * Writes the open batch and commits it.
     *
     * @return false when interrupted; nothing is committed and the loop must end
     */
    private boolean flush(Consumer<String, byte[]> c, String trigger) {
        if (batch.isEmpty()) return true;
        state = State.FLUSHING;
        long startNanos = System.nanoTime();
        List<ConsumerRecord<String, byte[]>> records = batch.drain();

        List<ConsumerRecord<String, byte[]>> written = new ArrayList<>(records.size());
        List<IngestEnvelope> envelopes = new ArrayList<>(records.size());
        List<Object> rows = new ArrayList<>(records.size());
        for (ConsumerRecord<String, byte[]> rec : records) {
            IngestEnvelope env = null;
            try {
                env = codec.decode(rec.value());
                if (env.getPayloadKind() != kind) {
                    throw new EnvelopeCodecException("expected " + kind + " envelope, got " + env.getPayloadKind());
                }
                ValidationResult vr = validator.validate(kind, env.getPayload());
                if (!vr.isValid()) {
                    throw new EnvelopeCodecException("invalid " + kind + " payload: " + vr.error());
                }
                rows.add(rowMapper.toRow(env.getTenantNamespace(), vr.event()));
                written.add(rec);
                envelopes.add(env);
            } catch (EnvelopeCodecException e) {
                log.warn("Undecodable telemetry record topic={} partition={} offset={} error={}",
                        rec.topic(), rec.partition(), rec.offset(), e.getMessage());
                deadLetters.record(rec, env, HubDlqReason.DESERIALIZATION.code(), 1, true, e);
            }
        }

        if (!rows.isEmpty()) {
            try {
                retry.call("bulk insert " + table + " rows=" + rows.size(), () -> {
                    store.bulkInsert(table, rows);
                    return null;
                }, retryListener());
                if (metrics != null) {
                    metrics.incFlushed(kind, rows.size());
                    metrics.recordFlushLatency(kind, Duration.ofNanos(System.nanoTime() - startNanos));
                }
                log.info("Flushed name={} table={} rows={} trigger={}", name, table, rows.size(), trigger);
            } catch (RetryExhaustedException e) {
                if (HubDlqReason.INTERRUPTED.code().equals(e.getReason())) {
                    log.warn("Interrupted while flushing name={} rows={}; leaving batch uncommitted", name, rows.size());
                    interrupted = true;
                    return false;
                }
                log.error("Flush failed name={} table={} rows={} attempts={} reason={}; dead-lettering batch",
                        name, table, rows.size(), e.getAttempts(), e.getReason());
                for (int i = 0; i < written.size(); i++) {
                    IngestEnvelope env = envelopes.get(i);
                    if (mdcEnabled) HubMdc.putNamespace(env.getTenantNamespace());
                    try {
                        deadLetters.record(written.get(i), env, e.getReason(), e.getAttempts(), e.isNonRetryable(), e.getCause());
                    } finally {
                        if (mdcEnabled) HubMdc.clear();
                    }
                }
            }
        }

        commit(c, TelemetryBatch.commitPositions(records));
        return true;
    }

    private RetryListener retryListener() {
        return (what, attempt, error, backoff) -> {
            if (metrics != null) metrics.incTelemetryRetry();
        };
    }

    private void commit(Consumer<String, byte[]> c, Map<TopicPartition, OffsetAndMetadata> offsets) {
        try {
            try {
                c.commitSync(offsets);
            } catch (WakeupException e) {
                // wakeup from stop() lands on whichever blocking call comes next
                c.commitSync(offsets);
            }
        } catch (CommitFailedException e) {
            log.warn("Commit failed name={} offsets={} error={}", name, offsets, e.getMessage());
        }
    }

    private final class FlushOnRevoke implements ConsumerRebalanceListener {
        private final Consumer<String, byte[]> c;

        FlushOnRevoke(Consumer<String, byte[]> c) {
            this.c = c;
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.info("Telemetry partitions revoked name={} partitions={}", name, partitions);
            if (!interrupted) flush(c, "revoke");
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Telemetry partitions assigned name={} partitions={}", name, partitions);
        }
    }
}
