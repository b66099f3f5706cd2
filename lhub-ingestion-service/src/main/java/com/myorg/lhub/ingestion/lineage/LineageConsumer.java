package com.myorg.lhub.ingestion.lineage;

import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.contracts.core.envelope.IngestEnvelope;
import com.myorg.lhub.contracts.core.envelope.PayloadKind;
import com.myorg.lhub.contracts.core.exception.EnvelopeCodecException;
import com.myorg.lhub.eventing.retry.BoundedRetry;
import com.myorg.lhub.eventing.retry.RetryExhaustedException;
import com.myorg.lhub.eventing.retry.RetryListener;
import com.myorg.lhub.ingestion.support.DeadLetterRecorder;
import com.myorg.lhub.kafka.HubDlqReason;
import com.myorg.lhub.observability.HubContext;
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

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Forwards lineage envelopes to the lineage store one at a time, in partition order, committing
 * each offset only after the store accepted the event or the event was dead-lettered.
 *
 * <p>Runs on its own thread with its own consumer. {@link #stop()} lets the current record finish,
 * commits, and closes the consumer.
 */
@Slf4j
public class LineageConsumer implements SmartLifecycle, DisposableBean {

    public enum State {
        IDLE,
        POLLING,
        PROCESSING,
        COMMITTING,
        SHUTTING_DOWN,
        TERMINAL
    }

    private final Supplier<Consumer<String, byte[]>> consumerFactory;
    private final String topic;
    private final EnvelopeCodec codec;
    private final LineageStoreClient store;
    private final BoundedRetry retry;
    private final DeadLetterRecorder deadLetters;
    private final HubMetrics metrics; // nullable
    private final boolean mdcEnabled;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;

    private final AtomicBoolean shutdown = new AtomicBoolean();
    // processed but not yet committed; touched by the loop thread only
    private final Map<TopicPartition, OffsetAndMetadata> pending = new HashMap<>();
    private volatile State state = State.IDLE;
    private volatile Consumer<String, byte[]> consumer;
    private volatile boolean running;
    private volatile Thread thread;
    private CountDownLatch finished = new CountDownLatch(0);

    public LineageConsumer(Supplier<Consumer<String, byte[]>> consumerFactory,
                           String topic,
                           EnvelopeCodec codec,
                           LineageStoreClient store,
                           BoundedRetry retry,
                           DeadLetterRecorder deadLetters,
                           HubMetrics metrics,
                           boolean mdcEnabled,
                           Duration pollTimeout,
                           Duration shutdownTimeout) {
        this.consumerFactory = consumerFactory;
        this.topic = topic;
        this.codec = codec;
        this.store = store;
        this.retry = retry;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.mdcEnabled = mdcEnabled;
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    public State state() {
        return state;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        shutdown.set(false);
        finished = new CountDownLatch(1);
        consumer = consumerFactory.get();
        running = true;
        thread = new Thread(this::runLoop, "lhub-lineage-consumer");
        thread.start();
        log.info("Lineage consumer started topic={}", topic);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        shutdown.set(true);
        Consumer<String, byte[]> c = consumer;
        if (c != null) c.wakeup();
        try {
            if (!finished.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Lineage consumer did not stop within {}; interrupting", shutdownTimeout);
                thread.interrupt();
                finished.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = false;
        log.info("Lineage consumer stopped state={}", state);
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
            c.subscribe(List.of(topic), new CommitOnRevoke(c));
            while (!shutdown.get()) {
                state = State.POLLING;
                ConsumerRecords<String, byte[]> records;
                try {
                    records = c.poll(pollTimeout);
                } catch (WakeupException e) {
                    if (shutdown.get()) break;
                    continue;
                }
                if (!processBatch(c, records)) break;
            }
        } catch (RuntimeException e) {
            log.error("Lineage consumer loop failed topic={}", topic, e);
        } finally {
            state = State.SHUTTING_DOWN;
            try {
                commitPending(c);
                c.close();
            } catch (RuntimeException e) {
                log.warn("Error closing lineage consumer: {}", e.toString());
            }
            state = State.TERMINAL;
            // a loop that died on its own must be restartable
            if (thread == Thread.currentThread()) running = false;
            finished.countDown();
        }
    }

    /** @return false when the loop must end without taking further records */
    private boolean processBatch(Consumer<String, byte[]> c, ConsumerRecords<String, byte[]> records) {
        for (TopicPartition tp : records.partitions()) {
            for (ConsumerRecord<String, byte[]> rec : records.records(tp)) {
                state = State.PROCESSING;
                if (!process(rec)) {
                    return false;
                }
                state = State.COMMITTING;
                pending.put(tp, new OffsetAndMetadata(rec.offset() + 1));
                commitPending(c);
                if (shutdown.get()) {
                    // uncommitted remainder is redelivered to the next owner
                    return false;
                }
            }
        }
        return true;
    }

    /** @return false when interrupted; the record is then left uncommitted */
    private boolean process(ConsumerRecord<String, byte[]> rec) {
        HubContext ctx = HubContext.ofRecord(rec.topic(), rec.partition(), rec.offset());
        if (mdcEnabled) HubMdc.put(ctx);
        try {
            IngestEnvelope env;
            try {
                env = codec.decode(rec.value());
                if (env.getPayloadKind() != PayloadKind.LINEAGE) {
                    throw new EnvelopeCodecException("expected LINEAGE envelope, got " + env.getPayloadKind());
                }
            } catch (EnvelopeCodecException e) {
                log.warn("Undecodable lineage record topic={} partition={} offset={} error={}",
                        rec.topic(), rec.partition(), rec.offset(), e.getMessage());
                deadLetters.record(rec, null, HubDlqReason.DESERIALIZATION.code(), 1, true, e);
                return true;
            }

            if (mdcEnabled) HubMdc.put(ctx.withEvent(env.getTenantNamespace(), env.getEventId(), env.getPayloadKind().name()));
            try {
                retry.call("forward lineage eventId=" + env.getEventId(), () -> {
                    store.send(env.getPayload());
                    return null;
                }, retryListener());
                if (metrics != null) metrics.incLineageForwarded();
                log.debug("Forwarded lineage namespace={} eventId={} runId={} partition={} offset={}",
                        env.getTenantNamespace(), env.getEventId(), env.getPartitionKey(), rec.partition(), rec.offset());
                return true;
            } catch (RetryExhaustedException e) {
                if (HubDlqReason.INTERRUPTED.code().equals(e.getReason())) {
                    log.warn("Interrupted while forwarding eventId={} partition={} offset={}; leaving uncommitted",
                            env.getEventId(), rec.partition(), rec.offset());
                    return false;
                }
                deadLetters.record(rec, env, e.getReason(), e.getAttempts(), e.isNonRetryable(), e.getCause());
                return true;
            }
        } finally {
            if (mdcEnabled) HubMdc.clear();
        }
    }

    private RetryListener retryListener() {
        return (what, attempt, error, backoff) -> {
            if (metrics != null) metrics.incLineageRetry();
        };
    }

    private void commitPending(Consumer<String, byte[]> c) {
        if (pending.isEmpty()) return;
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>(pending);
        try {
            commit(c, offsets);
        } catch (CommitFailedException e) {
            // partitions already reassigned; the new owner replays from the last commit
            log.warn("Commit failed offsets={} error={}", offsets, e.getMessage());
        }
        pending.clear();
    }

    private static void commit(Consumer<String, byte[]> c, Map<TopicPartition, OffsetAndMetadata> offsets) {
        try {
            c.commitSync(offsets);
        } catch (WakeupException e) {
            // wakeup from stop() lands on whichever blocking call comes next
            c.commitSync(offsets);
        }
    }

    private final class CommitOnRevoke implements ConsumerRebalanceListener {
        private final Consumer<String, byte[]> c;

        CommitOnRevoke(Consumer<String, byte[]> c) {
            this.c = c;
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.info("Lineage partitions revoked {}", partitions);
            commitPending(c);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Lineage partitions assigned {}", partitions);
        }
    }
}
