package com.myorg.lhub.ingestion.telemetry;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Records waiting for the next flush, in arrival order. Not thread-safe. */
class TelemetryBatch {

    private List<ConsumerRecord<String, byte[]>> records = new ArrayList<>();
    private Instant firstArrival;

    void add(ConsumerRecord<String, byte[]> rec, Instant now) {
        if (records.isEmpty()) firstArrival = now;
        records.add(rec);
    }

    int size() {
        return records.size();
    }

    boolean isEmpty() {
        return records.isEmpty();
    }

    /** Age of the oldest entry; zero for an empty batch. */
    Duration age(Instant now) {
        if (firstArrival == null) return Duration.ZERO;
        return Duration.between(firstArrival, now);
    }

    List<ConsumerRecord<String, byte[]>> drain() {
        List<ConsumerRecord<String, byte[]>> out = records;
        records = new ArrayList<>();
        firstArrival = null;
        return out;
    }

    /** Highest offset + 1 per partition. */
    static Map<TopicPartition, OffsetAndMetadata> commitPositions(List<ConsumerRecord<String, byte[]>> recs) {
        Map<TopicPartition, OffsetAndMetadata> out = new HashMap<>();
        for (ConsumerRecord<String, byte[]> r : recs) {
            TopicPartition tp = new TopicPartition(r.topic(), r.partition());
            OffsetAndMetadata cur = out.get(tp);
            if (cur == null || cur.offset() < r.offset() + 1) {
                out.put(tp, new OffsetAndMetadata(r.offset() + 1));
            }
        }
        return out;
    }
}
