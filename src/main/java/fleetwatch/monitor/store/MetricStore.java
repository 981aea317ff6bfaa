package fleetwatch.monitor.store;

import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.Sample;
import fleetwatch.monitor.repository.SampleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collected samples per (metric, instance), ordered and deduplicated by timestamp,
 * plus the collection watermark of each (metric, instance) pair.
 *
 * New samples are written to the {@link SampleLog} before they become visible in memory,
 * so a failed write leaves the in-memory view consistent with what is on disk.
 */
public class MetricStore {

    private static final Logger log = LoggerFactory.getLogger(MetricStore.class);

    private final SampleLog sampleLog;
    private final Instant defaultWatermark;
    private final Map<Partition, NavigableMap<Instant, Sample>> partitions = new ConcurrentHashMap<>();
    private final Map<Partition, Instant> watermarks = new ConcurrentHashMap<>();
    private final Map<String, Instant> floors = new ConcurrentHashMap<>();

    /**
     * @param sampleLog        persistent sink
     * @param defaultWatermark watermark of instances never collected before
     *                         (loop start minus a safety margin)
     */
    public MetricStore(SampleLog sampleLog, Instant defaultWatermark) {
        this.sampleLog = sampleLog;
        this.defaultWatermark = defaultWatermark;
    }

    /**
     * Merge samples into the (metric, instance) log and persist the ones not seen before.
     *
     * @return number of new samples
     * @throws IllegalArgumentException if a sample belongs to another instance
     * @throws fleetwatch.monitor.error.PersistenceException if the write failed
     */
    public int append(MetricName metric, String instanceId, List<Sample> samples) {
        if (samples.isEmpty()) {
            return 0;
        }
        NavigableMap<Instant, Sample> partition = partition(metric, instanceId);

        synchronized (partition) {
            TreeMap<Instant, Sample> fresh = new TreeMap<>();
            for (Sample sample : samples) {
                if (!instanceId.equals(sample.instanceId())) {
                    throw new IllegalArgumentException("Sample for " + sample.instanceId()
                            + " appended to partition of " + instanceId);
                }
                if (!partition.containsKey(sample.timestamp())) {
                    fresh.putIfAbsent(sample.timestamp(), sample);
                }
            }
            if (fresh.isEmpty()) {
                return 0;
            }

            sampleLog.append(metric, new ArrayList<>(fresh.values()));
            partition.putAll(fresh);
            return fresh.size();
        }
    }

    /**
     * @return start of the next fetch window of the metric for the instance
     */
    public Instant watermark(MetricName metric, String instanceId) {
        Instant floor = floors.get(instanceId);
        Instant mark = watermarks.get(new Partition(metric, instanceId));
        if (mark == null) {
            return floor == null ? defaultWatermark : floor;
        }
        return floor != null && floor.isAfter(mark) ? floor : mark;
    }

    /**
     * @return earliest watermark of the instance's collected metrics, or the
     *         instance floor (default watermark unless advanced) if nothing was collected yet
     */
    public Instant watermark(String instanceId) {
        Instant earliest = null;
        for (Partition partition : watermarks.keySet()) {
            if (!partition.instanceId().equals(instanceId)) continue;
            Instant mark = watermark(partition.metric(), instanceId);
            if (earliest == null || mark.isBefore(earliest)) {
                earliest = mark;
            }
        }
        return earliest == null ? floors.getOrDefault(instanceId, defaultWatermark) : earliest;
    }

    /**
     * Move the (metric, instance) watermark forward. Timestamps before the current watermark
     * (or the default one, for a pair not collected yet) are ignored.
     */
    public void advanceWatermark(MetricName metric, String instanceId, Instant timestamp) {
        watermarks.compute(new Partition(metric, instanceId), (p, current) -> {
            Instant base = current == null ? defaultWatermark : current;
            return timestamp.isAfter(base) ? timestamp : base;
        });
    }

    /**
     * Move the watermark of every metric of the instance forward to at least {@code timestamp}.
     * Timestamps before the current floor are ignored.
     */
    public void advanceWatermark(String instanceId, Instant timestamp) {
        floors.compute(instanceId, (id, current) -> {
            Instant base = current == null ? defaultWatermark : current;
            return timestamp.isAfter(base) ? timestamp : base;
        });
    }

    /**
     * Drop samples older than the (metric, instance) watermark, keeping at least the
     * {@code keepRecent} newest ones. Samples at or after the watermark are still needed
     * to recognise re-fetched datapoints.
     *
     * @return number of samples dropped
     */
    public int trim(MetricName metric, String instanceId, int keepRecent) {
        NavigableMap<Instant, Sample> partition = partitions.get(new Partition(metric, instanceId));
        if (partition == null) {
            return 0;
        }
        Instant watermark = watermark(metric, instanceId);
        synchronized (partition) {
            int dropped = 0;
            while (partition.size() > keepRecent && partition.firstKey().isBefore(watermark)) {
                partition.pollFirstEntry();
                dropped++;
            }
            return dropped;
        }
    }

    /**
     * Release everything held for an instance that is no longer tracked.
     * Rows already in the sample log are kept.
     */
    public void forget(String instanceId) {
        partitions.keySet().removeIf(p -> p.instanceId().equals(instanceId));
        watermarks.keySet().removeIf(p -> p.instanceId().equals(instanceId));
        floors.remove(instanceId);
        log.debug("Released in-memory samples of {}", instanceId);
    }

    /**
     * @return up to {@code count} most recent values, oldest first
     */
    public List<Double> recentValues(MetricName metric, String instanceId, int count) {
        NavigableMap<Instant, Sample> partition = partitions.get(new Partition(metric, instanceId));
        if (partition == null) {
            return List.of();
        }
        synchronized (partition) {
            List<Double> values = new ArrayList<>(Math.min(count, partition.size()));
            for (Sample sample : partition.descendingMap().values()) {
                if (values.size() == count) break;
                values.add(sample.value());
            }
            Collections.reverse(values);
            return values;
        }
    }

    /**
     * @return number of samples held for the (metric, instance) pair
     */
    public int size(MetricName metric, String instanceId) {
        NavigableMap<Instant, Sample> partition = partitions.get(new Partition(metric, instanceId));
        if (partition == null) {
            return 0;
        }
        synchronized (partition) {
            return partition.size();
        }
    }

    /**
     * Rebuild the in-memory view from rows already in the sample log.
     * Each (metric, instance) watermark resumes at the latest timestamp persisted for it.
     *
     * @param metrics tracked metrics
     * @return number of rows loaded
     */
    public int recover(Collection<MetricName> metrics) {
        int loaded = 0;
        Map<Partition, Instant> resumeAt = new HashMap<>();

        for (MetricName metric : metrics) {
            for (Sample sample : sampleLog.readAll(metric)) {
                NavigableMap<Instant, Sample> partition = partition(metric, sample.instanceId());
                synchronized (partition) {
                    if (partition.putIfAbsent(sample.timestamp(), sample) == null) {
                        loaded++;
                    }
                }
                resumeAt.merge(new Partition(metric, sample.instanceId()), sample.timestamp(),
                        (a, b) -> a.isAfter(b) ? a : b);
            }
        }

        // Resume points may predate the default watermark of this process; they win
        resumeAt.forEach(watermarks::putIfAbsent);

        if (loaded > 0) {
            long instances = resumeAt.keySet().stream().map(Partition::instanceId).distinct().count();
            log.info("Recovered {} samples for {} instances from {}", loaded, instances, sampleLog.location());
        }
        return loaded;
    }

    public SampleLog sampleLog() {
        return sampleLog;
    }

    private NavigableMap<Instant, Sample> partition(MetricName metric, String instanceId) {
        return partitions.computeIfAbsent(new Partition(metric, instanceId), p -> new TreeMap<>());
    }

    private record Partition(MetricName metric, String instanceId) {
    }
}
