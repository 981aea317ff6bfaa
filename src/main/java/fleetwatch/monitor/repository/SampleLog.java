package fleetwatch.monitor.repository;

import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.Sample;

import java.nio.file.Path;
import java.util.List;

/**
 * Append-only persistent sink for collected samples, one stream per metric.
 * Implementations throw {@link fleetwatch.monitor.error.PersistenceException} on I/O failure.
 */
public interface SampleLog {

    /**
     * Append rows to the metric's stream. Previously written rows are never rewritten.
     *
     * @param metric  the metric the samples belong to
     * @param samples rows to append, in write order
     */
    void append(MetricName metric, List<Sample> samples);

    /**
     * Read back every row previously written for a metric.
     *
     * @param metric the metric
     * @return rows in file order, empty if nothing was written yet
     */
    List<Sample> readAll(MetricName metric);

    /**
     * @return directory holding this run's streams
     */
    Path location();
}
