package fleetwatch.cloud.metrics;

import fleetwatch.cloud.AwsErrors;
import fleetwatch.monitor.error.InstanceNotFoundException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.MetricsBackend;
import fleetwatch.monitor.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * MetricsBackend backed by CloudWatch GetMetricStatistics.
 *
 * CloudWatch returns at most 1440 datapoints per call, so wider windows are fetched
 * in consecutive chunks of {@code 1440 x period}.
 */
public class CloudWatchMetricsBackend implements MetricsBackend {

    private static final Logger log = LoggerFactory.getLogger(CloudWatchMetricsBackend.class);

    static final int MAX_DATAPOINTS = 1440;
    static final String INSTANCE_DIMENSION = "InstanceId";

    private final CloudWatchClient cloudWatch;

    public CloudWatchMetricsBackend(CloudWatchClient cloudWatch) {
        this.cloudWatch = cloudWatch;
    }

    @Override
    public List<Sample> fetchMetricStatistics(String namespace, String metricName, String instanceId,
            Instant start, Instant end, Duration period, String statistic)
            throws TransientBackendException, InstanceNotFoundException {
        if (!end.isAfter(start)) {
            return List.of();
        }
        Statistic stat = Statistic.fromValue(statistic);
        if (stat == Statistic.UNKNOWN_TO_SDK_VERSION) {
            throw new IllegalArgumentException("Unsupported statistic: " + statistic);
        }
        Duration chunk = period.multipliedBy(MAX_DATAPOINTS);

        List<Sample> samples = new ArrayList<>();
        Instant chunkStart = start;
        while (chunkStart.isBefore(end)) {
            Instant chunkEnd = chunkStart.plus(chunk);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }

            GetMetricStatisticsRequest request = GetMetricStatisticsRequest.builder()
                    .namespace(namespace)
                    .metricName(metricName)
                    .dimensions(Dimension.builder().name(INSTANCE_DIMENSION).value(instanceId).build())
                    .startTime(chunkStart)
                    .endTime(chunkEnd)
                    .period((int) period.toSeconds())
                    .statistics(stat)
                    .build();

            GetMetricStatisticsResponse response;
            try {
                response = cloudWatch.getMetricStatistics(request);
            } catch (SdkException e) {
                String what = namespace + "/" + metricName + " for " + instanceId;
                if (AwsErrors.isNotFound(e)) {
                    throw new InstanceNotFoundException(instanceId, what + ": " + AwsErrors.describe(e), e);
                }
                if (AwsErrors.isTransient(e)) {
                    throw new TransientBackendException(what + ": " + AwsErrors.describe(e), e);
                }
                throw e;
            }

            for (Datapoint datapoint : response.datapoints()) {
                Double value = valueOf(datapoint, stat);
                if (value != null && datapoint.timestamp() != null) {
                    samples.add(new Sample(instanceId, value, datapoint.timestamp()));
                }
            }
            chunkStart = chunkEnd;
        }

        samples.sort(Comparator.comparing(Sample::timestamp));
        log.debug("{} datapoints of {}/{} for {} in [{}, {})",
                samples.size(), namespace, metricName, instanceId, start, end);
        return samples;
    }

    private static Double valueOf(Datapoint datapoint, Statistic statistic) {
        return switch (statistic) {
            case AVERAGE -> datapoint.average();
            case MAXIMUM -> datapoint.maximum();
            case MINIMUM -> datapoint.minimum();
            case SUM -> datapoint.sum();
            case SAMPLE_COUNT -> datapoint.sampleCount();
            default -> null;
        };
    }
}
