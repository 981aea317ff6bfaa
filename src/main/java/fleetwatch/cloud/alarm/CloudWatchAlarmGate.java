package fleetwatch.cloud.alarm;

import fleetwatch.cloud.AwsErrors;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.TerminationGate;
import fleetwatch.monitor.model.AlarmAction;
import fleetwatch.monitor.model.MetricName;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.ComparisonOperator;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricAlarmRequest;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.time.Duration;
import java.util.Locale;

/**
 * Installs a CloudWatch alarm that terminates (or stops) an instance whose metric stays
 * below a threshold, independently of the polling loop.
 */
public class CloudWatchAlarmGate implements TerminationGate {

    static final String ALARM_PREFIX = "fleetwatch-idle-";

    private final CloudWatchClient cloudWatch;
    private final String region;
    private final Duration period;
    private final int evaluationPeriods;

    public CloudWatchAlarmGate(CloudWatchClient cloudWatch, String region, Duration period, int evaluationPeriods) {
        this.cloudWatch = cloudWatch;
        this.region = region;
        this.period = period;
        this.evaluationPeriods = evaluationPeriods;
    }

    @Override
    public void putAlarm(String instanceId, MetricName metric, double threshold, AlarmAction action)
            throws TransientBackendException {
        PutMetricAlarmRequest request = PutMetricAlarmRequest.builder()
                .alarmName(ALARM_PREFIX + instanceId)
                .alarmDescription("Auto-" + action.name().toLowerCase(Locale.ROOT) + " " + instanceId
                        + " when " + metric + " stays below " + threshold)
                .namespace(metric.namespace())
                .metricName(metric.name())
                .dimensions(Dimension.builder().name("InstanceId").value(instanceId).build())
                .statistic(Statistic.AVERAGE)
                .period((int) period.toSeconds())
                .evaluationPeriods(evaluationPeriods)
                .threshold(threshold)
                .comparisonOperator(ComparisonOperator.LESS_THAN_THRESHOLD)
                .alarmActions(actionArn(action))
                .build();
        try {
            cloudWatch.putMetricAlarm(request);
        } catch (SdkException e) {
            if (AwsErrors.isTransient(e)) {
                throw new TransientBackendException("PutMetricAlarm failed for " + instanceId
                        + ": " + AwsErrors.describe(e), e);
            }
            throw e;
        }
    }

    String actionArn(AlarmAction action) {
        return "arn:aws:automate:" + region + ":ec2:" + action.name().toLowerCase(Locale.ROOT);
    }
}
