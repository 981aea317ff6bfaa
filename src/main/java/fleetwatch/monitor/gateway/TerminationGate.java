package fleetwatch.monitor.gateway;

import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.model.AlarmAction;
import fleetwatch.monitor.model.MetricName;

/**
 * Standing watchdog that acts on an instance independently of the polling loop.
 */
public interface TerminationGate {

    /**
     * Install (or replace) a low-utilization alarm on an instance.
     *
     * @param instanceId instance to watch
     * @param metric     metric the alarm evaluates
     * @param threshold  alarm fires when the statistic stays below this value
     * @param action     what the alarm does to the instance
     * @throws TransientBackendException when the alarm could not be installed
     */
    void putAlarm(String instanceId, MetricName metric, double threshold, AlarmAction action)
            throws TransientBackendException;
}
