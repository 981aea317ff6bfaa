package fleetwatch.monitor.support;

import fleetwatch.monitor.error.InstanceNotFoundException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.MetricsBackend;
import fleetwatch.monitor.model.Sample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MetricsBackend answering from per-(instance, metric) scripts.
 * Scripted responses are consumed in order; the last one keeps answering.
 * Unscripted pairs return no datapoints.
 */
public class ScriptedMetricsBackend implements MetricsBackend {

    @FunctionalInterface
    public interface Response {
        List<Sample> answer(String instanceId, Instant start, Instant end)
                throws TransientBackendException, InstanceNotFoundException;
    }

    public record Call(String namespace, String metricName, String instanceId,
            Instant start, Instant end, Duration period, String statistic) {
    }

    private final Map<String, Deque<Response>> scripts = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();

    public synchronized ScriptedMetricsBackend on(String instanceId, String metricName, Response... responses) {
        scripts.computeIfAbsent(key(instanceId, metricName), k -> new ArrayDeque<>()).addAll(List.of(responses));
        return this;
    }

    @Override
    public List<Sample> fetchMetricStatistics(String namespace, String metricName, String instanceId,
            Instant start, Instant end, Duration period, String statistic)
            throws TransientBackendException, InstanceNotFoundException {
        Response response;
        synchronized (this) {
            calls.add(new Call(namespace, metricName, instanceId, start, end, period, statistic));
            Deque<Response> script = scripts.get(key(instanceId, metricName));
            if (script == null || script.isEmpty()) {
                return List.of();
            }
            response = script.size() > 1 ? script.poll() : script.peek();
        }
        return response.answer(instanceId, start, end);
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    public synchronized List<Call> callsFor(String instanceId, String metricName) {
        return calls.stream()
                .filter(c -> c.instanceId().equals(instanceId) && c.metricName().equals(metricName))
                .toList();
    }

    // ===== canned responses =====

    /** Datapoints one period apart ending at {@code last} */
    public static Response values(Instant last, Duration period, double... values) {
        return (instanceId, start, end) -> {
            List<Sample> samples = new ArrayList<>();
            for (int i = 0; i < values.length; i++) {
                Instant ts = last.minus(period.multipliedBy(values.length - 1 - i));
                samples.add(new Sample(instanceId, values[i], ts));
            }
            return samples;
        };
    }

    public static Response throttled() {
        return (instanceId, start, end) -> {
            throw new TransientBackendException("Throttling: Rate exceeded");
        };
    }

    public static Response notFound() {
        return (instanceId, start, end) -> {
            throw new InstanceNotFoundException(instanceId, "InvalidInstanceID.NotFound: " + instanceId);
        };
    }

    private static String key(String instanceId, String metricName) {
        return instanceId + "|" + metricName;
    }
}
