package fleetwatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final record of one monitoring run, written as run-summary.json.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
        @JsonProperty("runId") String runId,
        @JsonProperty("runDirectory") String runDirectory,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("cycles") int cycles,
        @JsonProperty("drained") boolean drained,
        @JsonProperty("instancesSeen") List<String> instancesSeen,
        @JsonProperty("instancesTerminated") List<String> instancesTerminated,
        @JsonProperty("instancesVanished") List<String> instancesVanished,
        @JsonProperty("samplesPersisted") Map<String, Long> samplesPersisted) {
}
