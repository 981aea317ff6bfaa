package fleetwatch.monitor.store;

import fleetwatch.monitor.error.PersistenceException;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.Sample;
import fleetwatch.monitor.repository.SampleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tab-separated implementation of SampleLog.
 *
 * Layout: {@code <outputDir>/<runId>_<yyyy-MM-dd>/<MetricName>.tsv}, one row per sample:
 * {@code instanceId \t value \t timestamp}, timestamp in ISO-8601 UTC.
 */
public class TsvSampleLog implements SampleLog {

    private static final Logger log = LoggerFactory.getLogger(TsvSampleLog.class);

    private static final String SEPARATOR = "\t";

    private final Path directory;
    private final Map<MetricName, Object> fileLocks = new ConcurrentHashMap<>();
    private final Set<MetricName> tailsChecked = ConcurrentHashMap.newKeySet();

    public TsvSampleLog(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Failed to create run directory: " + directory, e);
        }
    }

    /**
     * Open the run directory named after the run id and the given date.
     */
    public static TsvSampleLog forRun(Path outputDirectory, String runId, LocalDate date) {
        return new TsvSampleLog(outputDirectory.resolve(runId + "_" + date));
    }

    @Override
    public void append(MetricName metric, List<Sample> samples) {
        if (samples.isEmpty()) {
            return;
        }
        Path file = fileFor(metric);
        synchronized (lockFor(metric)) {
            // Rows of an earlier process may end in a torn row; the first append starts on a fresh line
            boolean tornTail = !tailsChecked.contains(metric) && endsMidRow(file);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                if (tornTail) {
                    log.warn("{} ends with an incomplete row, starting a new line", file.getFileName());
                    writer.newLine();
                }
                for (Sample sample : samples) {
                    writer.write(sample.instanceId());
                    writer.write(SEPARATOR);
                    writer.write(Double.toString(sample.value()));
                    writer.write(SEPARATOR);
                    writer.write(sample.timestamp().toString());
                    writer.newLine();
                }
            } catch (IOException e) {
                throw new PersistenceException("Failed to append " + samples.size() + " samples to " + file, e);
            }
            tailsChecked.add(metric);
        }
        log.debug("Appended {} rows to {}", samples.size(), file.getFileName());
    }

    @Override
    public List<Sample> readAll(MetricName metric) {
        Path file = fileFor(metric);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        synchronized (lockFor(metric)) {
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PersistenceException("Failed to read " + file, e);
            }
        }

        List<Sample> samples = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) continue;
            Sample sample = parseRow(line);
            if (sample == null) {
                // A torn last row is what a crash mid-append leaves behind
                log.warn("Skipping malformed row {} in {}: '{}'", lineNo, file.getFileName(), line);
                continue;
            }
            samples.add(sample);
        }
        return samples;
    }

    @Override
    public Path location() {
        return directory;
    }

    Path fileFor(MetricName metric) {
        return directory.resolve(metric.name() + ".tsv");
    }

    private static boolean endsMidRow(Path file) {
        try {
            if (!Files.exists(file) || Files.size(file) == 0) {
                return false;
            }
            try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
                ByteBuffer last = ByteBuffer.allocate(1);
                channel.position(channel.size() - 1);
                channel.read(last);
                return last.get(0) != '\n';
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to inspect the end of " + file, e);
        }
    }

    private Object lockFor(MetricName metric) {
        return fileLocks.computeIfAbsent(metric, m -> new Object());
    }

    private static Sample parseRow(String line) {
        String[] fields = line.split(SEPARATOR, -1);
        if (fields.length != 3 || fields[0].isBlank()) {
            return null;
        }
        try {
            return new Sample(fields[0], Double.parseDouble(fields[1]), Instant.parse(fields[2]));
        } catch (NumberFormatException | DateTimeParseException e) {
            return null;
        }
    }
}
