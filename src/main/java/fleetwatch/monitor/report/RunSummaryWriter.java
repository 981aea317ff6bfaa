package fleetwatch.monitor.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fleetwatch.monitor.error.PersistenceException;
import fleetwatch.monitor.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes run-summary.json into the run directory once the loop has ended.
 */
public class RunSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);

    public static final String FILE_NAME = "run-summary.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @return path of the written file
     */
    public Path write(RunSummary summary, Path runDirectory) {
        Path file = runDirectory.resolve(FILE_NAME);
        try {
            Files.createDirectories(runDirectory);
            MAPPER.writeValue(file.toFile(), summary);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write run summary to " + file, e);
        }
        log.info("Run summary written to {} ({} cycles, {} terminated, drained={})",
                file, summary.cycles(), summary.instancesTerminated().size(), summary.drained());
        return file;
    }

    public RunSummary read(Path file) {
        try {
            return MAPPER.readValue(file.toFile(), RunSummary.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read run summary from " + file, e);
        }
    }
}
