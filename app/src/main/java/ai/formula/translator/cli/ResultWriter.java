package ai.formula.translator.cli;

import ai.formula.translator.translate.BatchResult;
import ai.formula.translator.translate.JobOutcome;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes batch outcomes as a JSON array, one entry per job in input order.
 */
public class ResultWriter {

    private final ObjectMapper objectMapper;

    public ResultWriter() {
        this(new ObjectMapper().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET));
    }

    ResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void write(BatchResult result, Path path) {
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                write(result, out);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write results to " + path, ex);
        }
    }

    public void write(BatchResult result, OutputStream out) throws IOException {
        List<ResultEntry> entries = result.outcomes().stream()
                .map(ResultWriter::toEntry)
                .toList();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, entries);
        out.write(System.lineSeparator().getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static ResultEntry toEntry(JobOutcome outcome) {
        return new ResultEntry(outcome.cellAddress().toString(),
                "=" + outcome.result().targetFormulaText(),
                outcome.result().status().name(),
                outcome.route().name(),
                outcome.result().notes(),
                List.copyOf(outcome.result().unmappedFunctions()));
    }

    record ResultEntry(String cell,
                       String formula,
                       String status,
                       String route,
                       List<String> notes,
                       List<String> unmappedFunctions) {
    }
}
