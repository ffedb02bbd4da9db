package dev.tributary.destination;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** JSON (de)serialization of staged row files. */
final class StagedRows {

    private static final TypeReference<List<StagedRow>> ROW_LIST = new TypeReference<>() {};

    private StagedRows() {
        // utility class
    }

    static List<StagedRow> read(ObjectMapper objectMapper, Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), ROW_LIST);
    }

    static void write(ObjectMapper objectMapper, Path file, List<StagedRow> rows) throws IOException {
        objectMapper.writeValue(file.toFile(), rows);
    }
}
