package dev.tributary.destination;

import dev.tributary.document.DocumentRecord;
import dev.tributary.document.Element;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.RecordStage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stager for the embedding-store destination: reshapes embedded elements into {@link StagedRow}s.
 *
 * <p>Store metadata only holds strings and numbers, so other element metadata values are written
 * as strings. {@code record_id}, {@code source_identity} and {@code element_type} are always set.
 */
public class EmbeddingStoreUploadStager implements RecordStage {

    static final String RECORD_ID = "record_id";

    private final ElementArtifacts artifacts;

    public EmbeddingStoreUploadStager(ElementArtifacts artifacts) {
        this.artifacts = artifacts;
    }

    @Override
    public StageName name() {
        return StageName.STAGE;
    }

    @Override
    public void process(DocumentRecord record, Path input, Path output) throws ProcessingException {
        try {
            List<Element> elements = artifacts.read(input);
            List<StagedRow> rows = new ArrayList<>(elements.size());
            for (Element element : elements) {
                if (element.embeddings() == null) {
                    throw new ProcessingException(name(), "Element " + element.elementId() + " of "
                            + record.sourceIdentity() + " has no embedding; configure an embedder stage");
                }
                rows.add(new StagedRow(element.elementId(), element.text(), element.embeddings(),
                        rowMetadata(record, element)));
            }
            StagedRows.write(artifacts.objectMapper(), output, rows);
        } catch (IOException e) {
            throw new ProcessingException(name(), "Failed to stage " + record.sourceIdentity(), e);
        }
    }

    private static Map<String, Object> rowMetadata(DocumentRecord record, Element element) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        element.metadata().forEach((key, value) -> {
            if (value instanceof String || value instanceof Integer || value instanceof Long
                    || value instanceof Float || value instanceof Double) {
                metadata.put(key, value);
            } else if (value != null) {
                metadata.put(key, String.valueOf(value));
            }
        });
        metadata.put(RECORD_ID, record.sourceIdentity());
        metadata.put("source_identity", record.sourceIdentity());
        metadata.put("element_type", element.type().value());
        return metadata;
    }
}
