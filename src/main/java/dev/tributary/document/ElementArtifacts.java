package dev.tributary.document;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Reads and writes the JSON element arrays exchanged between stages. */
public final class ElementArtifacts {

    private static final TypeReference<List<Element>> ELEMENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ElementArtifacts(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public List<Element> read(Path artifact) throws IOException {
        return objectMapper.readValue(artifact.toFile(), ELEMENT_LIST);
    }

    public void write(Path artifact, List<Element> elements) throws IOException {
        objectMapper.writeValue(artifact.toFile(), elements);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
