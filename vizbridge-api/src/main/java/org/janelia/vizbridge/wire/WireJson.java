package org.janelia.vizbridge.wire;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of the wire payloads. Binary values are written as base64 text.
 */
public class WireJson {

    private final ObjectMapper mapper;

    public WireJson() {
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        ;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public void writeImagePayload(ImagePayload payload, OutputStream outputStream) {
        try {
            mapper.writeValue(outputStream, payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void writeImagePayload(ImagePayload payload, Path file) {
        try (OutputStream outputStream = Files.newOutputStream(file)) {
            writeImagePayload(payload, outputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + file, e);
        }
    }

    public ImagePayload readImagePayload(InputStream inputStream) {
        try {
            return mapper.readValue(inputStream, ImagePayload.class);
        } catch (IOException e) {
            throw new CorruptPayloadException("Error reading image payload: " + e.getMessage(), e);
        }
    }

    public ImagePayload readImagePayload(Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return readImagePayload(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + file, e);
        }
    }

    public JsonNode readDocument(Path file) {
        try {
            return mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + file, e);
        }
    }

    public void writeDocument(JsonNode document, Path file) {
        try {
            mapper.writeValue(file.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + file, e);
        }
    }
}
