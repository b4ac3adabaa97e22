package com.panelkit.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.UUID;

/**
 * JSON document load/save. Writes go to a sibling temp file first and are
 * moved into place, so readers never see a half-written document.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Read a JSON object document. A missing or empty file yields an empty object.
     *
     * @throws IOException if the file exists but cannot be read or is not a JSON object
     */
    public static ObjectNode readObject(Path path) throws IOException {
        if (!Files.exists(path)) {
            return MAPPER.createObjectNode();
        }
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        if (raw.isBlank()) {
            return MAPPER.createObjectNode();
        }
        JsonNode node = MAPPER.readTree(raw);
        if (node instanceof ObjectNode object) {
            return object;
        }
        throw new IOException("Expected a JSON object in " + path + " but found " + node.getNodeType());
    }

    /**
     * Write {@code data} atomically with owner-only permissions where supported.
     */
    public static void writeAtomic(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        String json = MAPPER.writeValueAsString(data) + "\n";
        Files.writeString(tmp, json, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX file system
        }
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }
}
