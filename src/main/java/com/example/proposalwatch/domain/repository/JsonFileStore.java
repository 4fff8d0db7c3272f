package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.exception.StoreWriteException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * A single JSON document on disk, replaced as a whole on every write.
 * <p>
 * Writes go to a sibling {@code .tmp} file which is forced to disk and then renamed over the
 * target, so readers see either the previous or the new document, never a partial one.
 */
class JsonFileStore {

    private final ObjectMapper objectMapper;

    @Getter
    private final Path path;

    JsonFileStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    /**
     * @return empty when the file does not exist yet
     * @throws IOException when the file exists but cannot be read or parsed
     */
    <T> Optional<T> read(TypeReference<T> type) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
    }

    void write(Object value) {
        var tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            var bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
            try (var channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                var buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StoreWriteException(path.toString(), e);
        }
    }
}
