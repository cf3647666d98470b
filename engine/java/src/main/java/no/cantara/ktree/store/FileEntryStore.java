package no.cantara.ktree.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import no.cantara.ktree.EntryNotFoundException;
import no.cantara.ktree.MalformedEntryException;
import no.cantara.ktree.model.KnowledgeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Stores one pretty-printed JSON document per entry under a root directory. The entry key is
 * the file's path relative to the root.
 */
public class FileEntryStore implements EntryStore {

    private static final Logger log = LoggerFactory.getLogger(FileEntryStore.class);

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final Path root;

    public FileEntryStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public KnowledgeEntry read(String key) throws IOException {
        Path file = resolve(key);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(key);
        }
        Map<String, Object> data;
        try {
            data = JSON.readValue(bytes, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new MalformedEntryException(key, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (data == null) {
            throw new MalformedEntryException(key, List.of("document is empty"));
        }
        return EntryCodec.fromMap(key, data);
    }

    @Override
    public void write(String key, KnowledgeEntry entry) throws IOException {
        Path file = resolve(key);
        Files.createDirectories(file.getParent());
        byte[] bytes = JSON.writeValueAsBytes(EntryCodec.toMap(entry));
        // write to a sibling temp file, then replace, so readers never see a half-written entry
        Path tmp = Files.createTempFile(file.getParent(), ".", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {}", key);
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            Files.delete(resolve(key));
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(key);
        }
        log.debug("Deleted {}", key);
    }

    @Override
    public List<String> listAll() throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(EntryPaths.EXTENSION) && !name.equals(EntryPaths.CONTROL_FILE);
                    })
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .toList();
        }
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the knowledge root: '" + key + "'");
        }
        return resolved;
    }
}
