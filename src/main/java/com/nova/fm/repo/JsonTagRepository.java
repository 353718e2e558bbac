package com.nova.fm.repo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.fm.exception.CorruptStoreException;
import com.nova.fm.exception.TagPersistException;
import com.nova.fm.util.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Tag store backed by a single JSON object: normalized path -> array of tags.
 * The whole document is rewritten on every mutation.
 */
public class JsonTagRepository implements TagRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonTagRepository.class);

    private final Path filePath;
    private final ObjectMapper mapper;
    private final Map<String, List<String>> storage = new LinkedHashMap<>();
    private CorruptStoreException loadFailure;

    public JsonTagRepository(Path filePath) {
        this.filePath = PathNormalizer.normalize(filePath);
        this.mapper = new ObjectMapper();
        loadFromDisk();
    }

    public static JsonTagRepository load(Path filePath) {
        return new JsonTagRepository(filePath);
    }

    private void loadFromDisk() {
        if (!Files.exists(filePath)) {
            LOGGER.info("No tag document at {}, starting empty", filePath);
            return;
        }
        try {
            byte[] bytes = Files.readAllBytes(filePath);
            Map<String, List<String>> map = mapper.readValue(bytes, new TypeReference<LinkedHashMap<String, List<String>>>() {
            });
            storage.clear();
            if (map != null) {
                for (Map.Entry<String, List<String>> e : map.entrySet()) {
                    List<String> tags = distinct(e.getValue());
                    if (tags.isEmpty()) {
                        continue;
                    }
                    // keys written elsewhere may not be normalized; same path, same tag set
                    List<String> merged = storage.computeIfAbsent(keyOf(e.getKey()), k -> new ArrayList<>());
                    for (String tag : tags) {
                        if (!merged.contains(tag)) {
                            merged.add(tag);
                        }
                    }
                }
            }
            LOGGER.info("Loaded tags for {} paths from {}", storage.size(), filePath);
        } catch (IOException e) {
            storage.clear();
            loadFailure = new CorruptStoreException(filePath, e);
            LOGGER.warn("{}; starting with an empty tag store", loadFailure.getMessage());
        }
    }

    private void saveToDisk() throws TagPersistException {
        Path tmp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        try {
            Path parent = filePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(storage);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            LOGGER.error("Failed to save tags to {}", filePath, e);
            deleteQuietly(tmp, e);
            throw new TagPersistException(filePath, e);
        }
    }

    private static void deleteQuietly(Path tmp, IOException failure) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static String keyOf(String storedKey) {
        try {
            return PathNormalizer.key(Path.of(storedKey));
        } catch (InvalidPathException e) {
            LOGGER.warn("Keeping unparseable tag key as written: {}", storedKey);
            return storedKey;
        }
    }

    @Override
    public List<String> get(Path path) {
        List<String> tags = storage.get(PathNormalizer.key(path));
        return tags == null ? List.of() : List.copyOf(tags);
    }

    @Override
    public void add(Path path, String tag) throws TagPersistException {
        Objects.requireNonNull(tag, "tag");
        String key = PathNormalizer.key(path);
        List<String> tags = storage.computeIfAbsent(key, k -> new ArrayList<>());
        if (tags.contains(tag)) {
            return;
        }
        tags.add(tag);
        saveToDisk();
    }

    @Override
    public void remove(Path path, String tag) throws TagPersistException {
        String key = PathNormalizer.key(path);
        List<String> tags = storage.get(key);
        if (tags == null || !tags.remove(tag)) {
            return;
        }
        if (tags.isEmpty()) {
            storage.remove(key);
        }
        saveToDisk();
    }

    @Override
    public void set(Path path, List<String> tags) throws TagPersistException {
        String key = PathNormalizer.key(path);
        List<String> copy = distinct(tags);
        if (copy.isEmpty()) {
            storage.remove(key);
        } else {
            storage.put(key, copy);
        }
        saveToDisk();
    }

    @Override
    public void move(Path from, Path to) throws TagPersistException {
        String fromKey = PathNormalizer.key(from);
        String toKey = PathNormalizer.key(to);
        if (fromKey.equals(toKey)) {
            return;
        }
        List<String> tags = storage.remove(fromKey);
        if (tags == null) {
            return;
        }
        List<String> merged = storage.computeIfAbsent(toKey, k -> new ArrayList<>());
        for (String tag : tags) {
            if (!merged.contains(tag)) {
                merged.add(tag);
            }
        }
        saveToDisk();
    }

    @Override
    public Set<String> paths() {
        return Set.copyOf(storage.keySet());
    }

    @Override
    public Optional<CorruptStoreException> loadFailure() {
        return Optional.ofNullable(loadFailure);
    }

    public Path getFilePath() {
        return filePath;
    }

    private static List<String> distinct(Collection<String> tags) {
        List<String> result = new ArrayList<>();
        if (tags == null) {
            return result;
        }
        for (String tag : tags) {
            if (tag != null && !result.contains(tag)) {
                result.add(tag);
            }
        }
        return result;
    }
}
