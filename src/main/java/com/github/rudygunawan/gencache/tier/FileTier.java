package com.github.rudygunawan.gencache.tier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rudygunawan.gencache.model.CacheEntry;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Durable store keeping one JSON file per key under a root directory.
 *
 * <p>File layout: {@code {directory}/{sanitized_key}.json} containing
 * <pre>{@code
 * {
 *   "value" : <any JSON value>,
 *   "expires_at" : <unix seconds>,
 *   "created_at" : <unix seconds>,
 *   "cache_key" : "<key>",
 *   ...metadata fields
 * }
 * }</pre>
 *
 * <p>Durability is best-effort. The directory is created lazily; when it cannot be created, or a
 * write fails, the failure is logged and the tier behaves as empty. While the directory is
 * unavailable every operation retries creating it and otherwise does nothing, logging the problem
 * once at WARNING and then at FINE. A file that cannot be parsed
 * as an entry is deleted the next time it is read or swept. No other error deletes anything.
 *
 * <p>Writes go to a hidden temporary file in the same directory which is then renamed over the
 * target, so readers in this or another process never observe a partially written entry. Writes
 * are not locked: concurrent writers of the same key race and the last rename wins.
 */
public final class FileTier {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.gencache.Cache");

    static final String FILE_SUFFIX = ".json";
    private static final String TEMP_PREFIX = ".tmp-";
    private static final String TEMP_SUFFIX = ".tmp";

    static final String FIELD_VALUE = "value";
    static final String FIELD_EXPIRES_AT = "expires_at";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_CACHE_KEY = "cache_key";
    private static final Set<String> RESERVED_FIELDS =
            Set.of(FIELD_VALUE, FIELD_EXPIRES_AT, FIELD_CREATED_AT, FIELD_CACHE_KEY);

    private final Path directory;
    private final ObjectMapper mapper;
    private volatile boolean directoryReady;
    private volatile boolean directoryWarningLogged;

    /**
     * Creates a file tier rooted at {@code directory} and attempts to create the directory.
     * Failure to create it is logged, not thrown.
     *
     * @param directory the cache root directory
     * @param mapper the mapper used to read and write entry files
     */
    public FileTier(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null").toAbsolutePath().normalize();
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        ensureDirectory();
    }

    public Path directory() {
        return directory;
    }

    /**
     * Returns true if the cache directory exists or could be created now.
     */
    public boolean isAvailable() {
        return ensureDirectory();
    }

    /**
     * Returns the file an entry for {@code key} is stored in.
     */
    public Path pathFor(String key) {
        return directory.resolve(sanitize(key) + FILE_SUFFIX);
    }

    /**
     * Reads the entry for {@code key}.
     *
     * <p>Returns null when there is no file, when the file is expired at {@code nowMillis} (the file
     * is deleted), when it is corrupt (the file is deleted), or when it cannot be read.
     *
     * @param key the cache key
     * @param nowMillis the time used for the expiry check
     * @return the stored entry, or null
     */
    public CacheEntry get(String key, long nowMillis) {
        if (!ensureDirectory()) {
            return null;
        }
        Path path = pathFor(key);
        CacheEntry entry;
        try {
            entry = decode(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return null;
        } catch (JsonProcessingException | CorruptEntryException e) {
            LOGGER.log(Level.WARNING, "Discarding corrupt cache file " + path + ": " + e.getMessage());
            deleteQuietly(path);
            return null;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Cache read error for key: " + key, e);
            return null;
        }

        if (!key.equals(entry.getCacheKey())) {
            // Another key sanitized to the same file name
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Cache file " + path + " holds key " + entry.getCacheKey() + ", not " + key);
            }
            return null;
        }
        if (entry.isExpiredAt(nowMillis)) {
            deleteQuietly(path);
            return null;
        }
        return entry;
    }

    /**
     * Writes {@code entry} to its file, replacing any previous entry for the same key.
     *
     * @param entry the entry to persist
     * @return true if the entry was written, false if the failure was logged and swallowed
     */
    public boolean put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        if (!ensureDirectory()) {
            return false;
        }
        Path target = pathFor(entry.getCacheKey());
        Path temp = null;
        try {
            byte[] payload = encode(entry);
            temp = Files.createTempFile(directory, TEMP_PREFIX, TEMP_SUFFIX);
            Files.write(temp, payload);
            moveAtomically(temp, target);
            temp = null;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Wrote cache file for key: " + entry.getCacheKey());
            }
            return true;
        } catch (IOException e) {
            if (e instanceof NoSuchFileException) {
                // Directory removed underneath us; recreate on the next write
                directoryReady = false;
            }
            LOGGER.log(Level.WARNING, "Failed to write cache file for key: " + entry.getCacheKey(), e);
            return false;
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Deletes the file for {@code key} if present.
     *
     * @return true if a file was deleted
     */
    public boolean remove(String key) {
        if (!ensureDirectory()) {
            return false;
        }
        Path path = pathFor(key);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to delete cache file " + path, e);
            return false;
        }
    }

    /**
     * Lists the entry files whose stored key starts with {@code keyPrefix}.
     *
     * <p>File names only narrow the candidates: a different key can sanitize to a matching name,
     * so each candidate's {@code cache_key} is read and compared. Files that cannot be parsed are
     * skipped and left for {@link #sweepExpired(long)}.
     */
    public List<Path> listByPrefix(String keyPrefix) {
        String namePrefix = sanitize(keyPrefix);
        List<Path> matches = new ArrayList<>();
        for (Path path : listEntryFiles()) {
            if (!path.getFileName().toString().startsWith(namePrefix)) {
                continue;
            }
            String storedKey = readStoredKey(path);
            if (storedKey != null && storedKey.startsWith(keyPrefix)) {
                matches.add(path);
            }
        }
        return matches;
    }

    /**
     * Deletes every entry file whose key starts with {@code keyPrefix}.
     *
     * @return the number of files deleted
     */
    public int removeByPrefix(String keyPrefix) {
        return deleteAll(listByPrefix(keyPrefix));
    }

    /**
     * Deletes every entry file.
     *
     * @return the number of files deleted
     */
    public int clear() {
        return deleteAll(listEntryFiles());
    }

    /**
     * Deletes every entry file that is expired at {@code nowMillis} or cannot be parsed.
     *
     * @return the number of files deleted
     */
    public int sweepExpired(long nowMillis) {
        int removed = 0;
        for (Path path : listEntryFiles()) {
            boolean delete;
            try {
                delete = decode(Files.readAllBytes(path)).isExpiredAt(nowMillis);
            } catch (NoSuchFileException e) {
                continue;
            } catch (JsonProcessingException | CorruptEntryException e) {
                LOGGER.log(Level.WARNING, "Discarding corrupt cache file " + path + ": " + e.getMessage());
                delete = true;
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Error during cache cleanup of " + path, e);
                continue;
            }
            if (delete && deleteQuietly(path)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Returns the number of entry files currently in the directory.
     */
    public int count() {
        return listEntryFiles().size();
    }

    /**
     * Returns the file-system safe form of {@code key}: every character outside
     * {@code [A-Za-z0-9._-]} is replaced by {@code '_'}.
     */
    static String sanitize(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-';
            sb.append(safe ? c : '_');
        }
        return sb.toString();
    }

    private byte[] encode(CacheEntry entry) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.set(FIELD_VALUE, entry.getValue());
        root.put(FIELD_EXPIRES_AT, toSeconds(entry.getExpiresAtMillis()));
        root.put(FIELD_CREATED_AT, toSeconds(entry.getCreatedAtMillis()));
        root.put(FIELD_CACHE_KEY, entry.getCacheKey());
        for (Map.Entry<String, JsonNode> field : entry.getMetadata().entrySet()) {
            if (RESERVED_FIELDS.contains(field.getKey())) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Ignoring reserved metadata field '" + field.getKey() + "' for key: "
                            + entry.getCacheKey());
                }
                continue;
            }
            root.set(field.getKey(), field.getValue());
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
    }

    private CacheEntry decode(byte[] bytes) throws IOException {
        JsonNode root = mapper.readTree(bytes);
        if (root == null || !root.isObject()) {
            throw new CorruptEntryException("not a JSON object");
        }
        JsonNode expiresAt = root.get(FIELD_EXPIRES_AT);
        if (expiresAt == null || !expiresAt.isNumber()) {
            throw new CorruptEntryException("missing numeric " + FIELD_EXPIRES_AT);
        }
        if (!root.has(FIELD_VALUE)) {
            throw new CorruptEntryException("missing " + FIELD_VALUE);
        }
        JsonNode cacheKey = root.get(FIELD_CACHE_KEY);
        if (cacheKey == null || !cacheKey.isTextual()) {
            throw new CorruptEntryException("missing " + FIELD_CACHE_KEY);
        }
        JsonNode createdAt = root.get(FIELD_CREATED_AT);
        long createdAtMillis = createdAt != null && createdAt.isNumber() ? toMillis(createdAt.asDouble()) : 0L;

        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!RESERVED_FIELDS.contains(field.getKey())) {
                metadata.put(field.getKey(), field.getValue());
            }
        }
        return new CacheEntry(cacheKey.asText(), root.get(FIELD_VALUE),
                toMillis(expiresAt.asDouble()), createdAtMillis, metadata);
    }

    private String readStoredKey(Path path) {
        try {
            return decode(Files.readAllBytes(path)).getCacheKey();
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Skipping unreadable cache file " + path + ": " + e.getMessage());
            }
            return null;
        }
    }

    private List<Path> listEntryFiles() {
        if (!ensureDirectory()) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.endsWith(FILE_SUFFIX) && !name.startsWith(TEMP_PREFIX);
                    })
                    .filter(Files::isRegularFile)
                    .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return Collections.emptyList();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to list cache directory " + directory, e);
            return Collections.emptyList();
        }
    }

    private int deleteAll(List<Path> paths) {
        List<Path> failed = new ArrayList<>();
        int removed = 0;
        for (Path path : paths) {
            try {
                if (Files.deleteIfExists(path)) {
                    removed++;
                }
            } catch (IOException e) {
                failed.add(path);
            }
        }
        if (!failed.isEmpty()) {
            LOGGER.warning("Failed to delete " + failed.size() + " cache file(s) in " + directory);
        }
        return removed;
    }

    private boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Best-effort delete of " + path + " failed", e);
            return false;
        }
    }

    private boolean ensureDirectory() {
        if (directoryReady) {
            return true;
        }
        try {
            Files.createDirectories(directory);
            directoryReady = true;
            return true;
        } catch (IOException | SecurityException e) {
            if (!directoryWarningLogged) {
                directoryWarningLogged = true;
                LOGGER.log(Level.WARNING, "Failed to create cache directory " + directory
                        + "; continuing with memory only", e);
            } else if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Cache directory " + directory + " still unavailable: " + e);
            }
            return false;
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static double toSeconds(long millis) {
        return millis / 1000.0;
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000.0);
    }
}
