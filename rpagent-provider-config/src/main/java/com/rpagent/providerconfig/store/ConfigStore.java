package com.rpagent.providerconfig.store;

import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.codec.PayloadFormat;
import com.rpagent.providerconfig.codec.ProviderConfigCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Durable store of resource provider configs: a flat directory holding one JSON record per file.
 * <p>
 * Filenames are opaque. A record is found by the identity inside it, through an in-memory
 * identity→file index built from content ({@link #rebuildIndex()}). Writes go to a hidden temp
 * file in the same directory, are fsynced, then atomically renamed over the target, so a crash
 * leaves either the old or the new record and never two records with one identity. Every other
 * regular file in the directory is a record whatever its name; only hidden files and
 * {@code *.tmp} files are never read as records.
 * <p>
 * Callers serialize operations on one identity; the store itself only guards file naming.
 */
public final class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Map<ProviderIdentity, Path> index = new ConcurrentHashMap<>();
    private final Object namingLock = new Object();

    /**
     * Opens (creating if needed) the config directory and indexes the records already in it.
     *
     * @throws ConfigStoreException when the directory cannot be created or listed
     */
    public ConfigStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot create config directory " + directory, e);
        }
        rebuildIndex();
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Durably writes the config for its identity. An existing record keeps its filename; a new
     * one gets a fresh filename derived from the identity.
     *
     * @throws IllegalArgumentException when the config does not carry the given identity
     * @throws ConfigStoreException on I/O failure (the previous record, if any, is untouched)
     */
    public PutOutcome put(ProviderIdentity identity, ResourceProviderConfig config) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(config, "config");
        if (!identity.equals(config.identity())) {
            throw new IllegalArgumentException("Config identity " + config.identity() + " does not match " + identity);
        }
        byte[] bytes = ProviderConfigCodec.toPrettyJson(config);
        Path existing = index.get(identity);
        if (existing != null) {
            writeAtomically(existing, bytes);
            log.debug("Replaced resource provider record {} for {}", existing.getFileName(), identity);
            return PutOutcome.REPLACED;
        }
        synchronized (namingLock) {
            Path target = index.get(identity);
            if (target != null) {
                writeAtomically(target, bytes);
                return PutOutcome.REPLACED;
            }
            target = newRecordPath(identity);
            writeAtomically(target, bytes);
            index.put(identity, target);
            log.debug("Created resource provider record {} for {}", target.getFileName(), identity);
            return PutOutcome.CREATED;
        }
    }

    /**
     * Reads the record for the identity. A record deleted concurrently reads as absent.
     *
     * @throws CorruptRecordException when the record cannot be parsed
     */
    public Optional<ResourceProviderConfig> get(ProviderIdentity identity) {
        Path path = index.get(Objects.requireNonNull(identity, "identity"));
        if (path == null) {
            return Optional.empty();
        }
        try {
            ResourceProviderConfig config = read(path);
            if (!identity.equals(config.identity())) {
                throw new CorruptRecordException(path, "holds " + config.identity() + " instead of " + identity, null);
            }
            return Optional.of(config);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot read " + path, e);
        }
    }

    public boolean contains(ProviderIdentity identity) {
        return index.containsKey(identity);
    }

    /** File currently holding the identity's record. */
    public Optional<Path> recordPath(ProviderIdentity identity) {
        return Optional.ofNullable(index.get(identity));
    }

    /**
     * Deletes the record for the identity.
     *
     * @throws ConfigStoreException when the file exists but cannot be deleted (the record stays indexed)
     */
    public RemoveOutcome remove(ProviderIdentity identity) {
        Objects.requireNonNull(identity, "identity");
        synchronized (namingLock) {
            Path path = index.get(identity);
            if (path == null) {
                return RemoveOutcome.NOT_FOUND;
            }
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new ConfigStoreException("Cannot delete " + path, e);
            }
            index.remove(identity);
            syncDirectory();
            log.debug("Removed resource provider record {} for {}", path.getFileName(), identity);
            return RemoveOutcome.REMOVED;
        }
    }

    /** Every parsable record; corrupt files are logged and skipped. */
    public Stream<StoredRecord> listAll() {
        return listAll(path -> { });
    }

    /**
     * Single lazy pass over a snapshot of the directory listing, in filename order. Every regular
     * file that is neither hidden nor a temp file is a candidate record, whatever its name. Each file is
     * parsed when the stream reaches it; files that vanished meanwhile are skipped and corrupt ones
     * are logged, reported to {@code corruptSink} and skipped. Holds no lock.
     */
    public Stream<StoredRecord> listAll(Consumer<Path> corruptSink) {
        Objects.requireNonNull(corruptSink, "corruptSink");
        return recordFiles().stream()
                .map(path -> readForListing(path, corruptSink))
                .filter(Objects::nonNull);
    }

    /**
     * Rebuilds the identity index from file content. When two files carry the same identity the
     * first in filename order is kept and the other is logged and ignored; neither is deleted.
     *
     * @return number of indexed records
     */
    public int rebuildIndex() {
        synchronized (namingLock) {
            Map<ProviderIdentity, Path> rebuilt = new HashMap<>();
            listAll().forEach(record -> {
                Path first = rebuilt.putIfAbsent(record.getIdentity(), record.getPath());
                if (first != null) {
                    log.warn("Ignoring resource provider record {}: identity {} is already defined by {}",
                            record.getPath().getFileName(), record.getIdentity(), first.getFileName());
                }
            });
            index.clear();
            index.putAll(rebuilt);
            log.info("Indexed {} resource provider record(s) in {}", rebuilt.size(), directory);
            return rebuilt.size();
        }
    }

    /**
     * Deletes temp files left behind by an interrupted write.
     *
     * @return number of files deleted
     */
    public int purgeTempFiles() {
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, ".*" + TEMP_SUFFIX)) {
            for (Path temp : stream) {
                try {
                    if (Files.deleteIfExists(temp)) {
                        deleted++;
                        log.info("Deleted stale temp file {}", temp.getFileName());
                    }
                } catch (IOException e) {
                    log.warn("Failed to delete stale temp file {}: {}", temp, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot list config directory " + directory, e);
        }
        return deleted;
    }

    /** Number of indexed records. */
    public int size() {
        return index.size();
    }

    /** Indexed identities, sorted. */
    public Set<ProviderIdentity> identities() {
        return new TreeSet<>(index.keySet());
    }

    private List<Path> recordFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path p : stream) {
                if (isRecordFile(p)) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot list config directory " + directory, e);
        }
        files.sort(null);
        return files;
    }

    private static boolean isRecordFile(Path p) {
        String name = p.getFileName().toString();
        return !name.startsWith(".") && !name.endsWith(TEMP_SUFFIX) && Files.isRegularFile(p);
    }

    private StoredRecord readForListing(Path path, Consumer<Path> corruptSink) {
        try {
            return new StoredRecord(path, read(path));
        } catch (NoSuchFileException e) {
            log.debug("Resource provider record {} vanished during listing", path.getFileName());
            return null;
        } catch (CorruptRecordException e) {
            log.warn("Skipping {}", e.getMessage());
            corruptSink.accept(path);
            return null;
        } catch (IOException e) {
            log.warn("Skipping unreadable resource provider record {}: {}", path, e.getMessage());
            corruptSink.accept(path);
            return null;
        }
    }

    private static ResourceProviderConfig read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        ResourceProviderConfig config;
        try {
            config = ProviderConfigCodec.decode(bytes, PayloadFormat.JSON);
        } catch (UncheckedIOException e) {
            throw new CorruptRecordException(path, String.valueOf(e.getCause().getMessage()), e.getCause());
        }
        if (config.getType() == null || config.getName() == null) {
            throw new CorruptRecordException(path, "missing type or name", null);
        }
        return config;
    }

    private Path newRecordPath(ProviderIdentity identity) {
        String base = sanitize(identity.getType() + "." + identity.getName());
        Collection<Path> taken = index.values();
        Path candidate = directory.resolve(base + RECORD_SUFFIX);
        for (int n = 1; Files.exists(candidate) || taken.contains(candidate); n++) {
            candidate = directory.resolve(base + "-" + n + RECORD_SUFFIX);
        }
        return candidate;
    }

    static String sanitize(String raw) {
        String s = raw.replaceAll("[^A-Za-z0-9._-]", "_");
        return s.startsWith(".") ? "_" + s : s;
    }

    private void writeAtomically(Path target, byte[] bytes) {
        Path temp = directory.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ConfigStoreException("Cannot write " + target, e);
        }
        syncDirectory();
    }

    private void syncDirectory() {
        try (FileChannel dir = FileChannel.open(directory, StandardOpenOption.READ)) {
            dir.force(true);
        } catch (IOException e) {
            log.debug("Directory fsync not supported for {}: {}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }
}
