package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Filesystem-backed ChunkStore for development and testing.
 *
 * <p>Layout: {@code {root}/{tier1}/{tier2}/{hex}}
 * where tier1 = hex[0:2], tier2 = hex[2:4].
 *
 * <p>Writes land in a temporary file that is atomically moved into place, so a
 * listing never observes a partially written chunk. Every object reports
 * {@link StorageTier#HOT}.
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "filesystem")
public class FilesystemChunkStore implements ChunkStore {

    private static final Logger log = Logger.getLogger(FilesystemChunkStore.class);

    private final Path root;

    @Inject
    public FilesystemChunkStore(
            @ConfigProperty(name = "chunkstore.object-store.filesystem.root") String root) {
        this(Path.of(root));
    }

    public FilesystemChunkStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * The file store holding the chunk tree, used for free-space probing.
     */
    public FileStore fileStore() throws IOException {
        Files.createDirectories(root);
        return Files.getFileStore(root);
    }

    private Path resolvePath(ContentHash hash) {
        String hex = hash.toHex();
        return root.resolve(hex.substring(0, 2)).resolve(hex.substring(2, 4)).resolve(hex);
    }

    @Override
    public Uni<Void> put(ContentHash hash, byte[] content) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ChunkStore.verify(hash, content);
            Path path = resolvePath(hash);
            if (Files.exists(path)) {
                return;
            }
            Path tmp = path.resolveSibling("." + hash.toHex() + "." + UUID.randomUUID() + ".tmp");
            try {
                Files.createDirectories(path.getParent());
                Files.write(tmp, content);
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path);
                }
            } catch (FileAlreadyExistsException e) {
                log.debugf("Chunk %s written concurrently, discarding duplicate", hash);
                deleteQuietly(tmp);
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Failed to write chunk: " + hash, e);
            }
        });
    }

    @Override
    public Uni<byte[]> get(ContentHash hash) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(hash);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new ChunkNotFoundException(hash);
            } catch (IOException e) {
                throw new StorageException("Failed to read chunk: " + hash, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(ContentHash hash) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(hash);
            try {
                if (Files.deleteIfExists(path)) {
                    pruneEmptyParents(path.getParent());
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete chunk: " + hash, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(root)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            try {
                Files.delete(current);
            } catch (NoSuchFileException | DirectoryNotEmptyException e) {
                log.debugf("Stopped pruning at %s: %s", current, e.getClass().getSimpleName());
                break;
            }
            current = current.getParent();
        }
    }

    @Override
    public Uni<Boolean> exists(ContentHash hash) {
        return Uni.createFrom().item(() -> Files.exists(resolvePath(hash)));
    }

    /**
     * Walks the shard directories in hash order, entering only shards that can hold keys
     * after the continuation token and under the prefix, and stops once a page is full.
     */
    @Override
    public Uni<ListingPage> list(String prefix, String continuationToken, int maxKeys) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be positive: " + maxKeys);
        }
        return Uni.createFrom().item(() -> {
            if (!Files.isDirectory(root)) {
                return new ListingPage(List.of(), null);
            }
            String effectivePrefix = prefix == null ? "" : prefix;
            List<Path> files = new ArrayList<>(maxKeys + 1);
            try {
                outer:
                for (String tier1 : shards(root, "", effectivePrefix, continuationToken)) {
                    Path tier1Dir = root.resolve(tier1);
                    for (String tier2 : shards(tier1Dir, tier1, effectivePrefix, continuationToken)) {
                        Path leaf = tier1Dir.resolve(tier2.substring(2));
                        for (Path file : chunkFiles(leaf, effectivePrefix, continuationToken)) {
                            files.add(file);
                            if (files.size() > maxKeys) {
                                break outer;
                            }
                        }
                    }
                }
            } catch (IOException e) {
                throw new StorageException("Failed to list chunks under prefix: " + effectivePrefix, e);
            }

            boolean more = files.size() > maxKeys;
            List<StoredChunk> entries = new ArrayList<>(Math.min(files.size(), maxKeys));
            for (Path file : more ? files.subList(0, maxKeys) : files) {
                try {
                    entries.add(new StoredChunk(
                            ContentHash.fromHex(file.getFileName().toString()),
                            Files.size(file),
                            StorageTier.HOT));
                } catch (NoSuchFileException e) {
                    log.debugf("Chunk %s deleted while listing", file.getFileName());
                } catch (IOException e) {
                    throw new StorageException("Failed to stat chunk: " + file, e);
                }
            }
            String token = more ? files.get(maxKeys - 1).getFileName().toString() : null;
            return new ListingPage(entries, token);
        });
    }

    /**
     * Sorted keys ({@code parentKey} + directory name) of the shard directories under
     * {@code dir} that may contain matching hashes.
     */
    private static List<String> shards(Path dir, String parentKey, String prefix, String token) throws IOException {
        List<String> keys = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                String key = parentKey + name;
                if (isShardName(name) && matchesPrefix(key, prefix) && !beforeToken(key, token)) {
                    keys.add(key);
                }
            }
        } catch (NoSuchFileException e) {
            log.debugf("Shard %s removed while listing", dir);
        }
        Collections.sort(keys);
        return keys;
    }

    private static List<Path> chunkFiles(Path leaf, String prefix, String token) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(leaf)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (ContentHash.isHex(name) && name.startsWith(prefix)
                        && (token == null || name.compareTo(token) > 0)
                        && Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (NoSuchFileException e) {
            log.debugf("Shard %s removed while listing", leaf);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private static boolean isShardName(String name) {
        if (name.length() != 2) {
            return false;
        }
        for (int i = 0; i < 2; i++) {
            char c = name.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    /** True if every hash starting with {@code key} sorts before {@code token}. */
    private static boolean beforeToken(String key, String token) {
        return token != null && key.compareTo(token.substring(0, Math.min(token.length(), key.length()))) < 0;
    }

    /** True if some hash starting with {@code key} can also start with {@code prefix}. */
    private static boolean matchesPrefix(String key, String prefix) {
        int n = Math.min(key.length(), prefix.length());
        return key.regionMatches(0, prefix, 0, n);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("Failed to remove temporary file %s: %s", path, e.getMessage());
        }
    }
}
