package com.libragraph.chunkstore.core.schedule;

import com.libragraph.chunkstore.core.storage.FilesystemChunkStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileStore;
import java.util.OptionalDouble;

/**
 * Free space of the file system holding the filesystem store.
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "filesystem")
public class FileStoreFreeSpaceProbe implements FreeSpaceProbe {

    private static final Logger log = Logger.getLogger(FileStoreFreeSpaceProbe.class);

    private final FilesystemChunkStore store;

    @Inject
    public FileStoreFreeSpaceProbe(FilesystemChunkStore store) {
        this.store = store;
    }

    @Override
    public OptionalDouble freeSpacePercent() {
        try {
            FileStore fileStore = store.fileStore();
            long total = fileStore.getTotalSpace();
            if (total <= 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(100.0 * fileStore.getUsableSpace() / total);
        } catch (IOException e) {
            log.warnf("Cannot read free space under %s: %s", store.root(), e.getMessage());
            return OptionalDouble.empty();
        }
    }
}
