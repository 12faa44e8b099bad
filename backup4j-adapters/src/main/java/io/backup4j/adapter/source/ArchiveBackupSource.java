package io.backup4j.adapter.source;

import io.backup4j.adapter.TarGz;
import io.backup4j.core.SourceType;
import io.backup4j.utils.LocalFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Source whose artifact is a {@code .tar.gz} of JSON files under one named root directory.
 * Export and import run against a private scratch directory that is always removed.
 */
public abstract class ArchiveBackupSource extends AbstractBackupSource {

    private final String archiveRoot;

    protected ArchiveBackupSource(SourceType type, String archiveRoot, Path workDir, Clock clock) {
        super(type, workDir, clock);
        this.archiveRoot = archiveRoot;
    }

    /**
     * Write the export files into {@code dir}.
     */
    protected abstract void exportTo(Path dir) throws IOException, InterruptedException;

    /**
     * Load the files found in {@code dir} back into the backend.
     */
    protected abstract void importFrom(Path dir) throws IOException, InterruptedException;

    @Override
    protected final void writeArtifact(Path target) throws IOException, InterruptedException {
        Path scratch = LocalFiles.createTempDirectory(workDir(), archiveRoot + "-");
        try {
            exportTo(scratch);
            TarGz.pack(scratch, archiveRoot, target);
        } finally {
            LocalFiles.deleteQuietly(scratch);
        }
    }

    @Override
    protected final void restoreArtifact(Path artifact) throws IOException, InterruptedException {
        Path scratch = LocalFiles.createTempDirectory(workDir(), archiveRoot + "-restore-");
        try {
            Path root = TarGz.unpack(artifact, scratch);
            if (!root.getFileName().toString().equals(archiveRoot)) {
                throw new IOException("Archive does not contain a " + archiveRoot + " directory");
            }
            importFrom(root);
        } finally {
            LocalFiles.deleteQuietly(scratch);
        }
    }
}
