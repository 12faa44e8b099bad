package io.backup4j.adapter;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Gzipped tar archives holding one top-level directory, as written by the document-store sources.
 */
public final class TarGz {

    private TarGz() {
    }

    /**
     * Archive every regular file under {@code dir} as {@code <rootName>/<relative path>}.
     */
    public static void pack(Path dir, String rootName, Path archive) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(archive));
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Path file : files) {
                String entryName = rootName + "/" + dir.relativize(file).toString().replace('\\', '/');
                TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), entryName);
                tar.putArchiveEntry(entry);
                Files.copy(file, tar);
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
    }

    /**
     * Extract {@code archive} into {@code targetDir}.
     *
     * @return the single top-level directory of the archive, or {@code targetDir} when entries
     * are not nested
     * @throws IOException when the archive is corrupt or an entry would escape {@code targetDir}
     */
    public static Path unpack(Path archive, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        String topLevel = null;
        boolean nested = true;

        try (InputStream in = new BufferedInputStream(Files.newInputStream(archive));
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(in);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root) || target.equals(root)) {
                    throw new IOException("Archive entry outside target directory: " + entry.getName());
                }
                if (entry.isSymbolicLink() || entry.isLink()) {
                    throw new IOException("Archive links are not supported: " + entry.getName());
                }

                Path first = root.relativize(target).getName(0);
                if (topLevel == null) {
                    topLevel = first.toString();
                } else if (!topLevel.equals(first.toString())) {
                    nested = false;
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                if (root.relativize(target).getNameCount() == 1) {
                    nested = false;
                }
                Files.createDirectories(target.getParent());
                Files.copy(tar, target);
            }
        }

        if (topLevel == null) {
            throw new IOException("Archive is empty: " + archive.getFileName());
        }
        return nested ? root.resolve(topLevel) : root;
    }
}
