package io.backup4j.adapter;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TarGzTest {

    @TempDir
    Path tmp;

    @Test
    void packedDirectoryShouldUnpackUnderItsRootName() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src/sub"));
        Files.writeString(tmp.resolve("src/a.json"), "{\"a\":1}");
        Files.writeString(src.resolve("b.json"), "{\"b\":2}");
        Path archive = tmp.resolve("out.tar.gz");

        TarGz.pack(tmp.resolve("src"), "qdrant_backup", archive);
        Path root = TarGz.unpack(archive, Files.createDirectories(tmp.resolve("restore")));

        assertEquals("qdrant_backup", root.getFileName().toString());
        assertEquals("{\"a\":1}", Files.readString(root.resolve("a.json")));
        assertEquals("{\"b\":2}", Files.readString(root.resolve("sub/b.json")));
    }

    @Test
    void entryEscapingTargetShouldBeRejected() throws Exception {
        Path archive = tmp.resolve("evil.tar.gz");
        writeSingleEntry(archive, "../escaped.txt");

        assertThrows(IOException.class, () -> TarGz.unpack(archive, Files.createDirectories(tmp.resolve("restore"))));
        assertFalse(Files.exists(tmp.resolve("escaped.txt")));
    }

    @Test
    void corruptArchiveShouldRaise() throws Exception {
        Path archive = Files.writeString(tmp.resolve("bad.tar.gz"), "not gzip at all");

        assertThrows(IOException.class, () -> TarGz.unpack(archive, Files.createDirectories(tmp.resolve("restore"))));
    }

    private static void writeSingleEntry(Path archive, String name) throws IOException {
        byte[] data = "x".getBytes(StandardCharsets.UTF_8);
        try (OutputStream out = Files.newOutputStream(archive);
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            TarArchiveEntry entry = new TarArchiveEntry(name, true);
            entry.setSize(data.length);
            tar.putArchiveEntry(entry);
            tar.write(data);
            tar.closeArchiveEntry();
        }
    }
}
