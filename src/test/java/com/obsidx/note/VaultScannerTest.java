package com.obsidx.note;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VaultScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadNotesAndSkipHiddenAndExcludedDirectories() throws Exception {
        Path vault = Files.createDirectories(tempDir.resolve("vault"));
        Files.createDirectories(vault.resolve("sub/deeper"));
        Files.createDirectories(vault.resolve(".obsidian"));
        Files.createDirectories(vault.resolve("index-dir"));
        Files.writeString(vault.resolve("a.md"), "# A\n");
        Files.writeString(vault.resolve("sub/deeper/b.markdown"), "# B\n");
        Files.writeString(vault.resolve("sub/image.png"), "not a note");
        Files.writeString(vault.resolve(".obsidian/workspace.md"), "hidden");
        Files.writeString(vault.resolve("index-dir/stale.md"), "excluded");

        VaultScanner.ScanResult result = new VaultScanner().scan(vault, vault.resolve("index-dir"));

        List<String> paths = result.files().stream().map(VaultFile::relativePath).sorted().toList();
        assertEquals(List.of("a.md", "sub/deeper/b.markdown"), paths);
        assertTrue(result.failed().isEmpty());
        VaultFile a = result.files().stream().filter(f -> f.relativePath().equals("a.md")).findFirst().orElseThrow();
        assertEquals("# A\n", a.rawText());
        assertEquals(Files.getLastModifiedTime(vault.resolve("a.md")).toMillis(), a.mtime());
    }

    @Test
    void shouldReportUndecodableFilesWithoutAborting() throws Exception {
        Path vault = Files.createDirectories(tempDir.resolve("vault"));
        Files.writeString(vault.resolve("good.md"), "fine");
        Files.write(vault.resolve("bad.md"), new byte[] { (byte) 0xC3, (byte) 0x28, (byte) 0xFF });

        VaultScanner.ScanResult result = new VaultScanner().scan(vault);

        assertEquals(1, result.files().size());
        assertEquals("good.md", result.files().get(0).relativePath());
        assertEquals(1, result.failed().size());
        assertTrue(result.failed().get(0).endsWith("bad.md"));
    }

    @Test
    void shouldRejectMissingRoot() {
        assertThrows(java.io.IOException.class, () -> new VaultScanner().scan(tempDir.resolve("missing")));
    }
}
