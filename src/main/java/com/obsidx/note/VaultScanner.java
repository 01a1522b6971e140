package com.obsidx.note;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a vault recursively and reads every markdown file. Hidden
 * directories and any excluded directory (typically the index location)
 * are pruned. Files that cannot be read are reported, not thrown.
 */
public class VaultScanner {
    private static final Logger log = LoggerFactory.getLogger(VaultScanner.class);
    private static final Set<String> NOTE_EXTENSIONS = Set.of(".md", ".markdown");

    public ScanResult scan(Path root, Path... excluded) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IOException("Vault root is not a directory: " + normalizedRoot);
        }
        List<Path> excludedDirs = new ArrayList<>();
        for (Path path : excluded) {
            if (path != null) {
                excludedDirs.add(path.toAbsolutePath().normalize());
            }
        }

        List<VaultFile> files = new ArrayList<>();
        List<Path> failed = new ArrayList<>();
        Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(normalizedRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                if (isHidden(dir) || excludedDirs.contains(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || !isNote(file)) {
                    return FileVisitResult.CONTINUE;
                }
                try {
                    String text = Files.readString(file, StandardCharsets.UTF_8);
                    long mtime = attrs.lastModifiedTime().toMillis();
                    files.add(new VaultFile(file, relativeKey(normalizedRoot, file), text, mtime));
                } catch (IOException e) {
                    log.warn("vault.read.failed path={} reason={}", file, e.toString());
                    failed.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("vault.visit.failed path={} reason={}", file, e.toString());
                failed.add(file);
                return FileVisitResult.CONTINUE;
            }
        });
        log.debug("vault.scanned root={} files={} failed={}", normalizedRoot, files.size(), failed.size());
        return new ScanResult(files, failed);
    }

    static boolean isNote(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return NOTE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    static String relativeKey(Path root, Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static boolean isHidden(Path dir) {
        Path name = dir.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    public record ScanResult(List<VaultFile> files, List<Path> failed) {
    }
}
