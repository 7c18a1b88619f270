package org.learningjava.hpes.infrastructure.adapter.out.fs;

import org.learningjava.hpes.application.port.SourceTreeReaderPort;
import org.learningjava.hpes.domain.model.batch.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Reads a checked-out source tree. Symbolic links are never followed, VCS and
 * dependency directories are skipped, as are files above the size limit.
 */
@Component
public class FileSystemSourceTreeReader implements SourceTreeReaderPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSourceTreeReader.class);

    static final Set<String> SKIPPED_DIRS = Set.of(".git", ".svn", ".hg", "node_modules", "vendor", "target", "build");

    private final long maxFileBytes;

    public FileSystemSourceTreeReader(@Value("${hpes.ingest.max-file-bytes:5242880}") long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }

    @Override
    public List<SourceFile> read(Path root) {
        if (Files.isRegularFile(root, LinkOption.NOFOLLOW_LINKS)) {
            return List.of(new SourceFile(root.getFileName().toString(), readBytes(root)));
        }
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("Not a directory or regular file: " + root);
        }

        List<Path> files = new ArrayList<>();
        int[] skipped = {0};
        try {
            // walkFileTree without FOLLOW_LINKS reports links as non-directory, non-regular entries
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIPPED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (attrs.size() > maxFileBytes) {
                        log.debug("Skipping {} ({} bytes)", file, attrs.size());
                        skipped[0]++;
                        return FileVisitResult.CONTINUE;
                    }
                    files.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot read {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }

        List<SourceFile> out = new ArrayList<>(files.size());
        for (Path file : files) {
            out.add(new SourceFile(relative(root, file), readBytes(file)));
        }
        out.sort(Comparator.comparing(SourceFile::path));
        log.info("Found {} files under {} ({} above size limit)", out.size(), root, skipped[0]);
        return out;
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
