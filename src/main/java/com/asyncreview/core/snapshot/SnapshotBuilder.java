package com.asyncreview.core.snapshot;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.FileEntry;
import com.asyncreview.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeMap;

/**
 * Walks a repository directory and builds a bounded {@link Snapshot} of its text files.
 * <p>
 * Denied directories (e.g. {@code .git}, {@code node_modules}, {@code target}) are pruned
 * during the walk. Files are then considered in priority order and included until the
 * total byte budget would be exceeded; oversized, binary and non-UTF-8 files are skipped.
 */
@Service
public class SnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

    private static final int BINARY_PROBE_BYTES = 8192;

    private final AsyncReviewProperties.Snapshot config;

    public SnapshotBuilder(AsyncReviewProperties properties) {
        this.config = properties.getSnapshot();
    }

    /**
     * Builds a snapshot of the given repository root.
     *
     * @param root repository directory
     * @return the bounded snapshot
     * @throws InvalidRepositoryException if {@code root} is missing or not a directory
     */
    public Snapshot build(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new InvalidRepositoryException("Repository path does not exist or is not a directory: " + root);
        }
        Path repoRoot = root.toAbsolutePath().normalize();
        var rules = new PathRules(config.getIncludeGlobs(), config.getExcludeGlobs());

        List<String> ordered = rules.prioritize(discover(repoRoot, rules));

        var files = new LinkedHashMap<String, FileEntry>();
        var languages = new TreeMap<String, Integer>();
        long totalBytes = 0;

        for (String relative : ordered) {
            Path file = repoRoot.resolve(relative);
            long size;
            try {
                size = Files.size(file);
            } catch (IOException e) {
                log.debug("Skipping {}: {}", relative, e.getMessage());
                continue;
            }
            if (size > config.getMaxFileBytes()) {
                log.debug("Skipping {}: {} bytes exceeds per-file limit", relative, size);
                continue;
            }
            if (totalBytes + size > config.getMaxTotalBytes()) {
                log.info("Total byte budget reached at {}, stopping inclusion", relative);
                break;
            }

            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                log.debug("Skipping {}: {}", relative, e.getMessage());
                continue;
            }
            if (isBinary(bytes)) {
                log.debug("Skipping binary file {}", relative);
                continue;
            }
            String text = decodeUtf8(bytes);
            if (text == null) {
                log.debug("Skipping non-UTF-8 file {}", relative);
                continue;
            }

            String language = LanguageDetector.detect(file);
            files.put(relative, new FileEntry(
                    relative,
                    language,
                    size,
                    sha1(bytes),
                    Arrays.asList(text.split("\n", -1)),
                    RegexSymbolScanner.forLanguage(language).scan(text)
            ));
            languages.merge(language, 1, Integer::sum);
            totalBytes += size;
        }

        log.info("Snapshot of {}: {} of {} files, {} bytes", repoRoot, files.size(), ordered.size(), totalBytes);
        return new Snapshot(repoRoot.toString(), ordered, files, languages, totalBytes);
    }

    /**
     * Lists accepted files as {@code /}-separated relative paths, never descending into denied directories.
     */
    private List<String> discover(Path repoRoot, PathRules rules) {
        var found = new ArrayList<String>();
        try {
            Files.walkFileTree(repoRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(repoRoot) && rules.isDenied(repoRoot.relativize(dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    Path relative = repoRoot.relativize(file);
                    if (attrs.isRegularFile() && rules.accepts(relative)) {
                        found.add(toSlashPath(relative));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new InvalidRepositoryException("Failed to walk repository " + repoRoot + ": " + e.getMessage(), e);
        }
        return found;
    }

    private static String toSlashPath(Path relative) {
        var parts = new ArrayList<String>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }

    static boolean isBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) return true;
        }
        return false;
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    static String sha1(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
