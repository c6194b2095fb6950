package org.calista.replycraft.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FileIO — единая точка файлового I/O движка.
 *
 * <p>
 * - безопасный resolve внутри baseDir (anti path traversal)
 * - атомарная запись через временный файл-сосед + move (хранилище ключей, конфиг)
 * - пропуск перезаписи, если содержимое не изменилось
 * - append для JSONL-логов событий
 * </p>
 *
 * Без внешних зависимостей кроме логгера.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    public FileIO(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        log.debug("FileIO init: baseDir={}, charset={}", this.baseDir, charset);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) {
            throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);
        }
        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** Для внешних путей (каталог вне sandbox): относительный путь берётся от baseDir, выход за baseDir разрешён. */
    public Path resolveExternal(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        Path p = Paths.get(anyPath.replace('\\', '/'));
        return (p.isAbsolute() ? p : baseDir.resolve(p)).toAbsolutePath().normalize();
    }

    public void deleteIfExists(Path file) throws IOException {
        Files.deleteIfExists(file);
    }

    // ----------------------------
    // Read
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    /** JSONL: trim + skip empty lines. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        List<String> raw = Files.readAllLines(file, charset);
        ArrayList<String> out = new ArrayList<>(raw.size());
        for (String line : raw) {
            if (line == null) continue;
            String t = line.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    // ----------------------------
    // Write
    // ----------------------------

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.trace("Skip write, content unchanged: {}", file);
            return;
        }

        Path tmp = tempSibling(file);
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                w.write(content);
            }
            fsyncQuiet(tmp);
            atomicCommit(tmp, file);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        if (jsonLine == null || jsonLine.isBlank()) return;
        ensureParentDir(file);
        String line = jsonLine.replace('\n', ' ').replace('\r', ' ').trim() + System.lineSeparator();
        Files.writeString(file, line, charset,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private Path tempSibling(Path target) {
        String name = target.getFileName().toString();
        return target.resolveSibling("." + name + "." + Long.toHexString(System.nanoTime()) + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void fsyncQuiet(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync skipped for {}: {}", file, e.toString());
        }
    }

    private boolean isSameContent(Path file, String content) {
        try {
            if (!Files.exists(file)) return false;
            byte[] want = content.getBytes(charset);
            if (Files.size(file) != want.length) return false;
            return content.equals(Files.readString(file, charset));
        } catch (IOException e) {
            return false;
        }
    }
}
