package org.muma.mini.kvstore.persist;

import lombok.Getter;
import org.muma.mini.kvstore.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 数据库文件的原子读写
 * <p>
 * save: 先写同目录下的临时文件并 force 到磁盘, 再 rename 覆盖目标文件.
 * 中途崩溃时目标路径上要么是旧文件, 要么是完整的新文件.
 */
public class DatabaseFile {

    private static final Logger log = LoggerFactory.getLogger(DatabaseFile.class);

    public static final String DEFAULT_PERMISSIONS = "rw-r--r--";

    @Getter
    private final Path path;
    private final Set<PosixFilePermission> permissions;
    private final AtomicLong writeCount = new AtomicLong();

    public DatabaseFile(Path path) {
        this(path, DEFAULT_PERMISSIONS);
    }

    /**
     * @param permissions POSIX 权限字符串, 例如 "rw-r--r--"
     */
    public DatabaseFile(Path path, String permissions) {
        this.path = path.toAbsolutePath();
        this.permissions = PosixFilePermissions.fromString(permissions);
    }

    /**
     * 把整个数据库写入磁盘. 任何失败都只记录日志并返回 false, 由调用方决定是否重试.
     */
    public boolean save(Database database) {
        long start = System.currentTimeMillis();
        Path tempFile = null;
        try {
            byte[] data = DatabaseCodec.encode(database);

            Path dir = path.getParent();
            Files.createDirectories(dir);
            tempFile = Files.createTempFile(dir, "temp-" + path.getFileName() + "-", ".tmp");

            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(data);
                while (buf.hasRemaining()) {
                    channel.write(buf);
                }
                channel.force(true);
            }
            applyPermissions(tempFile);
            moveIntoPlace(tempFile);
            tempFile = null;

            long writes = writeCount.incrementAndGet();
            log.debug("Database saved to {}: {} keys, {} bytes, {} ms (write #{})",
                    path, database.size(), data.length, System.currentTimeMillis() - start, writes);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write database to file '{}'", path, e);
            return false;
        } finally {
            if (tempFile != null) {
                deleteQuietly(tempFile);
            }
        }
    }

    /**
     * 从磁盘读取数据库. 文件不存在 / 读不了 / 解码失败都返回 empty, 不抛异常.
     */
    public Optional<Database> load() {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.info("No database file at '{}', starting empty", path);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read database file '{}'", path, e);
            return Optional.empty();
        }

        try {
            Database database = DatabaseCodec.decode(data);
            log.info("Database loaded from '{}': {} keys", path, database.size());
            return Optional.of(database);
        } catch (IOException e) {
            log.error("Failed to decode database file '{}': {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /** 成功落盘的次数 */
    public long getWriteCount() {
        return writeCount.get();
    }

    void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for '{}', falling back to replace", path);
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void applyPermissions(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, permissions);
        } catch (UnsupportedOperationException e) {
            // 非 POSIX 文件系统 (Windows), 保持默认权限
            log.debug("POSIX permissions not supported for '{}'", file);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temp file '{}'", file, e);
        }
    }
}
