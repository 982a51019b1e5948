/**
 * RevisionStore.java
 *
 * 该服务独占管理 HEAD 指针与所有修订版本目录（{@code <root>/HEAD}、{@code <root>/<id>/}）。
 * 修订版本号从 0 开始单调递增，每次创建恰好加 1，且从不删除或重新编号；HEAD 对应的目录同时也是工作副本。
 * <p>
 * 创建新修订版本（快照、压缩包导入）时，分配版本号与填充内容都在同一把进程级互斥锁内完成，
 * 因此并发创建得到的版本号没有重复、没有空洞，其他请求也不会通过 {@link #currentRevision()} 看到尚未填充完成的版本。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import club.ppmc.workspace.model.RevisionListResponse;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RevisionStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RevisionStore.class);

    static final String HEAD_FILE_NAME = "HEAD";
    private static final String HEAD_TEMP_FILE_NAME = "HEAD.tmp";
    private static final Pattern REVISION_DIRECTORY_NAME = Pattern.compile("0|[1-9][0-9]{0,17}");

    /** 在新修订版本目录中填充内容的回调，在修订锁内执行。 */
    @FunctionalInterface
    public interface RevisionPopulator {
        void populate(long revision, Path directory) throws IOException;
    }

    private final Path storageRoot;
    private final Path headFile;
    private final ReentrantLock revisionLock = new ReentrantLock();

    /** HEAD 的内存缓存；只在持有 revisionLock 时写入。 */
    private volatile long head;

    public RevisionStore(StorageProperties properties) {
        this.storageRoot = Paths.get(properties.getRoot()).toAbsolutePath().normalize();
        this.headFile = storageRoot.resolve(HEAD_FILE_NAME);
    }

    /**
     * 确保存储根目录与修订版本 0 存在，HEAD 缺失时按磁盘上最大的修订目录初始化，然后加载 HEAD。
     * HEAD 标记损坏时同样以磁盘上的修订目录为准恢复，已有的修订版本不会被覆盖。
     * 每次进程启动都会调用，可重复执行。
     */
    @PostConstruct
    public void bootstrap() {
        revisionLock.lock();
        try {
            Files.createDirectories(revisionPath(0));
            if (Files.notExists(headFile)) {
                writeHead(highestRevisionOnDisk());
                LOGGER.info("存储根目录已初始化: {}", storageRoot);
            }
            long loaded = reconcileHead();
            Path headDir = revisionPath(loaded);
            if (!Files.isDirectory(headDir)) {
                LOGGER.warn("HEAD 指向的修订目录不存在，已重新创建: {}", headDir);
                Files.createDirectories(headDir);
            }
            this.head = loaded;
            LOGGER.info("修订存储已就绪，HEAD = {}", loaded);
        } catch (IOException e) {
            LOGGER.error("致命错误: 无法初始化存储根目录: {}", storageRoot, e);
            throw new IllegalStateException("无法初始化存储根目录: " + storageRoot, e);
        } finally {
            revisionLock.unlock();
        }
    }

    // HEAD 标记损坏，或落后磁盘上最大的修订目录不止一个版本时，以磁盘为准恢复并重写标记。
    // 恰好落后一个版本的目录是分配到一半时异常退出的残留，交给 allocateNext 清空重用。
    private long reconcileHead() throws IOException {
        OptionalLong marker = parseHeadMarker();
        long highest = highestRevisionOnDisk();
        if (marker.isPresent() && marker.getAsLong() + 1 >= highest) {
            return marker.getAsLong();
        }
        LOGGER.warn("HEAD 标记 {} 与磁盘上最大的修订版本 {} 不一致，已恢复为 {}",
                marker.isPresent() ? marker.getAsLong() : "(无效)", highest, highest);
        writeHead(highest);
        return highest;
    }

    private long highestRevisionOnDisk() throws IOException {
        try (Stream<Path> entries = Files.list(storageRoot)) {
            return entries
                    .filter(Files::isDirectory)
                    .map(entry -> entry.getFileName().toString())
                    .filter(name -> REVISION_DIRECTORY_NAME.matcher(name).matches())
                    .mapToLong(Long::parseLong)
                    .max()
                    .orElse(0L);
        }
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    /**
     * @return 当前 HEAD（最新且已填充完成的修订版本号）。
     */
    public long currentRevision() {
        return head;
    }

    /**
     * 从磁盘读取 HEAD 标记。文件缺失、无法读取或内容无法解析时返回 0，从不抛出异常。
     */
    public long readHeadMarker() {
        return parseHeadMarker().orElse(0L);
    }

    private OptionalLong parseHeadMarker() {
        try {
            long value = Long.parseLong(Files.readString(headFile, StandardCharsets.UTF_8).trim());
            if (value >= 0) {
                return OptionalLong.of(value);
            }
            LOGGER.warn("HEAD 标记为负数 ({})，按 0 处理", value);
        } catch (IOException | NumberFormatException e) {
            LOGGER.warn("无法读取 HEAD 标记 {}，按 0 处理: {}", headFile, e.getMessage());
        }
        return OptionalLong.empty();
    }

    /**
     * 分配一个新的空修订版本：创建目录、持久化 HEAD 并返回新版本号。
     * 每次成功调用都会占用一个版本号，调用方不应盲目重试。
     *
     * @return 新的修订版本号。
     * @throws StorageException INTERNAL_ERROR，如果目录创建或 HEAD 写入失败（此时 HEAD 保持不变）。
     */
    public long bump() {
        revisionLock.lock();
        try {
            long next = allocateNext();
            this.head = next;
            return next;
        } finally {
            revisionLock.unlock();
        }
    }

    /**
     * 分配新修订版本并在同一临界区内填充内容。
     * 填充失败时，该版本号仍然保留（目录可能只填充了一部分），不会回滚或复用。
     *
     * @param populator 负责写入新目录内容的回调。
     * @return 新的修订版本号。
     */
    public long createRevision(RevisionPopulator populator) {
        revisionLock.lock();
        try {
            long next = allocateNext();
            try {
                populator.populate(next, revisionPath(next));
            } catch (IOException e) {
                throw StorageException.internal("填充修订版本 " + next + " 失败", e);
            } finally {
                this.head = next;
            }
            LOGGER.info("已创建修订版本 {}", next);
            return next;
        } finally {
            revisionLock.unlock();
        }
    }

    /**
     * 将当前修订版本完整复制为一个新的修订版本。
     *
     * @return 新的修订版本号。
     */
    public long snapshot() {
        return createRevision((revision, directory) -> {
            Path source = revisionPath(revision - 1);
            FileUtils.copyDirectory(source.toFile(), directory.toFile());
            LOGGER.debug("已将修订版本 {} 复制到 {}", revision - 1, directory);
        });
    }

    public RevisionListResponse listRevisions() {
        long latest = head;
        return new RevisionListResponse(latest, LongStream.rangeClosed(0, latest).boxed().toList());
    }

    /**
     * @return 当前工作副本（HEAD 修订版本）的目录。
     */
    public Path currentDirectory() {
        return revisionPath(head);
    }

    /**
     * 返回一个已存在的修订版本目录。
     *
     * @throws StorageException NOT_FOUND，如果版本号越界或目录不存在。
     */
    public Path revisionDirectory(long revision) {
        if (revision < 0 || revision > head) {
            throw StorageException.notFound("修订版本不存在: " + revision);
        }
        Path directory = revisionPath(revision);
        if (!Files.isDirectory(directory)) {
            throw StorageException.notFound("修订版本不存在: " + revision);
        }
        return directory;
    }

    Path revisionPath(long revision) {
        return storageRoot.resolve(Long.toString(revision));
    }

    // 调用方必须持有 revisionLock。先建目录再写 HEAD，崩溃时 HEAD 只会指向已存在的目录。
    private long allocateNext() {
        long next = head + 1;
        Path directory = revisionPath(next);
        try {
            if (Files.isDirectory(directory)) {
                // 只有持久化的 HEAD 与内存缓存一致时，下一个目录才可能是分配残留；否则它可能是保留的修订版本
                if (parseHeadMarker().orElse(-1L) != head) {
                    throw StorageException.internal("修订目录 " + directory + " 已存在，但 HEAD 标记与缓存不一致，拒绝覆盖", null);
                }
                LOGGER.warn("发现残留的修订目录 {}（可能来自上次异常退出），清空后重用", directory);
                FileUtils.cleanDirectory(directory.toFile());
            } else {
                Files.createDirectory(directory);
            }
        } catch (IOException e) {
            throw StorageException.internal("无法创建修订目录: " + directory, e);
        }

        try {
            writeHead(next);
        } catch (IOException e) {
            try {
                FileUtils.deleteDirectory(directory.toFile());
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw StorageException.internal("无法持久化 HEAD = " + next, e);
        }
        return next;
    }

    private void writeHead(long value) throws IOException {
        Path temp = storageRoot.resolve(HEAD_TEMP_FILE_NAME);
        Files.writeString(temp, Long.toString(value), StandardCharsets.UTF_8);
        try {
            Files.move(temp, headFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, headFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
