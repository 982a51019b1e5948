/**
 * FileService.java
 *
 * 该服务负责当前修订版本（工作副本）中单个文件/目录的读、写、重命名、删除与创建目录。
 * 所有路径都先经过 SandboxPathResolver，保证操作不会离开 HEAD 修订版本的目录。
 * 并发写同一个文件不做额外保护，以最后一次写入为准。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.exception.StorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FileService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileService.class);

    private final RevisionStore revisionStore;
    private final SandboxPathResolver pathResolver;

    public FileService(RevisionStore revisionStore, SandboxPathResolver pathResolver) {
        this.revisionStore = revisionStore;
        this.pathResolver = pathResolver;
    }

    /**
     * 读取文件的完整文本内容（UTF-8）。
     *
     * @throws StorageException NOT_FOUND，如果路径不存在或不是普通文件。
     */
    public String readFileContent(String relativePath) throws IOException {
        Path file = pathResolver.resolve(revisionStore.currentDirectory(), relativePath);
        if (!Files.isRegularFile(file)) {
            throw StorageException.notFound("文件未找到: " + relativePath);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * 写入（创建或覆盖）文件内容，父目录不存在时自动创建。
     */
    public void writeFileContent(String relativePath, String content) throws IOException {
        Path target = resolveBelowRoot(relativePath);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
        LOGGER.debug("已写入文件: {}", target);
    }

    /**
     * 重命名或移动文件/目录，目标父目录不存在时自动创建。
     *
     * @throws StorageException BAD_REQUEST，如果任一路径无法通过沙箱校验或指向修订版本根目录。
     */
    public void renameFile(String fromPath, String toPath) throws IOException {
        Path source;
        Path target;
        try {
            source = resolveBelowRoot(fromPath);
            target = resolveBelowRoot(toPath);
        } catch (StorageException e) {
            if (e.getKind() == StorageException.ErrorKind.PATH_ESCAPE) {
                throw StorageException.badRequest(e.getMessage());
            }
            throw e;
        }

        Files.createDirectories(target.getParent());
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw StorageException.internal("无法原子地重命名 " + fromPath + " -> " + toPath, e);
        }
        LOGGER.info("已将 {} 重命名为 {}", fromPath, toPath);
    }

    /**
     * 删除文件；如果是目录，则连同其下所有内容一起删除。
     *
     * @throws StorageException NOT_FOUND，如果删除前路径就不存在。
     */
    public void deleteFile(String relativePath) throws IOException {
        Path target = resolveBelowRoot(relativePath);
        if (Files.notExists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw StorageException.notFound("路径未找到: " + relativePath);
        }
        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            FileUtils.deleteDirectory(target.toFile());
        } else {
            Files.delete(target);
        }
        LOGGER.info("已删除: {}", relativePath);
    }

    /**
     * 创建目录及所有缺失的上级目录；目录已存在时不报错。
     */
    public void createDirectory(String relativePath) throws IOException {
        Path target = pathResolver.resolve(revisionStore.currentDirectory(), relativePath);
        Files.createDirectories(target);
    }

    // 修订版本根目录本身不能被写入、移动或删除
    private Path resolveBelowRoot(String relativePath) {
        Path revisionRoot = revisionStore.currentDirectory();
        Path resolved = pathResolver.resolve(revisionRoot, relativePath);
        if (resolved.equals(revisionRoot.toAbsolutePath().normalize())) {
            throw StorageException.badRequest("不允许对修订版本根目录执行该操作。");
        }
        return resolved;
    }
}
