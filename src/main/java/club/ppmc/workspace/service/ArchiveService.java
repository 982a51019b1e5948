/**
 * ArchiveService.java
 *
 * 修订版本的批量导入与单文件导出。
 * <p>
 * 导入：解码 Base64 编码的 ZIP 压缩包，分配一个新的修订版本，并把每个条目按其内部相对路径解压到新目录中。
 * 压缩包视为不可信输入：每个条目路径都经过沙箱校验，条目数与解压总字节数均有上限。
 * 解压中途失败时，新版本号仍然保留（目录可能只填充了一部分），调用方只会收到通用的内部错误。
 * <p>
 * 导出：定位某个历史修订版本中的单个普通文件，由控制器以字节流的形式返回。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ArchiveService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveService.class);

    private static final int COPY_BUFFER_SIZE = 8 * 1024;

    private final RevisionStore revisionStore;
    private final SandboxPathResolver pathResolver;
    private final int maxEntries;
    private final long maxExtractedBytes;

    public ArchiveService(
            RevisionStore revisionStore, SandboxPathResolver pathResolver, StorageProperties properties) {
        this.revisionStore = revisionStore;
        this.pathResolver = pathResolver;
        this.maxEntries = properties.getArchiveMaxEntries();
        this.maxExtractedBytes = properties.getArchiveMaxExtractedSize().toBytes();
    }

    /**
     * 从 Base64 编码的 ZIP 压缩包创建一个新的修订版本。
     *
     * @param base64Zip 标准 Base64 编码的 ZIP 数据。
     * @return 新的修订版本号。
     * @throws StorageException BAD_REQUEST（缺少内容），INTERNAL_ERROR（解码或解压失败）。
     */
    public long importArchive(String base64Zip) {
        if (base64Zip == null || base64Zip.isBlank()) {
            throw StorageException.badRequest("缺少压缩包内容 zip_b64");
        }
        byte[] archive;
        try {
            archive = Base64.getDecoder().decode(base64Zip.trim());
        } catch (IllegalArgumentException e) {
            throw StorageException.internal("压缩包 Base64 解码失败", e);
        }
        // 本地文件头或空压缩包的目录结束记录都以 "PK" 开头
        if (archive.length < 4 || archive[0] != 'P' || archive[1] != 'K') {
            throw StorageException.internal("不是有效的 ZIP 压缩包", null);
        }

        long revision = revisionStore.createRevision((id, directory) -> extract(archive, directory));
        LOGGER.info("已从压缩包（{} 字节）导入修订版本 {}", archive.length, revision);
        return revision;
    }

    /**
     * 定位历史修订版本中的一个普通文件。
     *
     * @throws StorageException NOT_FOUND，如果修订版本或文件不存在。
     */
    public Path openRevisionFile(long revision, String relativePath) {
        Path revisionDirectory = revisionStore.revisionDirectory(revision);
        Path file = pathResolver.resolve(revisionDirectory, relativePath);
        if (!Files.isRegularFile(file)) {
            throw StorageException.notFound("修订版本 " + revision + " 中不存在文件: " + relativePath);
        }
        return file;
    }

    private void extract(byte[] archive, Path destination) throws IOException {
        int entries = 0;
        long extracted = 0;
        try (var zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (++entries > maxEntries) {
                    throw StorageException.internal("压缩包条目数超过上限 " + maxEntries, null);
                }
                Path target;
                try {
                    target = pathResolver.resolve(destination, entry.getName());
                } catch (StorageException e) {
                    throw StorageException.internal("压缩包条目路径非法: " + entry.getName(), e);
                }
                if (target.equals(destination)) {
                    continue;
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    extracted += copyBounded(zip, target, maxExtractedBytes - extracted);
                }
            }
        }
        LOGGER.debug("已解压 {} 个条目，共 {} 字节到 {}", entries, extracted, destination);
    }

    private long copyBounded(InputStream in, Path target, long remaining) throws IOException {
        long written = 0;
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                written += read;
                if (written > remaining) {
                    throw StorageException.internal("压缩包解压后的总大小超过上限 " + maxExtractedBytes + " 字节", null);
                }
                out.write(buffer, 0, read);
            }
        }
        return written;
    }
}
