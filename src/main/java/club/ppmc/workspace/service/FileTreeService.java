/**
 * FileTreeService.java
 *
 * 递归列出当前修订版本中某个目录的内容，构建可序列化的 {@link Node} 树。
 * 每一层都按“目录在前、名称不区分大小写升序”排序，保证前端文件树的顺序稳定。
 * 无法读取的条目（权限不足、遍历过程中被删除等）会被静默跳过，而不是让整个列表失败。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import club.ppmc.workspace.model.Node;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FileTreeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileTreeService.class);

    static final Comparator<Node> NODE_ORDER =
            Comparator.comparing((Node n) -> n.isDirectory() ? 0 : 1)
                    .thenComparing(Node::getName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(Node::getName);

    private final RevisionStore revisionStore;
    private final SandboxPathResolver pathResolver;
    private final LinkOption[] linkOptions;

    public FileTreeService(
            RevisionStore revisionStore, SandboxPathResolver pathResolver, StorageProperties properties) {
        this.revisionStore = revisionStore;
        this.pathResolver = pathResolver;
        this.linkOptions = properties.isAllowSymlinks()
                ? new LinkOption[0]
                : new LinkOption[] {LinkOption.NOFOLLOW_LINKS};
    }

    /**
     * 列出当前修订版本中指定目录的子节点（递归展开子目录）。
     *
     * @param relativePath 目录相对于当前修订版本的路径，空表示根目录。
     * @return 排好序的子节点列表；目录本身无法读取时返回空列表。
     * @throws StorageException NOT_FOUND，如果路径不存在。
     */
    public List<Node> list(String relativePath) {
        Path revisionRoot = revisionStore.currentDirectory();
        Path directory = pathResolver.resolve(revisionRoot, relativePath);
        if (Files.notExists(directory, linkOptions)) {
            throw StorageException.notFound("路径未找到: " + relativePath);
        }
        return buildTree(directory, pathResolver.relativize(revisionRoot, directory));
    }

    /**
     * 构建 directory 的子节点列表。
     *
     * @param directory 物理目录。
     * @param logicalPath 该目录的逻辑路径，用于拼接子节点的 path。
     */
    public List<Node> buildTree(Path directory, String logicalPath) {
        List<Node> nodes = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                Node node = toNode(entry, logicalPath);
                if (node != null) {
                    nodes.add(node);
                }
            }
        } catch (IOException e) {
            LOGGER.debug("无法读取目录 {}，已跳过: {}", directory, e.getMessage());
            return nodes;
        }
        nodes.sort(NODE_ORDER);
        return nodes;
    }

    private Node toNode(Path entry, String parentPath) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class, linkOptions);
        } catch (IOException e) {
            LOGGER.debug("无法读取条目 {}，已跳过: {}", entry, e.getMessage());
            return null;
        }
        if (attrs.isSymbolicLink()) {
            return null;
        }

        String name = entry.getFileName().toString();
        var node = new Node();
        node.setName(name);
        node.setPath(parentPath.isEmpty() ? name : parentPath + "/" + name);
        node.setDirectory(attrs.isDirectory());
        node.setModified(attrs.lastModifiedTime().toInstant().getEpochSecond());
        if (attrs.isDirectory()) {
            node.setChildren(buildTree(entry, node.getPath()));
        } else {
            node.setSize(attrs.size());
        }
        return node;
    }
}
