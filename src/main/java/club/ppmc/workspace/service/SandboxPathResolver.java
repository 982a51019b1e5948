/**
 * SandboxPathResolver.java
 *
 * 沙箱路径解析器：把客户端传入的逻辑路径转换为限定在指定根目录内的物理路径。
 * <p>
 * 解析分两步：
 * <ul>
 *   <li>语法检查：按 "/" 与 "\" 拆分路径分量，遇到 ".."、绝对路径标记、首个分量上的盘符前缀等非普通分量直接拒绝，
 *       "." 与空分量静默丢弃，其余分量依次追加到根目录。</li>
 *   <li>链接检查（{@code app.storage.allow-symlinks=false} 时）：对已存在的每一级路径校验
 *       不是符号链接，且真实路径仍在根目录内，防止通过链接逃逸。</li>
 * </ul>
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SandboxPathResolver {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("[A-Za-z]:");
    private static final boolean WINDOWS = File.separatorChar == '\\';

    private final boolean allowSymlinks;

    public SandboxPathResolver(StorageProperties properties) {
        this.allowSymlinks = properties.isAllowSymlinks();
    }

    /**
     * 将相对路径解析为根目录下的物理路径。
     *
     * @param root 沙箱根目录。
     * @param relative 客户端传入的相对路径，null 或空白表示根目录本身。
     * @return 位于 root 之内的路径。
     * @throws StorageException PATH_ESCAPE，如果路径试图离开根目录。
     */
    public Path resolve(Path root, String relative) {
        Path base = root.toAbsolutePath().normalize();
        if (relative == null || relative.isBlank()) {
            return base;
        }
        if (relative.startsWith("/") || relative.startsWith("\\")) {
            throw StorageException.pathEscape(relative);
        }

        Path result = base;
        boolean first = true;
        for (String component : relative.split("[/\\\\]")) {
            if (component.isEmpty() || ".".equals(component)) {
                continue;
            }
            if ("..".equals(component) || component.indexOf('\0') >= 0 || isPrefixComponent(component, first)) {
                throw StorageException.pathEscape(relative);
            }
            result = result.resolve(component);
            first = false;
        }

        if (!result.normalize().startsWith(base)) {
            throw StorageException.pathEscape(relative);
        }
        if (!allowSymlinks) {
            checkNoLinkEscape(base, result, relative);
        }
        return result;
    }

    // 盘符前缀（"C:"）只在首个分量上有意义；Windows 上文件名不能含冒号（NTFS 数据流），其他系统上冒号是普通字符
    private static boolean isPrefixComponent(String component, boolean first) {
        if (WINDOWS && component.indexOf(':') >= 0) {
            return true;
        }
        return first && DRIVE_PREFIX.matcher(component).lookingAt();
    }

    /**
     * 将根目录下的物理路径转换为使用 "/" 分隔的逻辑路径。
     */
    public String relativize(Path root, Path target) {
        Path relative = root.toAbsolutePath().normalize().relativize(target.toAbsolutePath().normalize());
        var joiner = new StringJoiner("/");
        for (Path segment : relative) {
            String name = segment.toString();
            if (!name.isEmpty()) {
                joiner.add(name);
            }
        }
        return joiner.toString();
    }

    // 目标文件可能尚不存在（写入/创建目录），因此只校验已存在的那一段路径
    private void checkNoLinkEscape(Path base, Path target, String input) {
        if (Files.notExists(base, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Path baseReal;
        try {
            baseReal = base.toRealPath();
        } catch (IOException e) {
            throw StorageException.internal("根目录无法解析: " + base, e);
        }

        Path current = base;
        for (Path segment : base.relativize(target)) {
            if (segment.toString().isEmpty()) {
                continue;
            }
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            if (Files.isSymbolicLink(current)) {
                throw StorageException.pathEscape(input);
            }
            try {
                if (!current.toRealPath().startsWith(baseReal)) {
                    throw StorageException.pathEscape(input);
                }
            } catch (IOException e) {
                throw StorageException.internal("路径无法解析: " + current, e);
            }
        }
    }
}
