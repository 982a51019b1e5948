/**
 * SearchService.java
 *
 * 在当前修订版本的某个子树中按文件名和文件内容搜索（均不区分大小写）。
 * <p>
 * 规则：
 * <ul>
 *   <li>文件名命中优先：文件名包含关键字时记为 name 命中，不再扫描其内容，每个文件最多一条结果。</li>
 *   <li>只有不超过 {@code app.storage.search-max-content-size} 的文件才参与内容匹配；
 *       无法按 UTF-8 解码或无法读取的文件静默跳过。</li>
 *   <li>目录本身永远不会作为结果返回。</li>
 * </ul>
 * 这是一个阻塞且可能很耗时的遍历，由控制器提交到存储工作线程池执行。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import club.ppmc.workspace.model.SearchHit;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchService.class);

    private final RevisionStore revisionStore;
    private final SandboxPathResolver pathResolver;
    private final long maxContentBytes;

    public SearchService(
            RevisionStore revisionStore, SandboxPathResolver pathResolver, StorageProperties properties) {
        this.revisionStore = revisionStore;
        this.pathResolver = pathResolver;
        this.maxContentBytes = properties.getSearchMaxContentSize().toBytes();
    }

    /**
     * 在当前修订版本的子树中搜索。
     *
     * @param relativePath 子树相对于当前修订版本的路径，空表示整个修订版本。
     * @param query 关键字，不能为空。
     * @return 按路径排序的命中列表。
     * @throws StorageException BAD_REQUEST（关键字为空）或 NOT_FOUND（子树不存在）。
     */
    public List<SearchHit> search(String relativePath, String query) {
        if (query == null || query.isEmpty()) {
            throw StorageException.badRequest("缺少搜索关键字 q");
        }
        String needle = query.toLowerCase(Locale.ROOT);

        Path revisionRoot = revisionStore.currentDirectory();
        Path base = pathResolver.resolve(revisionRoot, relativePath);
        if (Files.notExists(base)) {
            throw StorageException.notFound("路径未找到: " + relativePath);
        }

        List<SearchHit> hits = new ArrayList<>();
        try {
            Files.walkFileTree(base, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String logicalPath = pathResolver.relativize(revisionRoot, file);
                    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                    if (name.contains(needle)) {
                        hits.add(new SearchHit(logicalPath, SearchHit.MatchKind.NAME));
                    } else if (attrs.size() <= maxContentBytes && contentContains(file, needle)) {
                        hits.add(new SearchHit(logicalPath, SearchHit.MatchKind.CONTENT));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.debug("搜索时无法访问 {}，已跳过: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw StorageException.internal("搜索目录失败: " + base, e);
        }

        hits.sort(Comparator.comparing(SearchHit::path));
        LOGGER.debug("在 '{}' 中搜索 '{}'，共 {} 条结果", relativePath, query, hits.size());
        return hits;
    }

    private static boolean contentContains(Path file, String needle) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return text.toLowerCase(Locale.ROOT).contains(needle);
        } catch (CharacterCodingException e) {
            return false;
        } catch (IOException e) {
            LOGGER.debug("无法读取文件内容 {}，已跳过: {}", file, e.getMessage());
            return false;
        }
    }
}
