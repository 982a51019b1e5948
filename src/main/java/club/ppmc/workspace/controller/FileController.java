/**
 * FileController.java
 *
 * 该控制器处理当前工作副本（HEAD 修订版本）上的所有文件系统请求：
 * 列出文件树、读写文件、重命名、删除、创建目录、搜索以及创建快照。
 * 所有阻塞的文件系统操作都通过 StorageTaskExecutor 提交到存储线程池执行，异常由 GlobalExceptionHandler 统一转换。
 */
package club.ppmc.workspace.controller;

import club.ppmc.workspace.model.FileContentRequest;
import club.ppmc.workspace.model.NewRevisionResponse;
import club.ppmc.workspace.model.Node;
import club.ppmc.workspace.model.PathRequest;
import club.ppmc.workspace.model.RenameFileRequest;
import club.ppmc.workspace.model.SearchHit;
import club.ppmc.workspace.service.FileService;
import club.ppmc.workspace.service.FileTreeService;
import club.ppmc.workspace.service.RevisionStore;
import club.ppmc.workspace.service.SearchService;
import club.ppmc.workspace.service.StorageTaskExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fs")
@Slf4j
public class FileController {

    private final FileService fileService;
    private final FileTreeService fileTreeService;
    private final SearchService searchService;
    private final RevisionStore revisionStore;
    private final StorageTaskExecutor tasks;
    private final ObjectMapper objectMapper;

    public FileController(
            FileService fileService,
            FileTreeService fileTreeService,
            SearchService searchService,
            RevisionStore revisionStore,
            StorageTaskExecutor tasks,
            ObjectMapper objectMapper) {
        this.fileService = fileService;
        this.fileTreeService = fileTreeService;
        this.searchService = searchService;
        this.revisionStore = revisionStore;
        this.tasks = tasks;
        this.objectMapper = objectMapper;
    }

    /**
     * 获取指定目录的子节点（递归展开）。
     */
    @GetMapping("/list")
    public CompletableFuture<ResponseEntity<List<Node>>> list(@RequestParam(defaultValue = "") String path) {
        return tasks.submit("列出目录 " + path, () -> ResponseEntity.ok(fileTreeService.list(path)));
    }

    /**
     * 读取文件内容，以 JSON 字符串返回。
     */
    @GetMapping("/read")
    public CompletableFuture<ResponseEntity<String>> read(@RequestParam(defaultValue = "") String path) {
        return tasks.submit("读取文件 " + path, () -> {
            String content = fileService.readFileContent(path);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(content));
        });
    }

    /**
     * 保存或覆盖文件内容。无论新建还是覆盖都返回 201。
     */
    @PostMapping({"/save", "/write"})
    public CompletableFuture<ResponseEntity<Void>> save(@Valid @RequestBody FileContentRequest request) {
        return tasks.submit("写入文件 " + request.path(), () -> {
            fileService.writeFileContent(request.path(), request.content());
            return ResponseEntity.status(HttpStatus.CREATED).<Void>build();
        });
    }

    @PostMapping("/rename")
    public CompletableFuture<ResponseEntity<Void>> rename(@Valid @RequestBody RenameFileRequest request) {
        return tasks.submit("重命名 " + request.from(), () -> {
            fileService.renameFile(request.from(), request.to());
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @PostMapping("/delete")
    public CompletableFuture<ResponseEntity<Void>> delete(@Valid @RequestBody PathRequest request) {
        return tasks.submit("删除 " + request.path(), () -> {
            fileService.deleteFile(request.path());
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @PostMapping("/mkdir")
    public CompletableFuture<ResponseEntity<Void>> mkdir(@Valid @RequestBody PathRequest request) {
        return tasks.submit("创建目录 " + request.path(), () -> {
            fileService.createDirectory(request.path());
            return ResponseEntity.status(HttpStatus.CREATED).<Void>build();
        });
    }

    /**
     * 按文件名和文件内容搜索（不区分大小写）。
     */
    @GetMapping("/search")
    public CompletableFuture<ResponseEntity<List<SearchHit>>> search(
            @RequestParam(defaultValue = "") String path, @RequestParam(required = false) String q) {
        return tasks.submit("搜索 " + path, () -> ResponseEntity.ok(searchService.search(path, q)));
    }

    /**
     * 把当前工作副本复制为一个新的修订版本，新版本随即成为工作副本。
     */
    @PostMapping("/snapshot")
    public CompletableFuture<ResponseEntity<NewRevisionResponse>> snapshot() {
        return tasks.submit("创建快照", () -> {
            long id = revisionStore.snapshot();
            log.info("快照完成，新的修订版本: {}", id);
            return ResponseEntity.ok(new NewRevisionResponse(id));
        });
    }
}
