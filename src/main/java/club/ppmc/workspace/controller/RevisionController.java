/**
 * RevisionController.java
 *
 * 修订版本相关的 HTTP 接口：列出所有修订版本、通过上传压缩包创建新修订版本，
 * 以及从任意历史修订版本中下载单个文件。
 */
package club.ppmc.workspace.controller;

import club.ppmc.workspace.model.ArchiveImportRequest;
import club.ppmc.workspace.model.NewRevisionResponse;
import club.ppmc.workspace.model.RevisionListResponse;
import club.ppmc.workspace.service.ArchiveService;
import club.ppmc.workspace.service.RevisionStore;
import club.ppmc.workspace.service.StorageTaskExecutor;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/revisions")
@Slf4j
public class RevisionController {

    private final RevisionStore revisionStore;
    private final ArchiveService archiveService;
    private final StorageTaskExecutor tasks;

    public RevisionController(
            RevisionStore revisionStore, ArchiveService archiveService, StorageTaskExecutor tasks) {
        this.revisionStore = revisionStore;
        this.archiveService = archiveService;
        this.tasks = tasks;
    }

    @GetMapping
    public ResponseEntity<RevisionListResponse> list() {
        return ResponseEntity.ok(revisionStore.listRevisions());
    }

    /**
     * 解码并解压上传的压缩包，生成一个新的修订版本。
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<NewRevisionResponse>> importArchive(
            @RequestBody ArchiveImportRequest request) {
        return tasks.submit("导入压缩包", () -> {
            long id = archiveService.importArchive(request.zipBase64());
            log.info("压缩包导入完成，新的修订版本: {}", id);
            return ResponseEntity.ok(new NewRevisionResponse(id));
        });
    }

    /**
     * 以二进制流的形式下载指定修订版本中的文件。
     */
    @GetMapping("/file")
    public CompletableFuture<ResponseEntity<Resource>> file(@RequestParam long rev, @RequestParam String path) {
        return tasks.submit("下载修订版本文件 " + rev + "/" + path, () -> {
            Path file = archiveService.openRevisionFile(rev, path);
            var headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
            headers.setContentDisposition(
                    ContentDisposition.builder("attachment")
                            .filename(file.getFileName().toString(), StandardCharsets.UTF_8)
                            .build());
            return ResponseEntity.ok().headers(headers).<Resource>body(new FileSystemResource(file));
        });
    }
}
