package club.ppmc.workspace.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import club.ppmc.workspace.exception.StorageException.ErrorKind;
import java.nio.file.Files;
import java.nio.file.Path;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileServiceTest {

    @TempDir
    Path tempDir;

    private Path storageRoot;
    private RevisionStore store;
    private FileService service;

    @BeforeEach
    void setUp() {
        storageRoot = tempDir.resolve("decisions");
        var properties = new StorageProperties();
        properties.setRoot(storageRoot.toString());
        store = new RevisionStore(properties);
        store.bootstrap();
        service = new FileService(store, new SandboxPathResolver(properties));
    }

    private static void assertKind(ThrowingCallable call, ErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(StorageException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
    }

    @Test
    void writeThenRead_returnsSameContent() throws Exception {
        String content = "{\n  \"nodes\": [],\n  \"name\": \"定价规则\"\n}";

        service.writeFileContent("rules/pricing.json", content);

        assertThat(service.readFileContent("rules/pricing.json")).isEqualTo(content);
        assertThat(storageRoot.resolve("0").resolve("rules").resolve("pricing.json")).exists();
    }

    @Test
    void write_overwritesExistingFile() throws Exception {
        service.writeFileContent("a.txt", "first");
        service.writeFileContent("a.txt", "second");

        assertThat(service.readFileContent("a.txt")).isEqualTo("second");
    }

    @Test
    void write_targetsCurrentRevisionOnly() throws Exception {
        service.writeFileContent("a.txt", "v0");
        store.snapshot();

        service.writeFileContent("a.txt", "v1");

        assertThat(storageRoot.resolve("0").resolve("a.txt")).hasContent("v0");
        assertThat(storageRoot.resolve("1").resolve("a.txt")).hasContent("v1");
    }

    @Test
    void write_rejectsEscapeAndRevisionRoot() {
        assertKind(() -> service.writeFileContent("../HEAD", "99"), ErrorKind.PATH_ESCAPE);
        assertKind(() -> service.writeFileContent("", "x"), ErrorKind.BAD_REQUEST);
    }

    @Test
    void read_missingOrDirectoryIsNotFound() throws Exception {
        service.createDirectory("dir");

        assertKind(() -> service.readFileContent("missing.txt"), ErrorKind.NOT_FOUND);
        assertKind(() -> service.readFileContent("dir"), ErrorKind.NOT_FOUND);
    }

    @Test
    void mkdir_isIdempotent() throws Exception {
        service.createDirectory("a/b/c");
        service.createDirectory("a/b/c");

        assertThat(storageRoot.resolve("0").resolve("a").resolve("b").resolve("c")).isDirectory();
        try (var children = Files.list(storageRoot.resolve("0").resolve("a").resolve("b"))) {
            assertThat(children.count()).isEqualTo(1);
        }
    }

    @Test
    void rename_createsDestinationParents() throws Exception {
        service.writeFileContent("draft.json", "{}");

        service.renameFile("draft.json", "published/2024/final.json");

        assertThat(storageRoot.resolve("0").resolve("draft.json")).doesNotExist();
        assertThat(service.readFileContent("published/2024/final.json")).isEqualTo("{}");
    }

    @Test
    void rename_movesWholeDirectories() throws Exception {
        service.writeFileContent("old/x.txt", "x");

        service.renameFile("old", "new");

        assertThat(service.readFileContent("new/x.txt")).isEqualTo("x");
    }

    @Test
    void rename_reportsSandboxFailureAsBadRequest() throws Exception {
        service.writeFileContent("a.txt", "a");

        assertKind(() -> service.renameFile("a.txt", "../../stolen.txt"), ErrorKind.BAD_REQUEST);
        assertKind(() -> service.renameFile("/etc/passwd", "a.txt"), ErrorKind.BAD_REQUEST);
        assertThat(service.readFileContent("a.txt")).isEqualTo("a");
    }

    @Test
    void rename_missingSourceFailsWithIoError() {
        assertThatThrownBy(() -> service.renameFile("ghost.txt", "b.txt"))
                .isInstanceOf(java.nio.file.NoSuchFileException.class);
    }

    @Test
    void delete_missingPathIsNotFound() {
        assertKind(() -> service.deleteFile("ghost.txt"), ErrorKind.NOT_FOUND);
    }

    @Test
    void delete_removesDirectoryRecursively() throws Exception {
        service.writeFileContent("tree/a.txt", "a");
        service.writeFileContent("tree/sub/b.txt", "b");

        service.deleteFile("tree");

        assertThat(storageRoot.resolve("0").resolve("tree")).doesNotExist();
    }

    @Test
    void delete_removesSingleFile() throws Exception {
        service.writeFileContent("a.txt", "a");

        service.deleteFile("a.txt");

        assertThat(storageRoot.resolve("0").resolve("a.txt")).doesNotExist();
    }

    @Test
    void delete_refusesRevisionRoot() {
        assertKind(() -> service.deleteFile("."), ErrorKind.BAD_REQUEST);
        assertThat(storageRoot.resolve("0")).isDirectory();
    }
}
