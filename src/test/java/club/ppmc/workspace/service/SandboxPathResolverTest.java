package club.ppmc.workspace.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.workspace.config.StorageProperties;
import club.ppmc.workspace.exception.StorageException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SandboxPathResolverTest {

    @TempDir
    Path tempDir;

    private Path root;
    private SandboxPathResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.resolve("root"));
        resolver = new SandboxPathResolver(new StorageProperties());
    }

    @Test
    void resolve_appendsNormalComponents() {
        assertThat(resolver.resolve(root, "src/main/a.json")).isEqualTo(root.resolve("src").resolve("main").resolve("a.json"));
    }

    @Test
    void resolve_dropsCurrentDirectoryAndEmptyComponents() {
        assertThat(resolver.resolve(root, "./a//./b/")).isEqualTo(root.resolve("a").resolve("b"));
    }

    @Test
    void resolve_blankPathIsTheRootItself() {
        assertThat(resolver.resolve(root, "")).isEqualTo(root);
        assertThat(resolver.resolve(root, null)).isEqualTo(root);
        assertThat(resolver.resolve(root, ".")).isEqualTo(root);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "..",
            "../outside.txt",
            "a/../../outside.txt",
            "a/..",
            "/etc/passwd",
            "\\windows\\system32",
            "a\\..\\..\\b",
            "C:/Windows",
            "c:notes.txt",
            "a/b\0c"
    })
    void resolve_rejectsEscapingPaths(String input) {
        assertThatThrownBy(() -> resolver.resolve(root, input))
                .isInstanceOfSatisfying(StorageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StorageException.ErrorKind.PATH_ESCAPE));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void resolve_acceptsColonInsideNormalNames() {
        assertThat(resolver.resolve(root, "12:30 notes.txt")).isEqualTo(root.resolve("12:30 notes.txt"));
        assertThat(resolver.resolve(root, "logs/C:backup.txt")).isEqualTo(root.resolve("logs").resolve("C:backup.txt"));
    }

    @Test
    void resolve_rejectsSymlinkPointingOutsideRoot() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(root.resolve("link"), outside);

        assertThatThrownBy(() -> resolver.resolve(root, "link/secret.txt"))
                .isInstanceOfSatisfying(StorageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StorageException.ErrorKind.PATH_ESCAPE));
    }

    @Test
    void resolve_followsSymlinksWhenAllowed() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.createSymbolicLink(root.resolve("link"), outside);
        var properties = new StorageProperties();
        properties.setAllowSymlinks(true);

        Path resolved = new SandboxPathResolver(properties).resolve(root, "link/secret.txt");

        assertThat(resolved).isEqualTo(root.resolve("link").resolve("secret.txt"));
    }

    @Test
    void resolve_allowsPathsThatDoNotExistYet() {
        assertThat(resolver.resolve(root, "new/dir/file.txt")).startsWith(root);
    }

    @Test
    void relativize_usesForwardSlashes() {
        assertThat(resolver.relativize(root, root.resolve("a").resolve("b.txt"))).isEqualTo("a/b.txt");
        assertThat(resolver.relativize(root, root)).isEmpty();
    }
}
