package de.mirkosertic.filequality.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileDiscoverer Tests")
class FileDiscovererTest {

    @TempDir
    Path root;

    private static Path write(final Path file, final String content) throws Exception {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Nested
    @DisplayName("Walking a root directory")
    class Walking {

        @Test
        @DisplayName("Should return files in lexical path order")
        void shouldReturnSortedFiles() throws Exception {
            // Given
            write(root.resolve("z.txt"), "z");
            write(root.resolve("a/b.txt"), "b");
            write(root.resolve("a.txt"), "a");

            // When
            final DiscoveryResult result = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64)
                    .discover(root);

            // Then
            final Path normalizedRoot = root.toAbsolutePath().normalize();
            assertThat(result.root()).isEqualTo(normalizedRoot);
            assertThat(result.files()).containsExactly(
                    normalizedRoot.resolve("a.txt"),
                    normalizedRoot.resolve("a/b.txt"),
                    normalizedRoot.resolve("z.txt"));
            assertThat(result.issues()).isEmpty();
        }

        @Test
        @DisplayName("Should yield the same sequence on repeated runs")
        void shouldBeDeterministic() throws Exception {
            for (int i = 0; i < 20; i++) {
                write(root.resolve("dir" + (i % 3) + "/file" + i + ".txt"), "x" + i);
            }
            final FileDiscoverer discoverer = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64);

            assertThat(discoverer.discover(root).files()).isEqualTo(discoverer.discover(root).files());
        }

        @Test
        @DisplayName("Should prune excluded directories and apply includes")
        void shouldApplyPatterns() throws Exception {
            // Given
            write(root.resolve(".git/config"), "[core]");
            write(root.resolve("node_modules/lib/index.js"), "js");
            write(root.resolve("src/App.java"), "class App {}");
            write(root.resolve("src/notes.md"), "# notes");

            final FilePatternMatcher matcher = new FilePatternMatcher(
                    List.of("*.java", "*.md"), List.of("**/.git/**", "**/node_modules/**"));

            // When
            final DiscoveryResult result = new FileDiscoverer(matcher, 64).discover(root);

            // Then
            assertThat(result.files())
                    .extracting(p -> root.toAbsolutePath().normalize().relativize(p).toString().replace('\\', '/'))
                    .containsExactly("src/App.java", "src/notes.md");
        }

        @Test
        @DisplayName("Should respect the maximum depth")
        void shouldRespectMaxDepth() throws Exception {
            write(root.resolve("top.txt"), "t");
            write(root.resolve("one/two/deep.txt"), "d");

            final DiscoveryResult result = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 1)
                    .discover(root);

            assertThat(result.files()).extracting(p -> p.getFileName().toString()).containsExactly("top.txt");
        }

        @Test
        @DisplayName("A regular file as root should yield just that file")
        void shouldAcceptSingleFileRoot() throws Exception {
            final Path file = write(root.resolve("single.txt"), "s");

            final DiscoveryResult result = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64)
                    .discover(file);

            assertThat(result.files()).containsExactly(file.toAbsolutePath().normalize());
            assertThat(result.relativize(result.files().get(0))).isEqualTo(Path.of("single.txt"));
        }

        @Test
        @DisplayName("Should fail with AccessException for a missing root")
        void shouldFailForMissingRoot() {
            final FileDiscoverer discoverer = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64);
            final Path missing = root.resolve("missing");

            assertThatThrownBy(() -> discoverer.discover(missing))
                    .isInstanceOf(AccessException.class)
                    .hasMessageContaining("does not exist")
                    .satisfies(e -> assertThat(((AccessException) e).getPath()).isEqualTo(missing.toAbsolutePath().normalize()));
        }
    }

    @Nested
    @DisplayName("Explicit file lists")
    class ExplicitFiles {

        @Test
        @DisplayName("Should sort, deduplicate and report missing entries")
        void shouldResolveExplicitFiles() throws Exception {
            // Given
            final Path b = write(root.resolve("b.txt"), "b");
            final Path a = write(root.resolve("a.txt"), "a");
            final Path missing = root.resolve("missing.txt");

            // When
            final DiscoveryResult result = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64)
                    .discover(List.of(b, a, b, missing));

            // Then
            assertThat(result.files()).containsExactly(
                    a.toAbsolutePath().normalize(), b.toAbsolutePath().normalize());
            assertThat(result.issues()).singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.path()).isEqualTo(missing.toAbsolutePath().normalize());
                        assertThat(issue.message()).isEqualTo("Does not exist");
                    });
            assertThat(result.root()).isEqualTo(root.toAbsolutePath().normalize());
        }

        @Test
        @DisplayName("Should report directories given as files")
        void shouldReportDirectories() throws Exception {
            final Path dir = Files.createDirectories(root.resolve("dir"));

            final DiscoveryResult result = new FileDiscoverer(new FilePatternMatcher(List.of(), List.of()), 64)
                    .discover(List.of(dir));

            assertThat(result.files()).isEmpty();
            assertThat(result.issues()).extracting(DiscoveryIssue::message).containsExactly("Not a regular file");
        }
    }
}
