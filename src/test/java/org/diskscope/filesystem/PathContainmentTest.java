package org.diskscope.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThatCode;

class PathContainmentTest {

    @TempDir
    Path tmp;

    @Test
    void isStrictlyWithin_acceptsDescendantsOnly() throws IOException {
        Path root = Files.createDirectories(tmp.resolve("root"));
        Files.createDirectories(root.resolve("a/b"));

        assertThat(PathContainment.isStrictlyWithin(root, root.resolve("a/b/c.txt"))).isTrue();
        assertThat(PathContainment.isStrictlyWithin(root, root.resolve("not-created-yet"))).isTrue();
        assertThat(PathContainment.isStrictlyWithin(root, root)).isFalse();
        assertThat(PathContainment.isStrictlyWithin(root, root.resolve("a/../../escape"))).isFalse();
        assertThat(PathContainment.isStrictlyWithin(root, tmp.resolve("root-sibling/x"))).isFalse();
        assertThat(PathContainment.isStrictlyWithin(root, null)).isFalse();
    }

    @Test
    void isStrictlyWithin_rejectsEscapeThroughSymlinkedParent() throws IOException {
        Path root = Files.createDirectories(tmp.resolve("root"));
        Path outside = Files.createDirectories(tmp.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "s");
        assumeThatCode(() -> Files.createSymbolicLink(root.resolve("link"), outside)).doesNotThrowAnyException();

        assertThat(PathContainment.isStrictlyWithin(root, root.resolve("link/secret.txt"))).isFalse();
        assertThat(PathContainment.isStrictlyWithin(root, root.resolve("link"))).isTrue();
    }
}
