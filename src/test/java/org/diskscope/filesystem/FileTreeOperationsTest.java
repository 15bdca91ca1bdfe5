package org.diskscope.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThatCode;

class FileTreeOperationsTest {

    @TempDir
    Path tmp;

    @Test
    void deleteTree_removesNestedDirectories() throws IOException {
        Path dir = tmp.resolve("d");
        Files.createDirectories(dir.resolve("a/b/c"));
        Files.writeString(dir.resolve("a/b/c/x.txt"), "x");
        Files.writeString(dir.resolve("y.txt"), "y");

        FileTreeOperations.deleteTree(dir);

        assertThat(dir).doesNotExist();
    }

    @Test
    void deleteTree_missingPathIsNoOp() throws IOException {
        FileTreeOperations.deleteTree(tmp.resolve("missing"));

        assertThat(tmp).isEmptyDirectory();
    }

    @Test
    void deleteTree_removesLinkButNotItsTarget() throws IOException {
        Path target = Files.createDirectories(tmp.resolve("target"));
        Files.writeString(target.resolve("keep.txt"), "keep");
        Path dir = Files.createDirectories(tmp.resolve("d"));
        assumeThatCode(() -> Files.createSymbolicLink(dir.resolve("link"), target)).doesNotThrowAnyException();

        FileTreeOperations.deleteTree(dir);

        assertThat(dir).doesNotExist();
        assertThat(target.resolve("keep.txt")).hasContent("keep");
    }

    @Test
    void moveTree_movesDirectoryWithContent() throws IOException {
        Path source = tmp.resolve("src");
        Files.createDirectories(source.resolve("inner"));
        Files.writeString(source.resolve("inner/a.txt"), "a");
        Path target = tmp.resolve("dst");

        FileTreeOperations.moveTree(source, target);

        assertThat(source).doesNotExist();
        assertThat(target.resolve("inner/a.txt")).hasContent("a");
    }

    @Test
    void moveTree_neverOverwritesExistingTarget() throws IOException {
        Path source = Files.writeString(tmp.resolve("a.txt"), "new");
        Path target = Files.writeString(tmp.resolve("b.txt"), "old");

        assertThatThrownBy(() -> FileTreeOperations.moveTree(source, target)).isInstanceOf(FileAlreadyExistsException.class);
        assertThat(target).hasContent("old");
        assertThat(source).hasContent("new");
    }
}
