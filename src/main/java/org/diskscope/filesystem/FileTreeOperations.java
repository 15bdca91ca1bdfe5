package org.diskscope.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;

/**
 * 递归删除与移动（回收站的物理操作）。
 * <p>
 * 所有遍历都不跟随符号链接：链接按“文件”处理，删除/移动的是链接本身。
 */
public final class FileTreeOperations {

    private static final Logger log = LoggerFactory.getLogger(FileTreeOperations.class);

    private FileTreeOperations() {
    }

    /**
     * 递归删除文件或目录。路径不存在时什么也不做。
     */
    public static void deleteTree(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.deleteIfExists(path);
            return;
        }
        Files.walkFileTree(path, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                // 遍历期间被外部删除：视为已删除
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * 把 source 移动到 target（target 必须不存在，不会覆盖）。
     * <p>
     * 同一文件系统内是一次 rename；跨文件系统移动非空目录时 rename 不可行，退化为“递归复制 + 删除源”。
     * 复制失败会清理已复制的部分并抛出异常；复制成功但删除源失败时保留复制结果，只记录告警（不丢数据）。
     */
    public static void moveTree(Path source, Path target) throws IOException {
        try {
            Files.move(source, target);
        } catch (DirectoryNotEmptyException e) {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                throw e;
            }
            log.debug("无法直接 rename（可能跨文件系统），改为复制后删除：{} -> {}", source, target);
            copyTree(source, target);
            try {
                deleteTree(source);
            } catch (IOException deleteFailure) {
                log.warn("已复制到 {}，但删除源路径失败，残留内容需手动清理：{}", target, source, deleteFailure);
            }
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        try {
            Files.walkFileTree(source, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    Files.createDirectory(target.resolve(source.relativize(dir).toString()));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.copy(file, target.resolve(source.relativize(file).toString()),
                            StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            try {
                deleteTree(target);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }
    }
}
