package org.diskscope.filesystem.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.Set;

/**
 * 计算路径的精确递归大小（字节），仅用于决定子目录是“展开”还是“合并”。
 * <p>
 * 规则：
 * <ul>
 *   <li>文件返回自身大小；目录递归累加所有可达后代的大小。</li>
 *   <li>任何后代的 stat/list 失败都会被吞掉并按 0 计入：探测只会“降级”，不会整体失败。</li>
 *   <li>不做缓存：每次调用都重新遍历。</li>
 *   <li>不跟随符号链接时，链接本身按 0 计入；跟随时由 {@link Files#walkFileTree} 检测循环并跳过。</li>
 * </ul>
 * 遍历使用 walkFileTree（内部是显式栈），因此超深目录也不会导致调用栈溢出。
 */
public class SizeProbe {

    private static final Logger log = LoggerFactory.getLogger(SizeProbe.class);

    private final boolean followSymlinks;

    public SizeProbe(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public long computeSize(Path path) {
        BasicFileAttributes attrs;
        try {
            attrs = readAttributes(path);
        } catch (IOException | SecurityException e) {
            log.debug("无法读取路径属性，按 0 计入：{}（{}）", path, e.getMessage());
            return 0;
        }
        if (attrs.isSymbolicLink()) {
            return 0;
        }
        if (!attrs.isDirectory()) {
            return attrs.size();
        }

        long[] total = new long[]{0};
        Set<FileVisitOption> options = followSymlinks
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);
        try {
            Files.walkFileTree(path, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes fileAttrs) {
                    if (!fileAttrs.isSymbolicLink() && !fileAttrs.isDirectory()) {
                        total[0] += fileAttrs.size();
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (exc instanceof FileSystemLoopException) {
                        log.debug("检测到符号链接循环，已跳过：{}", file);
                    } else {
                        log.debug("访问失败，按 0 计入：{}（{}）", file, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    // 目录迭代中途失败：已统计的部分保留
                    if (exc != null) {
                        log.debug("目录遍历中断：{}（{}）", dir, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException | SecurityException e) {
            log.debug("遍历目录失败，返回已统计部分：{}（{}）", path, e.getMessage());
        }
        return total[0];
    }

    BasicFileAttributes readAttributes(Path path) throws IOException {
        return followSymlinks
                ? Files.readAttributes(path, BasicFileAttributes.class)
                : Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    }
}
