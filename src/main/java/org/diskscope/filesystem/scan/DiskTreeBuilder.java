package org.diskscope.filesystem.scan;

import org.diskscope.filesystem.dto.DiskCategory;
import org.diskscope.filesystem.dto.DiskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * 构建磁盘占用可视化树（深度 + 大小双重约束）。
 * <p>
 * 目录内的每个条目：
 * <ul>
 *   <li>小于 small-file 阈值的文件：累加到该目录的 “Misc / Other” 桶，不单独成节点。</li>
 *   <li>大于等于阈值的文件：单独成为叶子节点。</li>
 *   <li>子目录：先用 {@link SizeProbe} 算出精确大小；剩余深度耗尽、小于 small-folder 阈值、
 *       或目录名在忽略列表中时，整体累加到 “Other Folders” 桶（不递归）；否则以 depth-1 递归展开。</li>
 *   <li>单个条目的 stat/readdir 失败只跳过该条目（按 0 计入），不会中断整个构建。</li>
 * </ul>
 * 子节点按目录遍历顺序排列，两个桶节点（如有）追加在最后；目录自身的 value 为子节点之和。
 */
public class DiskTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(DiskTreeBuilder.class);

    private static final String ROOT_NAME = "Root";
    private static final String UNNAMED = "unnamed";

    private final SizeProbe sizeProbe;
    private final long smallFileBytes;
    private final long smallFolderBytes;
    private final Set<String> ignoredDirectories;

    public DiskTreeBuilder(SizeProbe sizeProbe, long smallFileBytes, long smallFolderBytes, Collection<String> ignoredDirectories) {
        this.sizeProbe = sizeProbe;
        this.smallFileBytes = smallFileBytes;
        this.smallFolderBytes = smallFolderBytes;
        this.ignoredDirectories = (ignoredDirectories == null) ? Set.of() : Set.copyOf(ignoredDirectories);
    }

    /**
     * 从 {@code path} 开始构建可视化树。
     *
     * @param path     起始路径（文件或目录）
     * @param maxDepth 最多向下展开的目录层数（0 表示只列出起始目录的直接条目，子目录全部合并）
     */
    public DiskNode buildTree(Path path, int maxDepth) {
        Path root = path.toAbsolutePath().normalize();
        Path rootName = root.getFileName();
        String name = (rootName == null) ? ROOT_NAME : rootName.toString();
        // 起始路径本身总是跟随链接（例如 macOS 的 /tmp -> /private/tmp）；follow-symlinks 只约束后代
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (IOException | SecurityException e) {
            log.debug("无法读取路径属性，按 0 计入：{}（{}）", root, e.getMessage());
            return new DiskNode(name, 0, root.toString(), DiskCategory.OTHER, null);
        }
        return buildNode(root, name, attrs, Math.max(0, maxDepth), new ArrayDeque<>());
    }

    private DiskNode buildNode(Path current, String name, BasicFileAttributes attrs, int remainingDepth, Deque<Path> ancestors) {
        if (!attrs.isDirectory()) {
            return DiskNode.file(name, attrs.size(), current.toString());
        }

        ancestors.push(realPathOrSelf(current));
        try {
            return buildDirectory(current, name, remainingDepth, ancestors);
        } finally {
            ancestors.pop();
        }
    }

    private DiskNode buildDirectory(Path current, String name, int remainingDepth, Deque<Path> ancestors) {
        List<DiskNode> children = new ArrayList<>();
        long miscFileBytes = 0;
        long otherFolderBytes = 0;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
            for (Path entry : stream) {
                String entryName = fileName(entry);
                BasicFileAttributes entryAttrs;
                try {
                    entryAttrs = sizeProbe.readAttributes(entry);
                } catch (IOException | SecurityException e) {
                    log.debug("跳过无法访问的条目：{}（{}）", entry, e.getMessage());
                    continue;
                }
                if (entryAttrs.isSymbolicLink()) {
                    continue;
                }

                if (!entryAttrs.isDirectory()) {
                    if (entryAttrs.size() < smallFileBytes) {
                        miscFileBytes += entryAttrs.size();
                    } else {
                        children.add(DiskNode.file(entryName, entryAttrs.size(), entry.toString()));
                    }
                    continue;
                }

                // 跟随链接时，指回祖先目录的条目视为循环，按 0 计入
                if (sizeProbe.isFollowSymlinks() && ancestors.contains(realPathOrSelf(entry))) {
                    log.debug("检测到目录循环，已跳过：{}", entry);
                    continue;
                }

                long childBytes = sizeProbe.computeSize(entry);
                if (remainingDepth <= 0 || childBytes < smallFolderBytes || ignoredDirectories.contains(entryName)) {
                    otherFolderBytes += childBytes;
                } else {
                    children.add(buildNode(entry, entryName, entryAttrs, remainingDepth - 1, ancestors));
                }
            }
        } catch (DirectoryIteratorException e) {
            // 遍历中途失败：保留已处理的条目
            log.debug("目录遍历中断，返回部分结果：{}（{}）", current, e.getCause().getMessage());
        } catch (IOException | SecurityException e) {
            log.debug("无法列出目录，按空目录处理：{}（{}）", current, e.getMessage());
            return DiskNode.directory(name, current.toString(), List.of());
        }

        if (miscFileBytes > 0) {
            children.add(DiskNode.bucket(DiskNode.MISC_FILES_ID, miscFileBytes));
        }
        if (otherFolderBytes > 0) {
            children.add(DiskNode.bucket(DiskNode.OTHER_FOLDERS_ID, otherFolderBytes));
        }
        return DiskNode.directory(name, current.toString(), children);
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException | SecurityException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        if (name == null || name.toString().isEmpty()) {
            return UNNAMED;
        }
        return name.toString();
    }
}
