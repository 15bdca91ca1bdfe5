package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 磁盘占用可视化树的节点（文件、目录或合并后的桶节点）。
 * <p>
 * 不变量：存在 {@code children} 时，{@code value} 等于所有子节点 {@code value} 之和；
 * 每个字节只会被计入一个节点（单个文件、桶节点，或通过子树递归）。
 *
 * @param id       显示名称（文件名/目录名，或桶节点的固定标签）
 * @param value    聚合大小（字节）
 * @param path     绝对路径（桶节点为 null）
 * @param category 分类
 * @param children 子节点（仅展开的目录才有；空目录/未展开时为 null）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiskNode(
        String id,
        long value,
        String path,
        DiskCategory category,
        List<DiskNode> children
) {

    public static final String MISC_FILES_ID = "Misc / Other";
    public static final String OTHER_FOLDERS_ID = "Other Folders";

    public DiskNode {
        children = (children == null || children.isEmpty()) ? null : List.copyOf(children);
    }

    public static DiskNode file(String name, long size, String path) {
        return new DiskNode(name, size, path, DiskCategory.forFileName(name), null);
    }

    /**
     * 目录节点：大小由子节点求和得出，而不是单独统计，保证“父 = 子之和”。
     */
    public static DiskNode directory(String name, String path, List<DiskNode> children) {
        long total = 0;
        if (children != null) {
            for (DiskNode child : children) {
                total += child.value();
            }
        }
        return new DiskNode(name, total, path, DiskCategory.FOLDER, children);
    }

    public static DiskNode bucket(String label, long size) {
        return new DiskNode(label, size, null, DiskCategory.OTHER, null);
    }

    @JsonIgnore
    public boolean isBucket() {
        return path == null && category == DiskCategory.OTHER;
    }
}
