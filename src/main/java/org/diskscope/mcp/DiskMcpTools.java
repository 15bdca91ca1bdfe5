package org.diskscope.mcp;

import org.diskscope.filesystem.DiskScopeProperties;
import org.diskscope.filesystem.dto.DiskNode;
import org.diskscope.filesystem.dto.TrashListResult;
import org.diskscope.filesystem.dto.TrashOperationResult;
import org.diskscope.filesystem.scan.ScanExecutor;
import org.diskscope.filesystem.scan.ScanFailedException;
import org.diskscope.filesystem.trash.TrashJournalManager;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

/**
 * 磁盘可视化扫描与回收站的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>可视化扫描（{@code disk_scan_for_visualization} / {@code disk_scan_for_visualization_deep}）。</li>
 *   <li>回收站（{@code trash_move} -> {@code trash_restore} / {@code trash_permanently_delete}，以及列表与清空）。</li>
 * </ul>
 * <p>
 * 本类只做参数校验与上限保护，实际逻辑在 {@link ScanExecutor} 与 {@link TrashJournalManager} 中。
 * 扫描在独立线程中执行；MCP Server 在自己的工作线程上调用工具方法，因此这里等待扫描结果不会阻塞请求接收。
 */
@Component
public class DiskMcpTools {

    private final DiskScopeProperties properties;
    private final ScanExecutor scanExecutor;
    private final TrashJournalManager trashManager;

    public DiskMcpTools(DiskScopeProperties properties, ScanExecutor scanExecutor, TrashJournalManager trashManager) {
        this.properties = properties;
        this.scanExecutor = scanExecutor;
        this.trashManager = trashManager;
    }

    @Tool(
            name = "disk_scan_for_visualization",
            description = "扫描目录并返回磁盘占用树（用于 treemap/sunburst 可视化）；小文件合并为 Misc / Other，小目录合并为 Other Folders。"
    )
    /**
     * 按深度扫描目录，返回可视化树。
     * <p>
     * 性能建议：目录很大时保持较小的 depth；深度越大，需要计算精确大小的子目录越多。
     */
    public DiskNode scanForVisualization(
            @ToolParam(description = "要扫描的目录（绝对路径）") String path,
            @ToolParam(required = false, description = "展开深度（默认 app.disk.scan-default-depth，上限 app.disk.scan-max-depth）") Integer depth
    ) {
        Path target = resolveExisting(path);
        return awaitScan(target, resolveScanDepth(depth));
    }

    @Tool(
            name = "disk_scan_for_visualization_deep",
            description = "以“深度扫描”预设深度扫描目录并返回磁盘占用树。"
    )
    public DiskNode scanForVisualizationDeep(
            @ToolParam(description = "要扫描的目录（绝对路径）") String path
    ) {
        Path target = resolveExisting(path);
        return awaitScan(target, resolveScanDepth(properties.getScanDeepDepth()));
    }

    @Tool(
            name = "trash_move",
            description = "把文件/目录移入应用回收站（可恢复）。"
    )
    public TrashOperationResult moveToTrash(
            @ToolParam(description = "要删除的文件/目录（绝对路径）") String path
    ) {
        return trashManager.moveToTrash(resolvePath(path));
    }

    @Tool(
            name = "trash_list",
            description = "列出回收站条目（应用回收站 + 系统回收站，按移入时间倒序）。"
    )
    public TrashListResult listTrashItems() {
        return TrashListResult.of(trashManager.listTrashItems());
    }

    @Tool(
            name = "trash_restore",
            description = "把应用回收站中的条目恢复到原路径（原路径已存在时失败，不覆盖；系统回收站条目不支持恢复）。"
    )
    public TrashOperationResult restoreFromTrash(
            @ToolParam(description = "trash_list 返回的 id") String id
    ) {
        return trashManager.restoreFromTrash(requireId(id));
    }

    @Tool(
            name = "trash_permanently_delete",
            description = "彻底删除回收站中的一个条目（不可恢复）。"
    )
    public TrashOperationResult permanentlyDelete(
            @ToolParam(description = "trash_list 返回的 id") String id
    ) {
        return trashManager.permanentlyDelete(requireId(id));
    }

    @Tool(
            name = "trash_empty",
            description = "清空回收站（应用回收站与系统回收站，不可恢复）。"
    )
    public TrashOperationResult emptyTrash() {
        return trashManager.emptyTrash();
    }

    private DiskNode awaitScan(Path target, int depth) {
        try {
            return scanExecutor.submit(target, depth).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ScanFailedException failed) {
                throw failed;
            }
            throw new ScanFailedException(target, e.getCause() != null ? e.getCause() : e);
        }
    }

    private int resolveScanDepth(Integer depth) {
        // 扫描深度上限保护：避免深层目录导致耗时过长/节点过多
        int resolved = (depth == null) ? properties.getScanDefaultDepth() : depth;
        resolved = Math.max(0, resolved);
        return Math.min(resolved, properties.getScanMaxDepth());
    }

    private static Path resolveExisting(String path) {
        Path resolved = resolvePath(path);
        if (!Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + resolved);
        }
        return resolved;
    }

    private static Path resolvePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        try {
            return Path.of(path.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("路径格式非法：" + path, e);
        }
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id 不能为空");
        }
        return id.trim();
    }
}
