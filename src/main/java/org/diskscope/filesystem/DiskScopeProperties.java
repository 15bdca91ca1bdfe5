package org.diskscope.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.List;

/**
 * 磁盘扫描与回收站的业务配置（{@code app.disk.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>扫描：通过 depth 上限与“小文件/小目录”阈值控制可视化树的节点数量，避免大目录产生海量节点。</li>
 *   <li>回收站：{@link #trashRoot} 是应用自己的回收站根目录（{@code files/} + {@code manifest.json}）。</li>
 *   <li>系统回收站只读合并到列表中，可通过 {@link #systemTrashDir} 指定位置（默认按平台自动探测）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.disk")
public class DiskScopeProperties {

    /**
     * 可视化扫描默认深度（调用方未传 depth 时使用）。
     */
    @Min(0)
    @Max(1_000)
    private int scanDefaultDepth = 2;

    /**
     * “深度扫描”预设使用的深度。
     */
    @Min(0)
    @Max(1_000)
    private int scanDeepDepth = 4;

    /**
     * 扫描深度的硬上限（上限保护）。
     * <p>
     * 说明：与调用方传入的 depth 无关，任何请求都会被裁剪到该值以内，防止超深目录导致递归失控。
     */
    @Min(0)
    @Max(1_000)
    private int scanMaxDepth = 16;

    /**
     * 小于该大小的文件会合并进 “Misc / Other” 桶节点。
     */
    @NotNull
    private DataSize smallFileThreshold = DataSize.ofMegabytes(5);

    /**
     * 小于该大小的目录不展开，整体合并进 “Other Folders” 桶节点。
     */
    @NotNull
    private DataSize smallFolderThreshold = DataSize.ofMegabytes(1);

    /**
     * 永远不展开的目录名（依赖/构建产物等），其大小直接计入 “Other Folders”。
     */
    @NotNull
    private List<String> ignoredDirectories = List.of(
            "node_modules", ".git", ".next", "dist", "build", ".cache", "Library"
    );

    /**
     * 是否跟随符号链接。
     * <p>
     * 安全建议：默认 false（链接不计大小、不遍历）；开启后依赖祖先链路的 realPath 校验防止循环。
     */
    private boolean followSymlinks = false;

    /**
     * 扫描线程名前缀。
     */
    @NotBlank
    private String scanThreadNamePrefix = "disk-scan";

    /**
     * 应用回收站根目录。
     */
    @NotBlank
    private String trashRoot = Path.of(System.getProperty("user.home"), ".diskscope", "trash").toString();

    /**
     * 是否把系统回收站的条目合并到回收站列表中。
     */
    private boolean systemTrashEnabled = true;

    /**
     * 系统回收站目录（XDG 布局：{@code files/} + {@code info/}）。
     * <p>
     * 为空时按平台自动探测；不支持的平台视为没有系统回收站。
     */
    private String systemTrashDir;

    public int getScanDefaultDepth() {
        return scanDefaultDepth;
    }

    public void setScanDefaultDepth(int scanDefaultDepth) {
        this.scanDefaultDepth = scanDefaultDepth;
    }

    public int getScanDeepDepth() {
        return scanDeepDepth;
    }

    public void setScanDeepDepth(int scanDeepDepth) {
        this.scanDeepDepth = scanDeepDepth;
    }

    public int getScanMaxDepth() {
        return scanMaxDepth;
    }

    public void setScanMaxDepth(int scanMaxDepth) {
        this.scanMaxDepth = scanMaxDepth;
    }

    public DataSize getSmallFileThreshold() {
        return smallFileThreshold;
    }

    public void setSmallFileThreshold(DataSize smallFileThreshold) {
        this.smallFileThreshold = smallFileThreshold;
    }

    public DataSize getSmallFolderThreshold() {
        return smallFolderThreshold;
    }

    public void setSmallFolderThreshold(DataSize smallFolderThreshold) {
        this.smallFolderThreshold = smallFolderThreshold;
    }

    public List<String> getIgnoredDirectories() {
        return ignoredDirectories;
    }

    public void setIgnoredDirectories(List<String> ignoredDirectories) {
        this.ignoredDirectories = ignoredDirectories;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public String getScanThreadNamePrefix() {
        return scanThreadNamePrefix;
    }

    public void setScanThreadNamePrefix(String scanThreadNamePrefix) {
        this.scanThreadNamePrefix = scanThreadNamePrefix;
    }

    public String getTrashRoot() {
        return trashRoot;
    }

    public void setTrashRoot(String trashRoot) {
        this.trashRoot = trashRoot;
    }

    public boolean isSystemTrashEnabled() {
        return systemTrashEnabled;
    }

    public void setSystemTrashEnabled(boolean systemTrashEnabled) {
        this.systemTrashEnabled = systemTrashEnabled;
    }

    public String getSystemTrashDir() {
        return systemTrashDir;
    }

    public void setSystemTrashDir(String systemTrashDir) {
        this.systemTrashDir = systemTrashDir;
    }
}
