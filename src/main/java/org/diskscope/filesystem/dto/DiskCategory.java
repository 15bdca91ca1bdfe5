package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * 可视化节点的分类：目录固定为 {@link #FOLDER}，文件按扩展名查表，桶节点为 {@link #OTHER}。
 */
public enum DiskCategory {
    CODE,
    MEDIA,
    DOCS,
    SYSTEM,
    FOLDER,
    OTHER;

    /**
     * 扩展名（小写、不含点）到分类的固定映射；未列出的扩展名一律为 {@link #OTHER}。
     */
    private static final Map<String, DiskCategory> BY_EXTENSION = Map.ofEntries(
            Map.entry("js", CODE), Map.entry("ts", CODE), Map.entry("tsx", CODE), Map.entry("jsx", CODE),
            Map.entry("py", CODE), Map.entry("html", CODE), Map.entry("css", CODE), Map.entry("json", CODE),
            Map.entry("jpg", MEDIA), Map.entry("jpeg", MEDIA), Map.entry("png", MEDIA), Map.entry("gif", MEDIA),
            Map.entry("webp", MEDIA), Map.entry("svg", MEDIA), Map.entry("mp4", MEDIA), Map.entry("mov", MEDIA),
            Map.entry("webm", MEDIA), Map.entry("avi", MEDIA),
            Map.entry("pdf", DOCS), Map.entry("doc", DOCS), Map.entry("docx", DOCS), Map.entry("txt", DOCS),
            Map.entry("md", DOCS),
            Map.entry("dll", SYSTEM), Map.entry("exe", SYSTEM), Map.entry("dmg", SYSTEM)
    );

    /**
     * 根据文件名的扩展名判定分类（大小写不敏感）。
     * <p>
     * 没有扩展名的文件（包括 {@code .bashrc} 这类以点开头的隐藏文件）归为 {@link #OTHER}。
     */
    public static DiskCategory forFileName(String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return OTHER;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(ext, OTHER);
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
