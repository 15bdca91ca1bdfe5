package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 回收站列表项（应用回收站与系统回收站合并后的统一视图）。
 *
 * @param id           应用条目为清单 id；系统条目为可逆编码后的路径（{@code system:...}）
 * @param name         名称
 * @param originalPath 原始路径（系统回收站无法得知时为 null）
 * @param trashedAt    移入时间（epoch 毫秒）
 * @param size         大小（字节）
 * @param isDirectory  是否目录
 * @param source       来源
 */
public record TrashItem(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("originalPath") String originalPath,
        @JsonProperty("trashedAt") long trashedAt,
        @JsonProperty("size") long size,
        @JsonProperty("isDirectory") boolean isDirectory,
        @JsonProperty("source") TrashSource source
) {
}
