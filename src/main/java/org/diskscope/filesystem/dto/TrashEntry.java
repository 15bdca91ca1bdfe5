package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 应用回收站清单中的一条记录。创建后不再修改，恢复或彻底删除时整条移除。
 *
 * @param id           全局唯一 id（移入回收站时生成）
 * @param name         原始文件名/目录名
 * @param originalPath 原始绝对路径（恢复目标）
 * @param storedName   在 {@code files/} 下的存放名（{@code id + "_" + name}），与实际内容一一对应
 * @param trashedAt    移入时间（epoch 毫秒）
 * @param size         大小（字节；目录为递归大小）
 * @param isDirectory  是否目录
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrashEntry(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("originalPath") String originalPath,
        @JsonProperty("storedName") String storedName,
        @JsonProperty("trashedAt") long trashedAt,
        @JsonProperty("size") long size,
        @JsonProperty("isDirectory") boolean isDirectory
) {
}
