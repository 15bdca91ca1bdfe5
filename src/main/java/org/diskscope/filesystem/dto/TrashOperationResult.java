package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 回收站操作（移入/恢复/彻底删除/清空）的返回结果。
 *
 * @param success  是否成功
 * @param id       涉及的条目 id（清空时为 null）
 * @param error    失败分类（成功时为 null）
 * @param message  失败原因（成功时为 null）
 * @param warnings 非致命告警（例如清空时个别条目删除失败、清单损坏已备份等）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrashOperationResult(
        boolean success,
        String id,
        TrashError error,
        String message,
        List<String> warnings
) {

    public static TrashOperationResult ok(String id) {
        return new TrashOperationResult(true, id, null, null, null);
    }

    public static TrashOperationResult ok(String id, List<String> warnings) {
        return new TrashOperationResult(true, id, null, null, (warnings == null || warnings.isEmpty()) ? null : List.copyOf(warnings));
    }

    public static TrashOperationResult failed(String id, TrashError error, String message) {
        return new TrashOperationResult(false, id, error, message, null);
    }
}
