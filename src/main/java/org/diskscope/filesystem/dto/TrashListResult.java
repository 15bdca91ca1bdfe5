package org.diskscope.filesystem.dto;

import java.util.List;

/**
 * {@code trash_list} 的返回结果。
 *
 * @param total       条目总数
 * @param appCount    应用回收站条目数
 * @param systemCount 系统回收站条目数
 * @param items       条目（按移入时间倒序）
 */
public record TrashListResult(
        int total,
        int appCount,
        int systemCount,
        List<TrashItem> items
) {

    public static TrashListResult of(List<TrashItem> items) {
        int app = 0;
        for (TrashItem item : items) {
            if (item.source() == TrashSource.APP) {
                app++;
            }
        }
        return new TrashListResult(items.size(), app, items.size() - app, items);
    }
}
