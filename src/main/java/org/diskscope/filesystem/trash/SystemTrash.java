package org.diskscope.filesystem.trash;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 系统（操作系统原生）回收站的只读视图 + 彻底删除能力。
 * <p>
 * 系统回收站的条目不写入应用清单，只在列出时实时枚举并合并；不支持通过应用恢复。
 */
public interface SystemTrash {

    /**
     * 存放回收内容的目录；不支持的平台返回 empty。
     */
    Optional<Path> contentRoot();

    /**
     * 实时枚举系统回收站中的条目。枚举失败时返回已得到的部分（不抛异常）。
     */
    List<SystemTrashItem> list();

    /**
     * 彻底删除一个条目（调用方已校验它位于 {@link #contentRoot()} 之内）。
     */
    void delete(Path item) throws IOException;

    /**
     * 系统回收站中的一个条目。
     *
     * @param path         条目在系统回收站中的绝对路径
     * @param name         名称
     * @param originalPath 原始路径（无法得知时为 null）
     * @param trashedAt    移入时间（epoch 毫秒）
     * @param size         大小（字节）
     * @param directory    是否目录
     */
    record SystemTrashItem(
            Path path,
            String name,
            String originalPath,
            long trashedAt,
            long size,
            boolean directory
    ) {
    }
}
