package org.diskscope.filesystem.dto;

import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * 回收站操作失败的分类。
 */
public enum TrashError {
    PERMISSION_DENIED,
    NOT_FOUND,
    NOT_A_DIRECTORY,
    /** 恢复目标路径已被占用（不会覆盖）。 */
    RESTORE_COLLISION,
    TRAVERSAL_FAULT,
    /** 清单文件无法解析且无法备份，拒绝在其之上继续写入。 */
    MANIFEST_CORRUPT,
    SYSTEM_ITEM_NOT_RESTORABLE,
    /** 系统回收站 id 解码后的路径不在系统回收站目录内。 */
    OUTSIDE_TRASH_ROOT,
    /** 目标是回收站自身或包含回收站的目录。 */
    INVALID_TARGET,
    IO_FAILURE;

    public static TrashError classify(Exception e) {
        if (e instanceof AccessDeniedException || e instanceof SecurityException) {
            return PERMISSION_DENIED;
        }
        if (e instanceof NoSuchFileException) {
            return NOT_FOUND;
        }
        if (e instanceof NotDirectoryException) {
            return NOT_A_DIRECTORY;
        }
        if (e instanceof FileAlreadyExistsException) {
            return RESTORE_COLLISION;
        }
        if (e instanceof FileSystemLoopException) {
            return TRAVERSAL_FAULT;
        }
        return IO_FAILURE;
    }
}
