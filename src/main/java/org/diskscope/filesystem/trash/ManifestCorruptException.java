package org.diskscope.filesystem.trash;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 清单文件无法解析，且无法把它备份到一旁。
 */
public class ManifestCorruptException extends IOException {

    public ManifestCorruptException(Path manifest, Throwable cause) {
        super("回收站清单已损坏且无法备份：" + manifest, cause);
    }
}
