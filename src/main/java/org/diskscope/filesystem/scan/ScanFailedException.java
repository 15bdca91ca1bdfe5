package org.diskscope.filesystem.scan;

import java.nio.file.Path;

/**
 * 扫描单元在产出结果前异常退出。没有部分结果。
 */
public class ScanFailedException extends RuntimeException {

    private final transient Path path;

    public ScanFailedException(Path path, Throwable cause) {
        super("扫描失败：" + path + "（" + cause.getMessage() + "）", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
