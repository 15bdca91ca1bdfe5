package org.diskscope.filesystem.trash;

import org.diskscope.filesystem.DiskScopeProperties;
import org.diskscope.filesystem.scan.SizeProbe;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 按平台选择系统回收站实现。
 */
public final class SystemTrashes {

    private static final SystemTrash NONE = new SystemTrash() {
        @Override
        public Optional<Path> contentRoot() {
            return Optional.empty();
        }

        @Override
        public List<SystemTrashItem> list() {
            return List.of();
        }

        @Override
        public void delete(Path item) throws IOException {
            throw new IOException("当前平台不支持系统回收站：" + item);
        }
    };

    private SystemTrashes() {
    }

    /**
     * 没有系统回收站（Windows 等不支持的平台，或配置关闭）。
     */
    public static SystemTrash none() {
        return NONE;
    }

    public static SystemTrash detect(DiskScopeProperties properties, SizeProbe sizeProbe) {
        if (!properties.isSystemTrashEnabled()) {
            return none();
        }
        String configured = properties.getSystemTrashDir();
        if (configured != null && !configured.isBlank()) {
            return new XdgSystemTrash(Path.of(configured), sizeProbe);
        }

        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        Path home = Path.of(System.getProperty("user.home"));
        if (os.contains("mac")) {
            return new MacSystemTrash(home.resolve(".Trash"), sizeProbe);
        }
        if (os.contains("linux") || os.contains("bsd") || os.contains("sunos")) {
            String dataHome = System.getenv("XDG_DATA_HOME");
            Path base = (dataHome == null || dataHome.isBlank())
                    ? home.resolve(".local").resolve("share")
                    : Path.of(dataHome);
            return new XdgSystemTrash(base.resolve("Trash"), sizeProbe);
        }
        return none();
    }
}
