package org.diskscope.filesystem.trash;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Optional;

/**
 * 系统回收站条目的 id：{@code system:} + 绝对路径的 URL-safe Base64（无填充）。可逆，不依赖清单。
 */
public final class SystemTrashIds {

    public static final String PREFIX = "system:";

    private SystemTrashIds() {
    }

    public static boolean isSystemId(String id) {
        return id != null && id.startsWith(PREFIX);
    }

    public static String encode(Path path) {
        byte[] bytes = path.toAbsolutePath().normalize().toString().getBytes(StandardCharsets.UTF_8);
        return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * @return 解码失败（格式错误、不是绝对路径）时返回 empty
     */
    public static Optional<Path> decode(String id) {
        if (!isSystemId(id)) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Base64.getUrlDecoder().decode(id.substring(PREFIX.length()));
            Path path = Path.of(new String(bytes, StandardCharsets.UTF_8));
            return path.isAbsolute() ? Optional.of(path.normalize()) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
