package org.diskscope.filesystem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * 判断路径是否严格位于某个根目录之内，用于阻止构造的 id/路径删除根目录之外的内容。
 * <p>
 * 校验分两层：
 * <ul>
 *   <li>规范化后的字符串层面 {@code startsWith}，快速挡掉 {@code ../} 之类的越界路径。</li>
 *   <li>对根目录 -> 目标父目录的逐级目录做 realPath 校验，防止中间某一级是 symlink/junction 造成逃逸。</li>
 * </ul>
 * 目标本身不做 realPath 解析：回收站里的条目可能就是一个符号链接，删除的是链接本身而不是它指向的内容。
 */
public final class PathContainment {

    private PathContainment() {
    }

    /**
     * @return candidate 位于 root 之下且不等于 root 本身时为 true
     */
    public static boolean isStrictlyWithin(Path root, Path candidate) {
        if (root == null || candidate == null) {
            return false;
        }
        Path rootPath = root.toAbsolutePath().normalize();
        Path target = candidate.toAbsolutePath().normalize();
        if (target.equals(rootPath) || !target.startsWith(rootPath)) {
            return false;
        }

        Path rootReal;
        try {
            rootReal = rootPath.toRealPath();
        } catch (IOException e) {
            // 根目录不存在时只能依赖字符串层面的校验
            return true;
        }

        Path current = rootPath;
        Path parentRelative = rootPath.relativize(target.getParent());
        for (Path segment : parentRelative) {
            if (segment.toString().isEmpty()) {
                continue;
            }
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    return false;
                }
            } catch (IOException e) {
                return false;
            }
        }
        return true;
    }
}
