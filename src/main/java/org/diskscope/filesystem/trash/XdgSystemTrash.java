package org.diskscope.filesystem.trash;

import org.diskscope.filesystem.FileTreeOperations;
import org.diskscope.filesystem.scan.SizeProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * freedesktop.org 规范的回收站（Linux/BSD 桌面）：{@code files/} 存放内容，{@code info/<名称>.trashinfo} 存放元数据。
 * <p>
 * {@code .trashinfo} 示例：
 * <pre>
 * [Trash Info]
 * Path=/home/u/Documents/a%20b.txt
 * DeletionDate=2024-05-01T12:30:00
 * </pre>
 * 缺少 info 文件时，移入时间退化为条目的最后修改时间，原始路径未知。
 */
public class XdgSystemTrash implements SystemTrash {

    private static final Logger log = LoggerFactory.getLogger(XdgSystemTrash.class);

    static final String INFO_SUFFIX = ".trashinfo";

    private final Path trashDir;
    private final Path filesDir;
    private final Path infoDir;
    private final SizeProbe sizeProbe;
    private final ZoneId zone;

    public XdgSystemTrash(Path trashDir, SizeProbe sizeProbe) {
        this(trashDir, sizeProbe, ZoneId.systemDefault());
    }

    XdgSystemTrash(Path trashDir, SizeProbe sizeProbe, ZoneId zone) {
        this.trashDir = trashDir.toAbsolutePath().normalize();
        this.filesDir = this.trashDir.resolve("files");
        this.infoDir = this.trashDir.resolve("info");
        this.sizeProbe = sizeProbe;
        this.zone = zone;
    }

    @Override
    public Optional<Path> contentRoot() {
        return Optional.of(filesDir);
    }

    @Override
    public List<SystemTrashItem> list() {
        if (!Files.isDirectory(filesDir)) {
            return List.of();
        }
        List<SystemTrashItem> items = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(filesDir)) {
            for (Path entry : stream) {
                SystemTrashItem item = toItem(entry);
                if (item != null) {
                    items.add(item);
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.debug("枚举系统回收站失败，返回部分结果：{}（{}）", filesDir, e.getMessage());
        }
        return items;
    }

    @Override
    public void delete(Path item) throws IOException {
        FileTreeOperations.deleteTree(item);
        // 只有 files/ 的直接子项才有对应的 .trashinfo
        Path normalized = item.toAbsolutePath().normalize();
        if (filesDir.equals(normalized.getParent())) {
            Files.deleteIfExists(infoFile(normalized.getFileName().toString()));
        }
    }

    private SystemTrashItem toItem(Path entry) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException | SecurityException e) {
            log.debug("跳过无法访问的系统回收站条目：{}（{}）", entry, e.getMessage());
            return null;
        }
        String name = entry.getFileName().toString();
        long size = attrs.isDirectory() ? sizeProbe.computeSize(entry) : attrs.size();
        long trashedAt = attrs.lastModifiedTime().toMillis();
        String originalPath = null;

        TrashInfo info = readInfo(name);
        if (info != null) {
            if (info.path() != null) {
                originalPath = info.path();
            }
            if (info.deletionDate() != null) {
                trashedAt = info.deletionDate().atZone(zone).toInstant().toEpochMilli();
            }
        }
        return new SystemTrashItem(entry, name, originalPath, trashedAt, size, attrs.isDirectory());
    }

    private TrashInfo readInfo(String name) {
        Path infoFile = infoFile(name);
        List<String> lines;
        try {
            lines = Files.readAllLines(infoFile, StandardCharsets.UTF_8);
        } catch (IOException | SecurityException e) {
            return null;
        }
        String path = null;
        LocalDateTime deletionDate = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.startsWith("Path=")) {
                path = resolveOriginalPath(percentDecode(line.substring("Path=".length())));
            } else if (line.startsWith("DeletionDate=")) {
                try {
                    deletionDate = LocalDateTime.parse(line.substring("DeletionDate=".length()));
                } catch (DateTimeParseException e) {
                    log.debug("无法解析 DeletionDate：{}（{}）", infoFile, line);
                }
            }
        }
        return new TrashInfo(path, deletionDate);
    }

    /**
     * 相对路径相对于回收站所在的顶层目录（{@code $topdir/.Trash-uid} 的 {@code $topdir}）。
     */
    private String resolveOriginalPath(String value) {
        if (value.isEmpty()) {
            return null;
        }
        Path path = Path.of(value);
        if (path.isAbsolute() || trashDir.getParent() == null) {
            return path.toString();
        }
        return trashDir.getParent().resolve(path).normalize().toString();
    }

    private Path infoFile(String name) {
        return infoDir.resolve(name + INFO_SUFFIX);
    }

    /**
     * 按 RFC 2396 解码 {@code %XX}；与 URLDecoder 不同，{@code +} 保持原样。
     */
    static String percentDecode(String value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length());
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            if (b == '%' && i + 2 < bytes.length) {
                int hi = Character.digit(bytes[i + 1], 16);
                int lo = Character.digit(bytes[i + 2], 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) + lo);
                    i += 2;
                    continue;
                }
            }
            out.write(b);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private record TrashInfo(String path, LocalDateTime deletionDate) {
    }
}
