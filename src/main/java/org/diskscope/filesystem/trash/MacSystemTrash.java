package org.diskscope.filesystem.trash;

import org.diskscope.filesystem.FileTreeOperations;
import org.diskscope.filesystem.scan.SizeProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * macOS 的 {@code ~/.Trash}：没有可读的元数据，移入时间取最后修改时间，原始路径未知。
 */
public class MacSystemTrash implements SystemTrash {

    private static final Logger log = LoggerFactory.getLogger(MacSystemTrash.class);

    private static final String DS_STORE = ".DS_Store";

    private final Path trashDir;
    private final SizeProbe sizeProbe;

    public MacSystemTrash(Path trashDir, SizeProbe sizeProbe) {
        this.trashDir = trashDir.toAbsolutePath().normalize();
        this.sizeProbe = sizeProbe;
    }

    @Override
    public Optional<Path> contentRoot() {
        return Optional.of(trashDir);
    }

    @Override
    public List<SystemTrashItem> list() {
        if (!Files.isDirectory(trashDir)) {
            return List.of();
        }
        List<SystemTrashItem> items = new ArrayList<>();
        // 未授予“完全磁盘访问权限”时这里会 AccessDenied，按空处理
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(trashDir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (DS_STORE.equals(name)) {
                    continue;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    long size = attrs.isDirectory() ? sizeProbe.computeSize(entry) : attrs.size();
                    items.add(new SystemTrashItem(entry, name, null, attrs.lastModifiedTime().toMillis(), size, attrs.isDirectory()));
                } catch (IOException | SecurityException e) {
                    log.debug("跳过无法访问的系统回收站条目：{}（{}）", entry, e.getMessage());
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.debug("枚举系统回收站失败，返回部分结果：{}（{}）", trashDir, e.getMessage());
        }
        return items;
    }

    @Override
    public void delete(Path item) throws IOException {
        FileTreeOperations.deleteTree(item);
    }
}
