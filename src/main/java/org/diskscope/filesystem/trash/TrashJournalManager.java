package org.diskscope.filesystem.trash;

import org.diskscope.filesystem.FileTreeOperations;
import org.diskscope.filesystem.PathContainment;
import org.diskscope.filesystem.dto.TrashEntry;
import org.diskscope.filesystem.dto.TrashError;
import org.diskscope.filesystem.dto.TrashItem;
import org.diskscope.filesystem.dto.TrashManifest;
import org.diskscope.filesystem.dto.TrashOperationResult;
import org.diskscope.filesystem.dto.TrashSource;
import org.diskscope.filesystem.scan.SizeProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 带日志清单的两段式删除：移入回收站（move + 追加清单）-> 恢复 / 彻底删除。
 * <p>
 * 状态机：{@code Live --移入--> Trashed --恢复--> Live}；{@code Trashed --彻底删除--> Gone}。
 * <p>
 * 重要说明：
 * <ul>
 *   <li>回收站根目录布局：{@code files/<storedName>} 存放内容，根目录下的 {@code manifest.json} 为清单。</li>
 *   <li>移入时先做物理移动、再写清单：两步之间进程崩溃会留下“没有清单记录的孤儿内容”（可手动找回，应用不可见）。
 *       写清单失败（非崩溃）时会把内容移回原处。</li>
 *   <li>每一次“读清单 -> 内存修改 -> 写清单”都在同一把锁内完成（单进程内串行化），避免后写覆盖先写。</li>
 *   <li>系统回收站只读合并：条目用可逆编码的路径作为 id，只允许彻底删除，不允许恢复。</li>
 *   <li>外部并发修改（条目被手动删除等）按“已不存在”处理，而不是报错中断。</li>
 * </ul>
 */
public class TrashJournalManager {

    private static final Logger log = LoggerFactory.getLogger(TrashJournalManager.class);

    public static final String FILES_DIR = "files";

    private final Path trashRoot;
    private final Path filesDir;
    private final TrashManifestStore manifestStore;
    private final SystemTrash systemTrash;
    private final SizeProbe sizeProbe;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final Object lock = new Object();

    public TrashJournalManager(Path trashRoot, TrashManifestStore manifestStore, SystemTrash systemTrash, SizeProbe sizeProbe, Clock clock) {
        this(trashRoot, manifestStore, systemTrash, sizeProbe, clock, () -> UUID.randomUUID().toString());
    }

    public TrashJournalManager(
            Path trashRoot,
            TrashManifestStore manifestStore,
            SystemTrash systemTrash,
            SizeProbe sizeProbe,
            Clock clock,
            Supplier<String> idGenerator
    ) {
        this.trashRoot = trashRoot.toAbsolutePath().normalize();
        this.filesDir = this.trashRoot.resolve(FILES_DIR);
        this.manifestStore = manifestStore;
        this.systemTrash = systemTrash;
        this.sizeProbe = sizeProbe;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public Path trashRoot() {
        return trashRoot;
    }

    /**
     * 把文件/目录移入应用回收站。stat 失败时整个操作失败，不产生任何状态变化。
     */
    public TrashOperationResult moveToTrash(Path path) {
        Path source = path.toAbsolutePath().normalize();
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(source, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException | SecurityException e) {
            return failed(null, e, "无法读取待删除路径：" + source);
        }
        if (overlapsTrashRoot(source)) {
            return TrashOperationResult.failed(null, TrashError.INVALID_TARGET, "不能把回收站自身（或其上级目录）移入回收站：" + source);
        }
        Path fileName = source.getFileName();
        if (fileName == null) {
            return TrashOperationResult.failed(null, TrashError.INVALID_TARGET, "不能把文件系统根目录移入回收站：" + source);
        }

        long size = attrs.isDirectory() ? sizeProbe.computeSize(source) : attrs.size();

        synchronized (lock) {
            TrashManifest manifest;
            try {
                manifest = manifestStore.load();
                Files.createDirectories(filesDir);
            } catch (IOException e) {
                return failed(null, e, "回收站不可用：" + trashRoot);
            }

            String id = idGenerator.get();
            String name = fileName.toString();
            String storedName = id + "_" + name;
            Path payload = filesDir.resolve(storedName);

            try {
                FileTreeOperations.moveTree(source, payload);
            } catch (IOException | SecurityException e) {
                return failed(id, e, "移入回收站失败：" + source);
            }

            TrashEntry entry = new TrashEntry(id, name, source.toString(), storedName, clock.millis(), size, attrs.isDirectory());
            try {
                manifestStore.save(manifest.with(entry));
            } catch (IOException e) {
                rollbackMove(payload, source);
                return failed(id, e, "写入回收站清单失败：" + manifestStore.manifestFile());
            }
            log.info("已移入回收站：{} -> {}（id={}，{} 字节）", source, storedName, id, size);
            return TrashOperationResult.ok(id);
        }
    }

    /**
     * 把应用回收站中的条目移回原路径。
     * <p>
     * 原路径已被占用时失败且条目保持 Trashed（不会覆盖）；原父目录不存在时自动创建。
     * 系统回收站的 id 一律拒绝。
     */
    public TrashOperationResult restoreFromTrash(String id) {
        if (SystemTrashIds.isSystemId(id)) {
            return TrashOperationResult.failed(id, TrashError.SYSTEM_ITEM_NOT_RESTORABLE, "系统回收站中的条目不支持从应用内恢复");
        }
        synchronized (lock) {
            TrashManifest manifest;
            try {
                manifest = manifestStore.load();
            } catch (IOException e) {
                return failed(id, e, "读取回收站清单失败");
            }
            Optional<TrashEntry> found = manifest.find(id);
            if (found.isEmpty()) {
                return TrashOperationResult.failed(id, TrashError.NOT_FOUND, "回收站中不存在该条目：" + id);
            }
            TrashEntry entry = found.get();
            Path payload = payloadOf(entry);
            if (payload == null) {
                return TrashOperationResult.failed(id, TrashError.OUTSIDE_TRASH_ROOT, "清单条目的存放名非法：" + entry.storedName());
            }

            if (!Files.exists(payload, LinkOption.NOFOLLOW_LINKS)) {
                // 内容已被外部删除：清单记录已失效，顺带移除
                log.warn("回收站内容已不存在，移除失效的清单条目：{}（{}）", id, payload);
                saveQuietly(manifest.without(id));
                return TrashOperationResult.failed(id, TrashError.NOT_FOUND, "回收站内容已不存在：" + entry.name());
            }

            Path target = Path.of(entry.originalPath());
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                return TrashOperationResult.failed(id, TrashError.RESTORE_COLLISION, "原路径已被占用：" + target);
            }
            Path parent = target.getParent();
            try {
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (FileAlreadyExistsException e) {
                return TrashOperationResult.failed(id, TrashError.NOT_A_DIRECTORY, "原路径的上级不是目录：" + parent);
            } catch (IOException | SecurityException e) {
                return failed(id, e, "创建原父目录失败：" + parent);
            }

            try {
                FileTreeOperations.moveTree(payload, target);
            } catch (IOException | SecurityException e) {
                return failed(id, e, "恢复失败：" + target);
            }

            try {
                manifestStore.save(manifest.without(id));
            } catch (IOException e) {
                // 内容已经恢复，只是清单仍残留该条目；下次访问时会因内容不存在而被清理
                log.warn("已恢复 {}，但写入回收站清单失败", target, e);
                return TrashOperationResult.ok(id, List.of("已恢复，但回收站清单更新失败：" + e.getMessage()));
            }
            log.info("已从回收站恢复：{}（id={}）", target, id);
            return TrashOperationResult.ok(id);
        }
    }

    /**
     * 彻底删除一个条目。
     * <p>
     * 应用条目：递归删除存放内容并移除清单记录。
     * 系统条目：先校验解码出的路径严格位于系统回收站目录内（防止构造 id 删除任意路径），再直接删除。
     */
    public TrashOperationResult permanentlyDelete(String id) {
        if (SystemTrashIds.isSystemId(id)) {
            return deleteSystemItem(id);
        }
        synchronized (lock) {
            TrashManifest manifest;
            try {
                manifest = manifestStore.load();
            } catch (IOException e) {
                return failed(id, e, "读取回收站清单失败");
            }
            Optional<TrashEntry> found = manifest.find(id);
            if (found.isEmpty()) {
                return TrashOperationResult.failed(id, TrashError.NOT_FOUND, "回收站中不存在该条目：" + id);
            }
            Path payload = payloadOf(found.get());
            if (payload == null) {
                return TrashOperationResult.failed(id, TrashError.OUTSIDE_TRASH_ROOT, "清单条目的存放名非法：" + found.get().storedName());
            }
            try {
                FileTreeOperations.deleteTree(payload);
            } catch (IOException | SecurityException e) {
                return failed(id, e, "删除回收站内容失败：" + payload);
            }
            try {
                manifestStore.save(manifest.without(id));
            } catch (IOException e) {
                return failed(id, e, "写入回收站清单失败：" + manifestStore.manifestFile());
            }
            log.info("已彻底删除：{}（id={}）", found.get().originalPath(), id);
            return TrashOperationResult.ok(id);
        }
    }

    /**
     * 清空回收站（尽力而为）：逐个删除应用条目与系统回收站条目，单个失败只记录告警；
     * 最后无条件把清单重置为空。
     */
    public TrashOperationResult emptyTrash() {
        synchronized (lock) {
            List<String> warnings = new ArrayList<>();
            try {
                TrashManifest manifest = manifestStore.load();
                for (TrashEntry entry : manifest.entries()) {
                    Path payload = payloadOf(entry);
                    if (payload == null) {
                        warnings.add("跳过存放名非法的条目：" + entry.storedName());
                        continue;
                    }
                    deleteQuietly(payload, warnings);
                }
            } catch (IOException e) {
                warnings.add("读取回收站清单失败，仅清理存放目录：" + e.getMessage());
            }
            // 清理存放目录中剩余的内容（包括崩溃遗留的孤儿内容）
            sweepFilesDir(warnings);

            for (SystemTrash.SystemTrashItem item : systemTrash.list()) {
                try {
                    systemTrash.delete(item.path());
                } catch (IOException | SecurityException e) {
                    log.warn("清空系统回收站条目失败：{}", item.path(), e);
                    warnings.add("删除系统回收站条目失败：" + item.name() + "（" + e.getMessage() + "）");
                }
            }

            try {
                manifestStore.save(TrashManifest.empty());
            } catch (IOException e) {
                return failed(null, e, "重置回收站清单失败：" + manifestStore.manifestFile());
            }
            log.info("已清空回收站（告警 {} 条）", warnings.size());
            return TrashOperationResult.ok(null, warnings);
        }
    }

    /**
     * 列出应用回收站条目与系统回收站条目，按移入时间倒序。
     * <p>
     * 清单里有、但内容已被外部删除的条目不会出现在列表中。
     */
    public List<TrashItem> listTrashItems() {
        List<TrashItem> items = new ArrayList<>();
        TrashManifest manifest;
        synchronized (lock) {
            try {
                manifest = manifestStore.load();
            } catch (IOException e) {
                log.warn("读取回收站清单失败，仅列出系统回收站", e);
                manifest = TrashManifest.empty();
            }
        }
        for (TrashEntry entry : manifest.entries()) {
            Path payload = payloadOf(entry);
            if (payload == null || !Files.exists(payload, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            items.add(new TrashItem(
                    entry.id(),
                    entry.name(),
                    entry.originalPath(),
                    entry.trashedAt(),
                    entry.size(),
                    entry.isDirectory(),
                    TrashSource.APP
            ));
        }
        for (SystemTrash.SystemTrashItem item : systemTrash.list()) {
            items.add(new TrashItem(
                    SystemTrashIds.encode(item.path()),
                    item.name(),
                    item.originalPath(),
                    item.trashedAt(),
                    item.size(),
                    item.directory(),
                    TrashSource.SYSTEM
            ));
        }
        items.sort(Comparator.comparingLong(TrashItem::trashedAt).reversed());
        return items;
    }

    /**
     * 字符串层面比较之外，再按真实路径比较一次：经由符号链接的上级目录也可能指向回收站。
     * 源路径本身不解析（移动链接只会移动链接本身）。
     */
    private boolean overlapsTrashRoot(Path source) {
        if (trashRoot.startsWith(source) || source.startsWith(trashRoot)) {
            return true;
        }
        Path parent = source.getParent();
        Path fileName = source.getFileName();
        if (parent == null || fileName == null) {
            return false;
        }
        Path realSource;
        try {
            realSource = parent.toRealPath().resolve(fileName.toString());
        } catch (IOException | SecurityException e) {
            return false;
        }
        Path realRoot = realPathOfNearestExisting(trashRoot);
        return realRoot.startsWith(realSource) || realSource.startsWith(realRoot);
    }

    /**
     * 回收站根目录可能尚未创建：解析最近的已存在上级，再拼回剩余部分。
     */
    private static Path realPathOfNearestExisting(Path path) {
        Path existing = path;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        try {
            return existing.toRealPath().resolve(existing.relativize(path).toString()).normalize();
        } catch (IOException | SecurityException e) {
            return path;
        }
    }

    private TrashOperationResult deleteSystemItem(String id) {
        Optional<Path> root = systemTrash.contentRoot();
        if (root.isEmpty()) {
            return TrashOperationResult.failed(id, TrashError.NOT_FOUND, "当前平台没有系统回收站");
        }
        Optional<Path> decoded = SystemTrashIds.decode(id);
        if (decoded.isEmpty() || !PathContainment.isStrictlyWithin(root.get(), decoded.get())) {
            log.warn("拒绝删除系统回收站目录之外的路径：id={}", id);
            return TrashOperationResult.failed(id, TrashError.OUTSIDE_TRASH_ROOT, "路径不在系统回收站目录内");
        }
        Path item = decoded.get();
        // 只接受 list() 会返回的条目（系统回收站目录的直接子项），不允许删除条目内部的某个后代
        if (!root.get().equals(item.getParent())) {
            log.warn("拒绝删除系统回收站条目内部的路径：{}", item);
            return TrashOperationResult.failed(id, TrashError.OUTSIDE_TRASH_ROOT, "只能删除系统回收站中的顶层条目");
        }
        if (!Files.exists(item, LinkOption.NOFOLLOW_LINKS)) {
            return TrashOperationResult.failed(id, TrashError.NOT_FOUND, "系统回收站中不存在该条目：" + item.getFileName());
        }
        try {
            systemTrash.delete(item);
        } catch (IOException | SecurityException e) {
            return failed(id, e, "删除系统回收站条目失败：" + item);
        }
        log.info("已彻底删除系统回收站条目：{}", item);
        return TrashOperationResult.ok(id);
    }

    /**
     * @return 存放内容路径；清单被篡改导致路径逃出 {@code files/} 时返回 null
     */
    private Path payloadOf(TrashEntry entry) {
        Path payload = filesDir.resolve(entry.storedName()).normalize();
        if (!payload.startsWith(filesDir) || payload.equals(filesDir) || !filesDir.equals(payload.getParent())) {
            return null;
        }
        return payload;
    }

    private void sweepFilesDir(List<String> warnings) {
        if (!Files.isDirectory(filesDir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(filesDir)) {
            for (Path leftover : stream) {
                deleteQuietly(leftover, warnings);
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.warn("清理回收站存放目录失败：{}", filesDir, e);
            warnings.add("清理回收站存放目录失败：" + e.getMessage());
        }
    }

    private void deleteQuietly(Path payload, List<String> warnings) {
        try {
            FileTreeOperations.deleteTree(payload);
        } catch (IOException | SecurityException e) {
            log.warn("清空回收站时删除失败：{}", payload, e);
            warnings.add("删除失败：" + payload.getFileName() + "（" + e.getMessage() + "）");
        }
    }

    private void rollbackMove(Path payload, Path source) {
        try {
            FileTreeOperations.moveTree(payload, source);
        } catch (IOException | SecurityException e) {
            log.error("写清单失败且无法移回原处，内容遗留在回收站存放目录中：{}（原路径 {}）", payload, source, e);
        }
    }

    private void saveQuietly(TrashManifest manifest) {
        try {
            manifestStore.save(manifest);
        } catch (IOException e) {
            log.warn("写入回收站清单失败：{}", manifestStore.manifestFile(), e);
        }
    }

    private static TrashOperationResult failed(String id, Exception e, String message) {
        TrashError error = TrashError.classify(e);
        if (e instanceof ManifestCorruptException) {
            error = TrashError.MANIFEST_CORRUPT;
        }
        log.debug("{}（{}）", message, error, e);
        return TrashOperationResult.failed(id, error, message + "（" + e.getMessage() + "）");
    }
}
