package org.diskscope.filesystem.trash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.CollectionType;
import org.diskscope.filesystem.dto.TrashEntry;
import org.diskscope.filesystem.dto.TrashManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;

/**
 * 回收站清单的持久化（JSON 文档，整份读写）。
 * <p>
 * 说明：
 * <ul>
 *   <li>文档格式：{@code {"version":1,"entries":[...]}}；也兼容没有版本字段的旧格式（顶层直接是数组）。</li>
 *   <li>写入采用“同目录临时文件 -> move 原子替换”，避免写到一半导致清单被截断。</li>
 *   <li>清单无法解析时：先把损坏文件改名备份（{@code manifest.json.corrupt-<毫秒>}），再按空清单继续；
 *       备份失败则抛出 {@link ManifestCorruptException}，避免覆盖唯一的一份数据。</li>
 *   <li>本类不做并发控制：读-改-写的串行化由调用方负责。</li>
 * </ul>
 */
public class TrashManifestStore {

    private static final Logger log = LoggerFactory.getLogger(TrashManifestStore.class);

    public static final String MANIFEST_FILE_NAME = "manifest.json";

    private final Path manifestFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TrashManifestStore(Path trashRoot, ObjectMapper objectMapper, Clock clock) {
        this.manifestFile = trashRoot.resolve(MANIFEST_FILE_NAME);
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path manifestFile() {
        return manifestFile;
    }

    public TrashManifest load() throws IOException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(manifestFile);
        } catch (NoSuchFileException e) {
            return TrashManifest.empty();
        }
        if (bytes.length == 0) {
            return TrashManifest.empty();
        }
        try {
            return parse(bytes);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return recoverFromCorruption(e);
        }
    }

    public void save(TrashManifest manifest) throws IOException {
        Path parent = manifestFile.getParent();
        Files.createDirectories(parent);
        byte[] bytes = objectMapper.writeValueAsBytes(manifest);

        Path tmp = Files.createTempFile(parent, "manifest-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, manifestFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, manifestFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("清理临时清单文件失败：{}", tmp, e);
            }
        }
    }

    private TrashManifest parse(byte[] bytes) throws IOException {
        JsonNode root = objectMapper.readTree(bytes);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return TrashManifest.empty();
        }
        JsonNode entriesNode;
        if (root.isArray()) {
            // 旧格式：没有版本字段，顶层直接是条目数组
            entriesNode = root;
        } else if (root.isObject()) {
            int version = root.path("version").asInt(TrashManifest.CURRENT_VERSION);
            if (version > TrashManifest.CURRENT_VERSION) {
                throw new IllegalArgumentException("不支持的清单版本：" + version);
            }
            entriesNode = root.path("entries");
        } else {
            throw new IllegalArgumentException("清单顶层既不是对象也不是数组");
        }
        if (entriesNode.isMissingNode() || entriesNode.isNull()) {
            return TrashManifest.empty();
        }

        CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, TrashEntry.class);
        List<TrashEntry> entries = objectMapper.convertValue(entriesNode, listType);
        for (TrashEntry entry : entries) {
            if (entry == null || entry.id() == null || entry.storedName() == null || entry.originalPath() == null) {
                throw new IllegalArgumentException("清单条目缺少 id/storedName/originalPath");
            }
        }
        return new TrashManifest(TrashManifest.CURRENT_VERSION, entries);
    }

    private TrashManifest recoverFromCorruption(Exception cause) throws ManifestCorruptException {
        Path backup = manifestFile.resolveSibling(MANIFEST_FILE_NAME + ".corrupt-" + clock.millis());
        try {
            Files.move(manifestFile, backup);
        } catch (IOException e) {
            e.addSuppressed(cause);
            throw new ManifestCorruptException(manifestFile, e);
        }
        log.warn("回收站清单无法解析，已备份为 {} 并按空清单继续（原清单中的条目需手动恢复）", backup, cause);
        return TrashManifest.empty();
    }
}
