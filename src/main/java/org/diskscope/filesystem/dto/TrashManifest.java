package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 应用回收站清单（整份持久化为一个 JSON 文档），是应用自有回收条目的唯一事实来源。
 *
 * @param version 文档格式版本
 * @param entries 按移入顺序排列的条目
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrashManifest(
        @JsonProperty("version") int version,
        @JsonProperty("entries") List<TrashEntry> entries
) {

    public static final int CURRENT_VERSION = 1;

    public TrashManifest {
        entries = (entries == null) ? List.of() : List.copyOf(entries);
    }

    public static TrashManifest empty() {
        return new TrashManifest(CURRENT_VERSION, List.of());
    }

    public Optional<TrashEntry> find(String id) {
        for (TrashEntry entry : entries) {
            if (entry.id().equals(id)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public TrashManifest with(TrashEntry entry) {
        List<TrashEntry> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(entry);
        return new TrashManifest(CURRENT_VERSION, next);
    }

    public TrashManifest without(String id) {
        List<TrashEntry> next = new ArrayList<>(entries.size());
        for (TrashEntry entry : entries) {
            if (!entry.id().equals(id)) {
                next.add(entry);
            }
        }
        return new TrashManifest(CURRENT_VERSION, next);
    }
}
