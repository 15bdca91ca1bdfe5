package org.diskscope.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 回收站条目的来源：应用自有回收站，或只读合并进来的系统回收站。
 */
public enum TrashSource {
    APP,
    SYSTEM;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
