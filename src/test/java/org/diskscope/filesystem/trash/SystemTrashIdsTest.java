package org.diskscope.filesystem.trash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class SystemTrashIdsTest {

    @Test
    void encode_isReversibleForUnicodePaths() {
        Path path = Path.of("/home/u/.local/share/Trash/files/报告 (1).pdf");

        String id = SystemTrashIds.encode(path);

        assertThat(id).startsWith(SystemTrashIds.PREFIX).doesNotContain("/", "+", "=");
        assertThat(SystemTrashIds.isSystemId(id)).isTrue();
        assertThat(SystemTrashIds.decode(id)).contains(path);
    }

    @Test
    void decode_rejectsMalformedAndRelativeIds() {
        String relative = SystemTrashIds.PREFIX
                + Base64.getUrlEncoder().withoutPadding().encodeToString("relative/x".getBytes(StandardCharsets.UTF_8));

        assertThat(SystemTrashIds.decode(SystemTrashIds.PREFIX + "not base64!")).isEmpty();
        assertThat(SystemTrashIds.decode(relative)).isEmpty();
        assertThat(SystemTrashIds.decode("app-id")).isEmpty();
        assertThat(SystemTrashIds.isSystemId(null)).isFalse();
    }
}
