package org.diskscope.filesystem.scan;

import org.diskscope.filesystem.dto.DiskCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiskCategoryTest {

    @Test
    void forFileName_mapsKnownExtensionsCaseInsensitively() {
        assertThat(DiskCategory.forFileName("App.TSX")).isEqualTo(DiskCategory.CODE);
        assertThat(DiskCategory.forFileName("holiday.JPEG")).isEqualTo(DiskCategory.MEDIA);
        assertThat(DiskCategory.forFileName("clip.webm")).isEqualTo(DiskCategory.MEDIA);
        assertThat(DiskCategory.forFileName("notes.md")).isEqualTo(DiskCategory.DOCS);
        assertThat(DiskCategory.forFileName("setup.exe")).isEqualTo(DiskCategory.SYSTEM);
    }

    @Test
    void forFileName_unlistedOrMissingExtensionIsOther() {
        assertThat(DiskCategory.forFileName("archive.zip")).isEqualTo(DiskCategory.OTHER);
        assertThat(DiskCategory.forFileName("Makefile")).isEqualTo(DiskCategory.OTHER);
        assertThat(DiskCategory.forFileName(".bashrc")).isEqualTo(DiskCategory.OTHER);
        assertThat(DiskCategory.forFileName("trailing.")).isEqualTo(DiskCategory.OTHER);
        assertThat(DiskCategory.forFileName(null)).isEqualTo(DiskCategory.OTHER);
    }

    @Test
    void jsonValue_isLowercaseName() {
        assertThat(DiskCategory.FOLDER.jsonValue()).isEqualTo("folder");
    }
}
