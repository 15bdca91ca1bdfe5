package org.diskscope.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.diskscope.filesystem.DiskScopeConfiguration;
import org.diskscope.filesystem.DiskScopeProperties;
import org.diskscope.filesystem.dto.DiskCategory;
import org.diskscope.filesystem.dto.DiskNode;
import org.diskscope.filesystem.dto.TrashListResult;
import org.diskscope.filesystem.dto.TrashOperationResult;
import org.diskscope.filesystem.dto.TrashSource;
import org.diskscope.filesystem.scan.DiskTreeBuilder;
import org.diskscope.filesystem.scan.SizeProbe;
import org.diskscope.filesystem.trash.SystemTrash;
import org.diskscope.filesystem.trash.TrashManifestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiskMcpToolsTest {

    private static final long SIX_MB = 6L * 1024 * 1024;

    @TempDir
    Path tmp;

    private Path scanRoot;
    private DiskScopeProperties properties;
    private DiskMcpTools tools;

    @BeforeEach
    void setUp() throws IOException {
        scanRoot = Files.createDirectories(tmp.resolve("scan"));
        // scan/l1/l2/l3/l4/l5，每层一个大文件，保证每层目录都超过小目录阈值
        Path level = scanRoot;
        for (int i = 1; i <= 5; i++) {
            level = level.resolve("l" + i);
            sparseFile(level.resolve("blob" + i + ".bin"), SIX_MB);
        }

        properties = new DiskScopeProperties();
        properties.setTrashRoot(tmp.resolve("trash").toString());
        properties.setSystemTrashEnabled(false);
        tools = createTools(properties);
    }

    private static DiskMcpTools createTools(DiskScopeProperties properties) {
        DiskScopeConfiguration configuration = new DiskScopeConfiguration();
        Clock clock = configuration.diskScopeClock();
        SizeProbe probe = configuration.sizeProbe(properties);
        DiskTreeBuilder builder = configuration.diskTreeBuilder(properties, probe);
        SystemTrash systemTrash = configuration.systemTrash(properties, probe);
        TrashManifestStore store = configuration.trashManifestStore(properties, new StaticListableBeanFactory().getBeanProvider(ObjectMapper.class), clock);
        return new DiskMcpTools(
                properties,
                configuration.scanExecutor(properties, builder),
                configuration.trashJournalManager(properties, store, systemTrash, probe, clock)
        );
    }

    @Test
    void scan_withoutDepthUsesDefaultDepth() {
        DiskNode root = tools.scanForVisualization(scanRoot.toString(), null);

        assertThat(root.id()).isEqualTo("scan");
        assertThat(root.value()).isEqualTo(5 * SIX_MB);
        assertThat(folderDepth(root)).isEqualTo(1 + properties.getScanDefaultDepth());
    }

    @Test
    void scan_depthIsClampedToConfiguredRange() {
        properties.setScanMaxDepth(3);

        assertThat(folderDepth(tools.scanForVisualization(scanRoot.toString(), 99))).isEqualTo(4);
        assertThat(folderDepth(tools.scanForVisualization(scanRoot.toString(), -5))).isEqualTo(1);
    }

    @Test
    void scanDeep_usesDeepPreset() {
        DiskNode root = tools.scanForVisualizationDeep(scanRoot.toString());

        assertThat(folderDepth(root)).isEqualTo(1 + properties.getScanDeepDepth());
        assertThat(root.value()).isEqualTo(5 * SIX_MB);
    }

    @Test
    void scan_rejectsMissingOrBlankPath() {
        assertThatThrownBy(() -> tools.scanForVisualization(tmp.resolve("absent").toString(), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("路径不存在");
        assertThatThrownBy(() -> tools.scanForVisualization("  ", 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.scanForVisualizationDeep(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trashTools_moveListRestoreRoundTrip() throws IOException {
        Path file = Files.writeString(tmp.resolve("note.md"), "note");

        TrashOperationResult moved = tools.moveToTrash(file.toString());
        TrashListResult listed = tools.listTrashItems();

        assertThat(moved.success()).isTrue();
        assertThat(listed.total()).isEqualTo(1);
        assertThat(listed.appCount()).isEqualTo(1);
        assertThat(listed.systemCount()).isZero();
        assertThat(listed.items().get(0).source()).isEqualTo(TrashSource.APP);
        assertThat(listed.items().get(0).originalPath()).isEqualTo(file.toString());

        assertThat(tools.restoreFromTrash(" " + moved.id() + " ").success()).isTrue();
        assertThat(file).hasContent("note");
        assertThat(tools.listTrashItems().total()).isZero();
    }

    @Test
    void trashTools_permanentDeleteAndEmpty() throws IOException {
        String first = tools.moveToTrash(Files.writeString(tmp.resolve("a.txt"), "a").toString()).id();
        tools.moveToTrash(Files.writeString(tmp.resolve("b.txt"), "b").toString());

        assertThat(tools.permanentlyDelete(first).success()).isTrue();
        assertThat(tools.listTrashItems().total()).isEqualTo(1);

        TrashOperationResult emptied = tools.emptyTrash();
        assertThat(emptied.success()).isTrue();
        assertThat(emptied.id()).isNull();
        assertThat(tools.listTrashItems().items()).isEmpty();
    }

    @Test
    void trashTools_rejectBlankIds() {
        assertThatThrownBy(() -> tools.restoreFromTrash("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.permanentlyDelete(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.moveToTrash(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static int folderDepth(DiskNode node) {
        if (node.category() != DiskCategory.FOLDER) {
            return 0;
        }
        int deepest = 0;
        if (node.children() != null) {
            for (DiskNode child : node.children()) {
                deepest = Math.max(deepest, folderDepth(child));
            }
        }
        return 1 + deepest;
    }

    private static void sparseFile(Path path, long size) throws IOException {
        Files.createDirectories(path.getParent());
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw")) {
            raf.setLength(size);
        }
    }
}
