package org.diskscope.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.diskscope.filesystem.scan.DiskTreeBuilder;
import org.diskscope.filesystem.scan.ScanExecutor;
import org.diskscope.filesystem.scan.ScanThreadFactory;
import org.diskscope.filesystem.scan.SizeProbe;
import org.diskscope.filesystem.trash.SystemTrash;
import org.diskscope.filesystem.trash.SystemTrashes;
import org.diskscope.filesystem.trash.TrashJournalManager;
import org.diskscope.filesystem.trash.TrashManifestStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 磁盘扫描与回收站的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link DiskScopeProperties} 注入到扫描器与回收站管理器中。</li>
 *   <li>这里不引入任何数据库/外部依赖，回收站清单是回收站根目录下的一个 JSON 文件。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class DiskScopeConfiguration {

    @Bean
    public Clock diskScopeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SizeProbe sizeProbe(DiskScopeProperties properties) {
        return new SizeProbe(properties.isFollowSymlinks());
    }

    @Bean
    public DiskTreeBuilder diskTreeBuilder(DiskScopeProperties properties, SizeProbe sizeProbe) {
        return new DiskTreeBuilder(
                sizeProbe,
                properties.getSmallFileThreshold().toBytes(),
                properties.getSmallFolderThreshold().toBytes(),
                properties.getIgnoredDirectories()
        );
    }

    @Bean
    public ScanExecutor scanExecutor(DiskScopeProperties properties, DiskTreeBuilder diskTreeBuilder) {
        return new ScanExecutor(diskTreeBuilder, new ScanThreadFactory(properties.getScanThreadNamePrefix()));
    }

    @Bean
    public SystemTrash systemTrash(DiskScopeProperties properties, SizeProbe sizeProbe) {
        return SystemTrashes.detect(properties, sizeProbe);
    }

    @Bean
    public TrashManifestStore trashManifestStore(DiskScopeProperties properties, ObjectProvider<ObjectMapper> objectMapper, Clock clock) {
        return new TrashManifestStore(
                Path.of(properties.getTrashRoot()),
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock
        );
    }

    @Bean
    public TrashJournalManager trashJournalManager(
            DiskScopeProperties properties,
            TrashManifestStore trashManifestStore,
            SystemTrash systemTrash,
            SizeProbe sizeProbe,
            Clock clock
    ) {
        return new TrashJournalManager(Path.of(properties.getTrashRoot()), trashManifestStore, systemTrash, sizeProbe, clock);
    }
}
