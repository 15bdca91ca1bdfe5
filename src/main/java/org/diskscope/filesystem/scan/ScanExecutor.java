package org.diskscope.filesystem.scan;

import org.diskscope.filesystem.dto.DiskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个扫描请求一个独立的执行单元（线程），结果通过一次性的 {@link CompletableFuture} 交付。
 * <p>
 * 约定：
 * <ul>
 *   <li>执行单元只持有请求的不可变副本（{@link ScanRequest}），与调用方不共享可变状态。</li>
 *   <li>单元跑完 {@link DiskTreeBuilder} 后交付结果并结束，不会被复用。</li>
 *   <li>单元在产出结果前异常退出时，future 以 {@link ScanFailedException} 失败，没有部分结果。</li>
 *   <li>没有取消/超时：不再需要结果的调用方直接丢弃即可；并发扫描之间不保证完成顺序。</li>
 * </ul>
 */
public class ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScanExecutor.class);

    private final DiskTreeBuilder treeBuilder;
    private final ThreadFactory threadFactory;
    private final AtomicInteger inFlight = new AtomicInteger(0);

    public ScanExecutor(DiskTreeBuilder treeBuilder, ThreadFactory threadFactory) {
        this.treeBuilder = treeBuilder;
        this.threadFactory = threadFactory;
    }

    /**
     * 提交一次扫描，立即返回；调用线程不会等待任何文件系统 IO。
     */
    public CompletableFuture<DiskNode> submit(Path path, int depth) {
        ScanRequest request = new ScanRequest(path.toAbsolutePath().normalize(), depth);
        CompletableFuture<DiskNode> result = new CompletableFuture<>();
        Thread unit = threadFactory.newThread(() -> run(request, result));
        inFlight.incrementAndGet();
        try {
            unit.start();
        } catch (RuntimeException | Error e) {
            inFlight.decrementAndGet();
            result.completeExceptionally(new ScanFailedException(request.path(), e));
        }
        return result;
    }

    /**
     * 当前尚未交付结果的扫描数量。
     */
    public int inFlight() {
        return inFlight.get();
    }

    private void run(ScanRequest request, CompletableFuture<DiskNode> result) {
        long startedAt = System.nanoTime();
        try {
            DiskNode tree = treeBuilder.buildTree(request.path(), request.depth());
            log.info("扫描完成：{}（depth={}，{} 字节，耗时 {} ms）",
                    request.path(), request.depth(), tree.value(), (System.nanoTime() - startedAt) / 1_000_000);
            inFlight.decrementAndGet();
            result.complete(tree);
        } catch (RuntimeException | Error e) {
            log.warn("扫描单元异常退出：{}", request.path(), e);
            inFlight.decrementAndGet();
            result.completeExceptionally(new ScanFailedException(request.path(), e));
        }
    }

    /**
     * 交给执行单元的请求副本。
     */
    record ScanRequest(Path path, int depth) {
    }
}
