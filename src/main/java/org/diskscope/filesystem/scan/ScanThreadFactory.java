package org.diskscope.filesystem.scan;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 给扫描线程统一命名（{@code prefix-序号}），便于在日志与线程 dump 中定位。
 * <p>
 * 扫描线程是 daemon 线程：正在进行的扫描不会阻止进程退出（扫描本身没有取消机制）。
 */
public class ScanThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(0);

    public ScanThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
