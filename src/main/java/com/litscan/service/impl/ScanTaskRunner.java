package com.litscan.service.impl;

import com.litscan.model.dto.ScanReport;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 在扫描线程池中执行扫描任务
 *
 * @author litscan
 */
@Component
public class ScanTaskRunner {

    @Async("scanExecutor")
    public CompletableFuture<ScanReport> run(Supplier<ScanReport> task) {
        return CompletableFuture.completedFuture(task.get());
    }
}
