package com.litscan.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次扫描的汇总结果
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanReport {

    private String rootDir;

    private int total;

    private int processed;

    private int skipped;

    private int failed;

    private boolean cancelled;

    @Builder.Default
    private List<ScanItemResult> items = new ArrayList<>();

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    public void addItem(ScanItemResult item) {
        items.add(item);
        if (item.isSkipped()) {
            skipped++;
        } else {
            processed++;
        }
        if (item.getError() != null) {
            failed++;
        }
    }
}
