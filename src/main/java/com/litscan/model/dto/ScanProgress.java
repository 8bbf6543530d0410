package com.litscan.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 扫描进度事件
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanProgress {

    /**
     * 当前文件序号，从 1 开始
     */
    private Integer current;

    private Integer total;

    /**
     * 0-100
     */
    private Integer percent;

    private String message;

    private String filename;
}
