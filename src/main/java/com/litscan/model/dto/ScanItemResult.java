package com.litscan.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个文件的处理结果
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanItemResult {

    public static final String TYPE_PAPER = "paper";
    public static final String TYPE_PATENT = "patent";
    public static final String TYPE_SOFTWARE = "software";
    public static final String TYPE_UNKNOWN = "unknown";

    private String relativePath;

    /**
     * paper / patent / software / unknown
     */
    private String type;

    private Long pdfFileId;

    private Long recordId;

    /**
     * 处理状态；无法识别的证书为 neither
     */
    private String status;

    private Double confidence;

    private boolean skipped;

    private String error;
}
