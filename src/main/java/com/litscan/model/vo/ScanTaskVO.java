package com.litscan.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 扫描任务状态 VO
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "扫描任务状态")
public class ScanTaskVO {

    @Schema(description = "是否正在运行")
    private Boolean running;

    @Schema(description = "扫描根目录")
    private String rootDir;

    @Schema(description = "当前文件序号")
    private Integer current;

    @Schema(description = "文件总数")
    private Integer total;

    @Schema(description = "进度(0-100)")
    private Integer percent;

    @Schema(description = "进度消息")
    private String message;

    @Schema(description = "开始时间")
    private LocalDateTime startTime;

    @Schema(description = "结束时间")
    private LocalDateTime endTime;
}
