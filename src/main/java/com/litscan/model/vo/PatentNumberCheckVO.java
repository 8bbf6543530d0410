package com.litscan.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 专利号校验结果 VO
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "专利号校验结果")
public class PatentNumberCheckVO {

    @Schema(description = "待校验的专利号")
    private String patentNumber;

    @Schema(description = "是否合法")
    private Boolean valid;

    @Schema(description = "不合法原因")
    private String reason;
}
