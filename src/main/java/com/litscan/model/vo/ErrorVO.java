package com.litscan.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 错误响应 VO
 *
 * @author litscan
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "错误响应")
public class ErrorVO {

    @Schema(description = "HTTP 状态码")
    private Integer code;

    @Schema(description = "错误信息")
    private String message;
}
