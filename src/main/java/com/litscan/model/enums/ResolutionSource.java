package com.litscan.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 书目解析结果来源
 *
 * @author litscan
 */
@Getter
@AllArgsConstructor
public enum ResolutionSource {

    /** DOI 直接命中 */
    DOI_LOOKUP("doi_lookup"),
    /** 模糊检索得分达到阈值 */
    AUTO("auto"),
    /** 有候选但得分不足 */
    REVIEW("review"),
    NONE("none");

    private final String value;
}
