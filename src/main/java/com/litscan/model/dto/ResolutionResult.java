package com.litscan.model.dto;

import com.litscan.model.enums.ResolutionSource;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 书目解析结果
 *
 * @author litscan
 */
@Getter
@Builder
@ToString
public class ResolutionResult {

    /**
     * 仅 DOI_LOOKUP / AUTO 时有值
     */
    private final String doi;

    private final double confidence;

    private final ResolutionSource source;

    private final ExtractedFields mergedFields;

    private final CandidateRecord candidate;

    public static ResolutionResult none(ExtractedFields fields) {
        return ResolutionResult.builder()
                .confidence(0)
                .source(ResolutionSource.NONE)
                .mergedFields(fields)
                .build();
    }
}
