package com.litscan.service;

import com.litscan.model.dto.ExtractedFields;
import com.litscan.model.dto.ResolutionResult;

/**
 * 书目解析服务
 *
 * @author litscan
 */
public interface BibliographicResolverService {

    /**
     * 先按 DOI 精确查询，否则按标题在各目录检索并打分
     *
     * @param fields 已抽取字段
     * @return 解析结果，mergedFields 为候选字段覆盖后的副本
     */
    ResolutionResult resolve(ExtractedFields fields);
}
