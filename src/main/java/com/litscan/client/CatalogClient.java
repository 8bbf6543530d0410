package com.litscan.client;

import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;

import java.util.List;
import java.util.Optional;

/**
 * 外部书目目录客户端
 *
 * <p>网络失败在重试耗尽后表现为“无数据”，实现类不向调用方抛出传输异常。</p>
 *
 * @author litscan
 */
public interface CatalogClient {

    /**
     * 目录名称，如 crossref
     */
    String getName();

    /**
     * 按 DOI 精确查询
     */
    Optional<CandidateRecord> lookupByDoi(String doi);

    /**
     * 按已抽取的标题、作者、年份模糊检索
     */
    List<CandidateRecord> search(ExtractedFields fields);
}
