package com.litscan.service;

import com.litscan.model.dto.ExtractedFields;

import java.util.Optional;

/**
 * 大模型元数据解析服务
 *
 * @author litscan
 */
public interface LlmParserService {

    boolean isEnabled();

    /**
     * 从文本中解析标题、作者、期刊、年份；未启用、调用失败或全部未知时返回空
     */
    Optional<ExtractedFields> parse(String text);
}
