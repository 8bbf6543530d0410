package com.litscan.service.impl;

import cn.hutool.core.util.StrUtil;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.service.LlmParserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 大模型元数据解析实现
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmParserServiceImpl implements LlmParserService {

    private static final String UNKNOWN = "未知";
    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");

    private final ChatClient metadataChatClient;
    @Qualifier("metadataExtractionPromptTemplate")
    private final String metadataExtractionPromptTemplate;
    private final LitScanProperties properties;

    @Override
    public boolean isEnabled() {
        return Boolean.TRUE.equals(properties.getLlm().getEnabled());
    }

    @Override
    public Optional<ExtractedFields> parse(String text) {
        if (!isEnabled() || StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        String prompt = metadataExtractionPromptTemplate.replace("{text}",
                StringUtils.left(text, properties.getLlm().getMaxInputChars()));
        try {
            String content = metadataChatClient.prompt()
                    .user(prompt)
                    .call()
                    .content();
            Optional<ExtractedFields> parsed = parseResponse(content);
            log.info("大模型解析完成: title={}", parsed.map(ExtractedFields::getTitle).orElse(null));
            return parsed;
        } catch (Exception e) {
            log.error("大模型解析失败: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * 解析 "标题: / 作者: / 期刊: / 年份:" 行，"未知" 视为缺失，年份必须是 4 位数字
     */
    static Optional<ExtractedFields> parseResponse(String content) {
        if (StrUtil.isBlank(content)) {
            return Optional.empty();
        }
        ExtractedFields fields = new ExtractedFields();
        for (String raw : content.trim().split("\n")) {
            String line = raw.trim();
            if (line.length() < 3 || (line.charAt(2) != ':' && line.charAt(2) != '：')) {
                continue;
            }
            String label = line.substring(0, 2);
            String value = line.substring(3).trim();
            if (value.isEmpty() || UNKNOWN.equals(value)) {
                continue;
            }
            switch (label) {
                case "标题" -> fields.setTitle(value);
                case "作者" -> fields.setAuthors(value);
                case "期刊" -> fields.setVenue(value);
                case "年份" -> {
                    if (FOUR_DIGITS.matcher(value).matches()) {
                        fields.setYear(Integer.parseInt(value));
                    }
                }
                default -> {
                }
            }
        }
        return fields.hasAnyBibliographicField() ? Optional.of(fields) : Optional.empty();
    }
}
