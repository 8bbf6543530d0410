package com.litscan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提示词模板配置类
 *
 * @author litscan
 * @since 2025-03-04
 */
@Configuration
public class PromptTemplateConfig {

    /**
     * 从 OCR / PDF 文本中抽取论文元数据
     */
    @Bean("metadataExtractionPromptTemplate")
    public String metadataExtractionPromptTemplate() {
        return """
            请从以下学术论文文本中提取元数据，按如下格式逐行输出：
            标题: <论文标题>
            作者: <作者列表，用分号分隔>
            期刊: <期刊或会议名称>
            年份: <四位数字年份>

            如果某项无法确定，请填写"未知"。不要输出任何解释。

            论文文本：
            {text}
            """;
    }
}
