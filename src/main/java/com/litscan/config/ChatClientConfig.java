package com.litscan.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @author litscan
 * @since 2025-03-04
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ChatClientConfig {

    private final OpenAiChatModel openAiChatModel;
    private final LitScanProperties properties;

    /**
     * 元数据抽取用的 ChatClient（低温度，短输出）
     */
    @Bean("metadataChatClient")
    public ChatClient metadataChatClient() {
        LitScanProperties.LlmConfig llm = properties.getLlm();
        log.info("初始化元数据抽取 ChatClient, model={}, enabled={}", llm.getModel(), llm.getEnabled());

        return ChatClient.builder(openAiChatModel)
            .defaultOptions(OpenAiChatOptions.builder()
                .model(llm.getModel())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .build())
            .defaultSystem("你是一个学术文献信息提取助手，只输出要求的字段，不要输出其他内容。")
            .build();
    }
}
