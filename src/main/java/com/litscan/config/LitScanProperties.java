package com.litscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * LitScan 配置类
 *
 * @author litscan
 * @since 2025-03-02
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "litscan")
public class LitScanProperties {

    /**
     * 抽取流水线配置
     */
    private PipelineConfig pipeline = new PipelineConfig();

    /**
     * 书目解析配置（Crossref / OpenAlex）
     */
    private ResolverConfig resolver = new ResolverConfig();

    /**
     * OCR 服务配置
     */
    private OcrConfig ocr = new OcrConfig();

    /**
     * 大模型解析配置
     */
    private LlmConfig llm = new LlmConfig();

    /**
     * 网络代理配置
     */
    private ProxyConfig proxy = new ProxyConfig();

    /**
     * 目录扫描配置
     */
    private ScanConfig scan = new ScanConfig();

    @Data
    public static class PipelineConfig {
        /**
         * 论文读取的最大页数
         */
        private Integer maxPages = 5;

        /**
         * 证书读取的最大页数
         */
        private Integer certificateMaxPages = 2;

        /**
         * 论文文本少于该长度时判定为需要 OCR
         */
        private Integer minTextLength = 200;

        /**
         * 证书文本少于该长度时直接走 OCR
         */
        private Integer certificateMinTextLength = 100;

        /**
         * 证书缺失字段达到该数量时触发 OCR 补全
         */
        private Integer ocrRemedyMissingThreshold = 4;

        /**
         * 失败信息最大长度
         */
        private Integer errorMessageMaxLength = 500;

        /**
         * BibTeX 键模式: short / medium / long
         */
        private String bibtexKeyMode = "medium";
    }

    @Data
    public static class ResolverConfig {
        /**
         * 自动采纳的置信度阈值
         */
        private Integer matchThreshold = 80;

        private String crossrefApiUrl = "https://api.crossref.org/works";

        private String openAlexApiUrl = "https://api.openalex.org/works";

        /**
         * Crossref polite pool 邮箱
         */
        private String email = "litscan@example.com";

        private String userAgent = "LitScan/1.0 (Java; mailto:litscan@example.com)";

        /**
         * 单次请求超时（秒）
         */
        private Integer timeoutSeconds = 10;

        /**
         * 失败后的最大重试次数
         */
        private Integer maxRetries = 2;

        /**
         * 首次重试等待（毫秒），之后按 2 倍递增
         */
        private Long initialBackoffMillis = 1000L;

        /**
         * 每个目录返回的候选数量
         */
        private Integer rows = 5;

        /**
         * 检索串最大长度
         */
        private Integer queryMaxLength = 500;
    }

    @Data
    public static class OcrConfig {
        /**
         * 版面解析服务地址，为空时不可用
         */
        private String url = "";

        /**
         * 访问令牌
         */
        private String key = "";

        private Integer timeoutSeconds = 60;

        /**
         * PDF 页面渲染倍率（72 dpi 基准）
         */
        private Float renderScale = 2.0f;
    }

    @Data
    public static class LlmConfig {
        private Boolean enabled = false;

        private String model = "deepseek-chat";

        private Integer maxTokens = 500;

        private Double temperature = 0.1;

        /**
         * 送入模型的文本最大长度
         */
        private Integer maxInputChars = 3000;
    }

    @Data
    public static class ProxyConfig {
        private Boolean enabled = false;

        /**
         * HTTP / SOCKS5
         */
        private String type = "SOCKS5";

        private String host = "127.0.0.1";

        private Integer port = 1080;
    }

    @Data
    public static class ScanConfig {
        /**
         * 默认扫描根目录
         */
        private String rootDir = "./literature";

        private List<String> extensions = new ArrayList<>(List.of(".pdf", ".png", ".jpg", ".jpeg", ".bmp", ".tiff"));

        /**
         * 排除的相对目录（前缀匹配）
         */
        private List<String> excludedFolders = new ArrayList<>();

        /**
         * 文件名含这些关键字时按证书处理
         */
        private List<String> certificateKeywords = new ArrayList<>(List.of("专利", "软著", "证书", "certificate", "patent"));

        private List<String> imageExtensions = new ArrayList<>(List.of(".png", ".jpg", ".jpeg", ".bmp", ".tiff"));
    }
}
