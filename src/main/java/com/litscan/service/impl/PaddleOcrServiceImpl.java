package com.litscan.service.impl;

import cn.hutool.core.codec.Base64;
import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.litscan.config.LitScanProperties;
import com.litscan.service.OcrService;
import com.litscan.service.PdfDocumentService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import top.continew.starter.core.exception.BusinessException;

import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 版面解析 OCR 服务实现（PaddleOCR 兼容接口）
 *
 * <pre>
 * 请求: POST {"file": base64, "fileType": 1}，Authorization: token &lt;key&gt;
 * 响应: result.layoutParsingResults[].markdown.text
 * </pre>
 *
 * 服务地址和令牌每次调用时读取，支持运行时更新。
 *
 * @author litscan
 */
@Slf4j
@Service
public class PaddleOcrServiceImpl implements OcrService {

    private final RestTemplate restTemplate;
    private final PdfDocumentService pdfDocumentService;
    private final LitScanProperties properties;
    private final ObjectMapper objectMapper;

    public PaddleOcrServiceImpl(@Qualifier("ocrRestTemplate") RestTemplate restTemplate,
                                PdfDocumentService pdfDocumentService,
                                LitScanProperties properties,
                                ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.pdfDocumentService = pdfDocumentService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String recognize(Path path, int pageIndex) {
        LitScanProperties.OcrConfig config = properties.getOcr();
        if (!isConfigured()) {
            log.warn("OCR 服务未配置");
            return ERROR_PREFIX + " OCR 未配置，请设置 litscan.ocr.url 和 litscan.ocr.key";
        }

        byte[] image;
        try {
            image = loadImage(path, pageIndex, config);
        } catch (BusinessException e) {
            return ERROR_PREFIX + " " + e.getMessage();
        } catch (Exception e) {
            log.error("OCR 图像准备失败: {}", path, e);
            return ERROR_PREFIX + " " + e.getMessage();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, "token " + config.getKey());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("file", Base64.encode(image));
        payload.put("fileType", 1);

        try {
            log.info("调用OCR服务: {}, file={}, page={}", config.getUrl(), path.getFileName(), pageIndex);
            ResponseEntity<String> response = restTemplate.postForEntity(config.getUrl(), new HttpEntity<>(payload, headers), String.class);
            log.info("OCR响应状态码: {}", response.getStatusCode().value());
            String body = response.getBody();
            return parseResponse(objectMapper.readTree(body == null ? "" : body));
        } catch (HttpStatusCodeException e) {
            log.warn("OCR服务返回错误: {}", e.getStatusCode());
            return ERROR_PREFIX + " HTTP " + e.getStatusCode().value() + ": " + StringUtils.left(e.getResponseBodyAsString(), 200);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.error("OCR请求超时: {}", path);
                return ERROR_PREFIX + " 请求超时 (" + config.getTimeoutSeconds() + "秒)";
            }
            log.error("OCR网络请求失败: {}", e.getMessage());
            return ERROR_PREFIX + " 网络请求失败: " + e.getMessage();
        } catch (JsonProcessingException e) {
            log.error("OCR响应解析失败: {}", e.getOriginalMessage());
            return ERROR_PREFIX + " 响应解析失败: " + e.getOriginalMessage();
        } catch (RestClientException e) {
            log.error("OCR处理失败: {}", e.getMessage());
            return ERROR_PREFIX + " " + e.getMessage();
        } catch (RuntimeException e) {
            // 地址非法等请求构造阶段的异常同样转为错误文本
            log.error("OCR请求异常: {}", config.getUrl(), e);
            return ERROR_PREFIX + " " + e.getMessage();
        }
    }

    /**
     * 解析服务响应：文本段用空行连接；无文本为警告；error 字段为错误；其他形状原样截断返回
     */
    String parseResponse(JsonNode result) {
        if (result.has("result")) {
            List<String> texts = new ArrayList<>();
            for (JsonNode item : result.path("result").path("layoutParsingResults")) {
                String text = item.path("markdown").path("text").asText("");
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            }
            if (texts.isEmpty()) {
                return WARNING_PREFIX + " 未识别到文本";
            }
            return String.join("\n\n", texts);
        }
        if (result.has("error")) {
            JsonNode error = result.get("error");
            return ERROR_PREFIX + " " + (error.isTextual() ? error.asText() : error.toString());
        }
        return RESULT_PREFIX + " " + StringUtils.left(result.toString(), 300);
    }

    private byte[] loadImage(Path path, int pageIndex, LitScanProperties.OcrConfig config) {
        if (isImage(path)) {
            return FileUtil.readBytes(path.toFile());
        }
        return pdfDocumentService.renderPageAsPng(path, pageIndex, config.getRenderScale());
    }

    private boolean isImage(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return properties.getScan().getImageExtensions().stream().anyMatch(name::endsWith);
    }

    @Override
    public boolean isConfigured() {
        LitScanProperties.OcrConfig config = properties.getOcr();
        return StrUtil.isNotBlank(config.getUrl()) && StrUtil.isNotBlank(config.getKey());
    }

    @Override
    public void reconfigure(String url, String key) {
        properties.getOcr().setUrl(StrUtil.trimToEmpty(url));
        properties.getOcr().setKey(StrUtil.trimToEmpty(key));
        log.info("OCR 服务配置已更新: {}", url);
    }
}
