package com.litscan.client;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.litscan.config.LitScanProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * 书目目录 GET 请求执行器
 *
 * <p>失败后按 1s、2s ... 指数退避重试，重试耗尽返回空。4xx（429 除外）不重试。</p>
 *
 * @author litscan
 */
@Slf4j
@Component
public class CatalogHttpExecutor {

    private final RestTemplate restTemplate;
    private final LitScanProperties properties;
    private final ObjectMapper objectMapper;

    public CatalogHttpExecutor(@Qualifier("catalogRestTemplate") RestTemplate restTemplate,
                               LitScanProperties properties,
                               ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> getJson(URI uri) {
        LitScanProperties.ResolverConfig config = properties.getResolver();
        int attempts = Math.max(0, config.getMaxRetries()) + 1;

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, config.getUserAgent());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Void> request = new HttpEntity<>(headers);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            String failure;
            try {
                ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, request, String.class);
                String body = response.getBody();
                if (StrUtil.isBlank(body)) {
                    log.warn("目录返回空响应: {}", uri);
                    return Optional.empty();
                }
                return Optional.of(objectMapper.readTree(body));
            } catch (HttpClientErrorException e) {
                if (e.getStatusCode().value() != HttpStatus.TOO_MANY_REQUESTS.value()) {
                    log.info("目录请求未命中: {} -> {}", uri, e.getStatusCode());
                    return Optional.empty();
                }
                failure = e.getMessage();
            } catch (RestClientException | JsonProcessingException e) {
                failure = e.getMessage();
            }

            if (attempt < attempts) {
                long waitMillis = config.getInitialBackoffMillis() << (attempt - 1);
                log.warn("目录请求失败 (第{}/{}次): {}, {}ms 后重试", attempt, attempts, failure, waitMillis);
                if (!sleep(waitMillis)) {
                    return Optional.empty();
                }
            } else {
                log.warn("目录请求失败 (第{}/{}次): {}, 放弃", attempt, attempts, failure);
            }
        }
        return Optional.empty();
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("重试等待被中断");
            return false;
        }
    }
}
