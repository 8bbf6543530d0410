package com.litscan.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.InetSocketAddress;
import java.net.Proxy;

/**
 * 外部服务 HTTP 客户端配置
 *
 * 书目目录（Crossref / OpenAlex）与 OCR 服务分别使用独立的超时设置，代理开启时统一走代理。
 *
 * @author litscan
 */
@Slf4j
@Configuration
@ConditionalOnClass(RestTemplate.class)
@RequiredArgsConstructor
public class HttpClientConfig {

    private final LitScanProperties properties;

    @Bean("catalogRestTemplate")
    public RestTemplate catalogRestTemplate() {
        return new RestTemplate(buildRequestFactory(properties.getResolver().getTimeoutSeconds(), properties.getProxy()));
    }

    @Bean("ocrRestTemplate")
    public RestTemplate ocrRestTemplate() {
        return new RestTemplate(buildRequestFactory(properties.getOcr().getTimeoutSeconds(), properties.getProxy()));
    }

    static SimpleClientHttpRequestFactory buildRequestFactory(int timeoutSeconds, LitScanProperties.ProxyConfig proxyConfig) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        // 连接超时（毫秒）
        factory.setConnectTimeout(timeoutSeconds * 1000);
        // 读取超时（毫秒）
        factory.setReadTimeout(timeoutSeconds * 1000);
        Proxy proxy = toProxy(proxyConfig);
        if (proxy != null) {
            factory.setProxy(proxy);
        }
        return factory;
    }

    static Proxy toProxy(LitScanProperties.ProxyConfig proxyConfig) {
        if (proxyConfig == null || !Boolean.TRUE.equals(proxyConfig.getEnabled())) {
            return null;
        }
        Proxy.Type type = "HTTP".equalsIgnoreCase(proxyConfig.getType()) ? Proxy.Type.HTTP : Proxy.Type.SOCKS;
        log.info("启用网络代理: {}://{}:{}", type, proxyConfig.getHost(), proxyConfig.getPort());
        return new Proxy(type, new InetSocketAddress(proxyConfig.getHost(), proxyConfig.getPort()));
    }
}
