package com.litscan.client;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.utils.AuthorNameUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Crossref REST API 客户端
 *
 * @author litscan
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class CrossrefClient implements CatalogClient {

    public static final String NAME = "crossref";

    private static final String[] YEAR_FIELDS = {"published-print", "published-online", "issued"};

    private final CatalogHttpExecutor httpExecutor;
    private final LitScanProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<CandidateRecord> lookupByDoi(String doi) {
        if (StrUtil.isBlank(doi)) {
            return Optional.empty();
        }
        URI uri = UriComponentsBuilder.fromUriString(properties.getResolver().getCrossrefApiUrl())
                .path("/" + doi.trim())
                .build()
                .encode()
                .toUri();
        return httpExecutor.getJson(uri)
                .map(root -> root.get("message"))
                .filter(JsonNode::isObject)
                .map(CrossrefClient::toCandidate);
    }

    @Override
    public List<CandidateRecord> search(ExtractedFields fields) {
        String query = buildQuery(fields);
        if (query.isEmpty()) {
            return new ArrayList<>();
        }
        LitScanProperties.ResolverConfig config = properties.getResolver();
        // 模板变量整体编码，"+" 等保留字符不会原样进入查询串
        URI uri = UriComponentsBuilder.fromUriString(config.getCrossrefApiUrl())
                .queryParam("query.bibliographic", "{query}")
                .queryParam("rows", "{rows}")
                .queryParam("mailto", "{mailto}")
                .encode()
                .buildAndExpand(StringUtils.left(query, config.getQueryMaxLength()), config.getRows(), config.getEmail())
                .toUri();

        List<CandidateRecord> candidates = new ArrayList<>();
        httpExecutor.getJson(uri).ifPresent(root -> {
            JsonNode items = root.path("message").path("items");
            for (int i = 0; i < Math.min(items.size(), config.getRows()); i++) {
                candidates.add(toCandidate(items.get(i)));
            }
        });
        log.info("Crossref 检索返回 {} 条候选: {}", candidates.size(), StringUtils.abbreviate(query, 80));
        return candidates;
    }

    /**
     * 标题 + 第一作者最后一个词 + 年份
     */
    static String buildQuery(ExtractedFields fields) {
        List<String> parts = new ArrayList<>();
        if (fields.getTitle() != null) {
            parts.add(fields.getTitle());
        }
        String author = AuthorNameUtils.firstAuthorLastToken(fields.getAuthors());
        if (!author.isEmpty()) {
            parts.add(author);
        }
        if (fields.getYear() != null) {
            parts.add(String.valueOf(fields.getYear()));
        }
        return String.join(" ", parts);
    }

    static CandidateRecord toCandidate(JsonNode item) {
        List<String> authors = new ArrayList<>();
        for (JsonNode author : item.path("author")) {
            String formatted = AuthorNameUtils.formatFromParts(author.path("family").asText(""), author.path("given").asText(""));
            if (!formatted.isEmpty()) {
                authors.add(formatted);
            }
        }
        String doi = text(item, "DOI");
        return CandidateRecord.builder()
                .doi(doi == null ? null : doi.toLowerCase(Locale.ROOT))
                .title(first(item.path("title")))
                .authors(authors.isEmpty() ? null : String.join("; ", authors))
                .year(year(item))
                .venue(first(item.path("container-title")))
                .volume(text(item, "volume"))
                .issue(text(item, "issue"))
                .pages(text(item, "page"))
                .url(text(item, "URL"))
                .type(text(item, "type"))
                .score(item.path("score").isNumber() ? item.path("score").asDouble() : null)
                .catalog(NAME)
                .build();
    }

    private static Integer year(JsonNode item) {
        for (String field : YEAR_FIELDS) {
            JsonNode value = item.path(field).path("date-parts").path(0).path(0);
            if (value.canConvertToInt() && value.asInt() > 0) {
                return value.asInt();
            }
        }
        return null;
    }

    private static String first(JsonNode array) {
        return array.isArray() && array.size() > 0 ? StrUtil.trimToNull(array.get(0).asText()) : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : StrUtil.trimToNull(value.asText());
    }
}
