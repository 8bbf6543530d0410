package com.litscan.client;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.utils.AuthorNameUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * OpenAlex API 客户端
 *
 * @author litscan
 */
@Slf4j
@Order(2)
@Component
@RequiredArgsConstructor
public class OpenAlexClient implements CatalogClient {

    public static final String NAME = "openalex";

    private static final String DOI_URL_PREFIX = "https://doi.org/";
    private static final int MAX_AUTHORS = 3;
    // 过滤器语法中的分隔符和运算符
    private static final Pattern FILTER_SYNTAX = Pattern.compile("[,:|!\"]");

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
        URI uri = UriComponentsBuilder.fromUriString(properties.getResolver().getOpenAlexApiUrl())
                .path("/doi:" + doi.trim())
                .queryParam("mailto", properties.getResolver().getEmail())
                .build()
                .encode()
                .toUri();
        return httpExecutor.getJson(uri)
                .filter(root -> root.hasNonNull("id"))
                .map(OpenAlexClient::toCandidate);
    }

    @Override
    public List<CandidateRecord> search(ExtractedFields fields) {
        String filter = buildFilter(fields);
        if (filter == null) {
            return new ArrayList<>();
        }
        LitScanProperties.ResolverConfig config = properties.getResolver();
        URI uri = UriComponentsBuilder.fromUriString(config.getOpenAlexApiUrl())
                .queryParam("filter", "{filter}")
                .queryParam("per-page", "{rows}")
                .queryParam("mailto", "{mailto}")
                .encode()
                .buildAndExpand(filter, config.getRows(), config.getEmail())
                .toUri();

        List<CandidateRecord> candidates = new ArrayList<>();
        httpExecutor.getJson(uri).ifPresent(root -> {
            JsonNode results = root.path("results");
            for (int i = 0; i < Math.min(results.size(), config.getRows()); i++) {
                candidates.add(toCandidate(results.get(i)));
            }
        });
        log.info("OpenAlex 检索返回 {} 条候选: {}", candidates.size(), filter);
        return candidates;
    }

    /**
     * title.search 加可选的 publication_year，多个条件用逗号连接（AND）
     */
    static String buildFilter(ExtractedFields fields) {
        if (fields.getTitle() == null) {
            return null;
        }
        String title = FILTER_SYNTAX.matcher(fields.getTitle()).replaceAll(" ").replaceAll("\\s+", " ").trim();
        if (title.isEmpty()) {
            return null;
        }
        String filter = "title.search:" + title;
        if (fields.getYear() != null) {
            filter += ",publication_year:" + fields.getYear();
        }
        return filter;
    }

    static CandidateRecord toCandidate(JsonNode work) {
        List<String> authors = new ArrayList<>();
        JsonNode authorships = work.path("authorships");
        for (int i = 0; i < Math.min(authorships.size(), MAX_AUTHORS); i++) {
            JsonNode authorship = authorships.get(i);
            String name = authorship.path("author").path("display_name").asText("");
            if (name.isEmpty()) {
                name = authorship.path("raw_author_name").asText("");
            }
            String formatted = AuthorNameUtils.formatFromDisplayName(name);
            if (!formatted.isEmpty()) {
                authors.add(formatted);
            }
        }

        String doiUrl = text(work, "doi");
        String venue = text(work.path("primary_location").path("source"), "display_name");
        if (venue == null) {
            venue = text(work.path("host_venue"), "display_name");
        }
        JsonNode biblio = work.path("biblio");
        return CandidateRecord.builder()
                .doi(stripDoiPrefix(doiUrl))
                .title(text(work, "title"))
                .authors(authors.isEmpty() ? null : String.join("; ", authors))
                .year(work.path("publication_year").canConvertToInt() ? work.path("publication_year").asInt() : null)
                .venue(venue)
                .volume(text(biblio, "volume"))
                .issue(text(biblio, "issue"))
                .pages(pages(biblio))
                .url(doiUrl != null ? doiUrl : text(work, "id"))
                .type(text(work, "type"))
                .score(work.path("relevance_score").isNumber() ? work.path("relevance_score").asDouble() : null)
                .catalog(NAME)
                .build();
    }

    static String stripDoiPrefix(String doi) {
        if (doi == null) {
            return null;
        }
        String lower = doi.toLowerCase(Locale.ROOT);
        return lower.startsWith(DOI_URL_PREFIX) ? lower.substring(DOI_URL_PREFIX.length()) : lower;
    }

    private static String pages(JsonNode biblio) {
        String first = text(biblio, "first_page");
        String last = text(biblio, "last_page");
        if (first == null) {
            return null;
        }
        return last == null || last.equals(first) ? first : first + "-" + last;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : StrUtil.trimToNull(value.asText());
    }
}
