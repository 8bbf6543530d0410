package com.litscan.service.impl;

import com.litscan.client.CatalogClient;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.model.dto.ResolutionResult;
import com.litscan.model.enums.ResolutionSource;
import com.litscan.service.BibliographicResolverService;
import com.litscan.utils.ConfidenceScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 书目解析实现
 *
 * <p>目录客户端按 {@code @Order} 顺序使用：DOI 查询取第一个命中，标题检索汇总全部候选取最高分。</p>
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BibliographicResolverServiceImpl implements BibliographicResolverService {

    private static final double DOI_LOOKUP_CONFIDENCE = 100;
    private static final String DOI_URL_PREFIX = "https://doi.org/";

    private final List<CatalogClient> catalogClients;
    private final LitScanProperties properties;

    @Override
    public ResolutionResult resolve(ExtractedFields fields) {
        if (fields.getDoi() != null) {
            for (CatalogClient client : catalogClients) {
                Optional<CandidateRecord> hit = client.lookupByDoi(fields.getDoi());
                if (hit.isPresent()) {
                    CandidateRecord candidate = hit.get();
                    String doi = candidate.getDoi() != null ? candidate.getDoi() : fields.getDoi();
                    log.info("DOI精确命中 [{}]: {}", client.getName(), doi);
                    return ResolutionResult.builder()
                            .doi(doi)
                            .confidence(DOI_LOOKUP_CONFIDENCE)
                            .source(ResolutionSource.DOI_LOOKUP)
                            .mergedFields(merge(fields, candidate, doi))
                            .candidate(candidate)
                            .build();
                }
            }
            log.warn("DOI未在目录中找到，改用标题检索: {}", fields.getDoi());
        }

        if (fields.getTitle() == null) {
            log.info("无DOI且无标题，跳过目录检索");
            return ResolutionResult.none(fields);
        }

        CandidateRecord best = null;
        double bestScore = 0;
        for (CatalogClient client : catalogClients) {
            for (CandidateRecord candidate : client.search(fields)) {
                double score = ConfidenceScorer.score(fields, candidate);
                log.debug("候选 [{}] score={}: {}", client.getName(), score, candidate.getTitle());
                if (score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }
        }

        if (best == null) {
            log.info("目录检索无匹配: {}", fields.getTitle());
            return ResolutionResult.none(fields);
        }
        if (bestScore >= properties.getResolver().getMatchThreshold()) {
            log.info("自动匹配 [{}] score={}: {}", best.getCatalog(), bestScore, best.getDoi());
            return ResolutionResult.builder()
                    .doi(best.getDoi())
                    .confidence(bestScore)
                    .source(ResolutionSource.AUTO)
                    .mergedFields(merge(fields, best, best.getDoi()))
                    .candidate(best)
                    .build();
        }
        log.info("匹配置信度不足，待人工审核 [{}] score={}: {}", best.getCatalog(), bestScore, best.getTitle());
        return ResolutionResult.builder()
                .confidence(bestScore)
                .source(ResolutionSource.REVIEW)
                .mergedFields(merge(fields, best, fields.getDoi()))
                .candidate(best)
                .build();
    }

    /**
     * 候选字段非空时覆盖抽取字段；doi 由调用方决定（待审核时不采用候选 DOI）
     */
    static ExtractedFields merge(ExtractedFields fields, CandidateRecord candidate, String doi) {
        ExtractedFields merged = fields.copy();
        if (candidate.getTitle() != null) {
            merged.setTitle(candidate.getTitle());
        }
        if (candidate.getAuthors() != null) {
            merged.setAuthors(candidate.getAuthors());
        }
        if (candidate.getYear() != null) {
            merged.setYear(candidate.getYear());
        }
        if (candidate.getVenue() != null) {
            merged.setVenue(candidate.getVenue());
        }
        if (candidate.getVolume() != null) {
            merged.setVolume(candidate.getVolume());
        }
        if (candidate.getIssue() != null) {
            merged.setIssue(candidate.getIssue());
        }
        if (candidate.getPages() != null) {
            merged.setPages(candidate.getPages());
        }
        merged.setDoi(doi);
        if (candidate.getUrl() != null && (candidate.getDoi() == null || candidate.getDoi().equals(doi))) {
            merged.setUrl(candidate.getUrl());
        } else if (merged.getUrl() == null && doi != null) {
            merged.setUrl(DOI_URL_PREFIX + doi);
        }
        return merged;
    }
}
