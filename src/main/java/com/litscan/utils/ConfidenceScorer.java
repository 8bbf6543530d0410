package com.litscan.utils;

import cn.hutool.core.util.StrUtil;
import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 候选记录置信度打分
 *
 * <pre>
 * 标题词集合 Jaccard × 0.4
 * 年份相同 +20，相差 1 年 +10
 * 第一作者前 10 个字符相同 +20，否则最后一个词相同 +10
 * 输入期刊名前 3 个词任一出现在候选期刊名中 +20
 * </pre>
 * 总分上限 100。
 *
 * @author litscan
 */
public class ConfidenceScorer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static double score(ExtractedFields paper, CandidateRecord candidate) {
        double score = titleSimilarity(paper.getTitle(), candidate.getTitle()) * 0.4;

        Integer paperYear = paper.getYear();
        Integer candidateYear = candidate.getYear();
        if (paperYear != null && candidateYear != null && paperYear > 0 && candidateYear > 0) {
            if (paperYear.equals(candidateYear)) {
                score += 20;
            } else if (Math.abs(paperYear - candidateYear) <= 1) {
                score += 10;
            }
        }

        String paperAuthor = AuthorNameUtils.firstAuthor(lower(paper.getAuthors()));
        String candidateAuthor = AuthorNameUtils.firstAuthor(lower(candidate.getAuthors()));
        if (!paperAuthor.isEmpty() && !candidateAuthor.isEmpty()) {
            if (StringUtils.left(paperAuthor, 10).equals(StringUtils.left(candidateAuthor, 10))) {
                score += 20;
            } else if (lastToken(paperAuthor).equals(lastToken(candidateAuthor))) {
                score += 10;
            }
        }

        String paperVenue = lower(paper.getVenue());
        String candidateVenue = lower(candidate.getVenue());
        if (!paperVenue.isBlank() && !candidateVenue.isBlank()) {
            String[] words = WHITESPACE.split(paperVenue.trim());
            for (int i = 0; i < Math.min(3, words.length); i++) {
                if (candidateVenue.contains(words[i])) {
                    score += 20;
                    break;
                }
            }
        }
        return Math.min(score, 100);
    }

    /**
     * 标题词集合的 Jaccard 相似度，0-100
     */
    public static double titleSimilarity(String t1, String t2) {
        if (StrUtil.isBlank(t1) || StrUtil.isBlank(t2)) {
            return 0;
        }
        Set<String> words1 = words(normalizeTitle(t1));
        Set<String> words2 = words(normalizeTitle(t2));
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0;
        }
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        return intersection.size() * 100.0 / union.size();
    }

    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return NON_WORD.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private static Set<String> words(String normalized) {
        String trimmed = normalized.trim();
        if (trimmed.isEmpty()) {
            return new HashSet<>();
        }
        return new HashSet<>(Arrays.asList(WHITESPACE.split(trimmed)));
    }

    private static String lastToken(String value) {
        String[] parts = WHITESPACE.split(value.trim());
        return parts[parts.length - 1];
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
