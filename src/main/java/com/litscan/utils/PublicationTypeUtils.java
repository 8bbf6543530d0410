package com.litscan.utils;

import cn.hutool.core.util.StrUtil;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 根据期刊 / 会议名称判断出版物类型和 BibTeX 条目类型
 *
 * <p>关键词按整词匹配，"sp" 不会命中 "springer"。</p>
 *
 * @author litscan
 */
public class PublicationTypeUtils {

    public static final String CONFERENCE = "conference";
    public static final String JOURNAL = "journal";
    public static final String OTHER = "other";

    public static final String ENTRY_ARTICLE = "article";
    public static final String ENTRY_INPROCEEDINGS = "inproceedings";

    private static final List<String> CONFERENCE_KEYWORDS = List.of(
            "proceedings", "conference", "ccs", "ndss", "sp", "oakland",
            "usenix security", "ieee symposium", "acm conference",
            "icml", "neurips", "cvpr", "iccv", "eccv", "iclr",
            "acl", "emnlp", "naacl", "ijcai", "aaai", "sigir",
            "kdd", "www", "icde", "vldb", "sigmod", "icdm",
            "icassp", "interspeech", "icra", "iros",
            "workshop", "symposium", "colloquium");

    private static final List<String> JOURNAL_KEYWORDS = List.of(
            "journal", "transactions", "letters", "ieee", "acm",
            "elsevier", "springer", "wiley", "taylor", "francis",
            "scie", "sci", "nature", "science", "cell",
            "physica", "applied physics", "review");

    private static final List<Pattern> CONFERENCE_PATTERNS = compile(CONFERENCE_KEYWORDS);
    private static final List<Pattern> JOURNAL_PATTERNS = compile(JOURNAL_KEYWORDS);

    private static final List<String> PROCEEDINGS_MARKERS = List.of("proceedings", "conference", "symposium");

    /**
     * @return conference / journal / other
     */
    public static String detect(String venue) {
        if (StrUtil.isBlank(venue)) {
            return OTHER;
        }
        String lower = venue.toLowerCase(Locale.ROOT).trim();
        if (matchesAny(lower, CONFERENCE_PATTERNS)) {
            return CONFERENCE;
        }
        if (matchesAny(lower, JOURNAL_PATTERNS)) {
            return JOURNAL;
        }
        return OTHER;
    }

    public static String entryType(String venue) {
        if (StrUtil.isBlank(venue)) {
            return ENTRY_ARTICLE;
        }
        String lower = venue.toLowerCase(Locale.ROOT);
        for (String marker : PROCEEDINGS_MARKERS) {
            if (lower.contains(marker)) {
                return ENTRY_INPROCEEDINGS;
            }
        }
        return ENTRY_ARTICLE;
    }

    private static boolean matchesAny(String lower, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> keywords) {
        return keywords.stream()
                .map(kw -> Pattern.compile("(?<![a-z])" + Pattern.quote(kw) + "(?![a-z])"))
                .collect(Collectors.toList());
    }
}
