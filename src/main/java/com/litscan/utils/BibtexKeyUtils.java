package com.litscan.utils;

import cn.hutool.core.util.StrUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BibTeX 引用键生成
 *
 * <ul>
 *     <li>short: author2024</li>
 *     <li>medium: author2024keyword</li>
 *     <li>long: author2024 + 标题前 3 个关键词</li>
 * </ul>
 *
 * @author litscan
 */
public class BibtexKeyUtils {

    public static final String MODE_SHORT = "short";
    public static final String MODE_MEDIUM = "medium";
    public static final String MODE_LONG = "long";

    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^a-zA-Z\\u4e00-\\u9fff]");
    private static final Pattern TITLE_WORD = Pattern.compile("\\b[a-zA-Z]+\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "of", "for", "and", "or", "in", "on", "to", "with", "by", "from",
            "as", "is", "are", "was", "were", "be", "been", "being", "at", "into", "through",
            "during", "before", "after", "above", "below", "between", "under", "over");

    public static String generate(String authors, Integer year, String title, String mode) {
        String key = firstAuthorKey(authors) + (year == null ? "0000" : String.valueOf(year));
        if (MODE_SHORT.equals(mode)) {
            return key;
        }
        List<String> keywords = titleKeywords(title);
        if (MODE_LONG.equals(mode)) {
            return key + String.join("", keywords.subList(0, Math.min(3, keywords.size())));
        }
        return key + (keywords.isEmpty() ? "" : keywords.get(0));
    }

    /**
     * 中文取第一个字，西文取姓（有逗号取逗号前，否则取最后一个词），仅保留字母和汉字
     */
    static String firstAuthorKey(String authors) {
        String first = AuthorNameUtils.firstAuthor(authors);
        String name;
        if (first.isEmpty()) {
            name = "unknown";
        } else if (AuthorNameUtils.containsCjk(first)) {
            name = first.substring(0, 1);
        } else if (first.contains(",")) {
            name = first.substring(0, first.indexOf(','));
        } else {
            String[] parts = WHITESPACE.split(first);
            name = parts[parts.length - 1];
        }
        name = NON_NAME_CHARS.matcher(name).replaceAll("").toLowerCase(Locale.ROOT);
        return StrUtil.isEmpty(name) ? "unknown" : name;
    }

    static List<String> titleKeywords(String title) {
        List<String> keywords = new ArrayList<>();
        if (StrUtil.isBlank(title)) {
            return keywords;
        }
        Matcher matcher = TITLE_WORD.matcher(title.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 2 && !STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }
}
