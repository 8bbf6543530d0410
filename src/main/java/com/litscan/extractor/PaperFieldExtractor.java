package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 论文字段的文本规则抽取
 *
 * <p>所有方法都是无副作用的静态方法，抽取不到时返回 {@link Optional#empty()}，不会返回空字符串。</p>
 *
 * @author litscan
 */
@Slf4j
public final class PaperFieldExtractor {

    private static final Pattern DOI_PATTERN = Pattern.compile("\\b(10\\.\\d{4,}/[-a-zA-Z0-9._%+]+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_PATTERN = Pattern.compile("\\b(19[5-9]\\d|20[0-2]\\d)\\b");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("([a-zA-Z0-9._-]+@[\\w.-]+\\.\\w+)");
    private static final Pattern CJK_PATTERN = Pattern.compile("[\\u4e00-\\u9fff]");
    private static final Pattern LATIN_LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern TITLE_NOISE = Pattern.compile("[^\\w\\s\\-–—]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern OCR_TITLE_NOISE = Pattern.compile("[^\\w\\s\\-–—:()]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NUMBERED_HEADING = Pattern.compile("^\\d+\\.\\s");
    private static final Pattern AUTHOR_LINE_NOISE = Pattern.compile("[$*^#{}\\\\|]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int MAX_DOI_MATCHES = 10;
    private static final int MIN_PLAUSIBLE_YEAR = 1990;
    private static final int MAX_PLAUSIBLE_YEAR = 2025;
    private static final int OCR_AUTHOR_LOOKBACK = 9;

    private static final List<String> VENUE_KEYWORDS = List.of(
            "conference", "proceedings", "journal", "symposium", "workshop",
            "lecture notes", "acm", "ieee", "springer", "elsevier", "arxiv");

    private static final List<String> INSTITUTION_KEYWORDS = List.of(
            "university", "institute", "college", "school", "technology",
            "department", "research", "laboratory", "center", "centre",
            "jiaotong", "science", "china", "hefei", "ustc", "stu.", "mail.",
            "jiot", "univsity", "scinc", "tchnoloy");

    private static final PatternCascade<String> TITLE_CASCADE = PatternCascade.of("title",
            PaperFieldExtractor::titleFromHeading,
            PaperFieldExtractor::titleFromLatinFallback);

    private PaperFieldExtractor() {
    }

    public static Optional<String> extractDoi(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        Matcher matcher = DOI_PATTERN.matcher(text);
        int seen = 0;
        while (matcher.find() && seen < MAX_DOI_MATCHES) {
            seen++;
            String candidate = matcher.group(1);
            if (candidate.contains("/") && candidate.length() > 10) {
                return Optional.of(candidate.toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /**
     * 出现两次以上的最高频年份；否则取第一个出现且在 1990-2025 之间的年份
     */
    public static Optional<Integer> extractYear(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = YEAR_PATTERN.matcher(text);
        while (matcher.find()) {
            counts.merge(Integer.parseInt(matcher.group(1)), 1, Integer::sum);
        }
        if (counts.isEmpty()) {
            return Optional.empty();
        }
        Integer best = null;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        if (bestCount >= 2) {
            return Optional.of(best);
        }
        if (best >= MIN_PLAUSIBLE_YEAR && best <= MAX_PLAUSIBLE_YEAR) {
            return Optional.of(best);
        }
        return Optional.empty();
    }

    public static Optional<String> extractTitle(String text) {
        return TITLE_CASCADE.apply(text);
    }

    /**
     * 首个非空行长度合适时作为标题；其后的行交给兜底规则
     */
    static Optional<String> titleFromHeading(String text) {
        List<String> lines = nonBlankLines(text);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        boolean chinese = isChineseText(text);
        int minLength = chinese ? 10 : 15;
        int maxLength = chinese ? 200 : 400;
        String first = lines.get(0);
        int cleanedLength = TITLE_NOISE.matcher(first).replaceAll("").length();
        if (cleanedLength <= minLength || cleanedLength >= maxLength) {
            return Optional.empty();
        }
        if (first.toLowerCase(Locale.ROOT).startsWith("http")) {
            return Optional.empty();
        }
        return Optional.of(first);
    }

    static Optional<String> titleFromLatinFallback(String text) {
        if (isChineseText(text)) {
            return Optional.empty();
        }
        for (String line : limit(nonBlankLines(text), 10)) {
            int cleanedLength = TITLE_NOISE.matcher(line).replaceAll("").length();
            if (cleanedLength > 20 && cleanedLength < 300) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> extractAuthors(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        List<String> lines = limit(nonBlankLines(text), 15);
        if (isChineseText(text)) {
            for (String line : lines) {
                if (containsAny(line.toLowerCase(Locale.ROOT), List.of("@", "mailto", "http", "www"))) {
                    continue;
                }
                if (line.length() >= 4 && line.length() <= 100 && CJK_PATTERN.matcher(line).find()) {
                    return Optional.of(line);
                }
            }
            return Optional.empty();
        }
        for (String line : lines) {
            if (containsAny(line.toLowerCase(Locale.ROOT), List.of("university", "institute", "@", "mailto"))) {
                continue;
            }
            String[] parts = WHITESPACE.split(line);
            if (parts.length >= 2 && parts.length <= 8) {
                int withLetters = 0;
                for (String part : parts) {
                    if (LATIN_LETTER.matcher(part).find()) {
                        withLetters++;
                    }
                }
                if (withLetters >= 2) {
                    return Optional.of(line);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<String> extractVenue(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        for (String line : limit(nonBlankLines(text), 50)) {
            if (containsAny(line.toLowerCase(Locale.ROOT), VENUE_KEYWORDS) && line.length() > 5 && line.length() < 150) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> extractTitleFromOcr(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        for (String line : limit(nonBlankLines(text), 50)) {
            if (OCR_TITLE_NOISE.matcher(line).replaceAll("").length() < 20) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("abstract") || lower.startsWith("introduction")) {
                continue;
            }
            if (containsAny(lower, List.of("index terms", "keywords", "doi:", "copyright"))) {
                continue;
            }
            if (line.startsWith("I.") || NUMBERED_HEADING.matcher(line).find()) {
                continue;
            }
            return Optional.of(line);
        }
        return Optional.empty();
    }

    /**
     * 以邮箱为锚点向上查找作者姓名行，结果用 "; " 连接
     */
    public static Optional<String> extractAuthorsFromOcr(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        List<String> lines = nonBlankLines(text);
        Map<String, String> emailToName = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = EMAIL_PATTERN.matcher(lines.get(i));
            if (!matcher.find()) {
                continue;
            }
            String email = matcher.group(1).toLowerCase(Locale.ROOT);
            for (int j = i - 1; j >= Math.max(0, i - OCR_AUTHOR_LOOKBACK); j--) {
                String candidate = cleanAuthorLine(lines.get(j));
                if (isNameLine(candidate)) {
                    emailToName.put(email, candidate);
                    break;
                }
            }
        }

        Set<String> seen = new LinkedHashSet<>();
        List<String> authors = new ArrayList<>();
        for (String name : emailToName.values()) {
            String corrected = OcrTextCorrector.correct(name);
            if (StrUtil.isNotBlank(corrected) && seen.add(corrected.toLowerCase(Locale.ROOT))) {
                authors.add(corrected);
            }
        }
        return authors.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", authors));
    }

    private static boolean isNameLine(String candidate) {
        if (candidate.length() < 2 || candidate.contains("@")) {
            return false;
        }
        if (containsAny(candidate.toLowerCase(Locale.ROOT), INSTITUTION_KEYWORDS)) {
            return false;
        }
        if (CJK_PATTERN.matcher(candidate).find()) {
            return true;
        }
        String[] words = candidate.split(" ");
        if (words.length < 1 || words.length > 4) {
            return false;
        }
        boolean hasLetter = false;
        for (char c : candidate.toCharArray()) {
            if (Character.isLetter(c)) {
                hasLetter = true;
            } else if (c != '\'' && c != '-' && c != ' ') {
                return false;
            }
        }
        return hasLetter && Character.isUpperCase(words[0].charAt(0));
    }

    public static List<String> extractEmails(String text) {
        Set<String> emails = new LinkedHashSet<>();
        if (StrUtil.isNotBlank(text)) {
            Matcher matcher = EMAIL_PATTERN.matcher(text);
            while (matcher.find()) {
                emails.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(emails);
    }

    public static boolean isChineseText(String text) {
        return text != null && CJK_PATTERN.matcher(text).find();
    }

    public static String cleanAuthorLine(String line) {
        String cleaned = AUTHOR_LINE_NOISE.matcher(line.trim()).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static List<String> limit(List<String> lines, int max) {
        return lines.size() <= max ? lines : lines.subList(0, max);
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
