package com.litscan.utils;

import cn.hutool.core.util.StrUtil;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 作者姓名格式化工具类
 * 西文统一为 "Surname, Given"，中文姓名保持原样
 *
 * @author litscan
 */
public class AuthorNameUtils {

    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static boolean containsCjk(String text) {
        return text != null && CJK.matcher(text).find();
    }

    /**
     * Crossref 的 family / given 拼成 "family, given"，中文直接拼接
     */
    public static String formatFromParts(String family, String given) {
        String f = StrUtil.trimToEmpty(family);
        String g = StrUtil.trimToEmpty(given);
        if (containsCjk(f + g)) {
            return f + g;
        }
        if (!f.isEmpty() && !g.isEmpty()) {
            return f + ", " + g;
        }
        return f.isEmpty() ? g : f;
    }

    /**
     * OpenAlex 的 "FirstName LastName" 转为 "LastName, FirstName"
     */
    public static String formatFromDisplayName(String name) {
        if (StrUtil.isBlank(name)) {
            return "";
        }
        String trimmed = name.trim();
        if (containsCjk(trimmed)) {
            return trimmed;
        }
        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length < 2) {
            return trimmed;
        }
        return parts[parts.length - 1] + ", " + String.join(" ", Arrays.copyOf(parts, parts.length - 1));
    }

    /**
     * 分号分隔列表中的第一作者
     */
    public static String firstAuthor(String authors) {
        if (StrUtil.isBlank(authors)) {
            return "";
        }
        return authors.split(";")[0].trim();
    }

    /**
     * 第一作者的最后一个词，用于组装检索串
     */
    public static String firstAuthorLastToken(String authors) {
        String first = firstAuthor(authors);
        if (first.isEmpty()) {
            return "";
        }
        String[] parts = WHITESPACE.split(first);
        return parts[parts.length - 1];
    }
}
