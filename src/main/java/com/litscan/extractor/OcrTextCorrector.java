package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 修正 OCR 常见的系统性误识别（多为中文拼音人名、地名丢字）
 *
 * <p>纯字母的误识别只在整词出现时替换，避免把正确的 "China" 改成 "Chinaa"；
 * 含撇号或空格的条目按顺序做子串替换，顺序有意义（"Jin'o" 先变 "Ji'o" 再变 "Jin'ao"）。</p>
 *
 * @author litscan
 */
public final class OcrTextCorrector {

    private static final Map<String, String> CORRECTIONS = new LinkedHashMap<>();

    static {
        CORRECTIONS.put("n'", "'");
        CORRECTIONS.put("Chin", "China");
        CORRECTIONS.put("Hfi", "Hefei");
        CORRECTIONS.put("Xi'n", "Xi'an");
        CORRECTIONS.put("Jin'o", "Jin'ao");
        CORRECTIONS.put("Tin", "Ting");
        CORRECTIONS.put("Hichun", "Haichuan");
        CORRECTIONS.put("Zhn", "Zhang");
        CORRECTIONS.put("Shn", "Shang");
        CORRECTIONS.put("Zin", "Zian");
        CORRECTIONS.put("Zisn", "Zisen");
        CORRECTIONS.put("Shilon", "Shilong");
        CORRECTIONS.put("Ji'o", "Jin'ao");
        CORRECTIONS.put("Yn Liu", "Yang Liu");
        CORRECTIONS.put("Liu Yn", "Yang Liu");
    }

    private static final Pattern ALPHA_ONLY = Pattern.compile("[A-Za-z]+");

    private OcrTextCorrector() {
    }

    public static String correct(String text) {
        if (StrUtil.isEmpty(text)) {
            return text;
        }
        String result = text;
        for (Map.Entry<String, String> entry : CORRECTIONS.entrySet()) {
            String wrong = entry.getKey();
            String right = entry.getValue();
            if (ALPHA_ONLY.matcher(wrong).matches()) {
                result = result.replaceAll("(?<![A-Za-z])" + Pattern.quote(wrong) + "(?![A-Za-z])",
                        Matcher.quoteReplacement(right));
            } else {
                result = result.replace(wrong, right);
            }
        }
        return result;
    }
}
