package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;
import com.litscan.model.dto.PatentFields;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 专利证书字段抽取
 *
 * <p>PDF 直接提取的文本里字段名常被空格或换行拆开（如 "专 利 号：ZL 2022 1 1713574.4"），规则均对此容错。</p>
 *
 * @author litscan
 */
@Slf4j
public final class PatentFieldExtractor {

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final int CI_DOTALL = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern PATENT_NUMBER = Pattern.compile("专\\s*利\\s*号[：:\\s]*((?:ZL|zl)[\\s\\d.X]+)", CI);
    private static final Pattern PATENT_NUMBER_BARE = Pattern.compile("(ZL\\s*\\d{4}\\s*\\d\\s*\\d{6,8}\\s*[.。]?\\s*[X\\d])", CI);
    private static final Pattern PATENT_NUMBER_COMPACT = Pattern.compile("专利号[:\\s]*((?:ZL|zl)\\d{9,15}[.X\\d]?)", CI);
    private static final Pattern PATENT_NUMBER_OCR = Pattern.compile("专利号[：:\\s]*((?:ZL|zl)\\d{4,6}\\d{5,8}[.X\\d]?)", CI);
    private static final Pattern PATENT_NUMBER_SEGMENTS = Pattern.compile("(?:ZL|zl)\\s*(\\d{4})\\s*(\\d)\\s*(\\d{6,8})\\s*[.。]?\\s*([X\\d])", CI);

    private static final Pattern GRANT_NUMBER = Pattern.compile("授\\s*权\\s*公\\s*告\\s*号[：:\\s]*((?:CN|cn)[\\s\\d]+[A-Za-z]?)", CI);
    private static final Pattern GRANT_NUMBER_COMPACT = Pattern.compile("授权公告号[:\\s]*([A-Z]{2}\\d+[A-Z]?)", CI);

    private static final String DATE = "(\\d{4}[年\\-/.]\\s*\\d{1,2}[月\\-/.]\\s*\\d{1,2}\\s*日?)";
    private static final Pattern APPLICATION_DATE = Pattern.compile("(?:专\\s*利\\s*)?申\\s*请\\s*日[：:\\s]*" + DATE);
    private static final Pattern GRANT_DATE = Pattern.compile("授\\s*权\\s*公?\\s*告?\\s*日[：:\\s]*" + DATE);

    private static final Pattern INVENTION_TITLE = Pattern.compile(
            "(?:发\\s*明\\s*名\\s*称|专\\s*利\\s*名\\s*称)[：:\\s]*([^\\n]+?)(?=\\n专|\\n发|\\n地|\\n申)", Pattern.DOTALL);

    private static final Pattern PATENTEE = Pattern.compile("专\\s*利\\s*权\\s*人[：:\\s]*([^\\n]+?)(?=\\n|地\\s*址|$)", CI_DOTALL);
    private static final Pattern PATENTEE_APPLICANT = Pattern.compile("申请日时申请人[：:\\s]*([^\\n]+?)(?=\\n|申请日时发明人|$)", CI_DOTALL);

    private static final Pattern INVENTORS = Pattern.compile(
            "发\\s*明\\s*人[：:\\s]*([^专地授国]+?)(?=专\\s*利|地\\s*址|授\\s*权|国家知识|申请日时申请人|$)", CI_DOTALL);
    private static final Pattern INVENTORS_APPLICANT = Pattern.compile(
            "申请日时发明人[：:\\s]*([^国专地]+?)(?=国家知识|专利权|地址|$)", CI_DOTALL);
    private static final Pattern NAME_LIST = Pattern.compile("[：:]\\s*([^;；\\n]{1,15}(?:[;；][^;；\\n]{1,15})+)");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NAME_SEPARATORS = Pattern.compile("[,，、]+");
    private static final Pattern LIST_SEPARATORS = Pattern.compile("[;；]");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final int MAX_TITLE_LENGTH = 200;
    private static final int MAX_INVENTORS_LENGTH = 500;
    private static final int MAX_PATENTEE_LENGTH = 200;
    private static final int MIN_PATENT_NUMBER_DIGITS = 8;

    private static final PatternCascade<String> PATENT_NUMBER_CASCADE = PatternCascade.of("patent_number",
            PatternCascade.firstGroup(PATENT_NUMBER, PatentFieldExtractor::normalizePatentNumber),
            PatternCascade.firstGroup(PATENT_NUMBER_BARE, PatentFieldExtractor::normalizePatentNumber),
            PatternCascade.firstGroup(PATENT_NUMBER_COMPACT, PatentFieldExtractor::normalizePatentNumber),
            PatternCascade.firstGroup(PATENT_NUMBER_OCR, PatentFieldExtractor::normalizePatentNumber),
            PatentFieldExtractor::patentNumberFromSegments);

    private static final PatternCascade<String> GRANT_NUMBER_CASCADE = PatternCascade.of("grant_number",
            PatternCascade.firstGroup(GRANT_NUMBER, PatentFieldExtractor::compactUpper),
            PatternCascade.firstGroup(GRANT_NUMBER_COMPACT, PatentFieldExtractor::compactUpper));

    private static final PatternCascade<String> TITLE_CASCADE = PatternCascade.of("title",
            PatternCascade.firstGroup(INVENTION_TITLE, value -> StringUtils.left(StrUtil.cleanBlank(value), MAX_TITLE_LENGTH)));

    private static final PatternCascade<String> INVENTORS_CASCADE = PatternCascade.of("inventors",
            PatternCascade.firstGroup(INVENTORS, PatentFieldExtractor::normalizeInventors),
            PatternCascade.firstGroup(INVENTORS_APPLICANT, PatentFieldExtractor::normalizeInventors),
            PatentFieldExtractor::inventorsFromNameList);

    private static final PatternCascade<String> PATENTEE_CASCADE = PatternCascade.of("patentee",
            PatternCascade.firstGroup(PATENTEE, PatentFieldExtractor::normalizePatentee),
            PatternCascade.firstGroup(PATENTEE_APPLICANT, PatentFieldExtractor::normalizePatentee));

    private PatentFieldExtractor() {
    }

    public static PatentFields extract(String text) {
        PatentFields fields = new PatentFields();
        if (StrUtil.isBlank(text)) {
            return fields;
        }
        fields.setPatentNumber(PATENT_NUMBER_CASCADE.apply(text).orElse(null));
        fields.setGrantNumber(GRANT_NUMBER_CASCADE.apply(text).orElse(null));
        fields.setTitle(TITLE_CASCADE.apply(text).orElse(null));
        fields.setInventors(INVENTORS_CASCADE.apply(text).orElse(null));
        fields.setPatentee(PATENTEE_CASCADE.apply(text).orElse(null));
        fields.setApplicationDate(PatternCascade.firstGroup(APPLICATION_DATE, StrUtil::cleanBlank).apply(text).orElse(null));
        fields.setGrantDate(PatternCascade.firstGroup(GRANT_DATE, StrUtil::cleanBlank).apply(text).orElse(null));
        fields.setPatentType(detectPatentType(text));
        log.info("专利字段抽取完成: patentNumber={}, title={}, 缺失={}",
                fields.getPatentNumber(), fields.getTitle(), fields.missingFields());
        return fields;
    }

    /**
     * 大写、去空白和中文句号；无小数点且长度不小于 14 时在校验位前补 "."
     */
    public static String normalizePatentNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String pn = raw.toUpperCase(Locale.ROOT).replaceAll("[\\s。]+", "");
        if (countDigits(pn) < MIN_PATENT_NUMBER_DIGITS) {
            return null;
        }
        if (!pn.contains(".") && pn.length() >= 14) {
            pn = pn.substring(0, pn.length() - 1) + "." + pn.substring(pn.length() - 1);
        }
        return pn;
    }

    static Optional<String> patentNumberFromSegments(String text) {
        Matcher matcher = PATENT_NUMBER_SEGMENTS.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of("ZL" + matcher.group(1) + matcher.group(2) + matcher.group(3) + "."
                + matcher.group(4).toUpperCase(Locale.ROOT));
    }

    static String normalizeInventors(String raw) {
        String inventors = WHITESPACE.matcher(raw).replaceAll("");
        inventors = NAME_SEPARATORS.matcher(inventors).replaceAll(";");
        inventors = StringUtils.strip(inventors, ";");
        if (inventors.length() <= 1) {
            return null;
        }
        return StringUtils.left(inventors, MAX_INVENTORS_LENGTH);
    }

    /**
     * 字段名乱码时的兜底：冒号后紧跟分号分隔的短名字列表
     */
    static Optional<String> inventorsFromNameList(String text) {
        Matcher matcher = NAME_LIST.matcher(text);
        while (matcher.find()) {
            String inventors = WHITESPACE.matcher(matcher.group(1)).replaceAll("");
            String[] parts = LIST_SEPARATORS.split(inventors);
            if (parts.length < 2) {
                continue;
            }
            boolean plausible = true;
            for (String part : parts) {
                if (part.length() > 15) {
                    plausible = false;
                    break;
                }
            }
            if (plausible) {
                return Optional.of(StringUtils.left(inventors, MAX_INVENTORS_LENGTH));
            }
        }
        return Optional.empty();
    }

    private static String normalizePatentee(String raw) {
        return StringUtils.left(WHITESPACE.matcher(raw).replaceAll(""), MAX_PATENTEE_LENGTH);
    }

    private static String compactUpper(String raw) {
        return WHITESPACE.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    static String detectPatentType(String text) {
        if (text.contains("实用新型")) {
            return "实用新型";
        }
        if (text.contains("外观设计")) {
            return "外观设计";
        }
        return PatentFields.DEFAULT_TYPE;
    }

    private static int countDigits(String value) {
        int count = 0;
        Matcher matcher = DIGIT.matcher(value);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
