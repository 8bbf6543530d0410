package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;
import com.litscan.model.dto.SoftwareFields;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 计算机软件著作权登记证书字段抽取
 *
 * @author litscan
 */
@Slf4j
public final class SoftwareFieldExtractor {

    private static final Pattern SOFTWARE_NAME = Pattern.compile("软\\s*件\\s*名\\s*称[：:\\s]*([^\\n]+?)(?=\\n|简称|V\\d|著)", Pattern.DOTALL);
    private static final Pattern SOFTWARE_NAME_LINE = Pattern.compile("软件名称[：:\\s]*([^\\n;；]+)", Pattern.DOTALL);
    private static final Pattern VERSION = Pattern.compile("[Vv][\\d.]+(?:\\.\\d+)?(?:版)?");
    private static final Pattern REGISTRATION_NUMBER = Pattern.compile("登\\s*记\\s*号[：:\\s]*(\\d{4}SR\\d+)");
    private static final Pattern REGISTRATION_NUMBER_BARE = Pattern.compile("(\\d{4}SR\\d+)");
    private static final Pattern COPYRIGHT_HOLDER = Pattern.compile("著\\s*作\\s*权\\s*人[：:\\s]*([^\\n]+?)(?=\\n|开发|首次)", Pattern.DOTALL);
    private static final Pattern COPYRIGHT_HOLDER_LINE = Pattern.compile("著作权人[：:\\s]*([^\\n;；]+)", Pattern.DOTALL);
    private static final Pattern DEVELOPMENT_DATE = Pattern.compile(
            "开\\s*发\\s*完\\s*成\\s*日\\s*期[：:\\s]*(\\d{4}[年\\-/.]\\s*\\d{1,2}[月\\-/.]\\s*\\d{1,2}\\s*日?)");

    private static final PatternCascade<String> NAME_CASCADE = PatternCascade.of("software_name",
            PatternCascade.firstGroup(SOFTWARE_NAME, StrUtil::cleanBlank),
            PatternCascade.firstGroup(SOFTWARE_NAME_LINE, StrUtil::cleanBlank));

    private static final PatternCascade<String> REGISTRATION_CASCADE = PatternCascade.of("registration_number",
            PatternCascade.firstGroup(REGISTRATION_NUMBER),
            PatternCascade.firstGroup(REGISTRATION_NUMBER_BARE));

    private static final PatternCascade<String> HOLDER_CASCADE = PatternCascade.of("copyright_holder",
            PatternCascade.firstGroup(COPYRIGHT_HOLDER, StrUtil::cleanBlank),
            PatternCascade.firstGroup(COPYRIGHT_HOLDER_LINE, StrUtil::cleanBlank));

    private SoftwareFieldExtractor() {
    }

    public static SoftwareFields extract(String text) {
        SoftwareFields fields = new SoftwareFields();
        if (StrUtil.isBlank(text)) {
            return fields;
        }
        Optional<String> name = NAME_CASCADE.apply(text);
        if (name.isPresent()) {
            String softwareName = name.get();
            // 版本号只在识别出软件名称时提取，并从名称中去掉
            Matcher version = VERSION.matcher(text);
            if (version.find()) {
                fields.setVersion(version.group());
                softwareName = VERSION.matcher(softwareName).replaceAll("").trim();
            }
            fields.setSoftwareName(StrUtil.emptyToNull(softwareName));
        }
        fields.setRegistrationNumber(REGISTRATION_CASCADE.apply(text).orElse(null));
        fields.setCopyrightHolder(HOLDER_CASCADE.apply(text).orElse(null));
        fields.setDevelopmentDate(PatternCascade.firstGroup(DEVELOPMENT_DATE, StrUtil::cleanBlank).apply(text).orElse(null));
        log.info("软著字段抽取完成: name={}, registrationNumber={}, 缺失={}",
                fields.getSoftwareName(), fields.getRegistrationNumber(), fields.missingFields());
        return fields;
    }
}
