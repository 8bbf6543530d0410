package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 专利号格式校验
 *
 * <p>标准格式: ZL + 4位年份 + 1位类型 + 7位序号 + . + 1位校验位，例如 ZL202211551727.X</p>
 *
 * @author litscan
 */
public final class PatentNumberValidator {

    private static final Pattern CANONICAL = Pattern.compile("^ZL\\d{4}[1-9]\\d{6,7}[.][X\\d]$");
    private static final int CANONICAL_LENGTH = 16;

    private PatentNumberValidator() {
    }

    public static Result validate(String patentNumber) {
        if (StrUtil.isBlank(patentNumber)) {
            return Result.invalid("专利号不能为空");
        }
        String pn = patentNumber.trim().toUpperCase(Locale.ROOT);
        if (!pn.startsWith("ZL")) {
            return Result.invalid("专利号必须以'ZL'开头");
        }
        pn = StrUtil.cleanBlank(pn);
        if (pn.length() != CANONICAL_LENGTH) {
            return Result.invalid("专利号必须为16位，当前: " + pn.length() + "位");
        }
        if (!CANONICAL.matcher(pn).matches()) {
            return Result.invalid("专利号格式不正确，请检查: ZL202211551727.X");
        }
        return Result.VALID;
    }

    @Getter
    @AllArgsConstructor
    public static class Result {

        static final Result VALID = new Result(true, "");

        private final boolean valid;

        /**
         * 不合法时的原因，合法时为空串
         */
        private final String reason;

        static Result invalid(String reason) {
            return new Result(false, reason);
        }
    }
}
