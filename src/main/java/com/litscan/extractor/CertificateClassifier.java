package com.litscan.extractor;

import com.litscan.model.enums.CertificateKind;

import java.util.List;

/**
 * 按字段名关键词判断证书类别，专利优先
 *
 * @author litscan
 */
public final class CertificateClassifier {

    private static final List<String> PATENT_MARKERS = List.of(
            "专利号", "发明名称", "发明人", "专利权人", "申请日", "授权公告日", "ZL");

    private static final List<String> SOFTWARE_MARKERS = List.of(
            "软件名称", "登记号", "著作权人", "开发完成日期", "SR", "软著");

    private static final int MIN_MARKERS = 3;

    private CertificateClassifier() {
    }

    public static CertificateKind classify(String text) {
        if (text == null || text.isEmpty()) {
            return CertificateKind.NEITHER;
        }
        if (countMarkers(text, PATENT_MARKERS) >= MIN_MARKERS) {
            return CertificateKind.PATENT;
        }
        if (countMarkers(text, SOFTWARE_MARKERS) >= MIN_MARKERS) {
            return CertificateKind.SOFTWARE;
        }
        return CertificateKind.NEITHER;
    }

    static int countMarkers(String text, List<String> markers) {
        int count = 0;
        for (String marker : markers) {
            if (text.contains(marker)) {
                count++;
            }
        }
        return count;
    }
}
