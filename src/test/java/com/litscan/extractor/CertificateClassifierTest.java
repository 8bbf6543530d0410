package com.litscan.extractor;

import com.litscan.model.enums.CertificateKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CertificateClassifierTest {

    @Test
    void classify_shouldRecognizePatentCertificate() {
        assertThat(CertificateClassifier.classify(PatentFieldExtractorTest.PATENT_CERTIFICATE))
                .isEqualTo(CertificateKind.PATENT);
    }

    @Test
    void classify_shouldRecognizeSoftwareCertificate() {
        assertThat(CertificateClassifier.classify(SoftwareFieldExtractorTest.SOFTWARE_CERTIFICATE))
                .isEqualTo(CertificateKind.SOFTWARE);
    }

    @Test
    void classify_shouldPreferPatentWhenBothQualify() {
        String text = "专利号 发明名称 专利权人 软件名称 登记号 著作权人";
        assertThat(CertificateClassifier.classify(text)).isEqualTo(CertificateKind.PATENT);
    }

    @Test
    void classify_shouldRequireThreeMarkers() {
        assertThat(CertificateClassifier.classify("专利号 发明人")).isEqualTo(CertificateKind.NEITHER);
        assertThat(CertificateClassifier.classify("")).isEqualTo(CertificateKind.NEITHER);
        assertThat(CertificateClassifier.classify(null)).isEqualTo(CertificateKind.NEITHER);
    }

    @Test
    void countMarkers_shouldCountDistinctMarkers() {
        assertThat(CertificateClassifier.countMarkers("SR SR 软著", List.of("SR", "软著", "登记号"))).isEqualTo(2);
    }
}
