package com.litscan.service.impl;

import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CertificateExtraction;
import com.litscan.model.dto.RawDocument;
import com.litscan.model.enums.CertificateKind;
import com.litscan.model.enums.ExtractionMethod;
import com.litscan.service.DocumentParserService;
import com.litscan.service.OcrService;
import com.litscan.service.PdfDocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CertificateExtractionServiceImplTest {

    private static final String PATENT_CERTIFICATE = """
            发明专利证书
            发明名称：一种文献元数据自动抽取方法
            发 明 人：张三、李四
            专 利 号：ZL 2022 1 1551727.2
            专利申请日：2022年12月15日
            专利权人：某某大学
            地址：北京市海淀区
            授权公告日：2023年06月30日
            授权公告号：CN 115757890 B
            国家知识产权局
            """;

    private static final String SOFTWARE_CERTIFICATE = """
            计算机软件著作权登记证书
            软件名称：文献智能管理系统V1.0
            著作权人：某某科技有限公司
            开发完成日期：2023年03月15日
            登记号：2023SR0123456
            """;

    private static final String SPARSE_PATENT_TEXT = "发明名称：一种文献管理方法\n专利权人：某某大学\n专利号 ZL";

    private PdfDocumentService pdfDocumentService;
    private DocumentParserService documentParserService;
    private OcrService ocrService;
    private CertificateExtractionServiceImpl service;

    @BeforeEach
    void setUp() {
        pdfDocumentService = mock(PdfDocumentService.class);
        documentParserService = mock(DocumentParserService.class);
        ocrService = mock(OcrService.class);
        service = new CertificateExtractionServiceImpl(pdfDocumentService, documentParserService, ocrService,
                new LitScanProperties());
    }

    private void givenPdfText(Path path, String text) {
        when(pdfDocumentService.load(path, 2)).thenReturn(RawDocument.builder()
                .path(path)
                .pageCount(1)
                .pageText(text)
                .build());
    }

    @Test
    void extractFromText_shouldFillOnlyMissingFieldsWithOneOcrCall() {
        Path path = Paths.get("certs/专利证书.pdf");
        when(ocrService.recognize(path, 0)).thenReturn(PATENT_CERTIFICATE);

        CertificateExtraction extraction = service.extractFromText(SPARSE_PATENT_TEXT, ExtractionMethod.PDF_TEXT, path);

        assertThat(extraction.getKind()).isEqualTo(CertificateKind.PATENT);
        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.PDF_OCR);
        assertThat(extraction.getOcrFilledFields())
                .containsExactly("patent_number", "inventors", "grant_number", "application_date", "grant_date");
        assertThat(extraction.getPatentFields().getTitle()).isEqualTo("一种文献管理方法");
        assertThat(extraction.getPatentFields().getPatentNumber()).isEqualTo("ZL202211551727.2");
        assertThat(extraction.getPatentFields().isComplete()).isTrue();
        verify(ocrService, times(1)).recognize(path, 0);
    }

    @Test
    void extractFromText_shouldKeepTextLayerWhenOcrFails() {
        Path path = Paths.get("certs/专利证书.pdf");
        when(ocrService.recognize(path, 0)).thenReturn("[OCR Error] HTTP 500: boom");

        CertificateExtraction extraction = service.extractFromText(SPARSE_PATENT_TEXT, ExtractionMethod.PDF_TEXT, path);

        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.PDF_TEXT);
        assertThat(extraction.getOcrFilledFields()).isEmpty();
        assertThat(extraction.getPatentFields().getPatentNumber()).isNull();
    }

    @Test
    void extractFromText_shouldNotRemedyOcrResults() {
        CertificateExtraction extraction = service.extractFromText(SPARSE_PATENT_TEXT, ExtractionMethod.OCR,
                Paths.get("certs/专利.png"));

        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.OCR);
        verifyNoInteractions(ocrService);
    }

    @Test
    void extractFromText_shouldReturnNeitherWithoutFields() {
        CertificateExtraction extraction = service.extractFromText("会议通知\n请各位老师准时参加", ExtractionMethod.PDF_TEXT,
                Paths.get("certs/通知.pdf"));

        assertThat(extraction.getKind()).isEqualTo(CertificateKind.NEITHER);
        assertThat(extraction.getFields()).isNull();
        assertThat(extraction.getOcrFilledFields()).isEmpty();
        verifyNoInteractions(ocrService);
    }

    @Test
    void extract_shouldUseTextLayerOfCompletePdf() {
        Path path = Paths.get("certs/专利证书.pdf");
        givenPdfText(path, PATENT_CERTIFICATE);

        CertificateExtraction extraction = service.extract(path);

        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.PDF_TEXT);
        assertThat(extraction.getPatentFields().getGrantNumber()).isEqualTo("CN115757890B");
        verifyNoInteractions(ocrService);
    }

    @Test
    void extract_shouldSwitchToOcrForShortPdfText() {
        Path path = Paths.get("certs/扫描件.PDF");
        givenPdfText(path, "专利");
        when(ocrService.recognize(path, 0)).thenReturn(PATENT_CERTIFICATE);

        CertificateExtraction extraction = service.extract(path);

        assertThat(extraction.getKind()).isEqualTo(CertificateKind.PATENT);
        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.OCR);
        assertThat(extraction.getPatentFields().getInventors()).isEqualTo("张三;李四");
    }

    @Test
    void extract_shouldRecognizeImagesWithOcr() {
        Path path = Paths.get("certs/软著.JPG");
        when(ocrService.recognize(path, 0)).thenReturn(SOFTWARE_CERTIFICATE);

        CertificateExtraction extraction = service.extract(path);

        assertThat(extraction.getKind()).isEqualTo(CertificateKind.SOFTWARE);
        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.OCR);
        assertThat(extraction.getSoftwareFields().getRegistrationNumber()).isEqualTo("2023SR0123456");
        verifyNoInteractions(pdfDocumentService);
    }

    @Test
    void extract_shouldTreatOcrSentinelOfImageAsEmptyText() {
        Path path = Paths.get("certs/软著.png");
        when(ocrService.recognize(path, 0)).thenReturn("[OCR Warning] 未识别到文本");

        CertificateExtraction extraction = service.extract(path);

        assertThat(extraction.getKind()).isEqualTo(CertificateKind.NEITHER);
        assertThat(extraction.getRawText()).isEmpty();
    }

    @Test
    void extract_shouldParseOtherFormatsAsText() {
        Path path = Paths.get("certs/软著登记.docx");
        when(documentParserService.parseFile(path)).thenReturn(SOFTWARE_CERTIFICATE);

        CertificateExtraction extraction = service.extract(path);

        assertThat(extraction.getExtractionMethod()).isEqualTo(ExtractionMethod.TEXT_FILE);
        assertThat(extraction.getSoftwareFields().getSoftwareName()).isEqualTo("文献智能管理系统");
        verify(ocrService, never()).recognize(any(), anyInt());
    }
}
