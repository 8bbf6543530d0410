package com.litscan.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.litscan.config.LitScanProperties;
import com.litscan.service.OcrService;
import com.litscan.service.PdfDocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import top.continew.starter.core.exception.BusinessException;

import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PaddleOcrServiceImplTest {

    private static final String OCR_URL = "http://ocr.local/layout-parsing";

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private PdfDocumentService pdfDocumentService;
    private LitScanProperties properties;
    private PaddleOcrServiceImpl ocrService;
    private Path image;

    @BeforeEach
    void setUp() throws Exception {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        pdfDocumentService = mock(PdfDocumentService.class);
        properties = new LitScanProperties();
        properties.getOcr().setUrl(OCR_URL);
        properties.getOcr().setKey("secret");
        ocrService = new PaddleOcrServiceImpl(restTemplate, pdfDocumentService, properties, new ObjectMapper());
        image = Files.write(tempDir.resolve("scan.png"), new byte[]{1, 2, 3});
    }

    @Test
    void recognize_shouldPostBase64ImageAndJoinTexts() {
        server.expect(requestTo(OCR_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "token secret"))
                .andExpect(jsonPath("$.file").value("AQID"))
                .andExpect(jsonPath("$.fileType").value(1))
                .andRespond(withSuccess("""
                        {"result":{"layoutParsingResults":[
                          {"markdown":{"text":"Hello"}},
                          {"markdown":{"text":""}},
                          {"markdown":{"text":"World"}}]}}
                        """, MediaType.APPLICATION_JSON));

        assertThat(ocrService.recognize(image, 0)).isEqualTo("Hello\n\nWorld");
        server.verify();
    }

    @Test
    void recognize_shouldRenderPdfPages() {
        Path pdf = tempDir.resolve("paper.pdf");
        when(pdfDocumentService.renderPageAsPng(eq(pdf), eq(0), anyFloat())).thenReturn(new byte[]{1, 2, 3});
        server.expect(requestTo(OCR_URL))
                .andExpect(jsonPath("$.file").value("AQID"))
                .andRespond(withSuccess("{\"result\":{\"layoutParsingResults\":[{\"markdown\":{\"text\":\"Page\"}}]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(ocrService.recognize(pdf, 0)).isEqualTo("Page");
        server.verify();
    }

    @Test
    void recognize_shouldWarnWhenNoTextFound() {
        server.expect(requestTo(OCR_URL))
                .andRespond(withSuccess("{\"result\":{\"layoutParsingResults\":[]}}", MediaType.APPLICATION_JSON));

        String text = ocrService.recognize(image, 0);

        assertThat(text).isEqualTo("[OCR Warning] 未识别到文本");
        assertThat(OcrService.isUsableText(text)).isFalse();
    }

    @Test
    void recognize_shouldReportHttpErrors() {
        server.expect(requestTo(OCR_URL)).andRespond(withServerError().body("boom"));

        String text = ocrService.recognize(image, 0);

        assertThat(text).isEqualTo("[OCR Error] HTTP 500: boom");
        assertThat(OcrService.isErrorText(text)).isTrue();
    }

    @Test
    void recognize_shouldReportTimeouts() {
        server.expect(requestTo(OCR_URL)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThat(ocrService.recognize(image, 0)).isEqualTo("[OCR Error] 请求超时 (60秒)");
    }

    @Test
    void recognize_shouldReportPageOutOfRange() {
        Path pdf = tempDir.resolve("short.pdf");
        when(pdfDocumentService.renderPageAsPng(eq(pdf), anyInt(), anyFloat()))
                .thenThrow(new BusinessException("页码超出范围 (共 1 页)"));

        assertThat(ocrService.recognize(pdf, 3)).isEqualTo("[OCR Error] 页码超出范围 (共 1 页)");
        server.verify();
    }

    @Test
    void recognize_shouldRefuseWhenNotConfigured() {
        properties.getOcr().setKey("");

        assertThat(ocrService.isConfigured()).isFalse();
        assertThat(ocrService.recognize(image, 0)).startsWith(OcrService.ERROR_PREFIX);
        server.verify();
    }

    @Test
    void reconfigure_shouldTakeEffectOnNextCall() {
        properties.getOcr().setUrl("");
        ocrService.reconfigure(OCR_URL, "secret");

        assertThat(ocrService.isConfigured()).isTrue();
    }

    @Test
    void recognize_shouldReturnErrorTextForUrlWithoutScheme() {
        PaddleOcrServiceImpl service = new PaddleOcrServiceImpl(new RestTemplate(), pdfDocumentService, properties, new ObjectMapper());
        service.reconfigure("ocr.example.com/layout-parsing", "secret");

        String text = service.recognize(image, 0);

        assertThat(text).startsWith(OcrService.ERROR_PREFIX);
    }

    @Test
    void parseResponse_shouldHandleErrorAndUnknownShapes() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(ocrService.parseResponse(mapper.readTree("{\"error\":\"quota exceeded\"}")))
                .isEqualTo("[OCR Error] quota exceeded");
        assertThat(ocrService.parseResponse(mapper.readTree("{\"other\":1}")))
                .isEqualTo("[OCR Result] {\"other\":1}");
    }
}
