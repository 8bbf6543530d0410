package com.litscan.service.impl;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.conditions.Wrapper;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.TableInfoHelper;
import com.litscan.mapper.PaperFileMapper;
import com.litscan.mapper.PaperMapper;
import com.litscan.mapper.PatentMapper;
import com.litscan.mapper.PdfFileMapper;
import com.litscan.mapper.SoftwareMapper;
import com.litscan.model.dto.SourceFile;
import com.litscan.model.entity.PaperFileDO;
import com.litscan.model.entity.PdfFileDO;
import org.apache.ibatis.builder.MapperBuilderAssistant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MybatisRecordStoreTest {

    private PdfFileMapper pdfFileMapper;
    private PaperFileMapper paperFileMapper;
    private MybatisRecordStore store;
    private SourceFile source;

    @BeforeAll
    static void initTableInfo() {
        MapperBuilderAssistant assistant = new MapperBuilderAssistant(new MybatisConfiguration(), "");
        TableInfoHelper.initTableInfo(assistant, PdfFileDO.class);
        TableInfoHelper.initTableInfo(assistant, PaperFileDO.class);
    }

    @BeforeEach
    void setUp() {
        pdfFileMapper = mock(PdfFileMapper.class);
        paperFileMapper = mock(PaperFileMapper.class);
        store = new MybatisRecordStore(pdfFileMapper, mock(PaperMapper.class), paperFileMapper,
                mock(PatentMapper.class), mock(SoftwareMapper.class));
        source = SourceFile.builder()
                .absolutePath(Path.of("/library/papers/smith2020.pdf"))
                .relativePath("papers/smith2020.pdf")
                .filename("smith2020.pdf")
                .sha256("sha-v2")
                .size(10L)
                .mtime(1L)
                .build();
    }

    @SuppressWarnings("unchecked")
    private LambdaUpdateWrapper<PdfFileDO> captureUpdate() {
        ArgumentCaptor<Wrapper<PdfFileDO>> captor = ArgumentCaptor.forClass(Wrapper.class);
        verify(pdfFileMapper).update(isNull(), captor.capture());
        return (LambdaUpdateWrapper<PdfFileDO>) captor.getValue();
    }

    private void givenExistingRecord() {
        when(pdfFileMapper.selectOne(any())).thenReturn(PdfFileDO.builder()
                .id(1L)
                .path("papers/smith2020.pdf")
                .sha256("sha-v1")
                .parseStatus("success")
                .build());
    }

    @Test
    void markPending_shouldKeepStoredHashOfExistingRecord() {
        givenExistingRecord();

        assertThat(store.markPending(source)).isEqualTo(1L);

        String sqlSet = captureUpdate().getSqlSet();
        assertThat(sqlSet).contains("parse_status").contains("parse_error");
        assertThat(sqlSet).doesNotContain("sha256");
        verify(pdfFileMapper, never()).insert(any(PdfFileDO.class));
    }

    @Test
    void markPending_shouldInsertUnknownFile() {
        ArgumentCaptor<PdfFileDO> inserted = ArgumentCaptor.forClass(PdfFileDO.class);

        store.markPending(source);

        verify(pdfFileMapper).insert(inserted.capture());
        assertThat(inserted.getValue().getParseStatus()).isEqualTo("pending");
        assertThat(inserted.getValue().getSha256()).isEqualTo("sha-v2");
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordFailure_shouldStoreNewHashAndDropPaperLink() {
        givenExistingRecord();
        when(paperFileMapper.delete(ArgumentMatchers.<Wrapper<PaperFileDO>>any())).thenReturn(1);

        assertThat(store.recordFailure(source, "damaged xref table")).isEqualTo(1L);

        String sqlSet = captureUpdate().getSqlSet();
        assertThat(sqlSet).contains("sha256").contains("parse_status").contains("parse_error");
        ArgumentCaptor<Wrapper<PaperFileDO>> unlink = ArgumentCaptor.forClass(Wrapper.class);
        verify(paperFileMapper).delete(unlink.capture());
        LambdaQueryWrapper<PaperFileDO> condition = (LambdaQueryWrapper<PaperFileDO>) unlink.getValue();
        assertThat(condition.getSqlSegment()).contains("pdf_file_id");
        assertThat(condition.getParamNameValuePairs()).containsValue(1L);
    }

    @Test
    void recordFailure_shouldRunInOneTransaction() throws NoSuchMethodException {
        assertThat(MybatisRecordStore.class.getMethod("recordFailure", SourceFile.class, String.class)
                .isAnnotationPresent(Transactional.class)).isTrue();
    }
}
