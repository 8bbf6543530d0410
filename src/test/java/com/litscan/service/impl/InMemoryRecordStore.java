package com.litscan.service.impl;

import com.litscan.model.dto.SourceFile;
import com.litscan.model.entity.PaperDO;
import com.litscan.model.entity.PatentDO;
import com.litscan.model.entity.PdfFileDO;
import com.litscan.model.entity.SoftwareDO;
import com.litscan.model.enums.ProcessingStatus;
import com.litscan.service.RecordStore;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 内存版记录存储，写入语义与 {@link MybatisRecordStore} 一致
 *
 * @author litscan
 */
class InMemoryRecordStore implements RecordStore {

    private final Map<Long, PdfFileDO> pdfFiles = new LinkedHashMap<>();
    private final Map<Long, PaperDO> papers = new HashMap<>();
    /**
     * pdfFileId -> paperId
     */
    private final Map<Long, Long> links = new HashMap<>();
    private final Map<String, PatentDO> patents = new HashMap<>();
    private final Map<String, SoftwareDO> softwares = new HashMap<>();
    private long nextId = 1;

    @Override
    public Optional<PdfFileDO> findPdfFileByPath(String relativePath) {
        return pdfFiles.values().stream().filter(f -> f.getPath().equals(relativePath)).findFirst();
    }

    @Override
    public Optional<PdfFileDO> getByContentHash(String sha256) {
        return pdfFiles.values().stream().filter(f -> sha256.equals(f.getSha256())).findFirst();
    }

    @Override
    public Optional<PdfFileDO> getPdfFile(Long pdfFileId) {
        return Optional.ofNullable(pdfFiles.get(pdfFileId));
    }

    @Override
    public boolean hasLinkedPaper(Long pdfFileId) {
        return links.containsKey(pdfFileId);
    }

    @Override
    public Optional<PaperDO> findPaperByPdfFile(Long pdfFileId) {
        return Optional.ofNullable(links.get(pdfFileId)).map(papers::get);
    }

    @Override
    public Long upsertPdfFile(SourceFile file, ProcessingStatus status, String error) {
        PdfFileDO record = findPdfFileByPath(file.getRelativePath()).orElseGet(() -> {
            PdfFileDO created = PdfFileDO.builder().id(nextId++).path(file.getRelativePath()).build();
            pdfFiles.put(created.getId(), created);
            return created;
        });
        record.setFilename(file.getFilename());
        record.setSha256(file.getSha256());
        record.setSize(file.getSize());
        record.setMtime(file.getMtime());
        record.setParseStatus(status.getValue());
        record.setParseError(error);
        return record.getId();
    }

    @Override
    public Long markPending(SourceFile file) {
        Optional<PdfFileDO> existing = findPdfFileByPath(file.getRelativePath());
        if (existing.isEmpty()) {
            return upsertPdfFile(file, ProcessingStatus.PENDING, null);
        }
        existing.get().setParseStatus(ProcessingStatus.PENDING.getValue());
        existing.get().setParseError(null);
        return existing.get().getId();
    }

    @Override
    public Long upsertPaper(PaperDO paper) {
        if (paper.getDoi() != null) {
            papers.values().stream()
                    .filter(p -> paper.getDoi().equals(p.getDoi()))
                    .findFirst()
                    .ifPresent(p -> paper.setId(p.getId()));
        }
        if (paper.getId() == null || !papers.containsKey(paper.getId())) {
            paper.setId(nextId++);
        }
        papers.put(paper.getId(), paper);
        return paper.getId();
    }

    @Override
    public void linkPaper(Long paperId, Long pdfFileId) {
        links.put(pdfFileId, paperId);
    }

    @Override
    public void setStatus(Long pdfFileId, ProcessingStatus status, String error) {
        PdfFileDO record = pdfFiles.get(pdfFileId);
        record.setParseStatus(status.getValue());
        record.setParseError(error);
    }

    @Override
    public Long savePaperOutcome(SourceFile file, PaperDO paper, ProcessingStatus status, String error) {
        Long pdfFileId = upsertPdfFile(file, status, error);
        linkPaper(upsertPaper(paper), pdfFileId);
        return pdfFileId;
    }

    @Override
    public Long recordFailure(SourceFile file, String error) {
        Long pdfFileId = upsertPdfFile(file, ProcessingStatus.FAILED, error);
        links.remove(pdfFileId);
        return pdfFileId;
    }

    @Override
    public boolean hasLinkedPatent(String filePath) {
        return patents.containsKey(filePath);
    }

    @Override
    public boolean hasLinkedSoftware(String filePath) {
        return softwares.containsKey(filePath);
    }

    @Override
    public Long upsertPatent(PatentDO patent) {
        patent.setId(nextId++);
        patents.put(patent.getFilePath(), patent);
        return patent.getId();
    }

    @Override
    public Long upsertSoftware(SoftwareDO software) {
        software.setId(nextId++);
        softwares.put(software.getFilePath(), software);
        return software.getId();
    }
}
