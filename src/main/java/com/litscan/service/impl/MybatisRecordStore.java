package com.litscan.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.litscan.mapper.PaperFileMapper;
import com.litscan.mapper.PaperMapper;
import com.litscan.mapper.PatentMapper;
import com.litscan.mapper.PdfFileMapper;
import com.litscan.mapper.SoftwareMapper;
import com.litscan.model.dto.SourceFile;
import com.litscan.model.entity.PaperDO;
import com.litscan.model.entity.PaperFileDO;
import com.litscan.model.entity.PatentDO;
import com.litscan.model.entity.PdfFileDO;
import com.litscan.model.entity.SoftwareDO;
import com.litscan.model.enums.ProcessingStatus;
import com.litscan.service.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 基于 MyBatis-Plus 的记录存储
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MybatisRecordStore implements RecordStore {

    private final PdfFileMapper pdfFileMapper;
    private final PaperMapper paperMapper;
    private final PaperFileMapper paperFileMapper;
    private final PatentMapper patentMapper;
    private final SoftwareMapper softwareMapper;

    @Override
    public Optional<PdfFileDO> findPdfFileByPath(String relativePath) {
        return Optional.ofNullable(pdfFileMapper.selectOne(
                new LambdaQueryWrapper<PdfFileDO>().eq(PdfFileDO::getPath, relativePath)));
    }

    @Override
    public Optional<PdfFileDO> getByContentHash(String sha256) {
        return Optional.ofNullable(pdfFileMapper.selectOne(
                new LambdaQueryWrapper<PdfFileDO>()
                        .eq(PdfFileDO::getSha256, sha256)
                        .orderByAsc(PdfFileDO::getId)
                        .last("LIMIT 1")));
    }

    @Override
    public Optional<PdfFileDO> getPdfFile(Long pdfFileId) {
        return Optional.ofNullable(pdfFileMapper.selectById(pdfFileId));
    }

    @Override
    public boolean hasLinkedPaper(Long pdfFileId) {
        return paperFileMapper.selectCount(
                new LambdaQueryWrapper<PaperFileDO>().eq(PaperFileDO::getPdfFileId, pdfFileId)) > 0;
    }

    @Override
    public Optional<PaperDO> findPaperByPdfFile(Long pdfFileId) {
        PaperFileDO link = paperFileMapper.selectOne(
                new LambdaQueryWrapper<PaperFileDO>()
                        .eq(PaperFileDO::getPdfFileId, pdfFileId)
                        .last("LIMIT 1"));
        if (link == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(paperMapper.selectById(link.getPaperId()));
    }

    @Override
    public Long upsertPdfFile(SourceFile file, ProcessingStatus status, String error) {
        LocalDateTime now = LocalDateTime.now();
        Optional<PdfFileDO> existing = findPdfFileByPath(file.getRelativePath());
        if (existing.isPresent()) {
            Long id = existing.get().getId();
            // parseError 需要能被清空，不走 updateById 的非空策略
            pdfFileMapper.update(null, new LambdaUpdateWrapper<PdfFileDO>()
                    .eq(PdfFileDO::getId, id)
                    .set(PdfFileDO::getFilename, file.getFilename())
                    .set(PdfFileDO::getSha256, file.getSha256())
                    .set(PdfFileDO::getSize, file.getSize())
                    .set(PdfFileDO::getMtime, file.getMtime())
                    .set(PdfFileDO::getParseStatus, status.getValue())
                    .set(PdfFileDO::getParseError, error)
                    .set(PdfFileDO::getLastScanTime, now)
                    .set(PdfFileDO::getUpdateTime, now));
            return id;
        }
        PdfFileDO record = PdfFileDO.builder()
                .path(file.getRelativePath())
                .filename(file.getFilename())
                .sha256(file.getSha256())
                .size(file.getSize())
                .mtime(file.getMtime())
                .parseStatus(status.getValue())
                .parseError(error)
                .lastScanTime(now)
                .build();
        pdfFileMapper.insert(record);
        log.debug("新增文件记录: id={}, path={}", record.getId(), record.getPath());
        return record.getId();
    }

    @Override
    public Long markPending(SourceFile file) {
        Optional<PdfFileDO> existing = findPdfFileByPath(file.getRelativePath());
        if (existing.isEmpty()) {
            return upsertPdfFile(file, ProcessingStatus.PENDING, null);
        }
        Long id = existing.get().getId();
        LocalDateTime now = LocalDateTime.now();
        pdfFileMapper.update(null, new LambdaUpdateWrapper<PdfFileDO>()
                .eq(PdfFileDO::getId, id)
                .set(PdfFileDO::getParseStatus, ProcessingStatus.PENDING.getValue())
                .set(PdfFileDO::getParseError, null)
                .set(PdfFileDO::getLastScanTime, now)
                .set(PdfFileDO::getUpdateTime, now));
        return id;
    }

    @Override
    public Long upsertPaper(PaperDO paper) {
        if (paper.getDoi() != null) {
            PaperDO sameDoi = paperMapper.selectOne(
                    new LambdaQueryWrapper<PaperDO>().eq(PaperDO::getDoi, paper.getDoi()));
            if (sameDoi != null) {
                paper.setId(sameDoi.getId());
            }
        }
        if (paper.getId() != null && paperMapper.selectById(paper.getId()) != null) {
            paperMapper.updateById(paper);
            log.debug("更新论文: id={}, doi={}", paper.getId(), paper.getDoi());
        } else {
            paper.setId(null);
            paperMapper.insert(paper);
            log.debug("新增论文: id={}, title={}", paper.getId(), paper.getTitle());
        }
        return paper.getId();
    }

    @Override
    public void linkPaper(Long paperId, Long pdfFileId) {
        paperFileMapper.delete(new LambdaQueryWrapper<PaperFileDO>().eq(PaperFileDO::getPdfFileId, pdfFileId));
        paperFileMapper.insert(PaperFileDO.builder()
                .paperId(paperId)
                .pdfFileId(pdfFileId)
                .build());
    }

    @Override
    public void setStatus(Long pdfFileId, ProcessingStatus status, String error) {
        LocalDateTime now = LocalDateTime.now();
        pdfFileMapper.update(null, new LambdaUpdateWrapper<PdfFileDO>()
                .eq(PdfFileDO::getId, pdfFileId)
                .set(PdfFileDO::getParseStatus, status.getValue())
                .set(PdfFileDO::getParseError, error)
                .set(PdfFileDO::getUpdateTime, now));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long savePaperOutcome(SourceFile file, PaperDO paper, ProcessingStatus status, String error) {
        Long pdfFileId = upsertPdfFile(file, status, error);
        Long paperId = upsertPaper(paper);
        linkPaper(paperId, pdfFileId);
        log.info("论文记录已保存: paperId={}, pdfFileId={}, status={}", paperId, pdfFileId, status.getValue());
        return pdfFileId;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long recordFailure(SourceFile file, String error) {
        Long pdfFileId = upsertPdfFile(file, ProcessingStatus.FAILED, error);
        // 失败文件不保留旧关联，否则新哈希会命中跳过规则
        int unlinked = paperFileMapper.delete(new LambdaQueryWrapper<PaperFileDO>().eq(PaperFileDO::getPdfFileId, pdfFileId));
        if (unlinked > 0) {
            log.info("处理失败，已解除论文关联: pdfFileId={}", pdfFileId);
        }
        return pdfFileId;
    }

    @Override
    public boolean hasLinkedPatent(String filePath) {
        return patentMapper.selectCount(
                new LambdaQueryWrapper<PatentDO>().eq(PatentDO::getFilePath, filePath)) > 0;
    }

    @Override
    public boolean hasLinkedSoftware(String filePath) {
        return softwareMapper.selectCount(
                new LambdaQueryWrapper<SoftwareDO>().eq(SoftwareDO::getFilePath, filePath)) > 0;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long upsertPatent(PatentDO patent) {
        LambdaQueryWrapper<PatentDO> wrapper = new LambdaQueryWrapper<>();
        if (patent.getPatentNumber() != null) {
            wrapper.eq(PatentDO::getPatentNumber, patent.getPatentNumber());
        } else {
            wrapper.eq(PatentDO::getFilePath, patent.getFilePath());
        }
        PatentDO existing = patentMapper.selectOne(wrapper.last("LIMIT 1"));
        if (existing != null) {
            patent.setId(existing.getId());
            patentMapper.updateById(patent);
        } else {
            patentMapper.insert(patent);
        }
        log.info("专利记录已保存: id={}, patentNumber={}", patent.getId(), patent.getPatentNumber());
        return patent.getId();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long upsertSoftware(SoftwareDO software) {
        LambdaQueryWrapper<SoftwareDO> wrapper = new LambdaQueryWrapper<>();
        if (software.getRegistrationNumber() != null) {
            wrapper.eq(SoftwareDO::getRegistrationNumber, software.getRegistrationNumber());
        } else {
            wrapper.eq(SoftwareDO::getFilePath, software.getFilePath());
        }
        SoftwareDO existing = softwareMapper.selectOne(wrapper.last("LIMIT 1"));
        if (existing != null) {
            software.setId(existing.getId());
            softwareMapper.updateById(software);
        } else {
            softwareMapper.insert(software);
        }
        log.info("软著记录已保存: id={}, registrationNumber={}", software.getId(), software.getRegistrationNumber());
        return software.getId();
    }
}
