package com.litscan.service;

import com.litscan.model.dto.SourceFile;
import com.litscan.model.entity.PaperDO;
import com.litscan.model.entity.PatentDO;
import com.litscan.model.entity.PdfFileDO;
import com.litscan.model.entity.SoftwareDO;
import com.litscan.model.enums.ProcessingStatus;

import java.util.Optional;

/**
 * 记录存储
 *
 * @author litscan
 */
public interface RecordStore {

    Optional<PdfFileDO> findPdfFileByPath(String relativePath);

    Optional<PdfFileDO> getByContentHash(String sha256);

    Optional<PdfFileDO> getPdfFile(Long pdfFileId);

    boolean hasLinkedPaper(Long pdfFileId);

    Optional<PaperDO> findPaperByPdfFile(Long pdfFileId);

    /**
     * 按相对路径新增或更新文件记录
     *
     * @return 文件记录 ID
     */
    Long upsertPdfFile(SourceFile file, ProcessingStatus status, String error);

    /**
     * 标记为处理中；已有记录只更新状态，哈希等文件信息留给最终结果写入
     *
     * @return 文件记录 ID
     */
    Long markPending(SourceFile file);

    /**
     * DOI 已存在时更新该论文，否则按 ID 更新或新增
     *
     * @return 论文 ID
     */
    Long upsertPaper(PaperDO paper);

    /**
     * 文件只关联一篇论文，已有关联会被替换
     */
    void linkPaper(Long paperId, Long pdfFileId);

    void setStatus(Long pdfFileId, ProcessingStatus status, String error);

    /**
     * 文件记录、论文、关联和终态在同一事务中写入
     *
     * @return 文件记录 ID；论文 ID 回填到 paper
     */
    Long savePaperOutcome(SourceFile file, PaperDO paper, ProcessingStatus status, String error);

    /**
     * 记录处理失败，并解除该文件已有的论文关联
     */
    Long recordFailure(SourceFile file, String error);

    boolean hasLinkedPatent(String filePath);

    boolean hasLinkedSoftware(String filePath);

    /**
     * 专利号已存在时更新，否则按文件路径更新或新增
     */
    Long upsertPatent(PatentDO patent);

    /**
     * 登记号已存在时更新，否则按文件路径更新或新增
     */
    Long upsertSoftware(SoftwareDO software);
}
