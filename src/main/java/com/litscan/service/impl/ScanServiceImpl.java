package com.litscan.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CertificateExtraction;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.model.dto.PatentFields;
import com.litscan.model.dto.ResolutionResult;
import com.litscan.model.dto.ScanItemResult;
import com.litscan.model.dto.ScanProgress;
import com.litscan.model.dto.ScanReport;
import com.litscan.model.dto.SoftwareFields;
import com.litscan.model.dto.SourceFile;
import com.litscan.model.entity.PaperDO;
import com.litscan.model.entity.PatentDO;
import com.litscan.model.entity.PdfFileDO;
import com.litscan.model.entity.SoftwareDO;
import com.litscan.model.enums.CertificateKind;
import com.litscan.model.enums.ProcessingStatus;
import com.litscan.model.enums.ResolutionSource;
import com.litscan.model.vo.ScanTaskVO;
import com.litscan.service.BibliographicResolverService;
import com.litscan.service.CertificateExtractionService;
import com.litscan.service.FileScannerService;
import com.litscan.service.MetadataExtractionService;
import com.litscan.service.OcrService;
import com.litscan.service.RecordStore;
import com.litscan.service.ScanProgressListener;
import com.litscan.service.ScanService;
import com.litscan.utils.BibtexKeyUtils;
import com.litscan.utils.PublicationTypeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 扫描编排实现
 *
 * <ul>
 *     <li>图片或文件名含证书关键字的文件走证书流程，其余走论文流程</li>
 *     <li>同一内容（SHA-256）已关联论文的文件直接跳过</li>
 *     <li>单个文件失败只记录失败状态，不中断扫描</li>
 * </ul>
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanServiceImpl implements ScanService {

    static final String SOURCE_PDF = "pdf";
    static final String SOURCE_OCR = "ocr";

    private final FileScannerService fileScannerService;
    private final MetadataExtractionService metadataExtractionService;
    private final BibliographicResolverService bibliographicResolverService;
    private final CertificateExtractionService certificateExtractionService;
    private final OcrService ocrService;
    private final RecordStore recordStore;
    private final ScanTaskRunner scanTaskRunner;
    private final LitScanProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean cancelRequested;
    private volatile ScanProgress progress;
    private volatile ScanReport lastReport;
    private volatile String taskRootDir;
    private volatile LocalDateTime taskStartTime;
    private volatile LocalDateTime taskEndTime;

    @Override
    public ScanReport scan(Path root, ScanProgressListener listener) {
        ScanReport report = ScanReport.builder()
                .rootDir(root.toString())
                .startTime(LocalDateTime.now())
                .build();
        List<Path> files = fileScannerService.listFiles(root);
        int total = files.size();
        report.setTotal(total);
        log.info("开始扫描: {}, 共 {} 个文件", root, total);
        listener.onProgress(progressOf(0, total, "开始扫描", null));

        for (int i = 0; i < total; i++) {
            if (cancelRequested) {
                report.setCancelled(true);
                log.info("扫描已取消，已处理 {}/{}", i, total);
                break;
            }
            Path file = files.get(i);
            String filename = file.getFileName().toString();
            listener.onProgress(progressOf(i, total, "正在处理: " + filename, filename));
            report.addItem(processFile(root, file));
        }

        cancelRequested = false;
        report.setEndTime(LocalDateTime.now());
        String message = report.isCancelled() ? "扫描已取消" : "扫描完成";
        listener.onProgress(progressOf(report.getProcessed() + report.getSkipped(), total, message, null));
        log.info("{}: 处理 {}，跳过 {}，失败 {}", message, report.getProcessed(), report.getSkipped(), report.getFailed());
        lastReport = report;
        return report;
    }

    @Override
    public ScanItemResult processFile(Path root, Path file) {
        SourceFile source = null;
        boolean certificate = false;
        try {
            source = fileScannerService.describe(root, file);
            certificate = isCertificate(source.getFilename());
            return certificate ? processCertificate(source) : processPaper(source);
        } catch (Exception e) {
            String relativePath = source != null ? source.getRelativePath() : FileScannerServiceImpl.relativePath(root, file);
            String error = truncateError(StrUtil.blankToDefault(e.getMessage(), e.getClass().getSimpleName()));
            log.error("文件处理失败: {}", relativePath, e);
            ScanItemResult item = ScanItemResult.builder()
                    .relativePath(relativePath)
                    .type(certificate ? ScanItemResult.TYPE_UNKNOWN : ScanItemResult.TYPE_PAPER)
                    .status(ProcessingStatus.FAILED.getValue())
                    .error(error)
                    .build();
            if (source != null && !certificate) {
                item.setPdfFileId(recordFailureSafely(source, error));
            }
            return item;
        }
    }

    private ScanItemResult processPaper(SourceFile source) {
        Optional<PdfFileDO> sameContent = recordStore.getByContentHash(source.getSha256());
        if (sameContent.isPresent() && recordStore.hasLinkedPaper(sameContent.get().getId())) {
            log.info("内容未变化，跳过: {}", source.getRelativePath());
            return ScanItemResult.builder()
                    .relativePath(source.getRelativePath())
                    .type(ScanItemResult.TYPE_PAPER)
                    .pdfFileId(sameContent.get().getId())
                    .status(sameContent.get().getParseStatus())
                    .skipped(true)
                    .build();
        }

        // 同路径文件内容变化时沿用原论文记录
        Long existingPaperId = recordStore.findPdfFileByPath(source.getRelativePath())
                .flatMap(record -> recordStore.findPaperByPdfFile(record.getId()))
                .map(PaperDO::getId)
                .orElse(null);

        ExtractedFields fields = metadataExtractionService.extractFromPdf(source.getAbsolutePath());
        recordStore.markPending(source);

        PaperDO paper;
        ProcessingStatus status;
        if (metadataExtractionService.needsOcr(fields)) {
            log.info("文本层不足 {} 字符，标记为待OCR: {}", fields.getCharCount(), source.getRelativePath());
            paper = toPaper(fields, 0, SOURCE_PDF, source.getFilename());
            status = ProcessingStatus.NEEDS_OCR;
        } else {
            ResolutionResult resolution = bibliographicResolverService.resolve(fields);
            paper = toPaper(resolution.getMergedFields(), resolution.getConfidence(),
                    sourceOf(resolution, SOURCE_PDF), source.getFilename());
            status = ProcessingStatus.fromConfidence(resolution.getConfidence(), properties.getResolver().getMatchThreshold());
        }
        paper.setId(existingPaperId);

        Long pdfFileId = recordStore.savePaperOutcome(source, paper, status, null);
        return ScanItemResult.builder()
                .relativePath(source.getRelativePath())
                .type(ScanItemResult.TYPE_PAPER)
                .pdfFileId(pdfFileId)
                .recordId(paper.getId())
                .status(status.getValue())
                .confidence(paper.getConfidence())
                .build();
    }

    private ScanItemResult processCertificate(SourceFile source) {
        String relativePath = source.getRelativePath();
        if (recordStore.hasLinkedPatent(relativePath) || recordStore.hasLinkedSoftware(relativePath)) {
            log.info("证书已入库，跳过: {}", relativePath);
            return ScanItemResult.builder()
                    .relativePath(relativePath)
                    .type(ScanItemResult.TYPE_UNKNOWN)
                    .skipped(true)
                    .build();
        }

        CertificateExtraction extraction = certificateExtractionService.extract(source.getAbsolutePath());
        String method = extraction.getExtractionMethod().getValue();
        if (extraction.getKind() == CertificateKind.PATENT) {
            PatentFields fields = extraction.getPatentFields();
            boolean needsReview = !fields.isComplete();
            Long id = recordStore.upsertPatent(PatentDO.builder()
                    .title(fields.getTitle())
                    .patentType(fields.getPatentType())
                    .patentNumber(fields.getPatentNumber())
                    .grantNumber(fields.getGrantNumber())
                    .inventors(fields.getInventors())
                    .patentee(fields.getPatentee())
                    .applicationDate(fields.getApplicationDate())
                    .grantDate(fields.getGrantDate())
                    .filePath(relativePath)
                    .extractionMethod(method)
                    .needsReview(needsReview)
                    .build());
            return certificateItem(relativePath, ScanItemResult.TYPE_PATENT, id, needsReview);
        }
        if (extraction.getKind() == CertificateKind.SOFTWARE) {
            SoftwareFields fields = extraction.getSoftwareFields();
            boolean needsReview = !fields.isComplete();
            Long id = recordStore.upsertSoftware(SoftwareDO.builder()
                    .softwareName(fields.getSoftwareName())
                    .version(fields.getVersion())
                    .registrationNumber(fields.getRegistrationNumber())
                    .copyrightHolder(fields.getCopyrightHolder())
                    .developmentDate(fields.getDevelopmentDate())
                    .filePath(relativePath)
                    .extractionMethod(method)
                    .needsReview(needsReview)
                    .build());
            return certificateItem(relativePath, ScanItemResult.TYPE_SOFTWARE, id, needsReview);
        }

        log.warn("无法识别证书类型，下次扫描重试: {}", relativePath);
        return ScanItemResult.builder()
                .relativePath(relativePath)
                .type(ScanItemResult.TYPE_UNKNOWN)
                .status(CertificateKind.NEITHER.getValue())
                .build();
    }

    @Override
    public ScanItemResult reparseWithOcr(Long pdfFileId, Path root) {
        PdfFileDO record = recordStore.getPdfFile(pdfFileId)
                .orElseThrow(() -> new BusinessException("文件记录不存在: " + pdfFileId));
        Path file = root.resolve(record.getPath());
        if (!Files.isRegularFile(file)) {
            throw new BusinessException("文件不存在: " + file);
        }
        SourceFile source = fileScannerService.describe(root, file);

        String ocrText = ocrService.recognize(file, 0);
        if (!OcrService.isUsableText(ocrText)) {
            String error = truncateError(ocrText);
            log.warn("OCR重新解析失败: {}, {}", record.getPath(), error);
            recordStore.setStatus(pdfFileId, ProcessingStatus.NEEDS_OCR, error);
            return ScanItemResult.builder()
                    .relativePath(record.getPath())
                    .type(ScanItemResult.TYPE_PAPER)
                    .pdfFileId(pdfFileId)
                    .status(ProcessingStatus.NEEDS_OCR.getValue())
                    .error(error)
                    .build();
        }

        ExtractedFields fields = metadataExtractionService.extractFromOcrText(ocrText);
        Optional<PaperDO> existing = recordStore.findPaperByPdfFile(pdfFileId);
        existing.ifPresent(paper -> fields.fillMissingFrom(toFields(paper)));

        ResolutionResult resolution = bibliographicResolverService.resolve(fields);
        PaperDO paper = toPaper(resolution.getMergedFields(), resolution.getConfidence(),
                sourceOf(resolution, SOURCE_OCR), record.getFilename());
        existing.ifPresent(old -> paper.setId(old.getId()));
        ProcessingStatus status = ProcessingStatus.fromConfidence(resolution.getConfidence(), properties.getResolver().getMatchThreshold());

        recordStore.savePaperOutcome(source, paper, status, null);
        log.info("OCR重新解析完成: {}, status={}, confidence={}", record.getPath(), status.getValue(), resolution.getConfidence());
        return ScanItemResult.builder()
                .relativePath(record.getPath())
                .type(ScanItemResult.TYPE_PAPER)
                .pdfFileId(pdfFileId)
                .recordId(paper.getId())
                .status(status.getValue())
                .confidence(paper.getConfidence())
                .build();
    }

    @Override
    public ScanTaskVO startScan(String rootDir) {
        if (!running.compareAndSet(false, true)) {
            throw new BusinessException("已有扫描任务正在运行");
        }
        Path root = Paths.get(StrUtil.blankToDefault(rootDir, properties.getScan().getRootDir())).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            running.set(false);
            throw new BusinessException("扫描目录不存在: " + root);
        }
        cancelRequested = false;
        taskRootDir = root.toString();
        taskStartTime = LocalDateTime.now();
        taskEndTime = null;
        progress = progressOf(0, 0, "等待开始", null);

        try {
            scanTaskRunner.run(() -> scan(root, p -> progress = p))
                    .whenComplete((report, ex) -> {
                        taskEndTime = LocalDateTime.now();
                        running.set(false);
                        if (ex != null) {
                            log.error("扫描任务异常结束: {}", root, ex);
                            progress = progressOf(0, 0, "扫描失败: " + ex.getMessage(), null);
                        }
                    });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return getTaskStatus();
    }

    @Override
    public void cancel() {
        if (running.get()) {
            cancelRequested = true;
            log.info("已请求取消扫描，当前文件处理完后停止");
        }
    }

    @Override
    public ScanTaskVO getTaskStatus() {
        ScanProgress current = progress;
        ScanTaskVO.ScanTaskVOBuilder builder = ScanTaskVO.builder()
                .running(running.get())
                .rootDir(taskRootDir)
                .startTime(taskStartTime)
                .endTime(taskEndTime);
        if (current != null) {
            builder.current(current.getCurrent())
                    .total(current.getTotal())
                    .percent(current.getPercent())
                    .message(current.getMessage());
        }
        return builder.build();
    }

    @Override
    public ScanReport getLastReport() {
        return lastReport;
    }

    private boolean isCertificate(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        LitScanProperties.ScanConfig scan = properties.getScan();
        return scan.getImageExtensions().stream().anyMatch(name::endsWith)
                || scan.getCertificateKeywords().stream().anyMatch(keyword -> name.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    private PaperDO toPaper(ExtractedFields fields, double confidence, String source, String filename) {
        String title = fields.getTitle() != null ? fields.getTitle() : FileUtil.mainName(filename);
        return PaperDO.builder()
                .title(title)
                .authors(fields.getAuthors())
                .year(fields.getYear())
                .venue(fields.getVenue())
                .doi(fields.getDoi())
                .url(fields.getUrl())
                .volume(fields.getVolume())
                .issue(fields.getIssue())
                .pages(fields.getPages())
                .entryType(PublicationTypeUtils.entryType(fields.getVenue()))
                .publicationType(PublicationTypeUtils.detect(fields.getVenue()))
                .bibtexKey(BibtexKeyUtils.generate(fields.getAuthors(), fields.getYear(), title,
                        properties.getPipeline().getBibtexKeyMode()))
                .confidence(confidence)
                .source(source)
                .build();
    }

    private static ExtractedFields toFields(PaperDO paper) {
        ExtractedFields fields = new ExtractedFields();
        fields.setTitle(paper.getTitle());
        fields.setAuthors(paper.getAuthors());
        fields.setYear(paper.getYear());
        fields.setVenue(paper.getVenue());
        fields.setDoi(paper.getDoi());
        fields.setUrl(paper.getUrl());
        fields.setVolume(paper.getVolume());
        fields.setIssue(paper.getIssue());
        fields.setPages(paper.getPages());
        return fields;
    }

    private static String sourceOf(ResolutionResult resolution, String fallback) {
        return resolution.getSource() == ResolutionSource.NONE ? fallback : resolution.getSource().getValue();
    }

    private static ScanItemResult certificateItem(String relativePath, String type, Long id, boolean needsReview) {
        return ScanItemResult.builder()
                .relativePath(relativePath)
                .type(type)
                .recordId(id)
                .status(needsReview ? ProcessingStatus.NEEDS_REVIEW.getValue() : ProcessingStatus.SUCCESS.getValue())
                .build();
    }

    private Long recordFailureSafely(SourceFile source, String error) {
        try {
            return recordStore.recordFailure(source, error);
        } catch (RuntimeException e) {
            log.error("写入失败状态出错: {}", source.getRelativePath(), e);
            return null;
        }
    }

    private String truncateError(String error) {
        return StringUtils.left(error, properties.getPipeline().getErrorMessageMaxLength());
    }

    private static ScanProgress progressOf(int current, int total, String message, String filename) {
        int percent = total == 0 ? 0 : current * 100 / total;
        return ScanProgress.builder()
                .current(current)
                .total(total)
                .percent(percent)
                .message(message)
                .filename(filename)
                .build();
    }
}
