package com.litscan.service;

import com.litscan.model.dto.ScanItemResult;
import com.litscan.model.dto.ScanReport;
import com.litscan.model.vo.ScanTaskVO;

import java.nio.file.Path;

/**
 * 扫描编排服务
 *
 * @author litscan
 */
public interface ScanService {

    /**
     * 同步扫描根目录，逐个处理文件
     *
     * @param root     扫描根目录
     * @param listener 进度回调
     * @return 扫描报告
     */
    ScanReport scan(Path root, ScanProgressListener listener);

    /**
     * 处理单个文件（论文或证书）
     */
    ScanItemResult processFile(Path root, Path file);

    /**
     * 对已有文件做 OCR 重新解析
     *
     * @param pdfFileId 文件记录 ID
     * @param root      扫描根目录，用于还原绝对路径
     */
    ScanItemResult reparseWithOcr(Long pdfFileId, Path root);

    /**
     * 在后台线程启动扫描，已有扫描运行时拒绝
     */
    ScanTaskVO startScan(String rootDir);

    /**
     * 请求取消，当前文件处理完后生效
     */
    void cancel();

    ScanTaskVO getTaskStatus();

    ScanReport getLastReport();
}
