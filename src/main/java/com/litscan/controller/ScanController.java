package com.litscan.controller;

import cn.hutool.core.util.StrUtil;
import com.litscan.config.LitScanProperties;
import com.litscan.extractor.PatentNumberValidator;
import com.litscan.model.dto.ScanItemResult;
import com.litscan.model.dto.ScanReport;
import com.litscan.model.vo.PatentNumberCheckVO;
import com.litscan.model.vo.ScanTaskVO;
import com.litscan.service.OcrService;
import com.litscan.service.ScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Paths;

/**
 * 扫描控制器
 *
 * @author litscan
 */
@Tag(name = "文献扫描")
@RestController
@RequestMapping("/api/scan")
@RequiredArgsConstructor
public class ScanController {

    private final ScanService scanService;
    private final OcrService ocrService;
    private final LitScanProperties properties;

    @Operation(summary = "启动扫描", description = "在后台线程扫描目录；已有扫描运行时返回错误")
    @PostMapping("/start")
    public ScanTaskVO start(
            @Parameter(description = "扫描根目录，默认取配置 litscan.scan.root-dir") @RequestParam(required = false) String rootDir) {
        return scanService.startScan(rootDir);
    }

    @Operation(summary = "取消扫描", description = "当前文件处理完成后停止")
    @PostMapping("/cancel")
    public ScanTaskVO cancel() {
        scanService.cancel();
        return scanService.getTaskStatus();
    }

    @Operation(summary = "扫描进度")
    @GetMapping("/progress")
    public ScanTaskVO progress() {
        return scanService.getTaskStatus();
    }

    @Operation(summary = "最近一次扫描报告")
    @GetMapping("/report")
    public ScanReport report() {
        return scanService.getLastReport();
    }

    @Operation(summary = "OCR重新解析", description = "识别首页后重新抽取、匹配并更新论文记录")
    @PostMapping("/files/{id}/ocr")
    public ScanItemResult reparseWithOcr(
            @Parameter(description = "文件记录ID") @PathVariable Long id,
            @Parameter(description = "扫描根目录") @RequestParam(required = false) String rootDir) {
        String root = StrUtil.blankToDefault(rootDir, properties.getScan().getRootDir());
        return scanService.reparseWithOcr(id, Paths.get(root).toAbsolutePath().normalize());
    }

    @Operation(summary = "更新OCR服务配置")
    @PutMapping("/ocr/config")
    public Boolean configureOcr(
            @Parameter(description = "服务地址") @RequestParam String url,
            @Parameter(description = "访问令牌") @RequestParam String key) {
        ocrService.reconfigure(url, key);
        return ocrService.isConfigured();
    }

    @Operation(summary = "专利号校验", description = "规范格式 ZL + 12/13位数字 + '.' + 校验位")
    @GetMapping("/patent-number/check")
    public PatentNumberCheckVO checkPatentNumber(
            @Parameter(description = "专利号") @RequestParam(required = false) String patentNumber) {
        PatentNumberValidator.Result result = PatentNumberValidator.validate(patentNumber);
        return PatentNumberCheckVO.builder()
                .patentNumber(patentNumber)
                .valid(result.isValid())
                .reason(result.getReason())
                .build();
    }
}
