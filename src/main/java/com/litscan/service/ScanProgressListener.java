package com.litscan.service;

import com.litscan.model.dto.ScanProgress;

/**
 * 扫描进度回调
 *
 * @author litscan
 */
@FunctionalInterface
public interface ScanProgressListener {

    ScanProgressListener NOOP = progress -> { };

    void onProgress(ScanProgress progress);
}
