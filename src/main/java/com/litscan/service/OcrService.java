package com.litscan.service;

import java.nio.file.Path;

/**
 * OCR 网关
 *
 * <p>识别失败不抛异常，而是返回以 {@link #ERROR_PREFIX} 开头的文本。</p>
 *
 * @author litscan
 */
public interface OcrService {

    String ERROR_PREFIX = "[OCR Error]";
    String WARNING_PREFIX = "[OCR Warning]";
    String RESULT_PREFIX = "[OCR Result]";

    /**
     * 识别文件的某一页；图片文件忽略页码
     *
     * @param path      PDF 或图片路径
     * @param pageIndex 页码，从 0 开始
     * @return 识别文本或哨兵文本
     */
    String recognize(Path path, int pageIndex);

    /**
     * 服务地址和令牌是否已配置
     */
    boolean isConfigured();

    /**
     * 运行时更新服务地址和令牌，下一次调用生效
     */
    void reconfigure(String url, String key);

    static boolean isErrorText(String text) {
        return text != null && text.startsWith(ERROR_PREFIX);
    }

    /**
     * 非空且不是任何哨兵文本
     */
    static boolean isUsableText(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return !text.startsWith(ERROR_PREFIX) && !text.startsWith(WARNING_PREFIX) && !text.startsWith(RESULT_PREFIX);
    }
}
