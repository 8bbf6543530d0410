package com.litscan.model.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;

/**
 * 源文件的只读视图：前 N 页文本与 PDF 内嵌信息
 *
 * @author litscan
 */
@Getter
@Builder
public class RawDocument {

    private final Path path;

    /**
     * 文档总页数
     */
    private final int pageCount;

    /**
     * 已读取页的文本，下标即页码
     */
    @Singular
    private final List<String> pageTexts;

    /**
     * PDF 信息字典中的标题 / 主题
     */
    private final String infoTitle;

    private final String infoAuthor;

    /**
     * 拼接后的全文，每页以换行结尾
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (String page : pageTexts) {
            if (page != null) {
                sb.append(page).append('\n');
            }
        }
        return sb.toString();
    }
}
