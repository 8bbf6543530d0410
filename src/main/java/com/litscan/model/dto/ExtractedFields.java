package com.litscan.model.dto;

import cn.hutool.core.util.StrUtil;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 抽取得到的论文字段，空白字符串一律视为缺失
 *
 * @author litscan
 */
@Data
@NoArgsConstructor
public class ExtractedFields {

    private String title;

    /**
     * 分号分隔的作者列表
     */
    private String authors;

    private Integer year;

    private String venue;

    private String doi;

    private String url;

    private String volume;

    private String issue;

    private String pages;

    private String rawText;

    private int pageCount;

    /**
     * 去除首尾空白后的文本长度
     */
    private int charCount;

    public void setTitle(String title) {
        this.title = StrUtil.trimToNull(title);
    }

    public void setAuthors(String authors) {
        this.authors = StrUtil.trimToNull(authors);
    }

    public void setVenue(String venue) {
        this.venue = StrUtil.trimToNull(venue);
    }

    public void setDoi(String doi) {
        this.doi = StrUtil.trimToNull(doi);
    }

    public void setUrl(String url) {
        this.url = StrUtil.trimToNull(url);
    }

    public void setVolume(String volume) {
        this.volume = StrUtil.trimToNull(volume);
    }

    public void setIssue(String issue) {
        this.issue = StrUtil.trimToNull(issue);
    }

    public void setPages(String pages) {
        this.pages = StrUtil.trimToNull(pages);
    }

    public ExtractedFields copy() {
        ExtractedFields copy = new ExtractedFields();
        copy.title = title;
        copy.authors = authors;
        copy.year = year;
        copy.venue = venue;
        copy.doi = doi;
        copy.url = url;
        copy.volume = volume;
        copy.issue = issue;
        copy.pages = pages;
        copy.rawText = rawText;
        copy.pageCount = pageCount;
        copy.charCount = charCount;
        return copy;
    }

    /**
     * 仅补全本对象缺失的书目字段
     */
    public void fillMissingFrom(ExtractedFields other) {
        if (other == null) {
            return;
        }
        if (title == null) {
            title = other.title;
        }
        if (authors == null) {
            authors = other.authors;
        }
        if (year == null) {
            year = other.year;
        }
        if (venue == null) {
            venue = other.venue;
        }
        if (doi == null) {
            doi = other.doi;
        }
        if (url == null) {
            url = other.url;
        }
        if (volume == null) {
            volume = other.volume;
        }
        if (issue == null) {
            issue = other.issue;
        }
        if (pages == null) {
            pages = other.pages;
        }
    }

    public boolean hasAnyBibliographicField() {
        return title != null || authors != null || year != null || venue != null || doi != null;
    }
}
