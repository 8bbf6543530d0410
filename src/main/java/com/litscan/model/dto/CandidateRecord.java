package com.litscan.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 书目目录返回的候选记录
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateRecord {

    private String doi;

    private String title;

    /**
     * "Surname, Given" 形式，分号分隔
     */
    private String authors;

    private Integer year;

    private String venue;

    private String volume;

    private String issue;

    private String pages;

    private String url;

    /**
     * 目录给出的类型，如 journal-article
     */
    private String type;

    /**
     * 目录自身的相关度分数
     */
    private Double score;

    /**
     * crossref / openalex
     */
    private String catalog;
}
