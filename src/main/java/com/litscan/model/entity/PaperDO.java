package com.litscan.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 论文记录
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("papers")
public class PaperDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String title;

    private String authors;

    private Integer year;

    private String venue;

    private String doi;

    private String url;

    private String volume;

    private String issue;

    private String pages;

    private String entryType; // article, inproceedings

    private String publicationType; // journal, conference, other

    private String bibtexKey;

    private Double confidence;

    private String source; // doi_lookup, auto, review, none, pdf, ocr

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
