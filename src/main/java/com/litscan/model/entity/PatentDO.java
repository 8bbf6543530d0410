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
 * 专利证书记录
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("patents")
public class PatentDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String title;

    private String patentType;

    private String patentNumber;

    private String grantNumber;

    private String inventors;

    private String patentee;

    private String applicationDate;

    private String grantDate;

    /**
     * 相对扫描根目录的路径
     */
    private String filePath;

    private String extractionMethod; // pdf_text, ocr, pdf+ocr, text_file

    private Boolean needsReview;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
