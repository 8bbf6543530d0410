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
 * 源文件记录
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("pdf_files")
public class PdfFileDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 相对扫描根目录的路径
     */
    private String path;

    private String filename;

    private String sha256;

    private Long size;

    private Long mtime;

    private String parseStatus; // pending, needs_ocr, needs_review, success, failed

    private String parseError;

    private LocalDateTime lastScanTime;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
