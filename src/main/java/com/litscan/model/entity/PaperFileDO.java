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
 * 论文与源文件关联
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("paper_files")
public class PaperFileDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long paperId;

    private Long pdfFileId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
