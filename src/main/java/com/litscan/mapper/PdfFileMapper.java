package com.litscan.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.litscan.model.entity.PdfFileDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 源文件 Mapper
 *
 * @author litscan
 */
@Mapper
public interface PdfFileMapper extends BaseMapper<PdfFileDO> {
}
