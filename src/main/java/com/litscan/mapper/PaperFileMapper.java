package com.litscan.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.litscan.model.entity.PaperFileDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 论文文件关联 Mapper
 *
 * @author litscan
 */
@Mapper
public interface PaperFileMapper extends BaseMapper<PaperFileDO> {
}
