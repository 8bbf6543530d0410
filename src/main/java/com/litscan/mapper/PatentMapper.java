package com.litscan.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.litscan.model.entity.PatentDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 专利 Mapper
 *
 * @author litscan
 */
@Mapper
public interface PatentMapper extends BaseMapper<PatentDO> {
}
