package com.litscan.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.litscan.model.entity.SoftwareDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 软著 Mapper
 *
 * @author litscan
 */
@Mapper
public interface SoftwareMapper extends BaseMapper<SoftwareDO> {
}
