package com.litscan.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.litscan.model.entity.PaperDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 论文 Mapper
 *
 * @author litscan
 */
@Mapper
public interface PaperMapper extends BaseMapper<PaperDO> {
}
