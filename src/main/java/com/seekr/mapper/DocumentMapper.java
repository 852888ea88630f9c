package com.seekr.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.seekr.model.entity.DocumentDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 文档 Mapper
 *
 * @author seekr
 */
@Mapper
public interface DocumentMapper extends BaseMapper<DocumentDO> {
}
