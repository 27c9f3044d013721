package com.leadengine.infrastructure.dao;

import com.leadengine.infrastructure.dao.po.PropertyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 房源 DAO（只读）
 */
@Mapper
public interface PropertyDao {

    PropertyPO selectById(@Param("id") Long id);

    List<PropertyPO> selectAvailableByTenant(@Param("tenantId") Long tenantId);
}
