package com.leadengine.infrastructure.dao;

import com.leadengine.infrastructure.dao.po.PropertyMatchPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 房源-线索匹配记录 DAO
 */
@Mapper
public interface PropertyMatchDao {

    /**
     * ON CONFLICT (property_id, lead_id) DO NOTHING
     *
     * @return 插入行数，已存在时为 0
     */
    int insertIgnoreConflict(PropertyMatchPO po);

    int markNotified(@Param("propertyId") Long propertyId,
                     @Param("leadId") Long leadId,
                     @Param("notifiedAt") LocalDateTime notifiedAt);

    List<PropertyMatchPO> selectByPropertyId(@Param("propertyId") Long propertyId);
}
