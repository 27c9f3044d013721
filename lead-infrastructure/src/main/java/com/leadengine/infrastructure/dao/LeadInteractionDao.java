package com.leadengine.infrastructure.dao;

import com.leadengine.infrastructure.dao.po.LeadInteractionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 线索交互记录 DAO，只有插入与查询
 */
@Mapper
public interface LeadInteractionDao {

    int insert(LeadInteractionPO po);

    List<LeadInteractionPO> selectRecentByLeadId(@Param("leadId") Long leadId,
                                                 @Param("limit") Integer limit);
}
