package com.leadengine.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 房源-线索匹配记录 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyMatchPO {

    private Long id;

    private Long propertyId;

    private Long leadId;

    private Long tenantId;

    private Double matchScore;

    /**
     * 匹配原因 (JSONB 数组)
     */
    private String matchReasons;

    private Boolean notified;

    private LocalDateTime notifiedAt;

    private LocalDateTime createdAt;
}
