package com.leadengine.domain.matching.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 房源-线索匹配记录，(propertyId, leadId) 唯一，用于保证每对最多通知一次。
 */
@Data
public class PropertyMatchRecordEntity {

    private Long id;

    private Long propertyId;

    private Long leadId;

    private Long tenantId;

    /**
     * 匹配分 [0, 1]
     */
    private double matchScore;

    private List<String> matchReasons = new ArrayList<>();

    private boolean notified;

    private LocalDateTime notifiedAt;

    private LocalDateTime createdAt;
}
