package com.leadengine.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 房源-线索匹配结果
 */
@Data
public class PropertyMatchDTO {

    private Long propertyId;

    private Long leadId;

    /**
     * 匹配分 [0, 1]
     */
    private Double matchScore;

    private List<String> matchReasons;
}
