package com.leadengine.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 房源 PO（只读）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyPO {

    private Long id;

    private Long tenantId;

    private String name;

    private BigDecimal price;

    private String propertyType;

    private String transactionType;

    private String location;

    private Integer bedrooms;

    private Boolean isAvailable;

    private LocalDateTime createdAt;
}
