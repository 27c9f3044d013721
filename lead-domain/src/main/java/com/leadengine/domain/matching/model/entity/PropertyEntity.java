package com.leadengine.domain.matching.model.entity;

import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 房源只读视图，房源目录的增删改不在本系统内。
 */
@Data
public class PropertyEntity {

    private Long id;

    private Long tenantId;

    private String name;

    private BigDecimal price;

    private PropertyTypeEnum propertyType;

    private TransactionTypeEnum transactionType;

    private String location;

    private Integer bedrooms;

    private boolean available;

    private LocalDateTime createdAt;
}
