package com.leadengine.api.dto;

import lombok.Data;

/**
 * 房源匹配通知结果
 */
@Data
public class PropertyNotifyResultDTO {

    private Long propertyId;

    /**
     * 匹配到的线索数
     */
    private Integer matched;

    /**
     * 本次新通知成功的线索数
     */
    private Integer notified;

    /**
     * 此前已记录过、本次跳过的线索数
     */
    private Integer skipped;

    private Integer failed;
}
