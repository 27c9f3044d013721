package com.leadengine.api.dto;

import lombok.Data;

/**
 * 一轮自动跟进的执行结果
 */
@Data
public class FollowupCycleResultDTO {

    private Integer attempted;

    private Integer succeeded;

    private Integer failed;
}
