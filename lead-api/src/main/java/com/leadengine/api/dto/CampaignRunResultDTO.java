package com.leadengine.api.dto;

import lombok.Data;

@Data
public class CampaignRunResultDTO {

    private Long campaignId;

    private Integer targeted;

    private Integer sent;

    private Integer failed;
}
