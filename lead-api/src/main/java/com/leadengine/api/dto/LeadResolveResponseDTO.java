package com.leadengine.api.dto;

import lombok.Data;

@Data
public class LeadResolveResponseDTO {

    private LeadDTO lead;

    /**
     * 本次调用是否新建了线索
     */
    private Boolean created;
}
