package com.leadengine.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 交给渠道适配层执行的出站请求。
 * <p>
 * type 取值：send_text / send_buttons / send_list / request_contact_share / generate_report / notify_operator
 * </p>
 */
@Data
public class OutboundRequestDTO {

    private String type;

    private String text;

    private List<ReplyOptionDTO> options;

    /**
     * 报告类型，仅 generate_report 使用
     */
    private String reportKind;

    private Map<String, Object> reportParams;
}
