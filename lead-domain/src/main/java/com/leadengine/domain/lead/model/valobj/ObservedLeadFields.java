package com.leadengine.domain.lead.model.valobj;

import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 入站观测到的线索字段，用于身份解析与空字段补全。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedLeadFields {

    /**
     * 观测渠道，与 channelUserId 配对使用
     */
    private ChannelEnum channel;

    private String channelUserId;

    private String profileUrl;

    private String phone;

    private String name;

    private String email;

    private String jobTitle;

    private String company;

    private LeadSourceEnum source;

    private LanguageEnum language;
}
