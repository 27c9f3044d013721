package com.leadengine.domain.lead.model.valobj;

import com.leadengine.domain.lead.model.entity.LeadEntity;

/**
 * 身份解析结果。
 *
 * @param lead    命中或新建的线索
 * @param created 是否新建
 */
public record LeadResolution(LeadEntity lead, boolean created) {
}
