package com.leadengine.domain.lead.model.valobj;

import com.leadengine.types.enums.LeadGradeEnum;

/**
 * 评分结果，四个维度分项加总后截断到 [0, 100]。
 */
public record LeadScore(int contact, int engagement, int qualification, int intent, int total, LeadGradeEnum grade) {
}
