package com.leadengine.domain.lead.service;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.LeadScore;
import com.leadengine.types.enums.LeadGradeEnum;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * 线索评分领域服务：每次写入前根据当前字段全量重算，不做增量修补。
 * <p>
 * 联系完整度 20 + 互动量 30 + 资质完整度 30 + 意向信号 20，结果截断到 [0, 100]。
 * 评分不读取时钟，相同字段值总是得到相同结果。
 * </p>
 */
@Service
public class LeadScoringDomainService {

    public LeadScore score(LeadEntity lead) {
        if (lead == null) {
            return new LeadScore(0, 0, 0, 0, 0, LeadGradeEnum.D);
        }
        int contact = contactScore(lead);
        int engagement = engagementScore(lead);
        int qualification = qualificationScore(lead);
        int intent = intentScore(lead);
        int total = clamp(contact + engagement + qualification + intent);
        return new LeadScore(contact, engagement, qualification, intent, total, gradeOf(total));
    }

    /**
     * 重算并写回评分与等级
     */
    public LeadScore rescore(LeadEntity lead) {
        LeadScore score = score(lead);
        if (lead != null) {
            lead.setScore(score.total());
            lead.setGrade(score.grade());
        }
        return score;
    }

    public LeadGradeEnum gradeOf(int score) {
        if (score >= 80) {
            return LeadGradeEnum.A;
        }
        if (score >= 60) {
            return LeadGradeEnum.B;
        }
        if (score >= 40) {
            return LeadGradeEnum.C;
        }
        return LeadGradeEnum.D;
    }

    private int contactScore(LeadEntity lead) {
        int score = 0;
        if (hasText(lead.getPhone())) {
            score += 5;
        }
        if (hasText(lead.getEmail())) {
            score += 5;
        }
        if (hasText(lead.getProfileUrl())) {
            score += 5;
        }
        if (hasText(lead.getJobTitle())) {
            score += 5;
        }
        return score;
    }

    private int engagementScore(LeadEntity lead) {
        int score = 0;
        if (lead.getFollowupCount() > 0) {
            score += 5;
        }
        if (lead.getMessagesReceived() > 0) {
            score += 10;
        }
        if (lead.getMessagesReceived() >= 3) {
            score += 10;
        }
        if (lead.getMessagesSent() > 0) {
            score += 5;
        }
        return score;
    }

    private int qualificationScore(LeadEntity lead) {
        int score = 0;
        if (lead.getBudgetMin() != null && lead.getBudgetMax() != null) {
            score += 10;
        }
        if (lead.getPropertyType() != null) {
            score += 5;
        }
        if (!isEmpty(lead.getPreferredLocations())) {
            score += 5;
        }
        if (lead.getTransactionType() != null) {
            score += 5;
        }
        if (lead.getPurpose() != null) {
            score += 5;
        }
        return score;
    }

    private int intentScore(LeadEntity lead) {
        int score = 0;
        if (!isEmpty(lead.getViewedPropertyIds())) {
            score += 5;
        }
        if (!isEmpty(lead.getFavoritedPropertyIds())) {
            score += 5;
        }
        if (lead.getLastActiveAt() != null) {
            score += 10;
        }
        return score;
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
