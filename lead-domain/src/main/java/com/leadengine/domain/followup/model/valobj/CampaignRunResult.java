package com.leadengine.domain.followup.model.valobj;

/**
 * 单个活动的执行统计。
 */
public record CampaignRunResult(Long campaignId, int targeted, int sent, int failed) {
}
