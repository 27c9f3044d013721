package com.leadengine.trigger.job;

import com.leadengine.domain.followup.model.valobj.CampaignRunResult;
import com.leadengine.trigger.application.command.FollowupCampaignApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 活动守护进程：执行到期的已排期活动。
 */
@Slf4j
@Component
public class CampaignDaemon {

    private final FollowupCampaignApplicationService followupCampaignApplicationService;
    private final boolean enabled;

    public CampaignDaemon(FollowupCampaignApplicationService followupCampaignApplicationService,
                          @Value("${campaign.scheduler-enabled:true}") boolean enabled) {
        this.followupCampaignApplicationService = followupCampaignApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${campaign.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void runDueCampaigns() {
        if (!enabled) {
            return;
        }
        try {
            List<CampaignRunResult> results = followupCampaignApplicationService.runDueCampaigns();
            if (!results.isEmpty()) {
                log.debug("Due campaigns executed. count={}", results.size());
            }
        } catch (Exception ex) {
            log.error("Campaign run aborted. error={}", ex.getMessage(), ex);
        }
    }
}
