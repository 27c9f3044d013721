package com.leadengine.trigger.application.command;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.InteractionDirectionEnum;
import com.leadengine.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.function.Supplier;

/**
 * 线索控制写用例：移出自动跟进、外部交互记录、房源浏览/收藏记录。
 */
@Service
public class LeadCommandService {

    private final LeadPersistenceApplicationService leadPersistenceApplicationService;

    public LeadCommandService(LeadPersistenceApplicationService leadPersistenceApplicationService) {
        this.leadPersistenceApplicationService = leadPersistenceApplicationService;
    }

    public LeadEntity removeFromPipeline(Long leadId) {
        return leadPersistenceApplicationService.removeFromPipeline(leadId, LocalDateTime.now());
    }

    public LeadEntity recordInteraction(Long leadId, String channelCode, String directionCode, String text) {
        ChannelEnum channel = parse(() -> ChannelEnum.fromCode(channelCode));
        InteractionDirectionEnum direction = parse(() -> InteractionDirectionEnum.fromCode(directionCode));
        return leadPersistenceApplicationService.recordInteraction(leadId, channel, direction, text, LocalDateTime.now());
    }

    public LeadEntity markViewed(Long leadId, Long propertyId) {
        requirePropertyId(propertyId);
        return leadPersistenceApplicationService.markViewed(leadId, propertyId);
    }

    public LeadEntity markFavorited(Long leadId, Long propertyId) {
        requirePropertyId(propertyId);
        return leadPersistenceApplicationService.markFavorited(leadId, propertyId);
    }

    private void requirePropertyId(Long propertyId) {
        if (propertyId == null) {
            throw AppException.illegalParameter("propertyId 不能为空");
        }
    }

    private <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
    }
}
