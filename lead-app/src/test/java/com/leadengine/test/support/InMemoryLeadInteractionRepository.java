package com.leadengine.test.support;

import com.leadengine.domain.lead.adapter.repository.ILeadInteractionRepository;
import com.leadengine.domain.lead.model.entity.LeadInteractionEntity;
import com.leadengine.types.enums.DeliveryStatusEnum;
import com.leadengine.types.enums.InteractionDirectionEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryLeadInteractionRepository implements ILeadInteractionRepository {

    private final List<LeadInteractionEntity> rows = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized LeadInteractionEntity append(LeadInteractionEntity entity) {
        entity.validate();
        entity.setId(ids.incrementAndGet());
        rows.add(entity);
        return entity;
    }

    @Override
    public synchronized List<LeadInteractionEntity> findRecentByLeadId(Long leadId, int limit) {
        List<LeadInteractionEntity> result = new ArrayList<>();
        for (int i = rows.size() - 1; i >= 0 && result.size() < limit; i--) {
            if (leadId.equals(rows.get(i).getLeadId())) {
                result.add(rows.get(i));
            }
        }
        return result;
    }

    public synchronized List<LeadInteractionEntity> all() {
        return new ArrayList<>(rows);
    }

    public synchronized List<LeadInteractionEntity> outbound(Long leadId, DeliveryStatusEnum status) {
        return rows.stream()
                .filter(row -> leadId.equals(row.getLeadId()))
                .filter(row -> row.getDirection() == InteractionDirectionEnum.OUTBOUND)
                .filter(row -> row.getDeliveryStatus() == status)
                .collect(Collectors.toList());
    }
}
