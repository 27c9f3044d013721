package com.leadengine.domain.conversation.model.valobj;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ConversationStateEnum;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话推进结果。
 *
 * @param reply        回复文本
 * @param nextState    推进后的状态
 * @param fieldUpdates 线索字段变更
 * @param options      回复附带的选项，可为空
 * @param sideEffects  额外副作用请求
 * @param interrupted  是否按插话处理（回答问题并重复当前提问）
 */
public record AdvanceResult(String reply,
                            ConversationStateEnum nextState,
                            LeadFieldUpdates fieldUpdates,
                            List<ReplyOption> options,
                            List<OutboundRequest> sideEffects,
                            boolean interrupted) {

    public AdvanceResult {
        fieldUpdates = fieldUpdates == null ? LeadFieldUpdates.none() : fieldUpdates;
        options = options == null ? List.of() : List.copyOf(options);
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    /**
     * 回复本身加上额外副作用，按发送顺序排列
     */
    public List<OutboundRequest> outboundRequests() {
        List<OutboundRequest> requests = new ArrayList<>();
        if (reply != null && !reply.isBlank()) {
            requests.add(OutboundRequest.reply(reply, options));
        }
        requests.addAll(sideEffects);
        return requests;
    }

    public void applyTo(LeadEntity lead) {
        if (lead == null) {
            return;
        }
        fieldUpdates.applyTo(lead);
        if (nextState != null) {
            lead.setConversationState(nextState);
        }
    }
}
