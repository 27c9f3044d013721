package com.leadengine.domain.conversation.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 出站副作用请求。会话引擎与调度器只产生请求，由外部发送方或渲染方执行。
 */
public sealed interface OutboundRequest {

    int MAX_BUTTONS = 3;
    int MAX_LIST_OPTIONS = 10;

    record SendText(String text) implements OutboundRequest {
    }

    record SendButtons(String text, List<ReplyOption> options) implements OutboundRequest {
        public SendButtons {
            options = List.copyOf(options);
            if (options.isEmpty() || options.size() > MAX_BUTTONS) {
                throw new IllegalArgumentException("Buttons require 1.." + MAX_BUTTONS + " options, got " + options.size());
            }
        }
    }

    record SendList(String text, List<ReplyOption> options) implements OutboundRequest {
        public SendList {
            options = List.copyOf(options);
            if (options.isEmpty() || options.size() > MAX_LIST_OPTIONS) {
                throw new IllegalArgumentException("List requires 1.." + MAX_LIST_OPTIONS + " options, got " + options.size());
            }
        }
    }

    record RequestContactShare(String prompt) implements OutboundRequest {
    }

    record GenerateReport(String kind, Map<String, Object> params) implements OutboundRequest {
        public GenerateReport {
            params = params == null ? Map.of() : Map.copyOf(params);
        }
    }

    record NotifyOperator(String message) implements OutboundRequest {
    }

    /**
     * 根据选项数量选择按钮或列表
     */
    static OutboundRequest reply(String text, List<ReplyOption> options) {
        if (options == null || options.isEmpty()) {
            return new SendText(text);
        }
        if (options.size() <= MAX_BUTTONS) {
            return new SendButtons(text, options);
        }
        return new SendList(text, options);
    }
}
