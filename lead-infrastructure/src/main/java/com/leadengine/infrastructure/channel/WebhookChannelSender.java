package com.leadengine.infrastructure.channel;

import com.leadengine.domain.followup.adapter.gateway.IChannelSender;
import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.types.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通过 HTTP 把出站消息转交给渠道适配层。
 * <p>
 * 5xx、429 与网络异常视为暂时性失败，其它 4xx 视为永久失败。
 * </p>
 */
@Slf4j
@Component
@EnableConfigurationProperties(ChannelSenderProperties.class)
public class WebhookChannelSender implements IChannelSender {

    private final RestTemplate restTemplate;
    private final ChannelSenderProperties properties;

    @Autowired
    public WebhookChannelSender(ChannelSenderProperties properties) {
        this.properties = properties;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());
        this.restTemplate = new RestTemplate(requestFactory);
    }

    public WebhookChannelSender(ChannelSenderProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(OutboundMessage message) throws ChannelDeliveryException {
        if (message == null || message.channel() == null) {
            throw new ChannelDeliveryException("Outbound message has no channel", false);
        }
        String endpoint = properties.getEndpoints().get(message.channel().getCode());
        if (StringUtils.isBlank(endpoint)) {
            throw new ChannelDeliveryException("No sender endpoint for channel: " + message.channel().getCode(), false);
        }
        if (StringUtils.isBlank(message.recipient())) {
            throw new ChannelDeliveryException("Outbound message has no recipient. leadId=" + message.leadId(), false);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leadId", message.leadId());
        body.put("channel", message.channel().getCode());
        body.put("recipient", message.recipient());
        body.put("text", message.text());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            restTemplate.postForEntity(endpoint, new HttpEntity<>(body, headers), Void.class);
            log.debug("Channel message sent. leadId={}, channel={}", message.leadId(), message.channel().getCode());
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            boolean transientFailure = status >= 500 || status == 429;
            throw new ChannelDeliveryException("Channel responded with status " + status, transientFailure, ex);
        } catch (ResourceAccessException ex) {
            throw new ChannelDeliveryException("Channel unreachable: " + ex.getMessage(), true, ex);
        }
    }
}
