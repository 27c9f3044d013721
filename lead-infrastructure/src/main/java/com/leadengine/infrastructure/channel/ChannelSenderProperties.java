package com.leadengine.infrastructure.channel;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 渠道发送配置：各渠道适配层的 webhook 地址
 */
@Data
@ConfigurationProperties(prefix = "channel.sender")
public class ChannelSenderProperties {

    /**
     * 渠道编码 -> 发送地址，例如 telegram -> http://adapter/telegram/send
     */
    private Map<String, String> endpoints = new HashMap<>();

    private int connectTimeoutMs = 3000;

    private int readTimeoutMs = 10000;
}
