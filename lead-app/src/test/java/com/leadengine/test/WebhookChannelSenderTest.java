package com.leadengine.test;

import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.infrastructure.channel.ChannelSenderProperties;
import com.leadengine.infrastructure.channel.WebhookChannelSender;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.exception.ChannelDeliveryException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class WebhookChannelSenderTest {

    private static final String TELEGRAM_ENDPOINT = "http://adapter.local/telegram/send";

    private MockRestServiceServer server;
    private WebhookChannelSender sender;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ChannelSenderProperties properties = new ChannelSenderProperties();
        properties.getEndpoints().put(ChannelEnum.TELEGRAM.getCode(), TELEGRAM_ENDPOINT);
        sender = new WebhookChannelSender(properties, restTemplate);
    }

    @Test
    public void shouldPostMessageToChannelEndpoint() throws Exception {
        server.expect(requestTo(TELEGRAM_ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.leadId").value(42))
                .andExpect(jsonPath("$.channel").value("telegram"))
                .andExpect(jsonPath("$.recipient").value("tg-42"))
                .andExpect(jsonPath("$.text").value("hello"))
                .andRespond(withSuccess());

        sender.send(message(ChannelEnum.TELEGRAM, "tg-42"));

        server.verify();
    }

    @Test
    public void shouldTreatServerErrorAsTransient() {
        server.expect(requestTo(TELEGRAM_ENDPOINT)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        ChannelDeliveryException ex = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.TELEGRAM, "tg-42")));

        Assertions.assertTrue(ex.isTransientFailure());
    }

    @Test
    public void shouldTreatRateLimitAsTransient() {
        server.expect(requestTo(TELEGRAM_ENDPOINT)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        ChannelDeliveryException ex = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.TELEGRAM, "tg-42")));

        Assertions.assertTrue(ex.isTransientFailure());
    }

    @Test
    public void shouldTreatClientErrorAsPermanent() {
        server.expect(requestTo(TELEGRAM_ENDPOINT)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        ChannelDeliveryException ex = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.TELEGRAM, "tg-42")));

        Assertions.assertFalse(ex.isTransientFailure());
    }

    @Test
    public void shouldTreatNetworkErrorAsTransient() {
        server.expect(requestTo(TELEGRAM_ENDPOINT)).andRespond(withException(new IOException("connection reset")));

        ChannelDeliveryException ex = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.TELEGRAM, "tg-42")));

        Assertions.assertTrue(ex.isTransientFailure());
    }

    @Test
    public void shouldFailPermanentlyWithoutEndpointOrRecipient() {
        ChannelDeliveryException noEndpoint = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.WHATSAPP, "wa-1")));
        ChannelDeliveryException noRecipient = Assertions.assertThrows(ChannelDeliveryException.class,
                () -> sender.send(message(ChannelEnum.TELEGRAM, " ")));

        Assertions.assertFalse(noEndpoint.isTransientFailure());
        Assertions.assertFalse(noRecipient.isTransientFailure());
        server.verify();
    }

    private OutboundMessage message(ChannelEnum channel, String recipient) {
        return new OutboundMessage(42L, channel, recipient, "hello");
    }
}
