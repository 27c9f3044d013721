package com.leadengine.test;

import com.google.common.cache.CacheBuilder;
import com.leadengine.domain.session.service.SessionRoutingDomainService;
import com.leadengine.infrastructure.repository.session.LocalRoutingSessionRepository;
import com.leadengine.test.support.LeadEngineFixture;
import com.leadengine.trigger.application.command.InboundMessageApplicationService;
import com.leadengine.trigger.application.command.SessionRoutingApplicationService;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.trigger.http.GlobalApiExceptionHandler;
import com.leadengine.trigger.http.InboundMessageController;
import com.leadengine.types.enums.ResponseCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class InboundMessageControllerTest {

    private LeadEngineFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        fixture = new LeadEngineFixture();
        SessionRoutingApplicationService routing = new SessionRoutingApplicationService(
                new LocalRoutingSessionRepository(CacheBuilder.newBuilder().build()),
                new SessionRoutingDomainService(), 24L);
        InboundMessageApplicationService inboundService = new InboundMessageApplicationService(routing,
                fixture.leadResolve, fixture.persistence, fixture.engine((question, language, lead) -> null),
                fixture.leadRepository);
        mockMvc = MockMvcBuilders.standaloneSetup(new InboundMessageController(inboundService, new LeadViewAssembler()))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnLanguageListForBootstrapMessage() throws Exception {
        mockMvc.perform(post("/api/v1/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"telegram\",\"externalUserId\":\"tg-100\",\"displayName\":\"Omid\","
                                + "\"text\":\"/start start_realty_7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.routed").value(true))
                .andExpect(jsonPath("$.data.tenantId").value(7))
                .andExpect(jsonPath("$.data.conversationState").value("language_select"))
                .andExpect(jsonPath("$.data.interrupted").value(false))
                .andExpect(jsonPath("$.data.outbound[0].type").value("send_list"))
                .andExpect(jsonPath("$.data.outbound[0].options[0].id").value("lang_en"));

        Assertions.assertEquals(1, fixture.leadRepository.size());
    }

    @Test
    public void shouldAnswerUnroutedMessageWithoutLead() throws Exception {
        mockMvc.perform(post("/api/v1/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"whatsapp\",\"externalUserId\":\"wa-9\",\"text\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.routed").value(false))
                .andExpect(jsonPath("$.data.leadId").doesNotExist());

        Assertions.assertEquals(0, fixture.leadRepository.size());
    }

    @Test
    public void shouldRouteDedicatedEntryByPath() throws Exception {
        mockMvc.perform(post("/api/v1/inbound/12")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"whatsapp\",\"externalUserId\":\"wa-10\",\"text\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.routed").value(true))
                .andExpect(jsonPath("$.data.tenantId").value(12));
    }

    @Test
    public void shouldRejectUnknownChannel() throws Exception {
        mockMvc.perform(post("/api/v1/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"fax\",\"externalUserId\":\"x\",\"text\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldRejectMissingExternalUserId() throws Exception {
        mockMvc.perform(post("/api/v1/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"telegram\",\"text\":\"/start start_realty_7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }
}
