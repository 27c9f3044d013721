package com.leadengine.test;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.test.support.LeadEngineFixture;
import com.leadengine.trigger.application.command.LeadCommandService;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.trigger.application.query.LeadQueryService;
import com.leadengine.trigger.http.GlobalApiExceptionHandler;
import com.leadengine.trigger.http.LeadController;
import com.leadengine.types.enums.ResponseCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class LeadControllerTest {

    private LeadEngineFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        fixture = new LeadEngineFixture();
        LeadViewAssembler assembler = new LeadViewAssembler();
        LeadController controller = new LeadController(fixture.leadResolve,
                new LeadCommandService(fixture.persistence),
                new LeadQueryService(fixture.leadRepository, assembler),
                assembler);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldResolveSameLeadTwice() throws Exception {
        String body = "{\"tenantId\":7,\"profileUrl\":\"https://www.linkedin.com/in/maryam\","
                + "\"name\":\"Maryam\",\"source\":\"linkedin\"}";

        mockMvc.perform(post("/api/v1/leads/resolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.created").value(true))
                .andExpect(jsonPath("$.data.lead.name").value("Maryam"));
        mockMvc.perform(post("/api/v1/leads/resolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(jsonPath("$.data.created").value(false));

        Assertions.assertEquals(1, fixture.leadRepository.size());
    }

    @Test
    public void shouldRejectResolveWithoutTenant() throws Exception {
        mockMvc.perform(post("/api/v1/leads/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"+971501234567\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldReturnNotFoundForUnknownLead() throws Exception {
        mockMvc.perform(get("/api/v1/leads/999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldRemoveLeadFromPipeline() throws Exception {
        LeadEntity lead = fixture.leadRepository.put(fixture.dueTelegramLead("tg-1", "Shirin"));

        mockMvc.perform(delete("/api/v1/leads/" + lead.getId() + "/pipeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.nextFollowupAt").doesNotExist());

        Assertions.assertNull(fixture.leadRepository.findById(lead.getId()).getNextFollowupAt());
    }

    @Test
    public void shouldRecordViewedPropertyOnce() throws Exception {
        LeadEntity lead = fixture.leadRepository.put(fixture.dueTelegramLead("tg-2", "Babak"));

        mockMvc.perform(post("/api/v1/leads/" + lead.getId() + "/viewed/31"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()));
        mockMvc.perform(post("/api/v1/leads/" + lead.getId() + "/viewed/31"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()));

        Assertions.assertEquals(1, fixture.leadRepository.findById(lead.getId()).getViewedPropertyIds().size());
    }

    @Test
    public void shouldRejectInteractionWithUnknownDirection() throws Exception {
        LeadEntity lead = fixture.leadRepository.put(fixture.dueTelegramLead("tg-3", "Elham"));

        mockMvc.perform(post("/api/v1/leads/" + lead.getId() + "/interactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"telegram\",\"direction\":\"sideways\",\"text\":\"called\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }
}
