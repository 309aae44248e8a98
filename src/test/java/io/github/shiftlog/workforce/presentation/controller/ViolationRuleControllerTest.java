package io.github.shiftlog.workforce.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.shiftlog.workforce.application.service.ViolationRuleService;
import io.github.shiftlog.workforce.domain.exception.ConflictException;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ViolationRuleController.class)
@AutoConfigureMockMvc(addFilters = false)
class ViolationRuleControllerTest {

    @SpringBootConfiguration
    @Import({ViolationRuleController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    ViolationRuleService ruleService;

    @BeforeEach
    void setup() {
        Mockito.reset(ruleService);
    }

    @Test
    void create_returns201() throws Exception {
        when(ruleService.createRule(1L, "late", "Late arrival", new BigDecimal("5"), true)).thenReturn(rule(7L, true));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("code", "late");
        req.put("name", "Late arrival");
        req.put("penaltyPercent", 5);
        req.put("autoDetectable", true);

        mockMvc.perform(post("/api/companies/{companyId}/violation-rules", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void create_penaltyAboveHundred_returns400() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("code", "late");
        req.put("name", "Late arrival");
        req.put("penaltyPercent", 120);

        mockMvc.perform(post("/api/companies/{companyId}/violation-rules", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("penaltyPercent must be at most 100"));
        verifyNoInteractions(ruleService);
    }

    @Test
    void create_duplicateCode_returns409() throws Exception {
        when(ruleService.createRule(anyLong(), anyString(), anyString(), any(), anyBoolean()))
                .thenThrow(new ConflictException("violation rule with code 'late' already exists"));

        mockMvc.perform(post("/api/companies/{companyId}/violation-rules", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"late\",\"name\":\"Late\",\"penaltyPercent\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"));
    }

    @Test
    void update_passesOnlyProvidedFields() throws Exception {
        when(ruleService.updateRule(1L, 7L, null, new BigDecimal("20"), null, null)).thenReturn(rule(7L, true));

        mockMvc.perform(patch("/api/companies/{companyId}/violation-rules/{ruleId}", 1L, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"penaltyPercent\":20}"))
                .andExpect(status().isOk());
        verify(ruleService).updateRule(1L, 7L, null, new BigDecimal("20"), null, null);
    }

    @Test
    void delete_deactivates() throws Exception {
        when(ruleService.deactivateRule(1L, 7L)).thenReturn(rule(7L, false));

        mockMvc.perform(delete("/api/companies/{companyId}/violation-rules/{ruleId}", 1L, 7L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    private static ViolationRule rule(Long id, boolean active) {
        ViolationRule r = new ViolationRule();
        r.setId(id);
        r.setCompanyId(1L);
        r.setCode("late");
        r.setName("Late arrival");
        r.setPenaltyPercent(new BigDecimal("5"));
        r.setActive(active);
        return r;
    }
}
