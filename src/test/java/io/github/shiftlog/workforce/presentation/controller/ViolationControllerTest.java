package io.github.shiftlog.workforce.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.shiftlog.workforce.application.service.ViolationService;
import io.github.shiftlog.workforce.domain.exception.RuleInactiveException;
import io.github.shiftlog.workforce.domain.exception.ScopeMismatchException;
import io.github.shiftlog.workforce.domain.model.ViolationSource;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
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
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ViolationController.class)
@AutoConfigureMockMvc(addFilters = false)
class ViolationControllerTest {

    @SpringBootConfiguration
    @Import({ViolationController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    ViolationService violationService;

    @BeforeEach
    void setup() {
        Mockito.reset(violationService);
    }

    @Test
    void record_defaultsToManualSource() throws Exception {
        Violation v = new Violation();
        v.setId(11L);
        v.setPenalty(new BigDecimal("5"));
        when(violationService.recordViolation(2L, 1L, 3L, ViolationSource.MANUAL, "late", null)).thenReturn(v);

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("employeeId", 2);
        req.put("ruleId", 3);
        req.put("reason", "late");

        mockMvc.perform(post("/api/companies/{companyId}/violations", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(11))
                .andExpect(jsonPath("$.penalty").value(5));
    }

    @Test
    void record_crossTenant_returns403() throws Exception {
        when(violationService.recordViolation(any(), any(), any(), any(), any(), any()))
                .thenThrow(new ScopeMismatchException("Employee", 2L, 1L));

        mockMvc.perform(post("/api/companies/{companyId}/violations", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":2,\"ruleId\":3}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("SCOPE_MISMATCH"));
    }

    @Test
    void record_inactiveRule_returns422() throws Exception {
        when(violationService.recordViolation(any(), any(), any(), any(), any(), any()))
                .thenThrow(new RuleInactiveException(3L));

        mockMvc.perform(post("/api/companies/{companyId}/violations", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":2,\"ruleId\":3}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("RULE_INACTIVE"));
    }

    @Test
    void record_missingRule_returns400() throws Exception {
        mockMvc.perform(post("/api/companies/{companyId}/violations", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("ruleId is required"));
        verifyNoInteractions(violationService);
    }

    @Test
    void listByCompany_parsesDateRange() throws Exception {
        when(violationService.listByCompany(1L, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 1)))
                .thenReturn(List.of(new Violation(), new Violation()));

        mockMvc.perform(get("/api/companies/{companyId}/violations", 1L)
                        .param("from", "2025-01-01")
                        .param("to", "2025-02-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void listByEmployee_openRange() throws Exception {
        when(violationService.listByEmployee(eq(1L), eq(2L), isNull(), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/api/companies/{companyId}/violations/employees/{employeeId}", 1L, 2L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        verify(violationService).listByEmployee(1L, 2L, null, null);
    }
}
