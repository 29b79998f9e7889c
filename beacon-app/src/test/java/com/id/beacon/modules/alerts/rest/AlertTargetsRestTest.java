package com.id.beacon.modules.alerts.rest;

import com.id.beacon.config.AppConfig;
import com.id.beacon.modules.alerts.model.BeaconAlertTarget;
import com.id.beacon.modules.alerts.service.AlertTargetsService;
import com.id.beacon.modules.ingest.logic.ApiKeyVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AlertTargetsRest.class)
@AutoConfigureMockMvc(addFilters = false)
@TestPropertySource(properties = "beacon.security.api-key=test-key")
@Import({AppConfig.class, ApiKeyVerifier.class})
class AlertTargetsRestTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AlertTargetsService alertTargetsService;

    @Test
    void listRequiresKey() throws Exception {
        mockMvc.perform(get("/alert-targets"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(alertTargetsService);
    }

    @Test
    void listReturnsTargets() throws Exception {
        when(alertTargetsService.findAll()).thenReturn(List.of(
                BeaconAlertTarget.builder().clusterId("eu-1").chatId("42").description("ops").build()));

        mockMvc.perform(get("/alert-targets").header("x-api-key", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].clusterId").value("eu-1"))
                .andExpect(jsonPath("$[0].chatId").value("42"));
    }

    @Test
    void unknownClusterIsNotFound() throws Exception {
        when(alertTargetsService.findByClusterId("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/alert-targets/nope").header("x-api-key", "test-key"))
                .andExpect(status().isNotFound());
    }

    @Test
    void putStoresTarget() throws Exception {
        when(alertTargetsService.save(eq("eu-1"), any(BeaconAlertTarget.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));

        mockMvc.perform(put("/alert-targets/eu-1")
                        .header("x-api-key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":\"-100123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clusterId").value("eu-1"))
                .andExpect(jsonPath("$.chatId").value("-100123"))
                .andExpect(jsonPath("$.description").value(""));
    }

    @Test
    void putWithoutChatIdIsBadRequest() throws Exception {
        mockMvc.perform(put("/alert-targets/eu-1")
                        .header("x-api-key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"missing chat\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(alertTargetsService);
    }

    @Test
    void deleteReturnsNoContentOrNotFound() throws Exception {
        when(alertTargetsService.delete("eu-1")).thenReturn(true);
        when(alertTargetsService.delete("eu-2")).thenReturn(false);

        mockMvc.perform(delete("/alert-targets/eu-1").header("x-api-key", "test-key"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/alert-targets/eu-2").header("x-api-key", "test-key"))
                .andExpect(status().isNotFound());

        verify(alertTargetsService).delete("eu-1");
    }
}
