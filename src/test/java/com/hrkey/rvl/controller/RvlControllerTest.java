package com.hrkey.rvl.controller;

import com.hrkey.rvl.dto.*;
import com.hrkey.rvl.exception.ReferenceValidationException;
import com.hrkey.rvl.exception.ValidationErrorCode;
import com.hrkey.rvl.service.ReferenceValidationOrchestrator;
import com.hrkey.rvl.service.StructuredOutputGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RvlController.class)
class RvlControllerTest {

    private static final String BODY = "{\"summary\":\"Maria led our payments team for three years.\","
            + "\"kpiRatings\":{\"communication\":4.5},\"referrerEmail\":\"maria.lopez@acme-corp.com\"}";

    @Autowired private MockMvc mvc;

    @MockBean private ReferenceValidationOrchestrator orchestrator;
    @MockBean private StructuredOutputGenerator outputGenerator;

    private static PublicReferenceView view() {
        return new PublicReferenceView(ValidationStatus.APPROVED, 0.88, 4, 1.0, Map.of(), List.of(),
                new PublicReferenceView.Meta(null, "1.0.0"), null, null);
    }

    @Test
    @DisplayName("GET /info returns the layer status")
    void info() throws Exception {
        when(orchestrator.getInfo()).thenReturn(new RvlInfo("1.0.0", Map.of("fraud_detection", true), Map.of(),
                new EmbeddingServiceStatus("hash", "hash-v1", 1536, false, true, false)));

        mvc.perform(get("/api/v1/rvl/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.embedding.provider").value("hash"));
    }

    @Test
    @DisplayName("POST /preview validates without embeddings and returns the public view")
    void preview() throws Exception {
        when(outputGenerator.forPublicApi(any(), eq(false))).thenReturn(view());

        mvc.perform(post("/api/v1/rvl/preview").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.fraudScore").value(4))
                .andExpect(jsonPath("$.internal").doesNotExist());

        ArgumentCaptor<ValidationOptions> options = ArgumentCaptor.forClass(ValidationOptions.class);
        verify(orchestrator).validateReference(any(ReferenceSubmission.class), options.capture());
        assertThat(options.getValue().skipEmbeddings()).isTrue();
    }

    @Test
    @DisplayName("POST /preview passes includeInternal through")
    void previewInternal() throws Exception {
        when(outputGenerator.forPublicApi(any(), eq(true))).thenReturn(view());

        mvc.perform(post("/api/v1/rvl/preview?includeInternal=true")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk());

        verify(outputGenerator).forPublicApi(any(), eq(true));
    }

    @Test
    @DisplayName("missing summary is a 400")
    void missingSummary() throws Exception {
        mvc.perform(post("/api/v1/rvl/preview").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kpiRatings\":{\"communication\":4.5}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("TEXT_TOO_SHORT maps to 422 with the error code")
    void tooShort() throws Exception {
        when(orchestrator.validateReference(any(), any())).thenThrow(
                new ReferenceValidationException(ValidationErrorCode.TEXT_TOO_SHORT, "Narrative text too short"));

        mvc.perform(post("/api/v1/rvl/preview").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("TEXT_TOO_SHORT"))
                .andExpect(jsonPath("$.message").value("Narrative text too short"));
    }
}
