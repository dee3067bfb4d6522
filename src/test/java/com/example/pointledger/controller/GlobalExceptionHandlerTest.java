package com.example.pointledger.controller;

import com.example.pointledger.entity.PointBatchStatus;
import com.example.pointledger.exception.BatchAlreadyTerminalException;
import com.example.pointledger.exception.InvalidTransferRequestStateException;
import com.example.pointledger.exception.TransferRequestNotFoundException;
import com.example.pointledger.facade.PointFacade;
import com.example.pointledger.facade.TransferRequestFacade;
import com.example.pointledger.facade.dto.GrantPointsRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {TransferRequestController.class, PointController.class})
@AutoConfigureMockMvc
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PointFacade pointFacade;

    @MockitoBean
    private TransferRequestFacade transferRequestFacade;

    @Test
    @DisplayName("handleNotFound - Unknown transfer request - Returns 404 with error response")
    void handleNotFound_UnknownTransferRequest_Returns404() throws Exception {
        when(transferRequestFacade.getTransferRequest(eq(99L), anyString()))
            .thenThrow(new TransferRequestNotFoundException(99L));

        mockMvc.perform(get("/transfer-requests/{id}", 99L).header("X-User-Id", "user_001"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.error").value("Not Found"))
            .andExpect(jsonPath("$.path").value("/transfer-requests/99"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("handleInvalidTransferRequestState - Approving expired request - Returns 409")
    void handleInvalidTransferRequestState_Returns409() throws Exception {
        when(transferRequestFacade.approveTransferRequest(eq(1L), anyString()))
            .thenThrow(new InvalidTransferRequestStateException("Cannot approve transfer request: id=1. It expired."));

        mockMvc.perform(post("/transfer-requests/{id}/approve", 1L).header("X-User-Id", "user_002"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.message").value(containsString("expired")));
    }

    @Test
    @DisplayName("handleBatchAlreadyTerminal - Returns 409 Batch Already Terminal")
    void handleBatchAlreadyTerminal_Returns409() throws Exception {
        when(pointFacade.getUpcomingExpirations(anyString()))
            .thenThrow(new BatchAlreadyTerminalException(3L, PointBatchStatus.EXPIRED));

        mockMvc.perform(get("/points/{userId}/expirations", "user_001"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Batch Already Terminal"));
    }

    @Test
    @DisplayName("handleTransientDataAccess - Lock wait exhausted retries - Returns 503")
    void handleTransientDataAccess_Returns503() throws Exception {
        when(pointFacade.getBalance(anyString())).thenThrow(new CannotAcquireLockException("Lock wait timeout exceeded"));

        mockMvc.perform(get("/points/{userId}/balance", "user_001"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Storage Unavailable"));
    }

    @Test
    @DisplayName("handleNotReadable - Malformed JSON - Returns 400 Malformed Request")
    void handleNotReadable_MalformedJson_Returns400() throws Exception {
        mockMvc.perform(post("/points/grants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\": \"user_001\", \"amount\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("handleGenericException - Unexpected error - Returns 500 without leaking details")
    void handleGenericException_Returns500() throws Exception {
        when(pointFacade.grantPoints(any(GrantPointsRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/points/grants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\": \"user_001\", \"amount\": 10}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal Server Error"))
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
