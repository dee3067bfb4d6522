package com.example.pointledger.event;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.entity.TransferRequestStatus;
import com.example.pointledger.mq.producer.LedgerEventProducer;
import com.example.pointledger.mq.producer.LedgerEventPublishException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

/**
 * TransferRequestStatusChangedListener 單元測試
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransferRequestStatusChangedListener Unit Tests")
class TransferRequestStatusChangedListenerTest {

    @Mock
    private LedgerEventProducer producer;

    @InjectMocks
    private TransferRequestStatusChangedListener listener;

    @Test
    @DisplayName("handleTransferRequestStatusChanged - With new request - Sends MQ notification")
    void handleTransferRequestStatusChanged_WithNewRequest_SendsMQ() {
        // Given
        TransferRequestStatusChangedEvent event = new TransferRequestStatusChangedEvent(
            this, request(TransferRequestStatus.PENDING), null);

        // When
        listener.handleTransferRequestStatusChanged(event);

        // Then
        assertThat(event.isTerminalState()).isFalse();
        verify(producer, times(1)).sendTransferRequestStatus(event);
    }

    @Test
    @DisplayName("handleTransferRequestStatusChanged - MQ send fails - Logs without rethrowing")
    void handleTransferRequestStatusChanged_MQSendFails_DoesNotRethrow() {
        // Given
        TransferRequestStatusChangedEvent event = new TransferRequestStatusChangedEvent(
            this, request(TransferRequestStatus.EXPIRED), TransferRequestStatus.PENDING);
        doThrow(new LedgerEventPublishException("Failed to send MQ message", new RuntimeException("timeout")))
            .when(producer).sendTransferRequestStatus(event);

        // When & Then
        assertThat(event.isTerminalState()).isTrue();
        assertThatCode(() -> listener.handleTransferRequestStatusChanged(event)).doesNotThrowAnyException();
    }

    private TransferRequest request(TransferRequestStatus status) {
        return TransferRequest.builder()
            .id(1L)
            .fromUserId("user_001")
            .toUserId("user_002")
            .amount(30L)
            .status(status)
            .expiresAt(LocalDateTime.of(2026, 1, 11, 12, 0))
            .build();
    }
}
