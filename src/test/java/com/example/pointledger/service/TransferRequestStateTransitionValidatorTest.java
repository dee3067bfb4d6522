package com.example.pointledger.service;

import com.example.pointledger.entity.TransferRequestStatus;
import com.example.pointledger.service.impl.TransferRequestStateTransitionValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TransferRequestStateTransitionValidator Unit Tests")
class TransferRequestStateTransitionValidatorTest {

    @ParameterizedTest
    @EnumSource(value = TransferRequestStatus.class, names = "PENDING", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("isTransitionAllowed - From PENDING - Allows every terminal status")
    void isTransitionAllowed_FromPending_AllowsEveryTerminalStatus(TransferRequestStatus target) {
        assertThat(TransferRequestStateTransitionValidator.isTransitionAllowed(TransferRequestStatus.PENDING, target))
            .isTrue();
        assertThat(TransferRequestStateTransitionValidator.isTerminalState(target)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = TransferRequestStatus.class, names = "PENDING", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("isTransitionAllowed - From terminal status - Allows nothing")
    void isTransitionAllowed_FromTerminalStatus_AllowsNothing(TransferRequestStatus current) {
        for (TransferRequestStatus target : TransferRequestStatus.values()) {
            assertThat(TransferRequestStateTransitionValidator.isTransitionAllowed(current, target)).isFalse();
        }
    }

    @Test
    @DisplayName("isTransitionAllowed - PENDING to PENDING or null - Not allowed")
    void isTransitionAllowed_PendingToPendingOrNull_NotAllowed() {
        assertThat(TransferRequestStateTransitionValidator.isTransitionAllowed(
            TransferRequestStatus.PENDING, TransferRequestStatus.PENDING)).isFalse();
        assertThat(TransferRequestStateTransitionValidator.isTransitionAllowed(null, TransferRequestStatus.APPROVED))
            .isFalse();
        assertThat(TransferRequestStateTransitionValidator.isTerminalState(TransferRequestStatus.PENDING)).isFalse();
        assertThat(TransferRequestStateTransitionValidator.isTerminalState(null)).isFalse();
    }
}
