package com.xbleey.signalalert.controller;

import com.xbleey.signalalert.exception.InvalidSignalRequestException;
import com.xbleey.signalalert.mapper.SignalAlertHistoryMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AlertControllerTest {

    private final SignalAlertHistoryMapper mapper = mock(SignalAlertHistoryMapper.class);
    private final AlertController controller = new AlertController(mapper);

    @Test
    void unknownSignalTypeIsRejected() {
        assertThatThrownBy(() -> controller.list(1, 20, null, List.of("risk,price")))
                .isInstanceOf(InvalidSignalRequestException.class)
                .hasMessage("Unknown signal type: price");

        verify(mapper, never()).selectPage(any(), any());
    }

    @Test
    void malformedWalletIsRejected() {
        assertThatThrownBy(() -> controller.list(1, 20, "0x123", null))
                .isInstanceOf(InvalidSignalRequestException.class)
                .hasMessage("Invalid wallet address format: 0x123");

        verify(mapper, never()).selectPage(any(), any());
    }
}
