package vn.com.fecredit.fileportal.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.fileportal.core.ExpiryReaper;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadSessionTimeoutServiceTest {

    @Mock
    private ExpiryReaper expiryReaper;

    @InjectMocks
    private UploadSessionTimeoutService timeoutService;

    @Test
    void cleanupRunsSweep() {
        when(expiryReaper.sweep()).thenReturn(3);

        timeoutService.cleanupExpiredSessions();

        verify(expiryReaper, times(1)).sweep();
    }

    @Test
    void sweepFailureDoesNotEscapeScheduler() {
        when(expiryReaper.sweep()).thenThrow(new IllegalStateException("database unavailable"));

        assertDoesNotThrow(() -> timeoutService.cleanupExpiredSessions());
        verify(expiryReaper).sweep();
    }
}
