package me.golemcore.toolexec.checkpoint;

import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CheckpointRetentionServiceTest {

    @Test
    void shouldPurgeOnSweep() {
        CheckpointManager manager = mock(CheckpointManager.class);
        CheckpointRetentionService service = new CheckpointRetentionService(manager, new ToolExecProperties());

        service.sweep();
        service.sweep();

        verify(manager, times(2)).purgeExpired();
    }

    @Test
    void shouldKeepSchedulerAliveWhenPurgeFails() {
        CheckpointManager manager = mock(CheckpointManager.class);
        doThrow(new IllegalStateException("storage offline")).when(manager).purgeExpired();
        CheckpointRetentionService service = new CheckpointRetentionService(manager, new ToolExecProperties());

        assertDoesNotThrow(service::sweep);
    }
}
