package com.mirrorwatch.watch.api;

import com.mirrorwatch.watch.model.CycleSummary;
import com.mirrorwatch.watch.service.CycleInProgressException;
import com.mirrorwatch.watch.service.WatchScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WatchControllerTest {

    @Mock
    private WatchScheduler scheduler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WatchController(scheduler))
            .setControllerAdvice(new WatchExceptionHandler())
            .build();
    }

    @Test
    void runReturnsCycleSummary() throws Exception {
        Instant start = Instant.parse("2024-06-01T12:00:00Z");
        when(scheduler.runNow()).thenReturn(new CycleSummary(
            4, start, start.plusSeconds(3), Duration.ofSeconds(3), 2, 1, 5, 10, List.of()
        ));

        mockMvc.perform(post("/api/watch/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cycleNumber").value(4))
            .andExpect(jsonPath("$.accountsChecked").value(2))
            .andExpect(jsonPath("$.accountsFailed").value(1))
            .andExpect(jsonPath("$.newItems").value(5))
            .andExpect(jsonPath("$.enqueuedTasks").value(10));
    }

    @Test
    void overlappingRunIsRejectedWithConflict() throws Exception {
        when(scheduler.runNow()).thenThrow(new CycleInProgressException("A watch cycle is already running"));

        mockMvc.perform(post("/api/watch/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("cycle_in_progress"))
            .andExpect(jsonPath("$.message").value("A watch cycle is already running"));
    }
}
