package com.bullrunhub.gameservice.games.bullrun.interfaces.http;

import com.bullrunhub.gameservice.common.WebExceptionAdvice;
import com.bullrunhub.gameservice.games.bullrun.application.SessionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("BullRunDebugController")
class BullRunDebugControllerTest {

    @Mock
    private SessionCoordinator coordinator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BullRunDebugController(coordinator))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    @DisplayName("ending a running game returns ended=true")
    void end_running() throws Exception {
        when(coordinator.endGame("ABC234")).thenReturn(true);

        mockMvc.perform(post("/debug/rooms/{code}/end", "ABC234"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.roomId").value("ABC234"))
                .andExpect(jsonPath("$.data.ended").value(true));
    }

    @Test
    @DisplayName("ending a room that is not running is a conflict")
    void end_notRunning() throws Exception {
        when(coordinator.endGame("ABC234")).thenReturn(false);

        mockMvc.perform(post("/debug/rooms/{code}/end", "ABC234"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Game has not started"));
    }
}
