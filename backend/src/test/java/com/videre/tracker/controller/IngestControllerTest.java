package com.videre.tracker.controller;

import com.videre.tracker.ingest.Notification;
import com.videre.tracker.ingest.NotificationDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = IngestController.class)
@ActiveProfiles("test")
class IngestControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private NotificationDispatcher dispatcher;

    @Test
    void matchStartedIsAcceptedAndDispatched() throws Exception {
        given(dispatcher.dispatch(any())).willReturn(CompletableFuture.completedFuture(true));

        mockMvc.perform(post("/api/ingest/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"MatchStarted\",\"matchId\":200,\"eventId\":100}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.kind", is("MatchStarted")));

        verify(dispatcher).dispatch(new Notification.MatchStarted(200, 100));
    }

    @Test
    void eventStartedWithTimestampsIsParsed() throws Exception {
        given(dispatcher.dispatch(any())).willReturn(CompletableFuture.completedFuture(true));

        mockMvc.perform(post("/api/ingest/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"EventStarted\",\"eventId\":100,\"format\":\"Modern\","
                                + "\"description\":\"League\",\"startTime\":\"2025-03-01T18:00:00Z\",\"completed\":false}"))
                .andExpect(status().isAccepted());

        verify(dispatcher).dispatch(new Notification.EventStarted(100, "Modern", "League",
                Instant.parse("2025-03-01T18:00:00Z"), null, false, null));
    }

    @Test
    void unknownKindIsRejected() throws Exception {
        mockMvc.perform(post("/api/ingest/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"Nonsense\",\"id\":1}"))
                .andExpect(status().isBadRequest());

        verify(dispatcher, never()).dispatch(any());
    }
}
