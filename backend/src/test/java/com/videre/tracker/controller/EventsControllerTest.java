package com.videre.tracker.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.videre.tracker.config.AsyncIngestConfig;
import com.videre.tracker.config.StreamSettings;
import com.videre.tracker.dto.EventDetailDTO;
import com.videre.tracker.dto.EventSummaryDTO;
import com.videre.tracker.dto.IngestActivityDTO;
import com.videre.tracker.dto.MatchDTO;
import com.videre.tracker.service.EventQueryService;
import com.videre.tracker.stream.IngestFeeds;
import com.videre.tracker.stream.NdjsonStreamer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {EventsController.class, MatchController.class})
@Import({NdjsonStreamer.class, IngestFeeds.class, StreamSettings.class, AsyncIngestConfig.class})
@ActiveProfiles("test")
class EventsControllerTest {

    private static final Instant START = Instant.parse("2025-03-01T18:00:00Z");

    @Autowired private MockMvc mockMvc;
    @Autowired private IngestFeeds feeds;
    @Autowired private ObjectMapper objectMapper;
    @MockBean private EventQueryService queryService;

    @Test
    void listReturnsPlainJson() throws Exception {
        given(queryService.listEvents(0, 50)).willReturn(List.of(summary(100), summary(101)));

        mockMvc.perform(get("/api/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id", is(100)))
                .andExpect(jsonPath("$[1].format", is("Modern")));
    }

    @Test
    void streamedListIsNdjson() throws Exception {
        given(queryService.streamEvents()).willReturn(List.of(summary(100), summary(101), summary(102)));

        MvcResult started = mockMvc.perform(get("/api/events").param("stream", "true"))
                .andExpect(request().asyncStarted())
                .andReturn();

        MvcResult done = mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "application/x-ndjson"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andReturn();

        String[] lines = done.getResponse().getContentAsString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(objectMapper.readValue(lines[2], EventSummaryDTO.class).id()).isEqualTo(102L);
    }

    @Test
    void singleEventIncludesMatches() throws Exception {
        MatchDTO match = new MatchDTO(200L, 100L, List.of(), Map.of(), List.of());
        given(queryService.getEvent(100L)).willReturn(Optional.of(new EventDetailDTO(summary(100), List.of(match))));

        mockMvc.perform(get("/api/events/100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event.id", is(100)))
                .andExpect(jsonPath("$.matches[0].id", is(200)));
    }

    @Test
    void unknownEventIs404() throws Exception {
        given(queryService.getEvent(404L)).willReturn(Optional.empty());

        mockMvc.perform(get("/api/events/404")).andExpect(status().isNotFound());
    }

    @Test
    void unknownMatchIs404() throws Exception {
        given(queryService.getMatch(404L)).willReturn(Optional.empty());

        mockMvc.perform(get("/api/matches/404")).andExpect(status().isNotFound());
    }

    @Test
    void formatsAreListed() throws Exception {
        given(queryService.listFormats()).willReturn(List.of("Legacy", "Modern"));

        mockMvc.perform(get("/api/events/formats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]", is("Modern")));
    }

    @Test
    void watchRelaysActivityAsItHappens() throws Exception {
        int before = feeds.activity().subscriberCount();
        MvcResult started = mockMvc.perform(get("/api/events/watch"))
                .andExpect(request().asyncStarted())
                .andReturn();
        assertThat(feeds.activity().subscriberCount()).isEqualTo(before + 1);

        feeds.activity().publish(new IngestActivityDTO("MATCH", 200L, 100L, START));

        String body = awaitBody(started);
        IngestActivityDTO relayed = objectMapper.readValue(body.trim(), IngestActivityDTO.class);
        assertThat(relayed.kind()).isEqualTo("MATCH");
        assertThat(relayed.parentId()).isEqualTo(100L);
    }

    private static String awaitBody(MvcResult result) throws Exception {
        long deadline = System.currentTimeMillis() + 3000;
        String body = result.getResponse().getContentAsString();
        while (!body.endsWith("\n") && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            body = result.getResponse().getContentAsString();
        }
        return body;
    }

    private static EventSummaryDTO summary(long id) {
        return new EventSummaryDTO(id, "Modern", "Modern League", "abc", "Burn", START, null, false);
    }
}
