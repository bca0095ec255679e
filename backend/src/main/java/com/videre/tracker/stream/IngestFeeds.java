package com.videre.tracker.stream;

import com.videre.tracker.dto.GameLogDTO;
import com.videre.tracker.dto.IngestActivityDTO;
import org.springframework.stereotype.Component;

/** Live feeds the writer publishes to after each commit. */
@Component
public class IngestFeeds {

    private final LiveFeed<IngestActivityDTO> activity = new LiveFeed<>("activity");
    private final LiveFeed<GameLogDTO> gameLogs = new LiveFeed<>("game-logs");

    public LiveFeed<IngestActivityDTO> activity() { return activity; }
    public LiveFeed<GameLogDTO> gameLogs() { return gameLogs; }
}
