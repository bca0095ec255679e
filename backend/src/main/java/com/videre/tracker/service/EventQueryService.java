package com.videre.tracker.service;

import com.videre.tracker.config.StreamSettings;
import com.videre.tracker.dto.EventDetailDTO;
import com.videre.tracker.dto.EventSummaryDTO;
import com.videre.tracker.dto.GameDTO;
import com.videre.tracker.dto.GameLogDTO;
import com.videre.tracker.dto.MatchDTO;
import com.videre.tracker.model.DeckModel;
import com.videre.tracker.model.EventModel;
import com.videre.tracker.model.GameLogModel;
import com.videre.tracker.model.GameModel;
import com.videre.tracker.model.MatchModel;
import com.videre.tracker.repository.EventRepository;
import com.videre.tracker.repository.GameLogRepository;
import com.videre.tracker.repository.GameRepository;
import com.videre.tracker.repository.MatchRepository;
import com.videre.tracker.stream.KeysetIterable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class EventQueryService {

    private final EventRepository eventRepository;
    private final MatchRepository matchRepository;
    private final GameRepository gameRepository;
    private final GameLogRepository gameLogRepository;
    private final StreamSettings streamSettings;

    public EventQueryService(EventRepository eventRepository, MatchRepository matchRepository,
                             GameRepository gameRepository, GameLogRepository gameLogRepository,
                             StreamSettings streamSettings) {
        this.eventRepository = eventRepository;
        this.matchRepository = matchRepository;
        this.gameRepository = gameRepository;
        this.gameLogRepository = gameLogRepository;
        this.streamSettings = streamSettings;
    }

    // Most recent first
    public List<EventSummaryDTO> listEvents(int page, int size) {
        int pageSize = Math.max(1, Math.min(size, 1000));
        return eventRepository.findAllByOrderByStartTimeDescIdDesc(PageRequest.of(Math.max(0, page), pageSize))
                .map(EventQueryService::toSummary)
                .getContent();
    }

    /**
     * All events, most recent first, fetched one page at a time as the caller iterates. Events
     * created during the walk sort ahead of the cursor and are not repeated.
     */
    public Iterable<EventSummaryDTO> streamEvents() {
        return new KeysetIterable<EventSummaryDTO>((last, limit) -> {
            PageRequest first = PageRequest.of(0, limit);
            List<EventModel> page = last == null
                    ? eventRepository.findAllByOrderByStartTimeDescIdDesc(first).getContent()
                    : eventRepository.findPageBefore(last.startTime(), last.id(), first);
            return page.stream().map(EventQueryService::toSummary).collect(Collectors.toList());
        }, streamSettings.getPageSize());
    }

    public List<String> listFormats() {
        return eventRepository.findDistinctFormats();
    }

    public Optional<EventDetailDTO> getEvent(Long id) {
        return eventRepository.findWithMatchesById(id).map(event -> new EventDetailDTO(
                toSummary(event),
                event.getMatches().stream().map(this::toMatch).collect(Collectors.toList())));
    }

    public Optional<MatchDTO> getMatch(Long id) {
        return matchRepository.findWithGamesById(id).map(this::toMatch);
    }

    public Optional<GameDTO> getGame(Long id) {
        return gameRepository.findById(id).map(this::toGame);
    }

    public boolean gameExists(Long id) {
        return gameRepository.existsById(id);
    }

    public List<GameLogDTO> listGameLogs(Long gameId, int page, int size) {
        int pageSize = Math.max(1, Math.min(size, 5000));
        Page<GameLogDTO> logs = gameLogRepository
                .findByGameIdOrderByTimestampAscIdAsc(gameId, PageRequest.of(Math.max(0, page), pageSize))
                .map(GameLogDTO::from);
        return logs.getContent();
    }

    /** Every log entry of a game in replay order, fetched one page at a time. */
    public Iterable<GameLogDTO> streamGameLogs(Long gameId) {
        return new KeysetIterable<GameLogDTO>((last, limit) -> {
            PageRequest first = PageRequest.of(0, limit);
            List<GameLogModel> page = last == null
                    ? gameLogRepository.findByGameIdOrderByTimestampAscIdAsc(gameId, first).getContent()
                    : gameLogRepository.findPageAfter(gameId, last.timestamp(), last.id(), first);
            return page.stream().map(GameLogDTO::from).collect(Collectors.toList());
        }, streamSettings.getPageSize());
    }

    private MatchDTO toMatch(MatchModel match) {
        List<GameDTO> games = match.getGames().stream().map(this::toGame).collect(Collectors.toList());
        return new MatchDTO(match.getId(), match.getEvent() != null ? match.getEvent().getId() : null,
                new ArrayList<>(match.getPlayerResults()),
                new LinkedHashMap<>(match.getSideboardChanges()),
                games);
    }

    private GameDTO toGame(GameModel game) {
        return new GameDTO(game.getId(), game.getMatch() != null ? game.getMatch().getId() : null,
                new ArrayList<>(game.getGamePlayerResults()),
                gameLogRepository.countByGameId(game.getId()));
    }

    private static EventSummaryDTO toSummary(EventModel e) {
        DeckModel deck = e.getDeck();
        return new EventSummaryDTO(e.getId(), e.getFormat(), e.getDescription(),
                deck != null ? deck.getHash() : null,
                deck != null ? deck.getName() : null,
                e.getStartTime(), e.getEndTime(), e.getEndTime() != null);
    }
}
