package com.videre.tracker.ingest;

import com.videre.tracker.config.IngestSettings;
import com.videre.tracker.dto.GameLogDTO;
import com.videre.tracker.dto.IngestActivityDTO;
import com.videre.tracker.model.CardEntry;
import com.videre.tracker.model.DeckModel;
import com.videre.tracker.model.EventModel;
import com.videre.tracker.model.GameLogModel;
import com.videre.tracker.model.GameModel;
import com.videre.tracker.model.GamePlayerResult;
import com.videre.tracker.model.MatchModel;
import com.videre.tracker.model.PlayerResult;
import com.videre.tracker.repository.DeckRepository;
import com.videre.tracker.repository.EventRepository;
import com.videre.tracker.repository.GameLogRepository;
import com.videre.tracker.repository.GameRepository;
import com.videre.tracker.repository.MatchRepository;
import com.videre.tracker.stream.IngestFeeds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Sole writer of event, match, game and game-log rows.
 *
 * <p>Every create is idempotent on the caller-assigned identity and never throws: a row that is
 * already there (or that a concurrent writer inserts first) comes back as {@code EXISTING}. Child
 * rows wait for their parent to become visible before inserting and are dropped with a warning
 * when it never does. Each call runs in its own transaction; the id cache, waiters and live feeds
 * are only touched after commit.
 */
@Service
public class EventDatabaseWriter {
    private static final Logger log = LoggerFactory.getLogger(EventDatabaseWriter.class);

    private final EventRepository eventRepository;
    private final DeckRepository deckRepository;
    private final MatchRepository matchRepository;
    private final GameRepository gameRepository;
    private final GameLogRepository gameLogRepository;
    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;
    private final IngestSettings settings;
    private final IngestFeeds feeds;
    private final PersistedIdCache idCache = new PersistedIdCache();
    private final RowAwaiter awaiter;

    public EventDatabaseWriter(EventRepository eventRepository,
                               DeckRepository deckRepository,
                               MatchRepository matchRepository,
                               GameRepository gameRepository,
                               GameLogRepository gameLogRepository,
                               PlatformTransactionManager transactionManager,
                               IngestSettings settings,
                               IngestFeeds feeds,
                               @Qualifier("ingestScheduler") ThreadPoolTaskScheduler ingestScheduler) {
        this.eventRepository = eventRepository;
        this.deckRepository = deckRepository;
        this.matchRepository = matchRepository;
        this.gameRepository = gameRepository;
        this.gameLogRepository = gameLogRepository;
        this.tx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.settings = settings;
        this.feeds = feeds;
        this.awaiter = new RowAwaiter(ingestScheduler.getScheduledExecutor(), this::rowExists, idCache,
                settings.getPollInitial(), settings.getPollMax());
    }

    // ---------------------------------------------------------------- creates

    public WriteResult<EventModel> addEvent(Notification.EventStarted event) {
        final long eventId = event.eventId();
        WriteResult<EventModel> result = insertIdempotent("AddEvent", "event " + eventId,
                () -> eventRepository.findById(eventId),
                status -> {
                    Optional<EventModel> existing = eventRepository.findById(eventId);
                    if (existing.isPresent()) {
                        return WriteResult.existing(existing.get());
                    }
                    Instant start = event.startTime() != null ? event.startTime() : Instant.now();
                    EventModel model = new EventModel(eventId, event.format(), event.description(), start);
                    Notification.DeckSnapshot snapshot = event.deck();
                    if (snapshot != null && snapshot.hash() != null && !snapshot.hash().isBlank()) {
                        // decks are shared between events, insert only when the hash is new
                        DeckModel deck = deckRepository.findById(snapshot.hash())
                                .orElseGet(() -> deckRepository.saveAndFlush(toDeck(snapshot)));
                        model.setDeck(deck);
                    }
                    return WriteResult.created(eventRepository.saveAndFlush(model));
                });
        if (result.isPersisted()) {
            awaiter.markVisible(RowKind.EVENT, eventId);
        }
        if (result.isCreated()) {
            log.info("[Ingest][AddEvent] created event {} format={}", eventId, event.format());
            feeds.activity().publish(new IngestActivityDTO(RowKind.EVENT.name(), eventId, null, Instant.now()));
        }
        return result;
    }

    public WriteResult<MatchModel> addMatch(long matchId, long parentEventId) {
        if (!awaitParent(RowKind.EVENT, parentEventId)) {
            log.warn("[Ingest][AddMatch] event {} not visible after {}ms, dropping match {}",
                    parentEventId, settings.getParentWaitTimeout().toMillis(), matchId);
            return WriteResult.abandoned();
        }
        WriteResult<MatchModel> result = insertIdempotent("AddMatch", "match " + matchId,
                () -> matchRepository.findById(matchId),
                status -> {
                    Optional<MatchModel> existing = matchRepository.findById(matchId);
                    if (existing.isPresent()) {
                        return WriteResult.existing(existing.get());
                    }
                    Optional<EventModel> parent = eventRepository.findById(parentEventId);
                    if (parent.isEmpty()) {
                        return WriteResult.abandoned();
                    }
                    MatchModel match = new MatchModel(matchId);
                    match.setEvent(parent.get());
                    return WriteResult.created(matchRepository.saveAndFlush(match));
                });
        if (result.isPersisted()) {
            idCache.recordMatch(matchId, parentEventId);
            awaiter.markVisible(RowKind.MATCH, matchId);
        }
        if (result.isCreated()) {
            log.info("[Ingest][AddMatch] created match {} under event {}", matchId, parentEventId);
            feeds.activity().publish(new IngestActivityDTO(RowKind.MATCH.name(), matchId, parentEventId, Instant.now()));
        }
        return result;
    }

    public WriteResult<GameModel> addGame(long gameId, long parentMatchId) {
        if (!awaitParent(RowKind.MATCH, parentMatchId)) {
            log.warn("[Ingest][AddGame] match {} not visible after {}ms, dropping game {}",
                    parentMatchId, settings.getParentWaitTimeout().toMillis(), gameId);
            return WriteResult.abandoned();
        }
        WriteResult<GameModel> result = insertIdempotent("AddGame", "game " + gameId,
                () -> gameRepository.findById(gameId),
                status -> {
                    Optional<GameModel> existing = gameRepository.findById(gameId);
                    if (existing.isPresent()) {
                        return WriteResult.existing(existing.get());
                    }
                    Optional<MatchModel> parent = matchRepository.findById(parentMatchId);
                    if (parent.isEmpty()) {
                        return WriteResult.abandoned();
                    }
                    GameModel game = new GameModel(gameId);
                    game.setMatch(parent.get());
                    return WriteResult.created(gameRepository.saveAndFlush(game));
                });
        if (result.isPersisted()) {
            idCache.recordGame(gameId, parentMatchId);
            awaiter.markVisible(RowKind.GAME, gameId);
        }
        if (result.isCreated()) {
            log.info("[Ingest][AddGame] created game {} under match {}", gameId, parentMatchId);
            feeds.activity().publish(new IngestActivityDTO(RowKind.GAME.name(), gameId, parentMatchId, Instant.now()));
        }
        return result;
    }

    /** @return true only when this call inserted the entry */
    public boolean addGameLog(GameLogEntry entry) {
        final long gameId = entry.getGameId();
        if (!awaitParent(RowKind.GAME, gameId)) {
            log.warn("[Ingest][AddGameLog] game {} not visible after {}ms, dropping {}",
                    gameId, settings.getParentWaitTimeout().toMillis(), entry);
            return false;
        }
        final long logId = entry.derivedId();
        WriteResult<GameLogModel> result = insertIdempotent("AddGameLog", "log " + logId,
                () -> gameLogRepository.findById(logId),
                status -> {
                    Optional<GameLogModel> existing = gameLogRepository.findById(logId);
                    if (existing.isPresent()) {
                        return WriteResult.existing(existing.get());
                    }
                    GameLogModel model = new GameLogModel(logId, gameId, entry.getTimestamp(), entry.getType(), entry.getData());
                    return WriteResult.created(gameLogRepository.saveAndFlush(model));
                });
        if (result.isCreated()) {
            log.debug("[Ingest][AddGameLog] stored {} as {}", entry, logId);
            feeds.gameLogs().publish(GameLogDTO.from(result.getModel()));
        }
        return result.isCreated();
    }

    // ---------------------------------------------------------------- updates

    /** Sets the end time only if it is still unset; a completed event never changes. */
    public boolean updateEventEndTime(long eventId, Instant endTime) {
        try {
            Integer rows = tx.execute(status -> eventRepository.setEndTimeIfUnset(eventId, endTime));
            boolean updated = rows != null && rows > 0;
            if (updated) {
                log.info("[Ingest][EndTime] event {} completed at {}", eventId, endTime);
            } else {
                log.debug("[Ingest][EndTime] event {} missing or already completed", eventId);
            }
            return updated;
        } catch (RuntimeException ex) {
            log.error("[Ingest][EndTime] event {} failed", eventId, ex);
            return false;
        }
    }

    public boolean updateGameResults(long gameId, List<GamePlayerResult> results) {
        return updateExisting("UpdateGameResults", "game " + gameId, () -> gameRepository.findById(gameId).map(game -> {
            game.setGamePlayerResults(results != null ? new ArrayList<>(results) : new ArrayList<>());
            gameRepository.saveAndFlush(game);
            return true;
        }));
    }

    public boolean updateMatchResults(long matchId, List<PlayerResult> results) {
        return updateExisting("UpdateMatchResults", "match " + matchId, () -> matchRepository.findById(matchId).map(match -> {
            match.setPlayerResults(results != null ? new ArrayList<>(results) : new ArrayList<>());
            matchRepository.saveAndFlush(match);
            return true;
        }));
    }

    /** Replaces the sideboard delta recorded for {@code gameId} inside the match. */
    public boolean updateSideboardChanges(long matchId, long gameId, List<CardEntry> changes) {
        return updateExisting("UpdateSideboard", "match " + matchId, () -> matchRepository.findById(matchId).map(match -> {
            Map<Long, List<CardEntry>> merged = match.getSideboardChanges() != null
                    ? new LinkedHashMap<>(match.getSideboardChanges()) : new LinkedHashMap<>();
            merged.put(gameId, changes != null ? new ArrayList<>(changes) : new ArrayList<>());
            match.setSideboardChanges(merged);
            matchRepository.saveAndFlush(match);
            return true;
        }));
    }

    // ---------------------------------------------------------------- waits and reads

    public CompletableFuture<Boolean> waitForEvent(long eventId) {
        return awaiter.await(RowKind.EVENT, eventId, settings.getParentWaitTimeout());
    }

    public CompletableFuture<Boolean> waitForMatch(long matchId) {
        return awaiter.await(RowKind.MATCH, matchId, settings.getParentWaitTimeout());
    }

    public CompletableFuture<Boolean> waitForGame(long gameId) {
        return awaiter.await(RowKind.GAME, gameId, settings.getParentWaitTimeout());
    }

    public List<GameModel> getGames(long matchId) {
        List<GameModel> games = readTx.execute(status -> gameRepository.findByMatchIdOrderByIdAsc(matchId));
        return games != null ? games : List.of();
    }

    /** Mainboard of the deck registered on the match's event, when there is one. */
    public Optional<List<CardEntry>> findRegisteredMainboard(long matchId) {
        List<CardEntry> mainboard = readTx.execute(status -> matchRepository.findWithEventById(matchId)
                .map(MatchModel::getEvent)
                .map(EventModel::getDeck)
                .map(deck -> new ArrayList<>(deck.getMainboard()))
                .orElse(null));
        return Optional.ofNullable(mainboard);
    }

    public PersistedIdCache getIdCache() {
        return idCache;
    }

    /** Drops cached identities and pending waits; rows are re-probed from the store afterwards. */
    public void resetCaches() {
        idCache.clear();
        awaiter.reset();
        log.info("[Ingest][Reset] id cache and waiters cleared");
    }

    // ---------------------------------------------------------------- internals

    private boolean awaitParent(RowKind kind, long parentId) {
        CompletableFuture<Boolean> wait = awaiter.await(kind, parentId, settings.getParentWaitTimeout());
        try {
            return Boolean.TRUE.equals(wait.get());
        } catch (InterruptedException ex) {
            wait.cancel(false);
            Thread.currentThread().interrupt();
            return false;
        } catch (CancellationException ex) {
            return false;
        } catch (ExecutionException ex) {
            log.warn("[Ingest][Wait] {} {} wait failed: {}", kind, parentId, ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
            return false;
        }
    }

    private <T> WriteResult<T> insertIdempotent(String op, String identity, Supplier<Optional<T>> reread,
                                                TransactionCallback<WriteResult<T>> attempt) {
        int attempts = settings.getMaxConflictRetries() + 1;
        for (int i = 1; i <= attempts; i++) {
            try {
                WriteResult<T> result = tx.execute(attempt);
                if (result == null) {
                    return WriteResult.failed();
                }
                if (result.getStatus() == WriteResult.Status.EXISTING) {
                    log.debug("[Ingest][{}] {} already stored", op, identity);
                }
                return result;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                log.warn("[Ingest][{}] conflict on {} (attempt {}/{}): {}", op, identity, i, attempts,
                        ex.getMostSpecificCause().getMessage());
                Optional<T> winner = rereadQuietly(op, identity, reread);
                if (winner.isPresent()) {
                    return WriteResult.existing(winner.get());
                }
            } catch (RuntimeException ex) {
                log.error("[Ingest][{}] {} failed", op, identity, ex);
                return WriteResult.failed();
            }
        }
        log.error("[Ingest][{}] {} still conflicting after {} attempts", op, identity, attempts);
        return WriteResult.failed();
    }

    private <T> Optional<T> rereadQuietly(String op, String identity, Supplier<Optional<T>> reread) {
        try {
            Optional<T> found = readTx.execute(status -> reread.get());
            return found != null ? found : Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("[Ingest][{}] re-read of {} failed: {}", op, identity, ex.getMessage());
            return Optional.empty();
        }
    }

    // Match and game rows are versioned; a stale write fails at flush and is re-applied to a fresh read
    private boolean updateExisting(String op, String identity, Supplier<Optional<Boolean>> change) {
        int attempts = settings.getMaxUpdateRetries() + 1;
        for (int i = 1; i <= attempts; i++) {
            try {
                Optional<Boolean> applied = tx.execute(status -> change.get());
                if (applied == null || applied.isEmpty()) {
                    log.warn("[Ingest][{}] {} not found, nothing updated", op, identity);
                    return false;
                }
                return applied.get();
            } catch (ConcurrencyFailureException ex) {
                log.warn("[Ingest][{}] conflict on {} (attempt {}/{}): {}", op, identity, i, attempts, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("[Ingest][{}] {} failed", op, identity, ex);
                return false;
            }
        }
        log.error("[Ingest][{}] {} still conflicting after {} attempts", op, identity, attempts);
        return false;
    }

    private boolean rowExists(RowKind kind, long id) {
        switch (kind) {
            case EVENT: return eventRepository.existsById(id);
            case MATCH: return matchRepository.existsById(id);
            case GAME: return gameRepository.existsById(id);
            default: throw new IllegalArgumentException("Unknown row kind " + kind);
        }
    }

    private static DeckModel toDeck(Notification.DeckSnapshot snapshot) {
        return new DeckModel(snapshot.hash(), snapshot.deckId(), snapshot.name(), snapshot.format(),
                snapshot.timestamp(), snapshot.mainboard(), snapshot.sideboard());
    }
}
