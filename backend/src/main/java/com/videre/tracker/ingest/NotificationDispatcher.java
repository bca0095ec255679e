package com.videre.tracker.ingest;

import com.videre.tracker.model.CardEntry;
import com.videre.tracker.model.GameModel;
import com.videre.tracker.model.PlayerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Routes client notifications to the writer and the lifecycle trackers. Each notification runs
 * as its own task; whatever goes wrong with one is logged and never reaches the next.
 */
@Service
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final EventDatabaseWriter writer;
    private final EventTrackerRegistry trackers;
    private final Executor ingestExecutor;

    public NotificationDispatcher(EventDatabaseWriter writer,
                                  EventTrackerRegistry trackers,
                                  @Qualifier("ingestExecutor") Executor ingestExecutor) {
        this.writer = writer;
        this.trackers = trackers;
        this.ingestExecutor = ingestExecutor;
    }

    /**
     * Completes with whether the notification changed stored state. Never completes exceptionally.
     *
     * <p>Rows the notification depends on are awaited first without holding an ingest thread; the
     * notification is only handed to {@code ingestExecutor} once they are visible, so children
     * queued ahead of their parent cannot starve the parent's own write.
     */
    public CompletableFuture<Boolean> dispatch(Notification notification) {
        CompletableFuture<Boolean> ready;
        try {
            ready = prerequisites(notification);
        } catch (RuntimeException ex) {
            log.error("[Dispatch] {} could not be scheduled", notification, ex);
            return CompletableFuture.completedFuture(false);
        }
        return ready
                .handle((visible, error) -> error == null && Boolean.TRUE.equals(visible))
                .thenApplyAsync(visible -> visible ? handleQuietly(notification) : dropped(notification), ingestExecutor)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof RejectedExecutionException) {
                        log.error("[Dispatch] queue full, dropping {}", notification);
                    } else {
                        log.error("[Dispatch] {} failed", notification, cause);
                    }
                    return false;
                });
    }

    /** Completes with true once every row the notification refers to is visible. */
    CompletableFuture<Boolean> prerequisites(Notification notification) {
        if (notification instanceof Notification.EventCompleted completed) {
            return writer.waitForEvent(completed.eventId());
        } else if (notification instanceof Notification.MatchStarted match) {
            return writer.waitForEvent(match.eventId());
        } else if (notification instanceof Notification.GameStarted game) {
            return writer.waitForMatch(game.matchId());
        } else if (notification instanceof Notification.GameLogged logged) {
            return writer.waitForGame(logged.gameId());
        } else if (notification instanceof Notification.GameResultsChanged results) {
            return writer.waitForGame(results.gameId());
        } else if (notification instanceof Notification.SideboardChanged sideboard) {
            return writer.waitForMatch(sideboard.matchId());
        } else if (notification instanceof Notification.MatchCompleted completed) {
            return allVisible(completed.gameIds() != null ? completed.gameIds() : List.of());
        }
        return CompletableFuture.completedFuture(true);
    }

    private CompletableFuture<Boolean> allVisible(List<Long> gameIds) {
        CompletableFuture<Boolean> all = CompletableFuture.completedFuture(true);
        for (Long gameId : gameIds) {
            all = all.thenCombine(writer.waitForGame(gameId), (a, b) -> a && Boolean.TRUE.equals(b));
        }
        return all;
    }

    private boolean dropped(Notification notification) {
        log.warn("[Dispatch] {} refers to rows that never appeared, dropped", notification);
        return false;
    }

    boolean handleQuietly(Notification notification) {
        try {
            return handle(notification);
        } catch (RuntimeException ex) {
            log.error("[Dispatch] {} failed for subject {}", notification.getClass().getSimpleName(),
                    notification.subjectId(), ex);
            return false;
        }
    }

    boolean handle(Notification notification) {
        if (notification instanceof Notification.EventStarted started) {
            return onEventStarted(started);
        } else if (notification instanceof Notification.EventCompleted completed) {
            return trackers.complete(completed.eventId(), completed.endTime());
        } else if (notification instanceof Notification.MatchStarted match) {
            trackers.touch(match.eventId());
            return writer.addMatch(match.matchId(), match.eventId()).isCreated();
        } else if (notification instanceof Notification.GameStarted game) {
            return writer.addGame(game.gameId(), game.matchId()).isCreated();
        } else if (notification instanceof Notification.GameLogged logged) {
            return writer.addGameLog(logged.toEntry());
        } else if (notification instanceof Notification.GameResultsChanged results) {
            return onGameResults(results);
        } else if (notification instanceof Notification.SideboardChanged sideboard) {
            return onSideboardChanged(sideboard);
        } else if (notification instanceof Notification.MatchCompleted completed) {
            return onMatchCompleted(completed);
        }
        throw new IllegalArgumentException("Unsupported notification " + notification.getClass().getName());
    }

    private boolean onEventStarted(Notification.EventStarted started) {
        WriteResult<?> result = writer.addEvent(started);
        if (result.isPersisted()) {
            trackers.track(started.eventId(), started.completed(), started.endTime());
        }
        return result.isCreated();
    }

    private boolean onGameResults(Notification.GameResultsChanged results) {
        return writer.updateGameResults(results.gameId(), results.results());
    }

    private boolean onSideboardChanged(Notification.SideboardChanged sideboard) {
        Optional<List<CardEntry>> registered = writer.findRegisteredMainboard(sideboard.matchId());
        if (registered.isEmpty()) {
            log.error("[Dispatch][Sideboard] match {} has no registered deck", sideboard.matchId());
            return false;
        }
        List<CardEntry> changes = SideboardDeltas.compute(registered.get(), sideboard.mainboard());
        log.debug("[Dispatch][Sideboard] match {} heading into game {}: {} changed cards",
                sideboard.matchId(), sideboard.gameId(), changes.size());
        return writer.updateSideboardChanges(sideboard.matchId(), sideboard.gameId(), changes);
    }

    private boolean onMatchCompleted(Notification.MatchCompleted completed) {
        long matchId = completed.matchId();
        List<Long> expected = completed.gameIds() != null ? completed.gameIds() : List.of();
        List<GameModel> games = writer.getGames(matchId);
        if (games.isEmpty()) {
            log.error("[Dispatch][MatchResults] match {} has no stored games", matchId);
            return false;
        }
        Set<Long> stored = games.stream().map(GameModel::getId).collect(Collectors.toSet());
        if (!stored.equals(new HashSet<>(expected))) {
            log.error("[Dispatch][MatchResults] match {} games mismatch, expected={} stored={}", matchId, expected, stored);
            return false;
        }
        List<String> players = completed.players() != null ? completed.players() : List.of();
        List<PlayerResult> results = MatchResults.aggregate(games, players);
        boolean updated = writer.updateMatchResults(matchId, results);
        if (updated) {
            log.debug("[Dispatch][MatchResults] match {} results {}", matchId, results);
        }
        return updated;
    }
}
