package com.videre.tracker.ingest;

import com.videre.tracker.model.CardEntry;
import com.videre.tracker.model.EventModel;
import com.videre.tracker.model.GameLogType;
import com.videre.tracker.model.GameModel;
import com.videre.tracker.model.GamePlayerResult;
import com.videre.tracker.model.MatchModel;
import com.videre.tracker.model.MatchResult;
import com.videre.tracker.model.PlayDrawResult;
import com.videre.tracker.model.PlayerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    private static final Instant T0 = Instant.parse("2025-03-01T18:00:00Z");

    @Mock private EventDatabaseWriter writer;
    @Mock private EventTrackerRegistry trackers;

    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(writer, trackers, Runnable::run);
        lenient().when(writer.waitForEvent(anyLong())).thenReturn(CompletableFuture.completedFuture(true));
        lenient().when(writer.waitForMatch(anyLong())).thenReturn(CompletableFuture.completedFuture(true));
        lenient().when(writer.waitForGame(anyLong())).thenReturn(CompletableFuture.completedFuture(true));
    }

    @Test
    void eventStartedWritesThenTracks() throws Exception {
        Notification.EventStarted started = new Notification.EventStarted(100, "Pauper", "League", T0, null, false, null);
        given(writer.addEvent(started)).willReturn(WriteResult.created(new EventModel(100L, "Pauper", "League", T0)));

        assertThat(dispatcher.dispatch(started).get()).isTrue();

        verify(trackers).track(100L, false, null);
    }

    @Test
    void failedEventWriteIsNotTracked() throws Exception {
        Notification.EventStarted started = new Notification.EventStarted(100, "Pauper", "League", T0, null, false, null);
        given(writer.addEvent(started)).willReturn(WriteResult.failed());

        assertThat(dispatcher.dispatch(started).get()).isFalse();

        verifyNoInteractions(trackers);
    }

    @Test
    void eventCompletedGoesThroughTheRegistry() throws Exception {
        given(trackers.complete(100L, T0)).willReturn(true);

        assertThat(dispatcher.dispatch(new Notification.EventCompleted(100, T0)).get()).isTrue();
    }

    @Test
    void matchStartedTouchesTheEventAndWritesTheMatch() throws Exception {
        given(writer.addMatch(200L, 100L)).willReturn(WriteResult.created(new MatchModel(200L)));

        assertThat(dispatcher.dispatch(new Notification.MatchStarted(200, 100)).get()).isTrue();

        verify(trackers).touch(100L);
    }

    @Test
    void duplicateGameIsNotACreate() throws Exception {
        given(writer.addGame(300L, 200L)).willReturn(WriteResult.existing(new GameModel(300L)));

        assertThat(dispatcher.dispatch(new Notification.GameStarted(300, 200)).get()).isFalse();
    }

    @Test
    void gameLoggedIsWrittenAsAnEntry() throws Exception {
        Notification.GameLogged logged = new Notification.GameLogged(300, T0, GameLogType.LIFE_CHANGE, "20 -> 18");
        given(writer.addGameLog(logged.toEntry())).willReturn(true);

        assertThat(dispatcher.dispatch(logged).get()).isTrue();
    }

    @Test
    void gameResultsWaitForTheGame() throws Exception {
        List<GamePlayerResult> results = List.of(new GamePlayerResult("alice", PlayDrawResult.PLAY, MatchResult.WIN, 700));
        given(writer.waitForGame(300L)).willReturn(CompletableFuture.completedFuture(true));
        given(writer.updateGameResults(300L, results)).willReturn(true);

        assertThat(dispatcher.dispatch(new Notification.GameResultsChanged(300, results)).get()).isTrue();
    }

    @Test
    void gameResultsForMissingGameAreDropped() throws Exception {
        given(writer.waitForGame(300L)).willReturn(CompletableFuture.completedFuture(false));

        assertThat(dispatcher.dispatch(new Notification.GameResultsChanged(300, List.of())).get()).isFalse();

        verify(writer, never()).updateGameResults(anyLong(), any());
    }

    @Test
    void sideboardChangeIsStoredAsDeltaAgainstRegisteredDeck() throws Exception {
        given(writer.waitForMatch(200L)).willReturn(CompletableFuture.completedFuture(true));
        given(writer.findRegisteredMainboard(200L)).willReturn(Optional.of(List.of(
                new CardEntry(1, "Lightning Bolt", 4), new CardEntry(2, "Mountain", 18))));
        given(writer.updateSideboardChanges(eq(200L), eq(302L), anyList())).willReturn(true);

        List<CardEntry> sideboarded = List.of(
                new CardEntry(1, "Lightning Bolt", 3), new CardEntry(2, "Mountain", 18), new CardEntry(5, "Pyroblast", 1));
        assertThat(dispatcher.dispatch(new Notification.SideboardChanged(200, 302, sideboarded)).get()).isTrue();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CardEntry>> changes = ArgumentCaptor.forClass(List.class);
        verify(writer).updateSideboardChanges(eq(200L), eq(302L), changes.capture());
        assertThat(changes.getValue()).containsExactly(
                new CardEntry(1, "Lightning Bolt", -1), new CardEntry(5, "Pyroblast", 1));
    }

    @Test
    void sideboardChangeWithoutRegisteredDeckIsSkipped() throws Exception {
        given(writer.waitForMatch(200L)).willReturn(CompletableFuture.completedFuture(true));
        given(writer.findRegisteredMainboard(200L)).willReturn(Optional.empty());

        assertThat(dispatcher.dispatch(new Notification.SideboardChanged(200, 302, List.of())).get()).isFalse();

        verify(writer, never()).updateSideboardChanges(anyLong(), anyLong(), any());
    }

    @Test
    void matchCompletedAggregatesStoredGameResults() throws Exception {
        given(writer.waitForGame(anyLong())).willReturn(CompletableFuture.completedFuture(true));
        given(writer.getGames(200L)).willReturn(List.of(
                game(301, MatchResult.WIN, MatchResult.LOSS),
                game(302, MatchResult.WIN, MatchResult.LOSS)));
        given(writer.updateMatchResults(eq(200L), anyList())).willReturn(true);

        Notification.MatchCompleted completed = new Notification.MatchCompleted(200, List.of(301L, 302L), List.of("alice", "bob"));
        assertThat(dispatcher.dispatch(completed).get()).isTrue();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PlayerResult>> results = ArgumentCaptor.forClass(List.class);
        verify(writer).updateMatchResults(eq(200L), results.capture());
        assertThat(results.getValue()).containsExactly(
                new PlayerResult("alice", MatchResult.WIN, 2, 0, 0),
                new PlayerResult("bob", MatchResult.LOSS, 0, 2, 0));
    }

    @Test
    void matchCompletedWithMismatchedGamesIsNotWritten() throws Exception {
        given(writer.waitForGame(anyLong())).willReturn(CompletableFuture.completedFuture(true));
        given(writer.getGames(200L)).willReturn(List.of(game(301, MatchResult.WIN, MatchResult.LOSS)));

        Notification.MatchCompleted completed = new Notification.MatchCompleted(200, List.of(301L, 302L), List.of("alice", "bob"));
        assertThat(dispatcher.dispatch(completed).get()).isFalse();

        verify(writer, never()).updateMatchResults(anyLong(), any());
    }

    @Test
    void oneFailingNotificationDoesNotStopTheNext() throws Exception {
        given(writer.addGame(300L, 200L)).willThrow(new IllegalStateException("boom"));
        given(writer.addGame(301L, 200L)).willReturn(WriteResult.created(new GameModel(301L)));

        assertThat(dispatcher.dispatch(new Notification.GameStarted(300, 200)).get()).isFalse();
        assertThat(dispatcher.dispatch(new Notification.GameStarted(301, 200)).get()).isTrue();
    }

    @Test
    void saturatedExecutorDropsTheNotification() throws Exception {
        NotificationDispatcher saturated = new NotificationDispatcher(writer, trackers, task -> {
            throw new RejectedExecutionException("full");
        });

        assertThat(saturated.dispatch(new Notification.GameStarted(300, 200)).get()).isFalse();
        verify(writer, never()).addGame(anyLong(), anyLong());
    }

    @Test
    void childIsNotHandedToTheExecutorUntilItsParentIsVisible() throws Exception {
        CompletableFuture<Boolean> matchVisible = new CompletableFuture<>();
        given(writer.waitForMatch(200L)).willReturn(matchVisible);
        given(writer.addGame(300L, 200L)).willReturn(WriteResult.created(new GameModel(300L)));
        List<Runnable> submitted = new ArrayList<>();
        NotificationDispatcher queued = new NotificationDispatcher(writer, trackers, submitted::add);

        CompletableFuture<Boolean> result = queued.dispatch(new Notification.GameStarted(300, 200));
        assertThat(submitted).isEmpty();

        matchVisible.complete(true);
        assertThat(submitted).hasSize(1);
        submitted.get(0).run();

        assertThat(result.get()).isTrue();
    }

    @Test
    void childOfAParentThatNeverAppearsIsDroppedWithoutWriting() throws Exception {
        given(writer.waitForGame(300L)).willReturn(CompletableFuture.completedFuture(false));

        Notification.GameLogged logged = new Notification.GameLogged(300, T0, GameLogType.TURN_CHANGE, "Turn 1");
        assertThat(dispatcher.dispatch(logged).get()).isFalse();

        verify(writer, never()).addGameLog(any());
    }

    @Test
    void matchCompletedWaitsForEveryGame() throws Exception {
        given(writer.waitForGame(302L)).willReturn(CompletableFuture.completedFuture(false));

        Notification.MatchCompleted completed = new Notification.MatchCompleted(200, List.of(301L, 302L), List.of("alice", "bob"));
        assertThat(dispatcher.dispatch(completed).get()).isFalse();

        verify(writer, never()).getGames(anyLong());
    }

    private static GameModel game(long id, MatchResult alice, MatchResult bob) {
        GameModel game = new GameModel(id);
        game.setGamePlayerResults(List.of(
                new GamePlayerResult("alice", PlayDrawResult.PLAY, alice, 500),
                new GamePlayerResult("bob", PlayDrawResult.DRAW, bob, 500)));
        return game;
    }
}
