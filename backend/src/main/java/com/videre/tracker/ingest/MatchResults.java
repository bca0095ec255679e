package com.videre.tracker.ingest;

import com.videre.tracker.model.GameModel;
import com.videre.tracker.model.GamePlayerResult;
import com.videre.tracker.model.MatchResult;
import com.videre.tracker.model.PlayerResult;

import java.util.ArrayList;
import java.util.List;

/** Derives match standings from the stored per-game results. */
public final class MatchResults {

    private MatchResults() {}

    /**
     * @throws IllegalStateException if a game has no result for one of the players
     */
    public static List<PlayerResult> aggregate(List<GameModel> games, List<String> players) {
        List<PlayerResult> results = new ArrayList<>();
        for (String player : players) {
            int wins = 0;
            int losses = 0;
            int draws = 0;
            for (GameModel game : games) {
                MatchResult result = resultFor(game, player);
                switch (result) {
                    case WIN: wins++; break;
                    case LOSS: losses++; break;
                    default: draws++;
                }
            }
            results.add(new PlayerResult(player, overall(wins, losses), wins, losses, draws));
        }
        return results;
    }

    static MatchResult overall(int wins, int losses) {
        if (wins > losses) return MatchResult.WIN;
        if (losses > wins) return MatchResult.LOSS;
        return MatchResult.DRAW;
    }

    private static MatchResult resultFor(GameModel game, String player) {
        List<GamePlayerResult> gameResults = game.getGamePlayerResults();
        if (gameResults != null) {
            for (GamePlayerResult r : gameResults) {
                if (player.equals(r.player()) && r.result() != null) {
                    return r.result();
                }
            }
        }
        throw new IllegalStateException("Game " + game.getId() + " has no result for " + player);
    }
}
