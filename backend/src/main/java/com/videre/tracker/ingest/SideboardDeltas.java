package com.videre.tracker.ingest;

import com.videre.tracker.model.CardEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-card mainboard change between the registered deck and the deck a player sideboarded into.
 */
public final class SideboardDeltas {

    private SideboardDeltas() {}

    /**
     * Signed quantity difference for every card whose count changed, in order of first
     * appearance (registered cards first). Unchanged cards are omitted.
     */
    public static List<CardEntry> compute(List<CardEntry> registered, List<CardEntry> sideboarded) {
        Map<Integer, Integer> before = quantities(registered);
        Map<Integer, Integer> after = quantities(sideboarded);
        Map<Integer, String> names = new LinkedHashMap<>();
        collectNames(registered, names);
        collectNames(sideboarded, names);

        List<CardEntry> changes = new ArrayList<>();
        for (Map.Entry<Integer, String> card : names.entrySet()) {
            int diff = after.getOrDefault(card.getKey(), 0) - before.getOrDefault(card.getKey(), 0);
            if (diff != 0) {
                changes.add(new CardEntry(card.getKey(), card.getValue(), diff));
            }
        }
        return changes;
    }

    private static Map<Integer, Integer> quantities(List<CardEntry> cards) {
        Map<Integer, Integer> totals = new LinkedHashMap<>();
        if (cards == null) return totals;
        for (CardEntry c : cards) {
            totals.merge(c.catalogId(), c.quantity(), Integer::sum);
        }
        return totals;
    }

    private static void collectNames(List<CardEntry> cards, Map<Integer, String> names) {
        if (cards == null) return;
        for (CardEntry c : cards) {
            names.putIfAbsent(c.catalogId(), c.name());
        }
    }
}
