package com.valuebet.domain.ports;

import com.valuebet.domain.model.SavedBet;

import java.util.List;

/**
 * Port for persisting value bets the user decided to keep.
 */
public interface SavedBetRepository {

    void save(SavedBet bet);

    /**
     * Most recently saved bets, newest first.
     */
    List<SavedBet> findRecent(int limit);
}
