package com.polymix.arb.core;

import com.polymix.arb.domain.OutcomePair;

import java.util.List;

/**
 * Feed of already-matched cross-venue outcome pairs, one snapshot per poll.
 */
public interface OutcomePairSource {

    String name();

    List<OutcomePair> poll();
}
