package com.debateleague.pairing.engine;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

public final class AdjudicatorHistory {

  private final Multiset<String> venues = HashMultiset.create();

  AdjudicatorHistory() {}

  public int venueCount(String venueName) {
    return venues.count(venueName);
  }

  void recordVenue(String venueName) {
    venues.add(venueName);
  }

  AdjudicatorHistory copy() {
    final AdjudicatorHistory copy = new AdjudicatorHistory();
    copy.venues.addAll(venues);
    return copy;
  }
}
