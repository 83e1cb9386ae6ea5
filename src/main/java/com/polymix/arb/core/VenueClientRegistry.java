package com.polymix.arb.core;

import com.polymix.arb.domain.Venue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class VenueClientRegistry {

    private final Map<Venue, VenueClient> clients = new EnumMap<>(Venue.class);

    public VenueClientRegistry(List<? extends VenueClient> clients) {
        for (VenueClient client : clients) {
            if (this.clients.put(client.venue(), client) != null) {
                throw new IllegalArgumentException("Duplicate venue client for " + client.venue());
            }
        }
    }

    public VenueClient get(Venue venue) {
        VenueClient client = clients.get(venue);
        if (client == null) {
            throw new IllegalStateException("No venue client registered for " + venue);
        }
        return client;
    }
}
