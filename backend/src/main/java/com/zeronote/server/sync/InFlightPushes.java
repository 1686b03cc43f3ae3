package com.zeronote.server.sync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

/**
 * Pushes that have started but not finished writing, per account.
 *
 * <p>A push reserves its change sequence values before the rows carrying them are visible, so
 * a pull that trusted the counter alone could hand out a cursor past a row that lands a moment
 * later. Each unfinished push holds a ticket whose floor is the counter value read before it
 * reserved anything, and a pull never reports a cursor above the lowest open floor.
 *
 * <p>Tickets live in this process only.
 */
@Component
public class InFlightPushes {

    private final Map<String, List<Ticket>> open = new HashMap<>();

    public synchronized Ticket open(String owner, long floor) {
        Ticket ticket = new Ticket(owner, floor);
        open.computeIfAbsent(owner, key -> new ArrayList<>()).add(ticket);
        return ticket;
    }

    public synchronized void close(Ticket ticket) {
        List<Ticket> tickets = open.get(ticket.owner);
        if (tickets != null && tickets.remove(ticket) && tickets.isEmpty()) {
            open.remove(ticket.owner);
        }
    }

    /** {@code current}, lowered to the floor of the oldest unfinished push for {@code owner}. */
    public synchronized long safeCursor(String owner, long current) {
        long cursor = current;
        for (Ticket ticket : open.getOrDefault(owner, List.of())) {
            cursor = Math.min(cursor, ticket.floor);
        }
        return cursor;
    }

    synchronized int openTickets(String owner) {
        return open.getOrDefault(owner, List.of()).size();
    }

    public static final class Ticket {
        private final String owner;
        private final long floor;

        private Ticket(String owner, long floor) {
            this.owner = owner;
            this.floor = floor;
        }

        public long floor() {
            return floor;
        }
    }
}
