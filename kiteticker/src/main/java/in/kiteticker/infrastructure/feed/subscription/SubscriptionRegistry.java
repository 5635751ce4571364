package in.kiteticker.infrastructure.feed.subscription;

import in.kiteticker.domain.data.TickMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Instruments currently subscribed on the ticker connection and the mode
 * requested for each.
 *
 * <p>One entry per token. The whole table is replayed, grouped by mode, every
 * time the connection is re-established, so it survives disconnects.
 *
 * <p>The registry does not talk to the socket. The client sends the control
 * message first and records the change here only when the send was accepted.
 * Mutations from application threads and from the event thread are serialized
 * on the registry's monitor.
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    /** Kite ticker limit: max instruments per connection. */
    public static final int DEFAULT_MAX_INSTRUMENTS = 3000;

    private final int maxInstruments;
    private final Map<Long, SubscriptionEntry> entries = new LinkedHashMap<>();

    public SubscriptionRegistry() {
        this(DEFAULT_MAX_INSTRUMENTS);
    }

    public SubscriptionRegistry(int maxInstruments) {
        if (maxInstruments <= 0) {
            throw new IllegalArgumentException("Max instruments must be positive");
        }
        this.maxInstruments = maxInstruments;
    }

    /**
     * Record a plain subscription. Any mode requested earlier for these tokens is
     * cleared, so they are replayed as QUOTE.
     */
    public void add(Collection<Long> tokens) {
        add(tokens, null);
    }

    /**
     * Record tokens with a requested mode ({@code null} = no explicit mode).
     *
     * @throws FeedSubscriptionException if the tokens would exceed the instrument limit;
     *                                   nothing is recorded in that case
     */
    public void add(Collection<Long> tokens, TickMode mode) {
        addChecked(tokens, mode, () -> {});
    }

    /**
     * Check the instrument limit, run {@code publish}, then record the tokens,
     * all under one hold of the registry's monitor. Concurrent callers cannot
     * both pass the check for the last free slots.
     *
     * @param publish action that announces the change (usually the control message send);
     *                if it throws, nothing is recorded
     * @throws FeedSubscriptionException if the tokens would exceed the instrument limit;
     *                                   {@code publish} is not run in that case
     */
    public synchronized void addChecked(Collection<Long> tokens, TickMode mode, Runnable publish) {
        ensureCapacity(tokens);
        publish.run();
        for (Long token : tokens) {
            entries.put(token, new SubscriptionEntry(token, mode));
        }
        log.debug("[KITE-WS] Registered {} tokens (mode={}, total={})",
            tokens.size(), mode != null ? mode.wireValue() : "default", entries.size());
    }

    /**
     * Update the requested mode. Tokens that are not yet registered are added.
     */
    public void setMode(TickMode mode, Collection<Long> tokens) {
        setModeChecked(mode, tokens, () -> {});
    }

    /**
     * {@link #setMode} with the limit check and {@code publish} done atomically,
     * as in {@link #addChecked}.
     */
    public void setModeChecked(TickMode mode, Collection<Long> tokens, Runnable publish) {
        if (mode == null) {
            throw new IllegalArgumentException("Mode must not be null");
        }
        addChecked(tokens, mode, publish);
    }

    public synchronized void remove(Collection<Long> tokens) {
        int removed = 0;
        for (Long token : tokens) {
            if (entries.remove(token) != null) {
                removed++;
            }
        }
        log.debug("[KITE-WS] Removed {} of {} tokens (total={})", removed, tokens.size(), entries.size());
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Check that adding the tokens keeps the registry within its instrument limit.
     * Tokens already registered do not count against the limit.
     *
     * @throws FeedSubscriptionException if the limit would be exceeded
     */
    private void ensureCapacity(Collection<Long> tokens) {
        Set<Long> newTokens = new LinkedHashSet<>(tokens);
        newTokens.removeAll(entries.keySet());

        int available = maxInstruments - entries.size();
        if (newTokens.size() > available) {
            throw new FeedSubscriptionException(List.copyOf(tokens),
                String.format("need %d slots, only %d free (limit %d)",
                    newTokens.size(), available, maxInstruments));
        }
    }

    /**
     * Tokens grouped by the mode they should be replayed with. All three modes
     * are present in the result; tokens without an explicit mode fall under QUOTE.
     */
    public synchronized Map<TickMode, List<Long>> groupByMode() {
        Map<TickMode, List<Long>> groups = new EnumMap<>(TickMode.class);
        for (TickMode mode : TickMode.values()) {
            groups.put(mode, new ArrayList<>());
        }
        for (SubscriptionEntry entry : entries.values()) {
            groups.get(entry.effectiveMode()).add(entry.token());
        }
        return groups;
    }

    public synchronized boolean contains(long token) {
        return entries.containsKey(token);
    }

    /**
     * Requested mode of a token; empty when the token is not registered or was
     * subscribed without an explicit mode.
     */
    public synchronized Optional<TickMode> modeOf(long token) {
        SubscriptionEntry entry = entries.get(token);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.requestedMode());
    }

    public synchronized List<SubscriptionEntry> entries() {
        return List.copyOf(entries.values());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
