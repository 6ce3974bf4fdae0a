package com.signal.lifecycle;

import com.signal.model.Signal;
import com.signal.model.SignalDirection;
import com.signal.model.SignalStatus;
import com.signal.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the set of emitted signals and is the only component that moves a signal out of
 * {@link SignalStatus#PENDING}.
 *
 * <p>At most one pending signal exists per timeframe. The book (all signals plus the
 * pending-by-timeframe index) is an immutable {@link Book} published through a volatile
 * field: writers build a new book under the lock and swap it in, readers always see a
 * complete, consistent snapshot.
 */
@Component
public class SignalLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SignalLifecycleManager.class);

    private final ResolutionPolicy policy;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Book book = new Book(List.of(), Map.of());

    public SignalLifecycleManager(ResolutionPolicy policy) {
        this.policy = policy;
    }

    public boolean hasPending(String timeframe) {
        return book.pendingByTimeframe().containsKey(timeframe);
    }

    /**
     * Track a newly created signal.
     *
     * @return false if a signal is already pending for the same timeframe; the new one is discarded
     */
    public boolean register(Signal signal) {
        if (!signal.isPending()) {
            throw new IllegalArgumentException("Only pending signals can be registered: " + signal.id());
        }
        lock.lock();
        try {
            Book current = book;
            Signal existing = current.pendingByTimeframe().get(signal.timeframe());
            if (existing != null) {
                log.warn("[{}] Signal {} discarded, {} is still pending", signal.timeframe(), signal.id(), existing.id());
                return false;
            }
            List<Signal> signals = new ArrayList<>(current.signals().size() + 1);
            signals.add(signal);
            signals.addAll(current.signals());
            Map<String, Signal> pending = new HashMap<>(current.pendingByTimeframe());
            pending.put(signal.timeframe(), signal);
            book = new Book(List.copyOf(signals), Map.copyOf(pending));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve every pending signal whose timeframe has elapsed at {@code nowMillis}.
     * Signals not yet due stay pending untouched.
     *
     * @param price     latest price used as exit price
     * @param nowMillis current wall-clock time in Unix milliseconds
     * @return the signals resolved by this call, in their resolved form
     */
    public List<Signal> resolveDue(double price, long nowMillis) {
        lock.lock();
        try {
            Book current = book;
            if (current.pendingByTimeframe().isEmpty()) return List.of();

            Map<String, Signal> resolvedById = new HashMap<>();
            for (Signal pending : current.pendingByTimeframe().values()) {
                if (nowMillis - pending.createdAt() >= Timeframe.durationMillis(pending.timeframe())) {
                    resolvedById.put(pending.id(), settle(pending, price));
                }
            }
            if (resolvedById.isEmpty()) return List.of();

            List<Signal> signals = new ArrayList<>(current.signals().size());
            List<Signal> resolved = new ArrayList<>(resolvedById.size());
            for (Signal signal : current.signals()) {
                Signal replacement = resolvedById.get(signal.id());
                if (replacement != null) {
                    signals.add(replacement);
                    resolved.add(replacement);
                } else {
                    signals.add(signal);
                }
            }
            Map<String, Signal> pending = new HashMap<>(current.pendingByTimeframe());
            resolved.forEach(signal -> pending.remove(signal.timeframe()));
            book = new Book(List.copyOf(signals), Map.copyOf(pending));

            resolved.forEach(signal -> log.info("[{}] Signal {} {} resolved {}: entry={} exit={} pnl={}",
                    signal.timeframe(), signal.id(), signal.direction(), signal.status(),
                    signal.entryPrice(), signal.exitPrice(), signal.pnl()));
            return List.copyOf(resolved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * All signals, newest first.
     */
    public List<Signal> signals() {
        return book.signals();
    }

    public SignalStats stats() {
        List<Signal> signals = book.signals();
        int wins = 0;
        int losses = 0;
        int active = 0;
        for (Signal signal : signals) {
            switch (signal.status()) {
                case WIN -> wins++;
                case LOSS -> losses++;
                case PENDING -> active++;
            }
        }
        int finished = wins + losses;
        double winRate = finished > 0 ? wins * 100.0 / finished : 0.0;
        return new SignalStats(signals.size(), wins, losses, winRate, active);
    }

    private Signal settle(Signal signal, double price) {
        boolean favourable = signal.direction() == SignalDirection.CALL
                ? price > signal.entryPrice()
                : price < signal.entryPrice();
        return favourable
                ? signal.resolve(SignalStatus.WIN, price, policy.winPayout())
                : signal.resolve(SignalStatus.LOSS, price, policy.lossPayout());
    }

    private record Book(List<Signal> signals, Map<String, Signal> pendingByTimeframe) {
    }
}
