package com.example.linguarelay.service;

import com.example.linguarelay.config.RelayProperties;
import com.example.linguarelay.model.Room;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic backstop for rooms that went empty without a tracked disconnect
 * (created but never joined, or whose long-grace timer never ran).
 */
@Service
public class RoomJanitor {

    private static final Logger log = LoggerFactory.getLogger(RoomJanitor.class);

    private final RoomStore store;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final List<PresenceListener> listeners;
    private final Duration period;
    private final Duration idleThreshold;

    private ScheduledFuture<?> task;

    @Autowired
    public RoomJanitor(RoomStore store,
                       Clock clock,
                       @Qualifier("presenceScheduler") ScheduledExecutorService scheduler,
                       RelayProperties props,
                       ObjectProvider<PresenceListener> listeners) {
        this(store, clock, scheduler, props.getJanitorPeriod(), props.getIdleThreshold(),
                listeners.orderedStream().toList());
    }

    public RoomJanitor(RoomStore store,
                       Clock clock,
                       ScheduledExecutorService scheduler,
                       Duration period,
                       Duration idleThreshold,
                       List<PresenceListener> listeners) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.period = Objects.requireNonNull(period, "period");
        this.idleThreshold = Objects.requireNonNull(idleThreshold, "idleThreshold");
        this.listeners = List.copyOf(listeners);
    }

    @PostConstruct
    public void start() {
        long ms = period.toMillis();
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                log.error("JANITOR sweep failed", e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.info("JANITOR started period={} idleThreshold={}", period, idleThreshold);
    }

    @PreDestroy
    public void stop() {
        if (task != null) task.cancel(false);
    }

    /** Deletes every empty room idle for longer than the threshold; returns how many were deleted. */
    public int sweep() {
        Instant now = clock.instant();
        int deleted = 0;
        for (Room room : store.listRooms()) {
            boolean gone = store.deleteIf(room,
                    r -> r.isEmpty() && Duration.between(r.getLastActivity(), now).compareTo(idleThreshold) > 0);
            if (gone) {
                deleted++;
                log.info("JANITOR deleted room {} (idle {} min)", room.getCode(),
                        Duration.between(room.getLastActivity(), now).toMinutes());
                PresenceManager.notifyRoomDeleted(listeners, room.getCode());
            }
        }
        if (deleted > 0 || log.isDebugEnabled()) {
            log.info("JANITOR sweep done: deleted={} remaining={}", deleted, store.size());
        }
        return deleted;
    }
}
