package io.amp.kernel.tools;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolSpecCache {
    private static final Logger log = LoggerFactory.getLogger(ToolSpecCache.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, RegisteredTool> tools = Map.of();
    private List<String> order = List.of();
    private Instant refreshedAt = Instant.EPOCH;

    public ToolSpecCache() {}

    public ToolSpecCache(List<RegisteredTool> snapshot) {
        replace(snapshot);
    }

    public static ToolSpecCache from(ToolRegistry registry) {
        var cache = new ToolSpecCache();
        cache.refresh(registry);
        return cache;
    }

    public void refresh(ToolRegistry registry) {
        var fresh = registry.snapshot();
        replace(fresh);
        log.debug("Tool cache refreshed with {} tool(s)", fresh.size());
    }

    public void replace(List<RegisteredTool> snapshot) {
        var ordered = new LinkedHashMap<String, RegisteredTool>();
        for (var tool : snapshot) {
            ordered.putIfAbsent(tool.name(), tool);
        }
        lock.writeLock().lock();
        try {
            tools = Map.copyOf(ordered);
            order = List.copyOf(ordered.keySet());
            refreshedAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<RegisteredTool> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tools.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RegisteredTool> withCapability(String capability) {
        var result = new ArrayList<RegisteredTool>();
        for (var tool : snapshot()) {
            if (tool.spec().advertises(capability)) {
                result.add(tool);
            }
        }
        return result;
    }

    public List<RegisteredTool> snapshot() {
        lock.readLock().lock();
        try {
            var result = new ArrayList<RegisteredTool>(order.size());
            for (var name : order) {
                result.add(tools.get(name));
            }
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> names() {
        lock.readLock().lock();
        try {
            return order;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant refreshedAt() {
        lock.readLock().lock();
        try {
            return refreshedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isStale(Duration maxAge) {
        return refreshedAt().plus(maxAge).isBefore(Instant.now());
    }
}
