package com.reflow.core.memory;

import com.reflow.core.config.ReflowProperties;
import com.reflow.core.model.RecoveryAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Similarity index from {@link FaultSignature} to the best-known recovery action.
 * <p>
 * Concurrent readers, single writer. Iteration follows insertion order, so ties between
 * equally similar entries resolve to the oldest one.
 */
@Component
public class MemoryBank {

    private static final Logger log = LoggerFactory.getLogger(MemoryBank.class);
    private static final double EPSILON = 1e-9;

    private final Map<String, MemoryEntry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final double minSimilarity;
    private final int maxExamples;

    @Autowired
    public MemoryBank(ReflowProperties properties) {
        this(properties.getMemory().getMinSimilarity(), properties.getMemory().getMaxExamples());
    }

    public MemoryBank(double minSimilarity, int maxExamples) {
        this.minSimilarity = minSimilarity;
        this.maxExamples = maxExamples;
    }

    public void upsert(FaultSignature signature, RecoveryAction action, boolean success) {
        lock.writeLock().lock();
        try {
            String key = signature.key();
            MemoryEntry existing = entries.get(key);
            MemoryEntry updated = existing == null
                    ? MemoryEntry.first(signature, action, success)
                    : existing.withOutcome(action, success, signature.keywords(), maxExamples);
            entries.put(key, updated);
            log.debug("Memory upsert {} -> {} (success={}, rate {}/{})",
                    key, updated.action(), success, updated.successes(), updated.total());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public MemoryMatch query(FaultSignature signature) {
        lock.readLock().lock();
        try {
            MemoryEntry exact = entries.get(signature.key());
            if (exact != null) {
                return match(exact, signature.key(), SignatureSimilarity.score(signature, exact.signature()));
            }
            String bestKey = null;
            MemoryEntry best = null;
            double bestScore = -1.0;
            for (Map.Entry<String, MemoryEntry> candidate : entries.entrySet()) {
                double score = SignatureSimilarity.score(signature, candidate.getValue().signature());
                if (score > bestScore) {
                    bestScore = score;
                    bestKey = candidate.getKey();
                    best = candidate.getValue();
                }
            }
            if (best == null || bestScore + EPSILON < minSimilarity) {
                return MemoryMatch.none();
            }
            return match(best, bestKey, bestScore);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static MemoryMatch match(MemoryEntry entry, String key, double similarity) {
        double confidence = Math.max(0.0, Math.min(1.0, 0.7 * similarity + 0.3 * entry.successRate()));
        return new MemoryMatch(entry.action(), confidence, key, similarity);
    }

    public List<MemoryEntry> entries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Replaces the whole content, e.g. after loading from disk. */
    public void replaceAll(Collection<MemoryEntry> loaded) {
        lock.writeLock().lock();
        try {
            entries.clear();
            for (MemoryEntry entry : loaded) {
                entries.put(entry.signature().key(), entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        replaceAll(List.of());
    }
}
