package com.enterprise.jobqueue.store;

import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * MapDB-based backing store.
 * Every operation runs under a single lock and is committed before the lock is
 * released, so each one is atomic for all threads of the process.
 */
public class MapDBBackingStore implements BackingStore {

    private static final Logger logger = LoggerFactory.getLogger(MapDBBackingStore.class);

    private static final String LIST_PREFIX = "list:";
    private static final String SCORED_INDEX_PREFIX = "zidx:";
    private static final String SCORED_MEMBER_PREFIX = "zmem:";

    private final DB db;
    private final boolean transactional;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed;

    // MapDB collections
    private final HTreeMap<String, byte[]> values;
    private final HTreeMap<String, Long> expirations;
    private final HTreeMap<String, Long> counters;
    private final HTreeMap<String, Long> listSequences;

    // Named collections are opened lazily and cached
    private final Map<String, BTreeMap<Long, String>> lists = new ConcurrentHashMap<>();
    private final Map<String, BTreeMap<String, String>> scoredIndexes = new ConcurrentHashMap<>();
    private final Map<String, HTreeMap<String, Long>> scoredMembers = new ConcurrentHashMap<>();

    MapDBBackingStore(DB db, boolean transactional, Clock clock, String description) {
        this.db = db;
        this.transactional = transactional;
        this.clock = clock;

        this.values = db.hashMap("values", Serializer.STRING, Serializer.BYTE_ARRAY).createOrOpen();
        this.expirations = db.hashMap("expirations", Serializer.STRING, Serializer.LONG).createOrOpen();
        this.counters = db.hashMap("counters", Serializer.STRING, Serializer.LONG).createOrOpen();
        this.listSequences = db.hashMap("listSequences", Serializer.STRING, Serializer.LONG).createOrOpen();
        commit();

        logger.info("MapDBBackingStore initialized ({})", description);
    }

    /**
     * Non-persistent store, used by tests and single-process deployments
     */
    public static MapDBBackingStore inMemory() {
        return inMemory(Clock.systemUTC());
    }

    public static MapDBBackingStore inMemory(Clock clock) {
        DB db = DBMaker.memoryDB().make();
        return new MapDBBackingStore(db, false, clock, "in-memory");
    }

    /**
     * File-backed store with transactions, surviving process restarts
     */
    public static MapDBBackingStore file(String dbPath) {
        return file(dbPath, Clock.systemUTC());
    }

    public static MapDBBackingStore file(String dbPath, Clock clock) {
        DB db = DBMaker.fileDB(new File(dbPath))
            .transactionEnable()
            .make();
        return new MapDBBackingStore(db, true, clock, "file " + dbPath);
    }

    @Override
    public void pushTail(String list, String value) {
        write("pushTail", () -> {
            long sequence = listSequences.getOrDefault(list, 0L) + 1;
            listSequences.put(list, sequence);
            list(list).put(sequence, value);
            return null;
        });
    }

    @Override
    public Optional<String> popHead(String list) {
        return write("popHead", () -> {
            BTreeMap<Long, String> entries = list(list);
            Map.Entry<Long, String> head = entries.firstEntry();
            if (head == null) {
                return Optional.empty();
            }
            entries.remove(head.getKey());
            return Optional.of(head.getValue());
        });
    }

    @Override
    public List<String> listRange(String list, long offset, int limit) {
        return read(() -> list(list).values().stream()
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public long listSize(String list) {
        return read(() -> (long) list(list).size());
    }

    @Override
    public void addScored(String set, String member, long score) {
        write("addScored", () -> {
            HTreeMap<String, Long> members = scoredMembers(set);
            BTreeMap<String, String> index = scoredIndex(set);
            Long previous = members.put(member, score);
            if (previous != null) {
                index.remove(indexKey(previous, member));
            }
            index.put(indexKey(score, member), member);
            return null;
        });
    }

    @Override
    public List<String> popDueScored(String set, long maxScore, int limit) {
        return write("popDueScored", () -> {
            HTreeMap<String, Long> members = scoredMembers(set);
            BTreeMap<String, String> index = scoredIndex(set);
            List<String> due = new ArrayList<>();
            List<String> dueKeys = new ArrayList<>();
            for (Map.Entry<String, String> entry : index.entrySet()) {
                if (due.size() >= limit || scoreOf(entry.getKey()) > maxScore) {
                    break;
                }
                due.add(entry.getValue());
                dueKeys.add(entry.getKey());
            }
            for (int i = 0; i < due.size(); i++) {
                index.remove(dueKeys.get(i));
                members.remove(due.get(i));
            }
            return due;
        });
    }

    @Override
    public boolean removeScored(String set, String member) {
        return write("removeScored", () -> {
            Long score = scoredMembers(set).remove(member);
            if (score == null) {
                return false;
            }
            scoredIndex(set).remove(indexKey(score, member));
            return true;
        });
    }

    @Override
    public List<String> scoredRange(String set, long offset, int limit) {
        return read(() -> scoredIndex(set).values().stream()
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public long scoredSize(String set) {
        return read(() -> (long) scoredMembers(set).size());
    }

    @Override
    public Optional<byte[]> get(String key) {
        return read(() -> Optional.ofNullable(liveValue(key)));
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        write("put", () -> {
            store(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean putIfAbsent(String key, byte[] value, Duration ttl) {
        return write("putIfAbsent", () -> {
            if (liveValue(key) != null) {
                return false;
            }
            store(key, value, ttl);
            return true;
        });
    }

    @Override
    public boolean compareAndSet(String key, byte[] expected, byte[] update, Duration ttl) {
        return write("compareAndSet", () -> {
            byte[] current = liveValue(key);
            if (current == null || !Arrays.equals(current, expected)) {
                return false;
            }
            store(key, update, ttl);
            return true;
        });
    }

    @Override
    public boolean compareAndDelete(String key, byte[] expected) {
        return write("compareAndDelete", () -> {
            byte[] current = liveValue(key);
            if (current == null || !Arrays.equals(current, expected)) {
                return false;
            }
            values.remove(key);
            expirations.remove(key);
            return true;
        });
    }

    @Override
    public boolean delete(String key) {
        return write("delete", () -> {
            boolean existed = liveValue(key) != null;
            values.remove(key);
            expirations.remove(key);
            return existed;
        });
    }

    @Override
    public int purgeExpired() {
        return write("purgeExpired", () -> {
            long now = clock.millis();
            List<String> expired = expirations.entrySet().stream()
                .filter(entry -> entry.getValue() <= now)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
            for (String key : expired) {
                values.remove(key);
                expirations.remove(key);
            }
            if (!expired.isEmpty()) {
                logger.debug("Purged {} expired keys", expired.size());
            }
            return expired.size();
        });
    }

    @Override
    public long increment(String counter, long delta) {
        return write("increment", () -> {
            long value = counters.getOrDefault(counter, 0L) + delta;
            counters.put(counter, value);
            return value;
        });
    }

    @Override
    public long counter(String counter) {
        return read(() -> counters.getOrDefault(counter, 0L));
    }

    @Override
    public void ping() {
        read(() -> values.size());
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            db.close();
            logger.info("MapDBBackingStore closed");
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // Reads take the same lock as writes: they may open a named collection for the first time
    private <T> T read(Supplier<T> action) {
        return write("read", action);
    }

    private <T> T write(String operation, Supplier<T> action) {
        lock.lock();
        try {
            ensureOpen();
            T result = action.get();
            commit();
            return result;
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (IllegalAccessError e) {
            // MapDB signals a database closed underneath us with an Error
            closed = true;
            logger.error("Store operation {} failed, database was closed", operation, e);
            throw new StoreUnavailableException("Backing store is closed", e);
        } catch (RuntimeException e) {
            rollback();
            logger.error("Store operation {} failed", operation, e);
            throw new StoreUnavailableException("Store operation " + operation + " failed", e);
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreUnavailableException("Backing store is closed");
        }
    }

    private void commit() {
        if (transactional) {
            db.commit();
        }
    }

    private void rollback() {
        if (transactional) {
            db.rollback();
        }
    }

    private byte[] liveValue(String key) {
        byte[] value = values.get(key);
        if (value == null) {
            return null;
        }
        Long expiresAt = expirations.get(key);
        if (expiresAt != null && expiresAt <= clock.millis()) {
            return null;
        }
        return value;
    }

    private void store(String key, byte[] value, Duration ttl) {
        values.put(key, value);
        if (ttl == null) {
            expirations.remove(key);
        } else {
            expirations.put(key, clock.millis() + ttl.toMillis());
        }
    }

    private BTreeMap<Long, String> list(String name) {
        return lists.computeIfAbsent(name, n ->
            db.treeMap(LIST_PREFIX + n, Serializer.LONG, Serializer.STRING).createOrOpen());
    }

    private BTreeMap<String, String> scoredIndex(String name) {
        return scoredIndexes.computeIfAbsent(name, n ->
            db.treeMap(SCORED_INDEX_PREFIX + n, Serializer.STRING, Serializer.STRING).createOrOpen());
    }

    private HTreeMap<String, Long> scoredMembers(String name) {
        return scoredMembers.computeIfAbsent(name, n ->
            db.hashMap(SCORED_MEMBER_PREFIX + n, Serializer.STRING, Serializer.LONG).createOrOpen());
    }

    // Zero-padded so lexical order of the index equals numeric score order
    private static String indexKey(long score, String member) {
        return String.format("%019d|%s", Math.max(0L, score), member);
    }

    private static long scoreOf(String indexKey) {
        return Long.parseLong(indexKey.substring(0, indexKey.indexOf('|')));
    }
}
