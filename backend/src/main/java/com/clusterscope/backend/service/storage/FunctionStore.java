package com.clusterscope.backend.service.storage;

import com.clusterscope.backend.config.ConsoleProperties;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionOrder;
import com.clusterscope.backend.domain.FunctionRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON-file persistence of user-defined functions, per-cluster preferences and built-in access times.
 * Every mutation is flushed before it returns.
 */
@Component
public class FunctionStore {

    private static final Logger log = LoggerFactory.getLogger(FunctionStore.class);

    static final String FILE_NAME = "system_functions.json";

    /** On-disk layout. */
    public record StoreFile(
            long nextId,
            List<FunctionDescriptor> functions,
            Map<Long, Map<String, FunctionPreference>> preferences,
            Map<String, Instant> accessTimes
    ) {}

    private final ObjectMapper om;
    private final Path filePath;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private long nextId = 1;
    private final Map<Long, FunctionDescriptor> functions = new LinkedHashMap<>();
    private final Map<Long, Map<String, FunctionPreference>> preferences = new HashMap<>();
    private final Map<String, Instant> accessTimes = new HashMap<>();

    public FunctionStore(ObjectMapper om, ConsoleProperties props) {
        this.om = om;
        this.filePath = Paths.get(props.getStorageDir(), FILE_NAME);
        load();
    }

    // ---------------- user-defined functions ----------------

    public List<FunctionDescriptor> userFunctions(long clusterId) {
        lock.readLock().lock();
        try {
            return functions.values().stream()
                    .filter(f -> Objects.equals(f.clusterId(), clusterId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<FunctionDescriptor> userFunction(long clusterId, long id) {
        lock.readLock().lock();
        try {
            FunctionDescriptor f = functions.get(id);
            return f != null && Objects.equals(f.clusterId(), clusterId) ? Optional.of(f) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores a new user-defined function and returns it with its assigned id.
     */
    public FunctionDescriptor insert(FunctionDescriptor draft) {
        lock.writeLock().lock();
        try {
            long id = nextId++;
            FunctionDescriptor created = new FunctionDescriptor(
                    id, draft.name(), draft.description(), draft.category(), draft.sqlQuery(),
                    false, false, draft.categoryOrder(), draft.displayOrder(),
                    draft.clusterId(), draft.createdBy(), draft.createdAt(), draft.updatedAt());
            functions.put(id, created);
            flush();
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public FunctionDescriptor replace(FunctionDescriptor next) {
        lock.writeLock().lock();
        try {
            if (next.id() == null || !functions.containsKey(next.id())) {
                throw new NoSuchElementException("Function not found: " + next.id());
            }
            functions.put(next.id(), next);
            flush();
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean delete(long clusterId, long id) {
        lock.writeLock().lock();
        try {
            FunctionDescriptor f = functions.get(id);
            if (f == null || !Objects.equals(f.clusterId(), clusterId)) return false;
            functions.remove(id);
            clusterPrefs(clusterId).remove(FunctionRef.user(id).key());
            flush();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the cluster's user-defined functions of a category with their preferences.
     *
     * @return number of functions removed
     */
    public int deleteCategory(long clusterId, String category) {
        lock.writeLock().lock();
        try {
            List<Long> doomed = functions.values().stream()
                    .filter(f -> Objects.equals(f.clusterId(), clusterId) && f.category().equals(category))
                    .map(FunctionDescriptor::id)
                    .toList();
            Map<String, FunctionPreference> prefs = clusterPrefs(clusterId);
            for (Long id : doomed) {
                functions.remove(id);
                prefs.remove(FunctionRef.user(id).key());
            }
            if (!doomed.isEmpty()) flush();
            return doomed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------- preferences ----------------

    public Map<String, FunctionPreference> preferences(long clusterId) {
        lock.readLock().lock();
        try {
            return Map.copyOf(preferences.getOrDefault(clusterId, Map.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Writes every order in one flush; favorite flags are kept.
     */
    public void upsertOrders(long clusterId, List<FunctionOrder> orders) {
        lock.writeLock().lock();
        try {
            Map<String, FunctionPreference> prefs = clusterPrefs(clusterId);
            Instant now = Instant.now();
            for (FunctionOrder o : orders) {
                String key = o.ref().key();
                FunctionPreference prev = prefs.get(key);
                prefs.put(key, new FunctionPreference(
                        o.categoryOrder(), o.displayOrder(), prev != null && prev.favorited(), now));
            }
            flush();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the new favorite flag
     */
    public boolean toggleFavorite(long clusterId, FunctionRef ref) {
        lock.writeLock().lock();
        try {
            Map<String, FunctionPreference> prefs = clusterPrefs(clusterId);
            FunctionPreference prev = prefs.get(ref.key());
            boolean next = prev == null || !prev.favorited();
            prefs.put(ref.key(), new FunctionPreference(
                    prev == null ? null : prev.categoryOrder(),
                    prev == null ? null : prev.displayOrder(),
                    next,
                    Instant.now()));
            flush();
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------- built-in access times ----------------

    public void touch(String name, Instant at) {
        lock.writeLock().lock();
        try {
            accessTimes.put(name, at);
            flush();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Instant> lastAccess(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(accessTimes.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------- file io ----------------

    private Map<String, FunctionPreference> clusterPrefs(long clusterId) {
        return preferences.computeIfAbsent(clusterId, k -> new HashMap<>());
    }

    private void ensureDir() {
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void load() {
        lock.writeLock().lock();
        try {
            ensureDir();
            if (!Files.exists(filePath)) {
                flush();
                return;
            }
            byte[] raw = Files.readAllBytes(filePath);
            if (raw.length == 0) return;

            StoreFile file = om.readValue(raw, StoreFile.class);
            if (file.functions() != null) {
                for (FunctionDescriptor f : file.functions()) {
                    functions.put(f.id(), f);
                }
            }
            if (file.preferences() != null) {
                file.preferences().forEach((cluster, prefs) -> preferences.put(cluster, withValidKeys(cluster, prefs)));
            }
            if (file.accessTimes() != null) {
                accessTimes.putAll(file.accessTimes());
            }
            long maxId = functions.keySet().stream().mapToLong(Long::longValue).max().orElse(0);
            nextId = Math.max(file.nextId(), maxId + 1);
            log.info("loaded {} user-defined function(s) from {}", functions.size(), filePath);
        } catch (IOException e) {
            log.error("function store {} is unreadable, starting empty", filePath, e);
            functions.clear();
            preferences.clear();
            accessTimes.clear();
            nextId = 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Map<String, FunctionPreference> withValidKeys(long clusterId, Map<String, FunctionPreference> prefs) {
        Map<String, FunctionPreference> out = new HashMap<>();
        prefs.forEach((key, pref) -> {
            try {
                out.put(FunctionRef.parse(key).key(), pref);
            } catch (IllegalArgumentException e) {
                log.warn("dropping preference {} of cluster {}: {}", key, clusterId, e.getMessage());
            }
        });
        return out;
    }

    private void flush() {
        try {
            ensureDir();
            StoreFile file = new StoreFile(nextId, new ArrayList<>(functions.values()), preferences, accessTimes);
            byte[] out = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(file);
            Files.write(filePath, out, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + filePath, e);
        }
    }
}
