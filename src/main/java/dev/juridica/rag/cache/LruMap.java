package dev.juridica.rag.cache;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Ordered map with explicit recency semantics. {@link #get(Object)} and
 * {@link #put(Object, Object)} move the key to the most recent position,
 * {@link #peek(Object)} does not. Not thread safe; owners guard it with their
 * own lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LruMap<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();

    public LruMap(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public V get(K key) {
        V value = entries.remove(key);
        if (value != null) {
            entries.put(key, value);
        }
        return value;
    }

    public V peek(K key) {
        return entries.get(key);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    /**
     * Stores the value as most recent entry.
     *
     * @return the least recently used entry if the insert exceeded the capacity
     */
    public Optional<Map.Entry<K, V>> put(K key, V value) {
        entries.remove(key);
        entries.put(key, value);
        if (entries.size() <= capacity) {
            return Optional.empty();
        }
        Iterator<Map.Entry<K, V>> iterator = entries.entrySet().iterator();
        Map.Entry<K, V> eldest = iterator.next();
        iterator.remove();
        return Optional.of(new AbstractMap.SimpleImmutableEntry<>(eldest));
    }

    public V remove(K key) {
        return entries.remove(key);
    }

    /**
     * Removes every entry matching the predicate.
     *
     * @return the removed keys, least recent first
     */
    public List<K> removeIf(BiPredicate<K, V> predicate) {
        List<K> removed = new ArrayList<>();
        Iterator<Map.Entry<K, V>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<K, V> entry = iterator.next();
            if (predicate.test(entry.getKey(), entry.getValue())) {
                removed.add(entry.getKey());
                iterator.remove();
            }
        }
        return removed;
    }

    public List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }
}
