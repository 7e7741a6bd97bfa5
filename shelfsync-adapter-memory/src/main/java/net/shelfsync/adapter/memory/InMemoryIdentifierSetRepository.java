package net.shelfsync.adapter.memory;

import net.shelfsync.core.spi.IdentifierSetRepository;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryIdentifierSetRepository implements IdentifierSetRepository {
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public int add(String setKey, Collection<String> identifiers) {
        Set<String> set = sets.computeIfAbsent(setKey, k -> ConcurrentHashMap.newKeySet());
        int added = 0;
        for (String id : identifiers) {
            if (set.add(id)) added++;
        }
        return added;
    }

    @Override
    public Set<String> members(String setKey) {
        return Set.copyOf(sets.getOrDefault(setKey, Set.of()));
    }

    @Override
    public int size(String setKey) {
        return sets.getOrDefault(setKey, Set.of()).size();
    }

    @Override
    public boolean delete(String setKey) {
        return sets.remove(setKey) != null;
    }
}
