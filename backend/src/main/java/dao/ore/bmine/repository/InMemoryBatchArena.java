package dao.ore.bmine.repository;

import dao.ore.bmine.model.IdentityBatch;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryBatchArena implements BatchArena {

    // key: batch id
    private final Map<Integer, IdentityBatch> batchesById = new ConcurrentHashMap<>();

    @Override
    public void save(IdentityBatch batch) {
        IdentityBatch previous = batchesById.putIfAbsent(batch.id(), batch);
        if (previous != null && previous != batch) {
            throw new IllegalStateException("batch id " + batch.id() + " already taken");
        }
    }

    @Override
    public Optional<IdentityBatch> findById(int id) {
        return Optional.ofNullable(batchesById.get(id));
    }

    @Override
    public List<IdentityBatch> findAll() {
        List<IdentityBatch> all = new ArrayList<>(batchesById.values());
        all.sort(Comparator.comparingInt(IdentityBatch::id));
        return all;
    }

    @Override
    public int size() {
        return batchesById.size();
    }
}
