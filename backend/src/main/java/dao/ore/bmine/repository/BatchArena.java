package dao.ore.bmine.repository;

import dao.ore.bmine.model.IdentityBatch;

import java.util.List;
import java.util.Optional;

/**
 * Owns every identity batch for the process lifetime. Batches are referred to elsewhere by id only.
 */
public interface BatchArena {

    void save(IdentityBatch batch);

    Optional<IdentityBatch> findById(int id);

    List<IdentityBatch> findAll();

    int size();
}
