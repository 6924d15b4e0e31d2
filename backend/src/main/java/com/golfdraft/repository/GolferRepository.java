package com.golfdraft.repository;

import com.golfdraft.model.Golfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GolferRepository extends JpaRepository<Golfer, UUID> {
    Optional<Golfer> findByExternalId(String externalId);

    List<Golfer> findByIdIn(Collection<UUID> ids);
}
