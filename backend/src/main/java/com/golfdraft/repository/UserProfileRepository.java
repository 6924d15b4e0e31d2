package com.golfdraft.repository;

import com.golfdraft.model.UserProfile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {
    List<UserProfile> findByIdIn(Collection<UUID> ids);

    boolean existsByIdAndAdminTrue(UUID id);

    /**
     * Locks the given users in id order. Season totals of a user are only changed while this
     * lock is held, which also covers the insert of a user's first row for a year.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from UserProfile u where u.id in :userIds order by u.id")
    List<UserProfile> findByIdInForUpdate(@Param("userIds") Collection<UUID> userIds);
}
