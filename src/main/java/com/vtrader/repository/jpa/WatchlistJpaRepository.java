package com.vtrader.repository.jpa;

import com.vtrader.entity.WatchlistEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface WatchlistJpaRepository extends JpaRepository<WatchlistEntity, String> {

    List<WatchlistEntity> findByUserId(String userId);

    @Query("SELECT w.userId FROM WatchlistEntity w WHERE w.id = :id")
    Optional<String> findUserIdById(@Param("id") String id);
}
