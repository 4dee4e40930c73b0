package com.vtrader.repository.jpa;

import com.vtrader.entity.TradingAccountEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trading_accounts table. The owner lookup selects the user id only,
 * so resolving the owner of an order or position never loads (or snapshots) the account.
 */
@Repository
public interface TradingAccountJpaRepository extends JpaRepository<TradingAccountEntity, String> {

    @Query("SELECT a.userId FROM TradingAccountEntity a WHERE a.id = :id")
    Optional<String> findUserIdById(@Param("id") String id);
}
