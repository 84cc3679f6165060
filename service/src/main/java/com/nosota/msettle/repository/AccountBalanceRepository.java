package com.nosota.msettle.repository;

import com.nosota.msettle.model.AccountBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountBalanceRepository extends JpaRepository<AccountBalance, Long> {
    /**
     * Retrieves the balance row of a principal in an asset and locks it for update.
     * <p>
     * Every balance mutation goes through this method, so concurrent operations touching
     * the same account are serialized by the database. Keep the surrounding transaction short.
     * </p>
     *
     * @param principal Account owner
     * @param asset     {@code NATIVE} or a token id
     * @return The locked row, or empty if the account has never been credited
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM AccountBalance b WHERE b.principal = :principal AND b.asset = :asset")
    Optional<AccountBalance> findForUpdate(@Param("principal") String principal, @Param("asset") String asset);

    Optional<AccountBalance> findByPrincipalAndAsset(String principal, String asset);

    List<AccountBalance> findAllByPrincipal(String principal);

    @Query("SELECT COALESCE(SUM(b.balance), 0L) FROM AccountBalance b WHERE b.asset = :asset")
    Long sumBalancesByAsset(@Param("asset") String asset);
}
