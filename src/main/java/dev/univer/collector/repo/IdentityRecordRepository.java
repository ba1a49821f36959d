package dev.univer.collector.repo;

import dev.univer.collector.model.IdentityRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface IdentityRecordRepository extends JpaRepository<IdentityRecord, Long> {

    @Query("select r.userId from IdentityRecord r where r.userId in :ids")
    List<Long> findExistingIds(@Param("ids") Collection<Long> ids);

    List<IdentityRecord> findAllByUsername(String username);
    List<IdentityRecord> findAllByCollectedAtBetweenOrderByCollectedAtAsc(Instant from, Instant to);
    List<IdentityRecord> findAllBySourceChatIdOrderByCollectedAtAsc(Long sourceChatId);

    long countByUsernameIsNotNull();
    long countByPremiumTrue();
    long countByVerifiedTrue();
    long countByBotTrue();

    @Query("select min(r.collectedAt) from IdentityRecord r")
    Instant findFirstCollectedAt();

    @Query("select max(r.collectedAt) from IdentityRecord r")
    Instant findLastCollectedAt();
}
