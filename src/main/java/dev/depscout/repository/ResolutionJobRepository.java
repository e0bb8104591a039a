package dev.depscout.repository;

import dev.depscout.domain.entity.ResolutionJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface ResolutionJobRepository extends JpaRepository<ResolutionJob, UUID> {
    @Transactional
    long deleteByExpiresAtBefore(Instant cutoff);
}
