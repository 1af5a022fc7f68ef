package dev.jobhunter.repository;

import dev.jobhunter.entity.JobMatch;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for persisted job matches.
 */
@Repository
public interface JobMatchRepository extends JpaRepository<JobMatch, String> {

    /**
     * Most recent matches first.
     */
    List<JobMatch> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Remove every match and report how many rows were deleted.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM JobMatch m")
    int deleteAllMatches();
}
