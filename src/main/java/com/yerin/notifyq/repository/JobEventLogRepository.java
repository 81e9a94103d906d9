package com.yerin.notifyq.repository;

import com.yerin.notifyq.domain.JobEventLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface JobEventLogRepository extends JpaRepository<JobEventLog, Long> {
    List<JobEventLog> findTop100ByJobKeyOrderByTsDesc(String jobKey);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from JobEventLog e where e.ts < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
