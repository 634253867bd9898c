package com.market.sentiment.repository;

import com.market.sentiment.entity.PipelineRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, Long> {

    List<PipelineRun> findTop20ByOrderByStartedAtDesc();

    @Query("SELECT MAX(r.runId) FROM PipelineRun r WHERE r.status = :status")
    Long findLastRunIdByStatus(@Param("status") String status);

    /**
     * 上次成功运行之后、未成功结束的运行中最早的候选窗口起点。
     * 这些运行的合并可能已经提交，而派生表没有重算完。
     */
    @Query("SELECT MIN(r.windowStart) FROM PipelineRun r WHERE r.runId > :afterRunId "
            + "AND r.runId <> :currentRunId AND r.status <> :status")
    LocalDateTime findEarliestUnfinishedWindowStart(@Param("afterRunId") Long afterRunId,
                                                    @Param("currentRunId") Long currentRunId,
                                                    @Param("status") String status);
}
