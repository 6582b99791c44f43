package com.eventbacktest.backtester.repository;

import com.eventbacktest.backtester.domain.BacktestRun;
import com.eventbacktest.backtester.domain.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for BacktestRun entity.
 */
@Repository
public interface BacktestRunRepository extends JpaRepository<BacktestRun, Long> {

    /**
     * Find runs by status, newest first.
     *
     * @param status the run status
     * @return list of runs with the given status
     */
    List<BacktestRun> findByStatusOrderByCreatedAtDesc(RunStatus status);

    /**
     * Find all runs of a strategy, newest first.
     */
    List<BacktestRun> findByStrategyNameOrderByCreatedAtDesc(String strategyName);
}
