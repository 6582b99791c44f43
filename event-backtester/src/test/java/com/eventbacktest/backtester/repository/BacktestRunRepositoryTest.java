package com.eventbacktest.backtester.repository;

import com.eventbacktest.backtester.config.JpaConfig;
import com.eventbacktest.backtester.domain.BacktestRun;
import com.eventbacktest.backtester.domain.RunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaConfig.class)
class BacktestRunRepositoryTest {

    @Autowired
    private BacktestRunRepository backtestRunRepository;

    @Test
    void testFindByStatus_AuditsTimestamps() {
        // Arrange
        backtestRunRepository.save(run("ma_crossover", RunStatus.COMPLETED));
        backtestRunRepository.save(run("ma_crossover", RunStatus.FAILED));
        backtestRunRepository.save(run("pairs_mean_reversion", RunStatus.COMPLETED));

        // Act
        List<BacktestRun> completed = backtestRunRepository.findByStatusOrderByCreatedAtDesc(RunStatus.COMPLETED);

        // Assert
        assertEquals(2, completed.size());
        assertTrue(completed.stream().allMatch(r -> r.getCreatedAt() != null && r.getUpdatedAt() != null));
        assertEquals(2, backtestRunRepository.findByStrategyNameOrderByCreatedAtDesc("ma_crossover").size());
    }

    @Test
    void testEquityCurveJsonRoundTripsAsText() {
        BacktestRun run = run("ma_crossover", RunStatus.COMPLETED);
        run.setEquityCurveJson("[{\"total\":100000.0000}]");

        BacktestRun saved = backtestRunRepository.saveAndFlush(run);

        assertEquals("[{\"total\":100000.0000}]",
                backtestRunRepository.findById(saved.getId()).orElseThrow().getEquityCurveJson());
    }

    private BacktestRun run(String strategyName, RunStatus status) {
        return BacktestRun.builder()
                .strategyName(strategyName)
                .symbols("AAPL")
                .parametersJson("{}")
                .status(status)
                .initialCapital(new BigDecimal("100000"))
                .build();
    }
}
