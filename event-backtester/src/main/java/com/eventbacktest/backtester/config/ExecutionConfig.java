package com.eventbacktest.backtester.config;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.execution.CommissionModel;
import com.eventbacktest.backtester.domain.execution.FixedCommissionModel;
import com.eventbacktest.backtester.domain.execution.PerShareCommissionModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the commission model used by simulated execution.
 */
@Configuration
@Slf4j
public class ExecutionConfig {

    @Bean
    public CommissionModel commissionModel(BacktestProperties properties) {
        String model = properties.getCommissionModel().toLowerCase();
        log.info("Using {} commission model", model);

        return switch (model) {
            case "fixed" -> new FixedCommissionModel(properties.getFixedCommission());
            case "per-share", "per_share" -> new PerShareCommissionModel();
            default -> throw new BacktestConfigurationException("Unknown commission model: " + model);
        };
    }
}
