package com.flagship.wolf_goat_pig.observability;

import com.flagship.wolf_goat_pig.engine.RoundEngine;
import com.flagship.wolf_goat_pig.engine.RoundService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Custom health indicators for the quarters engine.
 */
public class HealthIndicators {

    /**
     * Health indicator for round ledger integrity.
     * Down if any round in memory has a ledger that no longer sums to zero.
     */
    @Component("roundLedgerHealth")
    public static class RoundLedgerHealthIndicator implements HealthIndicator {

        private final RoundService roundService;

        public RoundLedgerHealthIndicator(RoundService roundService) {
            this.roundService = roundService;
        }

        @Override
        public Health health() {
            try {
                List<String> unbalanced = new ArrayList<>();
                int checked = 0;
                for (RoundEngine round : roundService.activeRounds()) {
                    checked++;
                    if (!round.zeroSumCheck()) {
                        unbalanced.add(round.getRoundId().toString());
                    }
                }

                Health.Builder builder = unbalanced.isEmpty() ? Health.up() : Health.down();
                return builder
                        .withDetail("roundsChecked", checked)
                        .withDetail("unbalancedRounds", unbalanced)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
