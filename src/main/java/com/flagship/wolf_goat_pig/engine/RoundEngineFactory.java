package com.flagship.wolf_goat_pig.engine;

import com.flagship.wolf_goat_pig.config.EngineProperties;
import com.flagship.wolf_goat_pig.distribution.QuarterDistributionEngine;
import com.flagship.wolf_goat_pig.journal.RoundEventJournal;
import com.flagship.wolf_goat_pig.observability.EngineMetrics;
import com.flagship.wolf_goat_pig.rotation.RotationManager;
import com.flagship.wolf_goat_pig.round.RoundSetup;
import com.flagship.wolf_goat_pig.scoring.ScoringResolver;
import com.flagship.wolf_goat_pig.team.TeamFormationStateMachine;
import com.flagship.wolf_goat_pig.wager.DoublingNegotiator;
import com.flagship.wolf_goat_pig.wager.WagerCalculator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Wires the stateless rule components into a new per-round {@link RoundEngine}.
 */
@Component
@Getter
@RequiredArgsConstructor
public class RoundEngineFactory {

    private final EngineProperties properties;
    private final RotationManager rotationManager;
    private final TeamFormationStateMachine formationStateMachine;
    private final WagerCalculator wagerCalculator;
    private final DoublingNegotiator doublingNegotiator;
    private final ScoringResolver scoringResolver;
    private final QuarterDistributionEngine distributionEngine;
    private final RoundEventJournal journal;
    private final EngineMetrics metrics;

    public RoundEngine create(UUID roundId, RoundSetup setup) {
        return new RoundEngine(roundId, setup, this);
    }
}
