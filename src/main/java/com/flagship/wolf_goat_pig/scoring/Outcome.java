package com.flagship.wolf_goat_pig.scoring;

import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.Side;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Result of comparing both sides' best balls on a hole.
 *
 * {@code winningSide} is null only for {@link OutcomeType#TIE}. The outlier is
 * set only for {@link OutcomeType#UNEVEN_PAYOFF}.
 */
@Value
@Builder
public class Outcome {
    OutcomeType type;
    Side winningSide;
    int captainBestBall;
    int opponentsBestBall;
    PlayerId outlier;

    public boolean isTie() {
        return type == OutcomeType.TIE;
    }

    public Optional<PlayerId> findOutlier() {
        return Optional.ofNullable(outlier);
    }

    public Side losingSide() {
        if (winningSide == null) {
            throw new IllegalStateException("A tied hole has no losing side");
        }
        return winningSide.opposite();
    }
}
