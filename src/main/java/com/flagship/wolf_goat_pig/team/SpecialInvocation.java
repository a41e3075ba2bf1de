package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

/**
 * A special rule invoked alongside a team declaration.
 *
 * Closed set; consumers switch on {@link #getKind()}.
 */
public sealed interface SpecialInvocation
    permits SpecialInvocation.Duncan, SpecialInvocation.LowPlayerSetsStakes,
            SpecialInvocation.PersonalOptIn, SpecialInvocation.BigDick {

    Kind getKind();

    enum Kind {
        DUNCAN,
        LOW_PLAYER_SETS_STAKES,
        PERSONAL_OPT_IN,
        BIG_DICK
    }

    static SpecialInvocation duncan() {
        return new Duncan();
    }

    static SpecialInvocation lowPlayerSetsStakes(int units) {
        return new LowPlayerSetsStakes(units);
    }

    static SpecialInvocation personalOptIn(PlayerId player, int stake) {
        return new PersonalOptIn(player, stake);
    }

    static SpecialInvocation bigDick(PlayerId player) {
        return new BigDick(player);
    }

    /**
     * Captain declares solo before seeing anyone else's result.
     */
    @Value
    class Duncan implements SpecialInvocation {
        @Override
        public Kind getKind() {
            return Kind.DUNCAN;
        }
    }

    /**
     * Special-phase captain overrides the hole's wager with a fixed value.
     */
    @Value
    class LowPlayerSetsStakes implements SpecialInvocation {
        int units;

        @Override
        public Kind getKind() {
            return Kind.LOW_PLAYER_SETS_STAKES;
        }
    }

    /**
     * One player raises their own exposure above the team wager.
     */
    @Value
    class PersonalOptIn implements SpecialInvocation {
        PlayerId player;
        int stake;

        @Override
        public Kind getKind() {
            return Kind.PERSONAL_OPT_IN;
        }
    }

    /**
     * On the final hole any player may take on the other three alone.
     */
    @Value
    class BigDick implements SpecialInvocation {
        PlayerId player;

        @Override
        public Kind getKind() {
            return Kind.BIG_DICK;
        }
    }
}
