package com.flagship.wolf_goat_pig.wager;

import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import com.flagship.wolf_goat_pig.team.Side;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The wager of one hole.
 *
 * Immutable: every change returns a new instance with the change appended to
 * {@link #getEvents()}. Once {@link #isLocked()} is true no method that changes
 * the amount may be called.
 *
 * Personal opt-in stakes do not change {@link #getCurrentUnits()}; they only
 * change how a side's total is split among its members (see
 * {@link #weightOf(PlayerId)}).
 */
@Value
public class WagerState {
    long baseUnits;
    long currentUnits;
    List<WagerEvent> events;
    Map<PlayerId, Long> personalStakes;
    /**
     * Team value the personal stakes were measured against; 0 when none.
     */
    long optInReferenceUnits;
    boolean optionPending;
    /**
     * Side entitled to counter the latest escalation, or null.
     */
    Side pendingCounter;
    boolean locked;

    private WagerState(long baseUnits, long currentUnits, List<WagerEvent> events,
                       Map<PlayerId, Long> personalStakes, long optInReferenceUnits,
                       boolean optionPending, Side pendingCounter, boolean locked) {
        this.baseUnits = baseUnits;
        this.currentUnits = currentUnits;
        this.events = List.copyOf(events);
        this.personalStakes = Map.copyOf(personalStakes);
        this.optInReferenceUnits = optInReferenceUnits;
        this.optionPending = optionPending;
        this.pendingCounter = pendingCounter;
        this.locked = locked;
    }

    /**
     * Creates an unlocked wager at {@code baseUnits}.
     */
    public static WagerState initial(long baseUnits) {
        if (baseUnits < 1) {
            throw new IllegalArgumentException("Base wager must be at least 1 unit");
        }
        List<WagerEvent> events = List.of(new WagerEvent(WagerRule.BASE, 0, baseUnits, null, null));
        return new WagerState(baseUnits, baseUnits, events, Map.of(), 0, false, null, false);
    }

    /**
     * Multiplies the running value.
     */
    public WagerState multiply(WagerRule rule, long factor, Side side) {
        requireUnlocked();
        long next = Math.multiplyExact(currentUnits, factor);
        return new WagerState(baseUnits, next, append(new WagerEvent(rule, currentUnits, next, null, side)),
            personalStakes, optInReferenceUnits, optionPending, pendingCounter, false);
    }

    /**
     * Replaces the running value, discarding multiplications applied so far.
     */
    public WagerState override(WagerRule rule, long units) {
        requireUnlocked();
        if (units < 1) {
            throw new IllegalArgumentException("Wager override must be at least 1 unit");
        }
        return new WagerState(baseUnits, units, append(new WagerEvent(rule, currentUnits, units, null, null)),
            personalStakes, optInReferenceUnits, optionPending, pendingCounter, false);
    }

    /**
     * Records a personal stake above the current team value.
     */
    public WagerState withPersonalStake(PlayerId player, long stake) {
        requireUnlocked();
        if (stake <= currentUnits) {
            throw new IllegalArgumentException("Personal stake must exceed the team wager");
        }
        Map<PlayerId, Long> stakes = new HashMap<>(personalStakes);
        stakes.put(player, stake);
        WagerEvent event = new WagerEvent(WagerRule.PERSONAL_OPT_IN, currentUnits, stake, player, null);
        return new WagerState(baseUnits, currentUnits, append(event), stakes, currentUnits,
            optionPending, pendingCounter, false);
    }

    public WagerState withPendingCounter(Side side) {
        requireUnlocked();
        return new WagerState(baseUnits, currentUnits, events, personalStakes, optInReferenceUnits,
            optionPending, side, false);
    }

    public WagerState withOptionPending(boolean pending) {
        requireUnlocked();
        return new WagerState(baseUnits, currentUnits, events, personalStakes, optInReferenceUnits,
            pending, pendingCounter, false);
    }

    /**
     * Freezes the wager. A still-pending Option is applied first as a regular
     * doubling step for the captain's side.
     */
    public WagerState lock() {
        requireUnlocked();
        WagerState settled = this;
        if (optionPending) {
            settled = withOptionPending(false).multiply(WagerRule.THE_OPTION, 2, Side.CAPTAIN);
        }
        return new WagerState(baseUnits, settled.currentUnits, settled.events, personalStakes,
            optInReferenceUnits, false, null, true);
    }

    /**
     * Units the hole would be played for if locked now, including a pending
     * Option.
     */
    public long projectedUnits() {
        return optionPending ? Math.multiplyExact(currentUnits, 2) : currentUnits;
    }

    /**
     * Relative share of a player within their side. Equal for everyone unless
     * personal stakes were taken; then opted-in players weigh their stake and
     * the rest weigh the team value the stakes were measured against.
     */
    public Quarters weightOf(PlayerId player) {
        if (personalStakes.isEmpty()) {
            return Quarters.ONE;
        }
        return Quarters.of(personalStakes.getOrDefault(player, optInReferenceUnits));
    }

    public boolean hasPersonalStake(PlayerId player) {
        return personalStakes.containsKey(player);
    }

    private List<WagerEvent> append(WagerEvent event) {
        List<WagerEvent> next = new ArrayList<>(events);
        next.add(event);
        return next;
    }

    private void requireUnlocked() {
        if (locked) {
            throw new IllegalStateException("Wager is locked; no further changes allowed");
        }
    }
}
