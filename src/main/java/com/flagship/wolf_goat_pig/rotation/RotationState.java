package com.flagship.wolf_goat_pig.rotation;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Who tees off in which order on the current hole, and which once-per-round
 * tokens each player has spent.
 *
 * Immutable. Only {@link RotationManager} produces new instances.
 */
@Value
public class RotationState {
    int holeNumber;
    boolean specialPhase;
    /**
     * Base-order index of the captain the normal rotation would pick. Keeps
     * advancing during the special phase even though the captain is overridden.
     */
    int rotationPointer;
    /**
     * Base-order index of this hole's actual captain.
     */
    int captainIndex;
    List<PlayerId> baseOrder;
    List<PlayerId> teeOrder;
    Map<PlayerId, Integer> floatTokensSpent;

    RotationState(int holeNumber, boolean specialPhase, int rotationPointer, int captainIndex,
                  List<PlayerId> baseOrder, List<PlayerId> teeOrder, Map<PlayerId, Integer> floatTokensSpent) {
        this.holeNumber = holeNumber;
        this.specialPhase = specialPhase;
        this.rotationPointer = rotationPointer;
        this.captainIndex = captainIndex;
        this.baseOrder = List.copyOf(baseOrder);
        this.teeOrder = List.copyOf(teeOrder);
        this.floatTokensSpent = Map.copyOf(floatTokensSpent);
    }

    public PlayerId getCaptain() {
        return teeOrder.get(0);
    }

    public int floatTokensSpentBy(PlayerId player) {
        return floatTokensSpent.getOrDefault(player, 0);
    }

    public boolean isInRotation(PlayerId player) {
        return baseOrder.contains(player);
    }

    public int baseIndexOf(PlayerId player) {
        return baseOrder.indexOf(player);
    }

    RotationState withFloatSpent(PlayerId player) {
        Map<PlayerId, Integer> spent = new HashMap<>(floatTokensSpent);
        spent.merge(player, 1, Integer::sum);
        return new RotationState(holeNumber, specialPhase, rotationPointer, captainIndex, baseOrder, teeOrder, spent);
    }
}
