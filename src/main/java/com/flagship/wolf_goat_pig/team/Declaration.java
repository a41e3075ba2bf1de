package com.flagship.wolf_goat_pig.team;

import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A captain's team formation call for one hole.
 */
@Value
@Builder
public class Declaration {
    CaptainChoice choice;
    PlayerId partner;
    @Singular
    List<SpecialInvocation> invocations;

    public static Declaration solo() {
        return builder().choice(CaptainChoice.SOLO).build();
    }

    public static Declaration partner(PlayerId partner) {
        return builder().choice(CaptainChoice.PARTNER).partner(partner).build();
    }

    public static Declaration requestPartner(PlayerId partner) {
        return builder().choice(CaptainChoice.REQUEST_PARTNER).partner(partner).build();
    }

    public static Declaration floatDecision() {
        return builder().choice(CaptainChoice.FLOAT).build();
    }

    public boolean has(SpecialInvocation.Kind kind) {
        return invocations.stream().anyMatch(i -> i.getKind() == kind);
    }

    public <T extends SpecialInvocation> Optional<T> find(Class<T> type) {
        return invocations.stream().filter(type::isInstance).map(type::cast).findFirst();
    }
}
