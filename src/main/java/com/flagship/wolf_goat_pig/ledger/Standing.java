package com.flagship.wolf_goat_pig.ledger;

import com.flagship.wolf_goat_pig.quarters.Quarters;
import com.flagship.wolf_goat_pig.round.PlayerId;
import lombok.Value;

@Value
public class Standing {
    int position;
    PlayerId player;
    Quarters total;
}
