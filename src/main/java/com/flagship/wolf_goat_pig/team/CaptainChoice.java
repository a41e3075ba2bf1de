package com.flagship.wolf_goat_pig.team;

public enum CaptainChoice {
    SOLO,
    PARTNER,
    REQUEST_PARTNER,
    FLOAT
}
