package com.demoAuto.salesAgent.catalog.model;

import lombok.Value;

/**
 * A catalog record paired with the score a matching strategy gave it.
 */
@Value
public class ScoredVehicle {

    VehicleRecord vehicle;
    double score;
}
