package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import java.util.Map;

/**
 * @param deviation 相对偏差，百分比
 */
public record NetworthValidation(boolean valid,
                                 double serverNetworth,
                                 double clientNetworth,
                                 double deviation,
                                 Map<String, Double> breakdown) {
}
