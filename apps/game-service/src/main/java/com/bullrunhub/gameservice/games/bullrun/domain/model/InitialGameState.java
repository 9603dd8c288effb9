package com.bullrunhub.gameservice.games.bullrun.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 开局时房主下发的共享初始数据，服务端只存储和转发，不解释其内容。
 */
@Data
public class InitialGameState {
    private JsonNode selectedAssets;
    private JsonNode assetUnlockSchedule;
    private List<String> yearlyQuotes;
    private Map<String, Integer> quizQuestionIndices;
}
