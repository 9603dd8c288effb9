package com.bullrunhub.gameservice.games.bullrun.domain.model;

import com.bullrunhub.gameservice.games.bullrun.domain.enums.PauseReason;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 房间内的对局状态。
 *
 * 不变式（由 RoomServiceImpl 在房间锁内维护）：
 * - pauseReason != NONE 当且仅当 paused；
 * - playersWaitingForQuiz 非空 当且仅当 pauseReason == QUIZ。
 */
@Data
public class GameState {
    private boolean started;
    private boolean paused;
    private PauseReason pauseReason = PauseReason.NONE;
    private int currentYear = 1;
    private int currentMonth = 1;
    /** 终局标记：计时器已取消，不再推进 */
    private boolean ended;
    private List<String> playersWaitingForQuiz = new ArrayList<>();
    private List<String> playersWaitingForIntro = new ArrayList<>();
    private Map<String, List<LifeEvent>> lifeEvents;

    // ---- 透传字段 ----
    private JsonNode selectedAssets;
    private JsonNode assetUnlockSchedule;
    private List<String> yearlyQuotes;
    private Map<String, Integer> quizQuestionIndices;

    public void pause(PauseReason reason) {
        this.paused = true;
        this.pauseReason = reason;
    }

    public void resume() {
        this.paused = false;
        this.pauseReason = PauseReason.NONE;
    }

    public GameState copy() {
        GameState c = new GameState();
        c.setStarted(started);
        c.setPaused(paused);
        c.setPauseReason(pauseReason);
        c.setCurrentYear(currentYear);
        c.setCurrentMonth(currentMonth);
        c.setEnded(ended);
        c.setPlayersWaitingForQuiz(new ArrayList<>(playersWaitingForQuiz));
        c.setPlayersWaitingForIntro(new ArrayList<>(playersWaitingForIntro));
        if (lifeEvents != null) {
            Map<String, List<LifeEvent>> events = new LinkedHashMap<>();
            lifeEvents.forEach((pid, list) -> {
                List<LifeEvent> copied = new ArrayList<>(list.size());
                list.forEach(e -> copied.add(e.copy()));
                events.put(pid, copied);
            });
            c.setLifeEvents(events);
        }
        c.setSelectedAssets(selectedAssets == null ? null : selectedAssets.deepCopy());
        c.setAssetUnlockSchedule(assetUnlockSchedule == null ? null : assetUnlockSchedule.deepCopy());
        c.setYearlyQuotes(yearlyQuotes == null ? null : new ArrayList<>(yearlyQuotes));
        c.setQuizQuestionIndices(quizQuestionIndices == null ? null : new LinkedHashMap<>(quizQuestionIndices));
        return c;
    }
}
