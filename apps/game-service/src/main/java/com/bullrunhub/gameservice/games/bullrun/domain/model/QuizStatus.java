package com.bullrunhub.gameservice.games.bullrun.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizStatus {
    /** 当前进行中的答题分类，null 表示没有 */
    private String currentQuiz;
    private boolean completed;

    public QuizStatus copy() {
        return new QuizStatus(currentQuiz, completed);
    }
}
