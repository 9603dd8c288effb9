package com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto;

import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.InitialGameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import com.bullrunhub.gameservice.games.bullrun.domain.valuation.FixedDeposit;
import com.bullrunhub.gameservice.games.bullrun.domain.valuation.Holdings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 两种方向：
 *   1. 前端 -> 后端：/app/bullrun.* 指令（*Cmd）
 *   2. 后端 -> 前端：房间广播 BroadcastEvent，以及私有应答 CommandReply
 *
 * 玩家身份一律取自连接（Principal），不信任消息体里的任何 id。
 */
public class BullRunMessages {

    /**
     * 创建房间
     */
    @Data
    public static class CreateRoomCmd {
        private String requestId;
        private String playerName;
    }

    /**
     * 加入房间
     */
    @Data
    public static class JoinRoomCmd {
        private String requestId;
        private String roomId;
        private String playerName;
    }

    /**
     * 无参数的简单指令（离开、暂停切换、介绍看完、请求密钥）
     */
    @Data
    public static class SimpleCmd {
        private String requestId;
    }

    /**
     * 开局（房主）：配置 + 可选的共享初始数据
     */
    @Data
    public static class StartGameCmd {
        private String requestId;
        private AdminSettings adminSettings;
        private InitialGameState initialGameState;
    }

    /**
     * 修改房主配置（仅开局前）
     */
    @Data
    public static class AdminSettingsCmd {
        private String requestId;
        private AdminSettings adminSettings;
    }

    /**
     * 上报净值与分类（展示缓存，不做校验）
     */
    @Data
    public static class UpdatePlayerStateCmd {
        private double networth;
        private PortfolioBreakdown portfolioBreakdown;
    }

    /**
     * 答题开始 / 结束
     */
    @Data
    public static class QuizCmd {
        private String quizCategory;
    }

    /**
     * 提交净值供服务端估值校验
     */
    @Data
    public static class SubmitNetworthCmd {
        private String requestId;
        private double networth;
        private PortfolioBreakdown portfolioBreakdown;
        private double pocketCash;
        private double savingsBalance;
        private List<FixedDeposit> fixedDeposits = new ArrayList<>();
        private Holdings holdings;
    }

    /**
     * 广播事件（服务端 → 客户端）
     * ---------------------------------------------
     *   - roomId ：所属房间；
     *   - type   ：事件类型（EventType 的名字）；
     *   - payload：事件内容。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String roomId;
        private String type;
        private Object payload;
    }

    /**
     * 指令的直接应答，发往 /user/queue/bullrun.reply
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommandReply {
        private String requestId;
        private boolean success;
        private String error;
        private Object data;

        public static CommandReply ok(String requestId, Object data) {
            return new CommandReply(requestId, true, null, data);
        }

        public static CommandReply fail(String requestId, String error) {
            return new CommandReply(requestId, false, error, null);
        }
    }
}
