package com.bullrunhub.gameservice.games.bullrun.service.impl;

import com.bullrunhub.gameservice.clock.scheduler.TickHandle;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TickAdvance;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TriggeredLifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.LifeEventType;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.PauseReason;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.domain.event.LifeEventGenerator;
import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.GameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.LifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import com.bullrunhub.gameservice.games.bullrun.domain.model.Room;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoomServiceImpl")
class RoomServiceImplTest {

    @Mock
    private LifeEventGenerator lifeEventGenerator;

    private RoomServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new RoomServiceImpl(lifeEventGenerator, 100000);
    }

    private String lobby() {
        String code = service.createRoom("h", "Host");
        service.joinRoom(code, "p1", "Alice");
        service.joinRoom(code, "p2", "Bob");
        return code;
    }

    private String startedRoom() {
        String code = lobby();
        service.startGame(code, new AdminSettings());
        return code;
    }

    private GameState state(String code) {
        return service.snapshot(code).orElseThrow().getGameState();
    }

    private static RoomError errorOf(Runnable action) {
        try {
            action.run();
        } catch (RoomException e) {
            return e.getError();
        }
        throw new AssertionError("expected RoomException");
    }

    @Nested
    @DisplayName("lobby")
    class Lobby {

        @Test
        @DisplayName("room codes are 6 unambiguous characters and unique")
        void createRoom_codes() {
            Set<String> codes = new HashSet<>();
            for (int i = 0; i < 300; i++) {
                codes.add(service.createRoom("host-" + i, "H"));
            }

            assertThat(codes).hasSize(300);
            assertThat(codes).allMatch(c -> c.matches("[" + RoomServiceImpl.CODE_ALPHABET + "]{6}"));
        }

        @Test
        @DisplayName("host sits at zero net worth, joiners start with the default cash")
        void join_startingCash() {
            String code = lobby();

            Room room = service.snapshot(code).orElseThrow();
            assertThat(room.getPlayers().get("h").isHost()).isTrue();
            assertThat(room.getPlayers().get("h").getNetworth()).isZero();
            assertThat(room.getPlayers().get("p1").getNetworth()).isEqualTo(100000.0);
            assertThat(room.getPlayers().get("p1").getPortfolioBreakdown().getCash()).isEqualTo(100000.0);
            assertThat(room.getPlayers()).containsOnlyKeys("h", "p1", "p2");
            assertThat(service.findRoomCodeByPlayer("p2")).contains(code);
        }

        @Test
        @DisplayName("joiners use the configured initial pocket cash")
        void join_usesAdminCash() {
            String code = service.createRoom("h", "Host");
            AdminSettings s = new AdminSettings();
            s.setInitialPocketCash(250000);
            service.updateAdminSettings(code, s);

            service.joinRoom(code, "p1", "Alice");

            assertThat(service.snapshot(code).orElseThrow().getPlayers().get("p1").getNetworth()).isEqualTo(250000.0);
        }

        @Test
        @DisplayName("join rejects unknown rooms, duplicates, players elsewhere and started games")
        void join_rejections() {
            String code = lobby();
            String other = service.createRoom("h2", "Other host");

            assertThat(errorOf(() -> service.joinRoom("NOPE42", "x", "X"))).isEqualTo(RoomError.ROOM_NOT_FOUND);
            assertThat(errorOf(() -> service.joinRoom(code, "p1", "Alice"))).isEqualTo(RoomError.PLAYER_ALREADY_PRESENT);
            assertThat(errorOf(() -> service.joinRoom(other, "p1", "Alice"))).isEqualTo(RoomError.PLAYER_IN_OTHER_ROOM);
            assertThat(errorOf(() -> service.createRoom("p1", "Alice"))).isEqualTo(RoomError.PLAYER_IN_OTHER_ROOM);

            service.startGame(code, new AdminSettings());
            assertThat(errorOf(() -> service.joinRoom(code, "late", "Late"))).isEqualTo(RoomError.GAME_ALREADY_STARTED);
        }

        @Test
        @DisplayName("only the host may start, and only with at least two players")
        void assertCanStart_rules() {
            String code = service.createRoom("h", "Host");

            assertThat(errorOf(() -> service.assertCanStart(code, "h"))).isEqualTo(RoomError.INSUFFICIENT_PLAYERS);
            service.joinRoom(code, "p1", "Alice");
            assertThat(errorOf(() -> service.assertCanStart(code, "p1"))).isEqualTo(RoomError.NOT_HOST);

            service.assertCanStart(code, "h");
        }

        @Test
        @DisplayName("admin settings are locked once the game starts")
        void updateAdminSettings_lockedAfterStart() {
            String code = startedRoom();

            assertThat(errorOf(() -> service.updateAdminSettings(code, new AdminSettings())))
                    .isEqualTo(RoomError.GAME_ALREADY_STARTED);
        }

        @Test
        @DisplayName("idle sweep removes only never-started rooms older than the limit")
        void cleanupOldRooms_onlyStaleLobbies() {
            String stale = service.createRoom("a", "A");
            String started = startedRoom();
            long future = System.currentTimeMillis() + 10_000;

            int removed = service.cleanupOldRooms(5_000, future);

            assertThat(removed).isEqualTo(1);
            assertThat(service.snapshot(stale)).isEmpty();
            assertThat(service.snapshot(started)).isPresent();
            assertThat(service.findRoomCodeByPlayer("a")).isEmpty();
        }

        @Test
        @DisplayName("idle sweep keeps ended rooms until their players leave")
        void cleanupOldRooms_keepsEndedRooms() {
            String ended = startedRoom();
            assertThat(service.markGameEnded(ended)).isTrue();
            long future = System.currentTimeMillis() + 10_000;

            int removed = service.cleanupOldRooms(5_000, future);

            assertThat(removed).isZero();
            assertThat(service.snapshot(ended)).isPresent();
            assertThat(service.findRoomCodeByPlayer("p1")).contains(ended);
        }
    }

    @Nested
    @DisplayName("leaving")
    class Leaving {

        @Test
        @DisplayName("host leaving closes the room, cancels its timer and frees every player")
        void leave_host_closesRoom() {
            String code = startedRoom();
            TickHandle handle = mock(TickHandle.class);
            service.attachTickHandle(code, handle);

            LeaveResult r = service.leaveRoom("h");

            assertThat(r).isEqualTo(new LeaveResult(code, true, true, false));
            verify(handle).cancel();
            assertThat(service.snapshot(code)).isEmpty();
            assertThat(service.findRoomCodeByPlayer("p1")).isEmpty();
        }

        @Test
        @DisplayName("a non-host leaving keeps the room")
        void leave_player_keepsRoom() {
            String code = lobby();

            LeaveResult r = service.leaveRoom("p1");

            assertThat(r.leftRoom()).isTrue();
            assertThat(r.roomClosed()).isFalse();
            assertThat(r.resumed()).isFalse();
            assertThat(service.snapshot(code).orElseThrow().getPlayers()).containsOnlyKeys("h", "p2");
            assertThat(service.leaveRoom("p1")).isEqualTo(LeaveResult.NOT_IN_ROOM);
        }

        @Test
        @DisplayName("the last player waiting on a quiz leaving releases the barrier")
        void leave_releasesQuizBarrier() {
            String code = startedRoom();
            service.markQuizStarted("p1", "GOLD");

            LeaveResult r = service.leaveRoom("p1");

            assertThat(r).isEqualTo(new LeaveResult(code, false, false, true));
            GameState gs = state(code);
            assertThat(gs.isPaused()).isFalse();
            assertThat(gs.getPauseReason()).isEqualTo(PauseReason.NONE);
        }
    }

    @Nested
    @DisplayName("pause and barriers")
    class Barriers {

        @Test
        @DisplayName("start resets the clock and runs unpaused without intro")
        void start_runsImmediately() {
            String code = startedRoom();

            GameState gs = state(code);
            assertThat(gs.isStarted()).isTrue();
            assertThat(gs.isPaused()).isFalse();
            assertThat(gs.getCurrentYear()).isEqualTo(1);
            assertThat(gs.getCurrentMonth()).isEqualTo(1);
        }

        @Test
        @DisplayName("with intro enabled the game starts paused until every non-host finished it")
        void start_withIntro() {
            String code = lobby();
            AdminSettings s = new AdminSettings();
            s.setShowIntro(true);
            service.startGame(code, s);

            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.INTRO);
            assertThat(state(code).getPlayersWaitingForIntro()).containsExactly("p1", "p2");

            assertThat(service.markIntroCompleted("p1")).isFalse();
            assertThat(service.markIntroCompleted("p2")).isTrue();
            assertThat(state(code).isPaused()).isFalse();
        }

        @Test
        @DisplayName("quiz barrier holds until the last player finishes and resumes exactly once")
        void quiz_barrier() {
            String code = startedRoom();

            assertThat(service.markQuizStarted("p1", "GOLD")).isTrue();
            assertThat(service.markQuizStarted("p2", "STOCKS")).isTrue();
            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.QUIZ);
            assertThat(state(code).getPlayersWaitingForQuiz()).containsExactly("p1", "p2");

            assertThat(service.markQuizCompleted("p1", "GOLD")).isFalse();
            assertThat(state(code).isPaused()).isTrue();
            assertThat(service.markQuizCompleted("p2", "STOCKS")).isTrue();
            assertThat(state(code).isPaused()).isFalse();
            assertThat(state(code).getPlayersWaitingForQuiz()).isEmpty();

            assertThat(service.markQuizCompleted("p2", "STOCKS")).isFalse();
        }

        @Test
        @DisplayName("manual toggle is ignored while a quiz barrier is active")
        void togglePause_noopUnderQuiz() {
            String code = startedRoom();
            service.markQuizStarted("p1", "GOLD");

            assertThat(service.togglePause(code)).isFalse();

            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.QUIZ);
            assertThat(state(code).getPlayersWaitingForQuiz()).containsExactly("p1");
        }

        @Test
        @DisplayName("manual toggle pauses and resumes a running game")
        void togglePause_manual() {
            String code = startedRoom();

            assertThat(service.togglePause(code)).isTrue();
            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.MANUAL);
            assertThat(service.togglePause(code)).isTrue();
            assertThat(state(code).isPaused()).isFalse();
            assertThat(service.togglePause(lobbyCode())).isFalse();
        }

        private String lobbyCode() {
            String code = service.createRoom("h9", "H");
            service.joinRoom(code, "p9", "P");
            return code;
        }

        @Test
        @DisplayName("a quiz barrier released while intro is pending falls back to the intro pause")
        void quiz_releasedIntoIntro() {
            String code = lobby();
            AdminSettings s = new AdminSettings();
            s.setShowIntro(true);
            service.startGame(code, s);

            service.markQuizStarted("p1", "GOLD");
            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.QUIZ);

            assertThat(service.markQuizCompleted("p1", "GOLD")).isFalse();
            assertThat(state(code).getPauseReason()).isEqualTo(PauseReason.INTRO);
        }
    }

    @Nested
    @DisplayName("leaderboard")
    class Leaderboard {

        @Test
        @DisplayName("excludes the host and sorts by net worth descending, ties in join order")
        void leaderboard_order() {
            String code = service.createRoom("h", "Host");
            service.joinRoom(code, "a", "A");
            service.joinRoom(code, "b", "B");
            service.joinRoom(code, "c", "C");
            service.startGame(code, new AdminSettings());

            service.updatePlayerState("a", 120000, new PortfolioBreakdown());
            service.updatePlayerState("b", 150000, new PortfolioBreakdown());
            service.updatePlayerState("c", 120000, new PortfolioBreakdown());
            service.updatePlayerState("h", 999999, new PortfolioBreakdown());

            assertThat(service.getLeaderboard(code)).extracting(PlayerInfo::getId).containsExactly("b", "a", "c");
        }
    }

    @Nested
    @DisplayName("clock")
    class Clock {

        @Test
        @DisplayName("240 ticks end the game at year 20 month 12 and the 241st is a no-op")
        void advanceClock_fullGame() {
            String code = startedRoom();
            TickHandle handle = mock(TickHandle.class);
            service.attachTickHandle(code, handle);

            for (int i = 0; i < 239; i++) {
                assertThat(service.advanceClock(code, 20).status()).isEqualTo(TickAdvance.Status.ADVANCED);
            }
            assertThat(state(code).getCurrentYear()).isEqualTo(20);
            assertThat(state(code).getCurrentMonth()).isEqualTo(12);

            TickAdvance last = service.advanceClock(code, 20);
            assertThat(last).isEqualTo(new TickAdvance(TickAdvance.Status.FINISHED, 20, 12));
            assertThat(state(code).isEnded()).isTrue();
            verify(handle).cancel();

            assertThat(service.advanceClock(code, 20).status()).isEqualTo(TickAdvance.Status.NOT_RUNNING);
            assertThat(state(code).getCurrentYear()).isEqualTo(20);
            assertThat(state(code).getCurrentMonth()).isEqualTo(12);
        }

        @Test
        @DisplayName("paused rooms do not advance")
        void advanceClock_paused() {
            String code = startedRoom();
            service.togglePause(code);

            assertThat(service.advanceClock(code, 20).status()).isEqualTo(TickAdvance.Status.PAUSED);
            assertThat(state(code).getCurrentMonth()).isEqualTo(1);
            assertThat(service.advanceClock("GONE00", 20).status()).isEqualTo(TickAdvance.Status.ROOM_MISSING);
        }

        @Test
        @DisplayName("due life events fire once and adjust the player's cash and net worth")
        void triggerDueLifeEvents_firesOnce() {
            when(lifeEventGenerator.generateLifeEvents(anyInt(), any())).thenAnswer(inv -> List.of(
                    new LifeEvent("e1", LifeEventType.LOSS, "Stolen mobile phone", -12000, 1, 2, false)));
            String code = startedRoom();
            service.generateLifeEventsForRoom(code, 3);
            service.advanceClock(code, 20);

            List<TriggeredLifeEvent> fired = service.triggerDueLifeEvents(code, 1, 2);

            assertThat(fired).extracting(TriggeredLifeEvent::playerId).containsExactly("h", "p1", "p2");
            TriggeredLifeEvent p1 = fired.get(1);
            assertThat(p1.postPocketCash()).isEqualTo(88000.0);
            assertThat(p1.event().isTriggered()).isTrue();
            PlayerInfo info = service.snapshot(code).orElseThrow().getPlayers().get("p1");
            assertThat(info.getNetworth()).isEqualTo(88000.0);
            assertThat(service.triggerDueLifeEvents(code, 1, 2)).isEmpty();
        }

        @Test
        @DisplayName("a failing generator leaves only that player without events")
        void generateLifeEvents_failureIsolated() {
            when(lifeEventGenerator.generateLifeEvents(anyInt(), any()))
                    .thenReturn(List.of(new LifeEvent("e1", LifeEventType.GAIN, "Tax refund received", 25000, 2, 3, false)))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(List.of());
            String code = startedRoom();

            assertThat(service.generateLifeEventsForRoom(code, 3)).isTrue();

            assertThat(state(code).getLifeEvents()).containsOnlyKeys("h", "p1", "p2");
            assertThat(state(code).getLifeEvents().get("h")).hasSize(1);
            assertThat(state(code).getLifeEvents().get("p1")).isEmpty();
        }

        @Test
        @DisplayName("markGameEnded only ends a running game once")
        void markGameEnded_once() {
            String code = startedRoom();

            assertThat(service.markGameEnded(code)).isTrue();
            assertThat(service.markGameEnded(code)).isFalse();
            assertThat(state(code).isEnded()).isTrue();
            assertThat(state(code).isStarted()).isFalse();
        }
    }
}
