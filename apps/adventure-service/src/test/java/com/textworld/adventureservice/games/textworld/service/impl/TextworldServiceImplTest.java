package com.textworld.adventureservice.games.textworld.service.impl;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.ParseResult;
import com.textworld.adventureservice.games.textworld.application.CreationWizard;
import com.textworld.adventureservice.games.textworld.application.LongTextFormatter;
import com.textworld.adventureservice.games.textworld.application.NarrationPrompts;
import com.textworld.adventureservice.games.textworld.application.RoomClockCoordinator;
import com.textworld.adventureservice.games.textworld.application.RoundOrchestrator;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.enums.CreationStep;
import com.textworld.adventureservice.games.textworld.domain.enums.RoomPhase;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.adventureservice.support.ManualTimeoutScheduler;
import com.textworld.adventureservice.support.MutableClock;
import com.textworld.adventureservice.support.RecordingBroadcaster;
import com.textworld.adventureservice.support.ScriptedGenerationBackend;
import com.textworld.web.common.CurrentPlayerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextworldServiceImplTest {

    private final CurrentPlayerInfo host = new CurrentPlayerInfo("host", "阿明", "user.host");
    private final CurrentPlayerInfo guest = new CurrentPlayerInfo("guest", "小红", "user.guest");
    private final CurrentPlayerInfo late = new CurrentPlayerInfo("late", "老王", "user.late");
    private final CurrentPlayerInfo admin = new CurrentPlayerInfo("root", "管理员", "user.root");

    private TextworldProperties props;
    private RoomRegistry registry;
    private ManualTimeoutScheduler scheduler;
    private RecordingBroadcaster broadcaster;
    private CreationWizard wizard;
    private TextworldServiceImpl service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        props = new TextworldProperties();
        props.setAdminIds(List.of("root"));
        registry = new RoomRegistry(props, clock);
        scheduler = new ManualTimeoutScheduler();
        broadcaster = new RecordingBroadcaster();
        ScriptedGenerationBackend backend = ScriptedGenerationBackend.answering("火光摇曳。");
        NarrationPrompts prompts = new NarrationPrompts(props);
        LongTextFormatter formatter = new LongTextFormatter(props);
        RoomClockCoordinator coordinator = new RoomClockCoordinator(scheduler, registry);
        coordinator.register();
        RoundOrchestrator orchestrator = new RoundOrchestrator(registry, coordinator, backend, broadcaster,
                prompts, formatter, props, Runnable::run, clock);
        orchestrator.register();
        wizard = new CreationWizard(registry, backend, (url, name) -> ParseResult.failure("不支持的格式"),
                prompts, formatter, props, clock);
        service = new TextworldServiceImpl(registry, wizard, orchestrator, broadcaster, formatter, props);
    }

    private Room quickRoom() {
        service.quickCreate(host, "");
        return registry.findRoomByPlayer("host").orElseThrow();
    }

    private Room startedRoom() {
        Room room = quickRoom();
        service.join(guest, room.getId());
        service.begin(host);
        service.handleFreeText(InboundMessage.text(host, "索林：矮人战士，手持战斧"));
        service.handleFreeText(InboundMessage.text(guest, "莉亚：精灵弓手，目光敏锐"));
        return room;
    }

    @Test
    void quickCreateUsesDefaults() {
        String reply = service.quickCreate(host, "");

        Room room = registry.findRoomByPlayer("host").orElseThrow();
        assertThat(room.getName()).isEqualTo(GameMessages.QUICKSTART_ROOM_NAME);
        assertThat(room.getWorldSetting()).isEqualTo(GameMessages.QUICKSTART_WORLD);
        assertThat(room.getRoundTimeoutSeconds()).isEqualTo(props.getDefaultTimeout());
        assertThat(reply).contains(room.getId());
    }

    @Test
    void quickCreateDiscardsPendingWizard() {
        service.createRoom(host);

        service.quickCreate(host, "地下城");

        assertThat(wizard.hasPending("host")).isFalse();
    }

    @Test
    void joinAnnouncesToRoom() {
        Room room = quickRoom();

        String reply = service.join(guest, room.getId());

        assertThat(reply).isEqualTo(GameMessages.formatJoined(room.getName()));
        assertThat(broadcaster.sent()).singleElement()
                .satisfies(s -> assertThat(s.addresses()).containsExactly("user.host", "user.guest"));
    }

    @Test
    void freeTextRoutesToWizard() {
        service.createRoom(host);

        List<String> replies = service.handleFreeText(InboundMessage.text(host, "矮人王国"));

        assertThat(replies).hasSize(1);
        assertThat(wizard.currentStep("host")).contains(CreationStep.TIMEOUT);
    }

    @Test
    void freeTextWithNothingToDoIsIgnored() {
        assertThat(service.handleFreeText(InboundMessage.text(guest, "大家好"))).isEmpty();
    }

    @Test
    void fullRoundThroughService() {
        Room room = startedRoom();

        service.act(host, "点燃火把");
        service.act(guest, "搭箭戒备");

        assertThat(room.getPhase()).isEqualTo(RoomPhase.ACTIVE);
        assertThat(room.getHistory()).hasSize(1);
        assertThat(service.characters(host)).contains("索林").contains("莉亚");
        assertThat(service.status(guest, null)).contains(room.getId()).contains("第2轮");
    }

    @Test
    void pauseStageAndResume() {
        Room room = startedRoom();

        service.pause(host);
        assertThat(service.stageTimeout(host, "45")).isEqualTo(String.format(GameMessages.TIMEOUT_STAGED, 45));
        service.stageNote(host, "龙已苏醒");
        service.join(late, room.getId());
        assertThat(room.getPendingPlayers()).hasSize(1);

        service.resume(host);

        assertThat(room.getRoundTimeoutSeconds()).isEqualTo(45);
        assertThat(room.getCorrectionNote()).isEqualTo("龙已苏醒");
        assertThat(room.findActivePlayer("late")).isPresent();
        assertThat(broadcaster.sent().get(broadcaster.sent().size() - 1).addresses()).contains("user.late");
    }

    @Test
    void stagingRequiresPausedRoomAndHost() {
        startedRoom();

        assertThatThrownBy(() -> service.stageTimeout(host, "45"))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getRejection()).isEqualTo(RoomRejection.NOT_PAUSED));
        service.pause(host);
        assertThatThrownBy(() -> service.stageNote(guest, "我也想改"))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getRejection()).isEqualTo(RoomRejection.NOT_HOST));
    }

    @Test
    void hostLeavingClosesRoomForEveryone() {
        Room room = quickRoom();
        service.join(guest, room.getId());
        broadcaster.clear();

        service.leave(host);

        assertThat(registry.findRoom(room.getId())).isEmpty();
        assertThat(registry.isInRoom("guest")).isFalse();
        assertThat(broadcaster.sent()).singleElement()
                .satisfies(s -> assertThat(s.addresses()).containsExactly("user.guest"));
    }

    @Test
    void closeByHost() {
        Room room = quickRoom();
        service.join(guest, room.getId());

        assertThat(service.close(host)).isEqualTo(GameMessages.ROOM_CLOSED_REPLY);
        assertThat(registry.roomCount()).isZero();
        assertThatThrownBy(() -> service.close(guest)).isInstanceOf(StateConflictException.class);
    }

    @Test
    void adminCommandsRequireAdmin() {
        Room room = quickRoom();

        assertThatThrownBy(() -> service.adminList(host))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getRejection()).isEqualTo(RoomRejection.NOT_ADMIN));
        assertThat(service.adminList(admin)).contains(room.getId());

        service.adminClose(admin, room.getId());

        assertThat(registry.roomCount()).isZero();
        assertThat(broadcaster.texts()).contains(GameMessages.formatClosedByAdmin(room.getName()));
    }

    @Test
    void listShowsOpenRooms() {
        assertThat(service.list()).isEqualTo(GameMessages.NO_ROOMS);
        Room room = quickRoom();

        assertThat(service.list()).contains(room.getId());
        assertThat(service.listRooms()).singleElement()
                .satisfies(s -> assertThat(s.hostName()).isEqualTo("阿明"));
    }
}
