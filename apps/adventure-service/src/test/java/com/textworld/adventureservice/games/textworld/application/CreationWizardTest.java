package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.GenerationResult;
import com.textworld.adventureservice.engine.core.ParseResult;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.enums.CreationStep;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import com.textworld.adventureservice.platform.transport.FileAttachment;
import com.textworld.adventureservice.support.MutableClock;
import com.textworld.adventureservice.support.ScriptedGenerationBackend;
import com.textworld.web.common.CurrentPlayerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreationWizardTest {

    private static final String WORLD = "一个被遗忘的地下王国，矮人曾在此挖掘秘银。";

    private final CurrentPlayerInfo alice = new CurrentPlayerInfo("alice", "爱丽丝", "user.alice");

    private MutableClock clock;
    private TextworldProperties props;
    private RoomRegistry registry;
    private ScriptedGenerationBackend backend;
    private ParseResult fileResult;
    private CreationWizard wizard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        props = new TextworldProperties();
        registry = new RoomRegistry(props, clock);
        backend = ScriptedGenerationBackend.answering("总".repeat(120));
        fileResult = ParseResult.success(WORLD);
        wizard = new CreationWizard(registry, backend, (url, name) -> fileResult,
                new NarrationPrompts(props), new LongTextFormatter(props), props, clock);
    }

    private List<String> say(String text) {
        return wizard.handleInput(alice, text, Optional.empty());
    }

    private CreationStep step() {
        return wizard.currentStep("alice").orElseThrow();
    }

    private void upToWorld() {
        wizard.start(alice);
        say("矮人王国");
        say("默认");
    }

    @Test
    void fullFlowCreatesRoom() {
        wizard.start(alice);
        say("矮人王国");
        assertThat(step()).isEqualTo(CreationStep.TIMEOUT);
        say("60");
        assertThat(step()).isEqualTo(CreationStep.WORLD_SETTING);
        say(WORLD);
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);

        List<String> replies = say("确认");

        assertThat(wizard.hasPending("alice")).isFalse();
        Room room = registry.findRoomByPlayer("alice").orElseThrow();
        assertThat(room.getName()).isEqualTo("矮人王国");
        assertThat(room.getRoundTimeoutSeconds()).isEqualTo(60);
        assertThat(room.getWorldSetting()).isEqualTo(WORLD);
        assertThat(room.getCharacterTimeoutSeconds()).isEqualTo(props.getCharCreationTimeout());
        assertThat(replies).singleElement().asString().contains(room.getId());
    }

    @Test
    void defaultTimeoutKeyword() {
        upToWorld();
        say(WORLD);
        say("yes");

        assertThat(registry.findRoomByPlayer("alice").orElseThrow().getRoundTimeoutSeconds())
                .isEqualTo(props.getDefaultTimeout());
    }

    @Test
    void invalidInputKeepsStep() {
        wizard.start(alice);
        assertThatThrownBy(() -> say("名".repeat(31))).isInstanceOf(UserInputException.class);
        assertThat(step()).isEqualTo(CreationStep.ROOM_NAME);

        say("矮人王国");
        assertThatThrownBy(() -> say("abc")).isInstanceOf(UserInputException.class)
                .hasMessage(GameMessages.TIMEOUT_NOT_A_NUMBER);
        assertThatThrownBy(() -> say("10")).isInstanceOf(UserInputException.class)
                .hasMessage("请输入 30-600 之间的数字");
        assertThat(step()).isEqualTo(CreationStep.TIMEOUT);

        say("30");
        assertThatThrownBy(() -> say("太短")).isInstanceOf(UserInputException.class);
        assertThat(step()).isEqualTo(CreationStep.WORLD_SETTING);
    }

    @Test
    void overlongWorldCanBeTruncated() {
        upToWorld();
        String longWorld = "龙".repeat(5000);

        say(longWorld);
        assertThat(step()).isEqualTo(CreationStep.WORLD_TOO_LONG);

        say("2");
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
        say("确认");

        Room room = registry.findRoomByPlayer("alice").orElseThrow();
        assertThat(room.getWorldSetting()).hasSize(4000);
        assertThat(room.getOriginalWorldSetting()).hasSize(5000);
    }

    @Test
    void overlongWorldCanBeKept() {
        upToWorld();
        say("龙".repeat(5000));

        say("保留");

        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
        say("ok");
        assertThat(registry.findRoomByPlayer("alice").orElseThrow().getWorldSetting()).hasSize(5000);
    }

    @Test
    void summarySuccessReplacesWorld() {
        upToWorld();
        say("龙".repeat(5000));

        List<String> replies = say("总结");

        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
        assertThat(replies).hasSize(3);
        assertThat(backend.promptsContaining("龙".repeat(100))).isEqualTo(1);
        say("确认");
        assertThat(registry.findRoomByPlayer("alice").orElseThrow().getWorldSetting()).isEqualTo("总".repeat(120));
    }

    @Test
    void summaryFailureStaysOnChoice() {
        backend.answer(p -> GenerationResult.failure("无可用的AI服务"));
        upToWorld();
        say("龙".repeat(5000));

        List<String> replies = say("1");

        assertThat(step()).isEqualTo(CreationStep.WORLD_TOO_LONG);
        assertThat(replies.get(replies.size() - 1)).contains("无可用的AI服务");
    }

    @Test
    void tooShortSummaryCountsAsFailure() {
        backend.answer(p -> GenerationResult.success("太短了"));
        upToWorld();
        say("龙".repeat(5000));

        say("总结");

        assertThat(step()).isEqualTo(CreationStep.WORLD_TOO_LONG);
    }

    @Test
    void uploadedFileIsUsedAsWorld() {
        upToWorld();

        List<String> replies = wizard.handleInput(alice, "", Optional.of(new FileAttachment("http://files/w.txt", "w.txt")));

        assertThat(replies.get(0)).isEqualTo(GameMessages.FILE_PARSING);
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
    }

    @Test
    void failedUploadKeepsWorldStep() {
        fileResult = ParseResult.failure("不支持的格式");
        upToWorld();

        List<String> replies = wizard.handleInput(alice, "", Optional.of(new FileAttachment("http://files/w.pdf", "w.pdf")));

        assertThat(replies).contains(GameMessages.ERROR_PREFIX + "不支持的格式");
        assertThat(step()).isEqualTo(CreationStep.WORLD_SETTING);
    }

    @Test
    void expiresLazilyOnNextInput() {
        wizard.start(alice);
        clock.advance(Duration.ofSeconds(props.getCreationTimeout() + 1));

        assertThat(say("矮人王国")).containsExactly(GameMessages.WIZARD_EXPIRED);
        assertThat(wizard.hasPending("alice")).isFalse();
    }

    @Test
    void startReclaimsExpiredWizard() {
        wizard.start(alice);
        say("矮人王国");
        clock.advance(Duration.ofSeconds(props.getCreationTimeout() + 1));

        assertThat(wizard.start(alice)).isEqualTo(GameMessages.WIZARD_STARTED);
        assertThat(step()).isEqualTo(CreationStep.ROOM_NAME);
    }

    @Test
    void replacementTextAfterOverlongWorldClearsOriginal() {
        upToWorld();
        say("龙".repeat(5000));

        List<String> stillLong = say("虎".repeat(4500));
        assertThat(stillLong).containsExactly(GameMessages.formatStillTooLong(4500));
        assertThat(step()).isEqualTo(CreationStep.WORLD_TOO_LONG);

        say(WORLD);
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
        say("确认");

        Room room = registry.findRoomByPlayer("alice").orElseThrow();
        assertThat(room.getWorldSetting()).isEqualTo(WORLD);
        assertThat(room.getOriginalWorldSetting()).isNull();
    }

    @Test
    void viewAtConfirmShowsFullWorldAndKeepsStep() {
        upToWorld();
        say(WORLD);

        List<String> replies = say("查看");

        assertThat(String.join("\n", replies)).contains(WORLD);
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
        assertThat(registry.isInRoom("alice")).isFalse();
    }

    @Test
    void restartAndCancelAtConfirm() {
        upToWorld();
        say(WORLD);

        assertThat(say("重来")).containsExactly(GameMessages.WIZARD_RESTARTED);
        assertThat(step()).isEqualTo(CreationStep.ROOM_NAME);

        say("矮人王国");
        say("默认");
        say(WORLD);
        assertThat(say("取消")).containsExactly(GameMessages.WIZARD_CANCELLED);
        assertThat(wizard.hasPending("alice")).isFalse();
        assertThat(registry.isInRoom("alice")).isFalse();
    }

    @Test
    void startRejections() {
        wizard.start(alice);
        assertThatThrownBy(() -> wizard.start(alice))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getRejection()).isEqualTo(RoomRejection.CREATION_IN_PROGRESS));

        CurrentPlayerInfo bob = new CurrentPlayerInfo("bob", "鲍勃", "user.bob");
        registry.createRoom(new RoomRegistry.RoomDraft(bob, "别处", WORLD, null, 300, 180));
        assertThatThrownBy(() -> wizard.start(bob))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getRejection()).isEqualTo(RoomRejection.ALREADY_IN_A_ROOM));
    }

    @Test
    void confirmAtCapacityKeepsWizard() {
        props.setMaxRooms(1);
        upToWorld();
        say(WORLD);
        registry.createRoom(new RoomRegistry.RoomDraft(new CurrentPlayerInfo("bob", "鲍勃", "user.bob"),
                "别处", WORLD, null, 300, 180));

        assertThatThrownBy(() -> say("确认")).isInstanceOf(StateConflictException.class);
        assertThat(step()).isEqualTo(CreationStep.CONFIRM);
    }

    @Test
    void parseTimeoutBounds() {
        assertThat(CreationWizard.parseTimeout(" 600 ")).isEqualTo(600);
        assertThatThrownBy(() -> CreationWizard.parseTimeout("601")).isInstanceOf(UserInputException.class);
    }
}
