package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.FileTextExtractor;
import com.textworld.adventureservice.engine.core.GenerationBackend;
import com.textworld.adventureservice.engine.core.GenerationResult;
import com.textworld.adventureservice.engine.core.ParseResult;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.enums.CreationStep;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.domain.model.PendingCreation;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import com.textworld.adventureservice.platform.transport.FileAttachment;
import com.textworld.web.common.CurrentPlayerInfo;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 房间创建向导：每个玩家一份，按 房间名 → 超时 → 世界观 → [过长处理] → 确认 逐步推进。
 * <p>
 * 向导与房间无关，确认成功后才在注册表中创建房间。超时在下一次输入时惰性检查。
 * 同一向导的步骤推进在该向导对象上串行；AI 总结与文件下载在锁外进行，期间步骤为 SUMMARIZING。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreationWizard {

    static final int MIN_WORLD_LENGTH = 10;
    static final int MIN_TIMEOUT = 30;
    static final int MAX_TIMEOUT = 600;
    /** AI 总结结果的最短有效长度 */
    static final int MIN_SUMMARY_LENGTH = 50;

    private static final Set<String> DEFAULT_WORDS = Set.of("默认", "default");
    private static final Set<String> SUMMARIZE_WORDS = Set.of("总结", "1", "ai", "summary", "summarize");
    private static final Set<String> TRUNCATE_WORDS = Set.of("截断", "2", "cut", "truncate");
    private static final Set<String> KEEP_WORDS = Set.of("保留", "3", "keep", "full");
    private static final Set<String> CONFIRM_WORDS = Set.of("确认", "确定", "y", "yes", "ok", "confirm");
    private static final Set<String> CANCEL_WORDS = Set.of("取消", "n", "no", "cancel");
    private static final Set<String> RESTART_WORDS = Set.of("重来", "restart", "reset");
    private static final Set<String> VIEW_WORDS = Set.of("查看完整", "查看", "完整", "full", "view");

    private final RoomRegistry registry;
    private final GenerationBackend generationBackend;
    private final FileTextExtractor fileTextExtractor;
    private final NarrationPrompts prompts;
    private final LongTextFormatter formatter;
    private final TextworldProperties properties;
    private final Clock clock;

    private final ConcurrentMap<String, PendingCreation> creations = new ConcurrentHashMap<>();

    // ================= 生命周期 =================

    /**
     * 开始创建向导。
     *
     * @throws StateConflictException ALREADY_IN_A_ROOM / CREATION_IN_PROGRESS / AT_CAPACITY
     */
    public String start(CurrentPlayerInfo player) {
        if (registry.isInRoom(player.playerId())) {
            throw new StateConflictException(RoomRejection.ALREADY_IN_A_ROOM);
        }
        PendingCreation existing = creations.get(player.playerId());
        if (existing != null) {
            boolean reclaimed;
            synchronized (existing) {
                reclaimed = expired(existing);
            }
            if (!reclaimed) {
                throw new StateConflictException(RoomRejection.CREATION_IN_PROGRESS);
            }
        }
        if (!registry.canCreateRoom()) {
            throw new StateConflictException(RoomRejection.AT_CAPACITY);
        }
        PendingCreation pending = new PendingCreation(player.playerId(), player.displayName(),
                player.replyAddress(), clock.millis());
        if (creations.putIfAbsent(player.playerId(), pending) != null) {
            throw new StateConflictException(RoomRejection.CREATION_IN_PROGRESS);
        }
        log.debug("创建向导开始: playerId={}", player.playerId());
        return GameMessages.WIZARD_STARTED;
    }

    public boolean hasPending(String playerId) {
        return creations.containsKey(playerId);
    }

    public Optional<CreationStep> currentStep(String playerId) {
        return Optional.ofNullable(creations.get(playerId)).map(PendingCreation::getStep);
    }

    /**
     * @return true 表示确实丢弃了一个进行中的向导
     */
    public boolean discard(String playerId) {
        return creations.remove(playerId) != null;
    }

    @PreDestroy
    public int clear() {
        int size = creations.size();
        creations.clear();
        if (size > 0) {
            log.info("清理未完成的创建向导 {} 个", size);
        }
        return size;
    }

    // ================= 输入处理 =================

    /**
     * 处理向导中的自由文本输入。
     *
     * @return 回复（可能多条）；玩家没有进行中的向导时返回空列表
     * @throws UserInputException 输入不合法，向导停留在当前步骤
     */
    public List<String> handleInput(CurrentPlayerInfo player, String text, Optional<FileAttachment> attachment) {
        PendingCreation pending = creations.get(player.playerId());
        if (pending == null) {
            return List.of();
        }
        List<String> replies = new ArrayList<>();
        String toSummarize = null;
        synchronized (pending) {
            if (expired(pending)) {
                return List.of(GameMessages.WIZARD_EXPIRED);
            }
            if (pending.getStep() == CreationStep.SUMMARIZING) {
                return List.of(GameMessages.WIZARD_BUSY);
            }
            if (pending.getStep() == CreationStep.WORLD_TOO_LONG && SUMMARIZE_WORDS.contains(normalize(text))) {
                toSummarize = pending.getOriginalWorldSetting() == null ? "" : pending.getOriginalWorldSetting();
                pending.setStep(CreationStep.SUMMARIZING);
                replies.add(GameMessages.formatSummarizing(toSummarize.length()));
            } else if (pending.getStep() != CreationStep.WORLD_SETTING || attachment.isEmpty()) {
                return handleStep(pending, text, replies);
            }
        }
        if (toSummarize != null) {
            return summarize(pending, toSummarize, replies);
        }

        // 世界观步骤上传了文件：锁外下载解析
        FileAttachment file = attachment.get();
        replies.add(GameMessages.FILE_PARSING);
        ParseResult parsed = fileTextExtractor.parse(file.url(), file.filename());
        if (!parsed.ok()) {
            log.info("世界观文件解析失败: playerId={}, file={}, error={}", player.playerId(), file.filename(), parsed.error());
            replies.add(GameMessages.ERROR_PREFIX + parsed.error());
            return replies;
        }
        replies.add(GameMessages.formatFileParsed(parsed.text().length()));
        synchronized (pending) {
            if (creations.get(player.playerId()) != pending || pending.getStep() != CreationStep.WORLD_SETTING) {
                return replies;
            }
            return handleStep(pending, parsed.text(), replies);
        }
    }

    /** 调用方持有 pending 的监视器 */
    private List<String> handleStep(PendingCreation pending, String text, List<String> replies) {
        switch (pending.getStep()) {
            case ROOM_NAME -> replies.add(handleRoomName(pending, text));
            case TIMEOUT -> replies.add(handleTimeout(pending, text));
            case WORLD_SETTING -> replies.add(handleWorldSetting(pending, text));
            case WORLD_TOO_LONG -> handleWorldTooLong(pending, text, replies);
            case CONFIRM -> replies.add(handleConfirm(pending, text));
            default -> replies.add(GameMessages.WIZARD_BUSY);
        }
        return replies;
    }

    private boolean expired(PendingCreation pending) {
        if (!pending.expired(clock.millis(), properties.getCreationTimeout() * 1000L)) {
            return false;
        }
        creations.remove(pending.getPlayerId(), pending);
        log.info("创建向导超时: playerId={}", pending.getPlayerId());
        return true;
    }

    private String handleRoomName(PendingCreation pending, String text) {
        if (text.isEmpty() || text.length() > 30) {
            throw new UserInputException(GameMessages.ROOM_NAME_INVALID);
        }
        pending.setRoomName(text);
        pending.setStep(CreationStep.TIMEOUT);
        return GameMessages.formatRoomNameAccepted(text, properties.getDefaultTimeout());
    }

    private String handleTimeout(PendingCreation pending, String text) {
        int seconds;
        if (DEFAULT_WORDS.contains(normalize(text))) {
            seconds = properties.getDefaultTimeout();
        } else {
            seconds = parseTimeout(text);
        }
        pending.setTimeoutSeconds(seconds);
        pending.setStep(CreationStep.WORLD_SETTING);
        return GameMessages.formatTimeoutAccepted(seconds, properties.getWorldSettingMaxLength());
    }

    /**
     * 解析 30-600 之间的秒数
     */
    public static int parseTimeout(String text) {
        int seconds;
        try {
            seconds = Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new UserInputException(GameMessages.TIMEOUT_NOT_A_NUMBER);
        }
        if (seconds < MIN_TIMEOUT || seconds > MAX_TIMEOUT) {
            throw new UserInputException(String.format(GameMessages.TIMEOUT_OUT_OF_RANGE, MIN_TIMEOUT, MAX_TIMEOUT));
        }
        return seconds;
    }

    private String handleWorldSetting(PendingCreation pending, String text) {
        String template = properties.getWorldTemplate();
        if (DEFAULT_WORDS.contains(normalize(text)) && template != null && !template.isBlank()) {
            pending.setWorldSetting(template);
            pending.setStep(CreationStep.CONFIRM);
            return confirmSummary(pending);
        }
        if (text.length() < MIN_WORLD_LENGTH) {
            throw new UserInputException(String.format(GameMessages.WORLD_TOO_SHORT, MIN_WORLD_LENGTH));
        }
        int max = properties.getWorldSettingMaxLength();
        if (text.length() > max) {
            pending.setOriginalWorldSetting(text);
            pending.setStep(CreationStep.WORLD_TOO_LONG);
            return GameMessages.formatWorldTooLong(text.length(), max, properties.getWorldSettingSummaryLength());
        }
        pending.setWorldSetting(text);
        pending.setStep(CreationStep.CONFIRM);
        return confirmSummary(pending);
    }

    /** 调用方持有 pending 的监视器；“总结”已在 handleInput 中分流 */
    private void handleWorldTooLong(PendingCreation pending, String text, List<String> replies) {
        String choice = normalize(text);
        String original = pending.getOriginalWorldSetting() == null ? "" : pending.getOriginalWorldSetting();
        int max = properties.getWorldSettingMaxLength();

        if (TRUNCATE_WORDS.contains(choice)) {
            pending.setWorldSetting(original.substring(0, Math.min(max, original.length())));
            pending.setStep(CreationStep.CONFIRM);
            replies.add(GameMessages.formatTruncated(max));
            replies.add(confirmSummary(pending));
        } else if (KEEP_WORDS.contains(choice)) {
            pending.setWorldSetting(original);
            pending.setStep(CreationStep.CONFIRM);
            replies.add(GameMessages.formatKeptFull(original.length()));
            replies.add(confirmSummary(pending));
        } else if (text.length() >= MIN_WORLD_LENGTH) {
            if (text.length() <= max) {
                pending.setWorldSetting(text);
                pending.setOriginalWorldSetting(null);
                pending.setStep(CreationStep.CONFIRM);
                replies.add(GameMessages.formatNewWorldSaved(text.length()));
                replies.add(confirmSummary(pending));
            } else {
                pending.setOriginalWorldSetting(text);
                replies.add(GameMessages.formatStillTooLong(text.length()));
            }
        } else {
            replies.add(GameMessages.TOO_LONG_PROMPT);
        }
    }

    /**
     * AI 总结：调用方已置 SUMMARIZING 并释放监视器；生成返回后复核向导仍然有效再落结果。
     */
    private List<String> summarize(PendingCreation pending, String original, List<String> replies) {
        GenerationResult result;
        try {
            result = generationBackend.generate(prompts.summary(original));
        } catch (RuntimeException e) {
            log.warn("世界观总结异常: playerId={}, ex={}", pending.getPlayerId(), e.toString());
            result = GenerationResult.failure(e.getClass().getSimpleName());
        }
        synchronized (pending) {
            if (creations.get(pending.getPlayerId()) != pending) {
                // 等待期间被取消或已超时
                return replies;
            }
            String summary = result.ok() && result.text() != null ? result.text().strip() : "";
            if (summary.length() > MIN_SUMMARY_LENGTH) {
                pending.setWorldSetting(summary);
                pending.setStep(CreationStep.CONFIRM);
                replies.add(GameMessages.formatSummaryDone(original.length(), summary.length()));
                replies.add(confirmSummary(pending));
            } else {
                pending.setStep(CreationStep.WORLD_TOO_LONG);
                String error = result.ok() ? "AI总结失败" : result.error();
                log.info("世界观总结失败: playerId={}, error={}", pending.getPlayerId(), error);
                replies.add(GameMessages.formatSummaryFailed(error));
            }
            return replies;
        }
    }

    private String handleConfirm(PendingCreation pending, String text) {
        String t = normalize(text);
        if (VIEW_WORDS.contains(t)) {
            String world = pending.getWorldSetting() == null ? "" : pending.getWorldSetting();
            return formatter.format(world, "完整世界观 (" + world.length() + "字)");
        }
        if (CONFIRM_WORDS.contains(t)) {
            // 创建失败（房间已满等）时向导保留在确认步骤
            Room room = registry.createRoom(new RoomRegistry.RoomDraft(
                    new CurrentPlayerInfo(pending.getPlayerId(), pending.getPlayerName(), pending.getReplyAddress()),
                    pending.getRoomName(),
                    pending.getWorldSetting(),
                    pending.getOriginalWorldSetting(),
                    pending.getTimeoutSeconds() != null ? pending.getTimeoutSeconds() : properties.getDefaultTimeout(),
                    properties.getCharCreationTimeout()));
            creations.remove(pending.getPlayerId(), pending);
            return GameMessages.formatRoomCreated(room.getName(), room.getId(), room.getRoundTimeoutSeconds());
        }
        if (CANCEL_WORDS.contains(t)) {
            creations.remove(pending.getPlayerId(), pending);
            return GameMessages.WIZARD_CANCELLED;
        }
        if (RESTART_WORDS.contains(t)) {
            pending.restart(clock.millis());
            return GameMessages.WIZARD_RESTARTED;
        }
        return GameMessages.CONFIRM_PROMPT;
    }

    private static String normalize(String text) {
        return text.strip().toLowerCase(Locale.ROOT);
    }

    private String confirmSummary(PendingCreation pending) {
        int timeout = pending.getTimeoutSeconds() != null ? pending.getTimeoutSeconds() : properties.getDefaultTimeout();
        return GameMessages.formatConfirm(pending.getRoomName(), timeout,
                pending.getWorldSetting(), pending.getOriginalWorldSetting());
    }
}
