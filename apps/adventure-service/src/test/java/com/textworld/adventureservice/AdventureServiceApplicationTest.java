package com.textworld.adventureservice;

import com.textworld.adventureservice.clock.scheduler.TimeoutScheduler;
import com.textworld.adventureservice.engine.core.GenerationBackend;
import com.textworld.adventureservice.games.textworld.interfaces.command.CommandDispatcher;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.CurrentPlayerInfo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AdventureServiceApplicationTest {

    @Autowired
    private CommandDispatcher dispatcher;

    @Autowired
    private TimeoutScheduler timeoutScheduler;

    @Autowired
    private GenerationBackend generationBackend;

    @Test
    void contextWiresCommandPath() {
        CurrentPlayerInfo p = new CurrentPlayerInfo("smoke", "烟测", "user.smoke");

        assertThat(dispatcher.dispatch(InboundMessage.text(p, "/tw list"))).hasSize(1);
        assertThat(timeoutScheduler.isScheduled("round:none")).isFalse();
        // 未配置 api-key 时走兜底
        assertThat(generationBackend.generate("ping").ok()).isFalse();
    }
}
