package com.textworld.adventureservice.games.textworld.interfaces.command;

import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.service.TextworldService;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.CurrentPlayerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private final CurrentPlayerInfo p = new CurrentPlayerInfo("p1", "阿明", "user.p1");

    @Mock
    private TextworldService service;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(service);
    }

    private List<String> send(String text) {
        return dispatcher.dispatch(InboundMessage.text(p, text));
    }

    @Test
    void routesCommandsWithArguments() {
        when(service.join(p, "ab12cd34")).thenReturn("joined");
        when(service.act(p, "推开 石门")).thenReturn("acted");

        assertThat(send("/tw join ab12cd34")).containsExactly("joined");
        assertThat(send("/tw act   推开 石门")).containsExactly("acted");
    }

    @Test
    void commandNameIsCaseInsensitive() {
        when(service.list()).thenReturn("rooms");

        assertThat(send("/tw LIST")).containsExactly("rooms");
    }

    @Test
    void bareOrHelpShowsHelp() {
        when(service.help()).thenReturn(GameMessages.HELP);

        assertThat(send("/tw")).containsExactly(GameMessages.HELP);
        assertThat(send("/tw help")).containsExactly(GameMessages.HELP);
    }

    @Test
    void quickstartWithOptionalName() {
        when(service.quickCreate(p, "")).thenReturn("a");
        when(service.quickCreate(p, "地下城")).thenReturn("b");

        assertThat(send("/tw quickstart")).containsExactly("a");
        assertThat(send("/tw quickstart 地下城")).containsExactly("b");
    }

    @Test
    void adminSubcommands() {
        when(service.adminClose(p, "ab12cd34")).thenReturn("closed");
        when(service.adminList(p)).thenReturn("all");

        assertThat(send("/tw admin close ab12cd34")).containsExactly("closed");
        assertThat(send("/tw admin list")).containsExactly("all");
        assertThat(send("/tw admin")).containsExactly(GameMessages.USAGE_ADMIN);
    }

    @Test
    void actWithoutTextIsUsageError() {
        assertThatThrownBy(() -> send("/tw act")).isInstanceOf(UserInputException.class)
                .hasMessage(GameMessages.USAGE_ACT);
    }

    @Test
    void unknownCommandIsRejected() {
        assertThatThrownBy(() -> send("/tw dance")).isInstanceOf(UserInputException.class)
                .hasMessage(GameMessages.UNKNOWN_COMMAND);
    }

    @Test
    void foreignSlashCommandsAreIgnored() {
        assertThat(send("/roll d20")).isEmpty();
        assertThat(send("/twitter")).isEmpty();
        verifyNoInteractions(service);
    }

    @Test
    void freeTextGoesToWizardOrCharacterCreation() {
        when(service.handleFreeText(any())).thenReturn(List.of("ok"));

        assertThat(send("索林：矮人战士一名")).containsExactly("ok");
        verify(service).handleFreeText(InboundMessage.text(p, "索林：矮人战士一名"));
    }
}
