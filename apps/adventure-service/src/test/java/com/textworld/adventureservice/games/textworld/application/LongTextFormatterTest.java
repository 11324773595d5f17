package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LongTextFormatterTest {

    private LongTextFormatter formatter;

    @BeforeEach
    void setUp() {
        TextworldProperties props = new TextworldProperties();
        props.setChunkSize(10);
        formatter = new LongTextFormatter(props);
    }

    @Test
    void shortTextIsSingleChunk() {
        assertThat(formatter.split("短文本")).containsExactly("短文本");
        assertThat(formatter.format("短文本", null)).isEqualTo("短文本");
    }

    @Test
    void mergesParagraphsUpToChunkSize() {
        assertThat(formatter.split("aaaa\nbbbb\ncccccc")).containsExactly("aaaa\nbbbb", "cccccc");
    }

    @Test
    void hardSplitsOverlongParagraph() {
        List<String> chunks = formatter.split("x".repeat(25));

        assertThat(chunks).containsExactly("x".repeat(10), "x".repeat(10), "x".repeat(5));
    }

    @Test
    void numbersPartsAndAddsTitle() {
        String out = formatter.format("aaaa\nbbbb\ncccccc", "世界观");

        assertThat(out).startsWith("━━━━ 世界观 ━━━━");
        assertThat(out).contains("[第1部分/2]\naaaa\nbbbb").contains("[第2部分/2]\ncccccc");
    }

    @Test
    void appendsFooter() {
        assertThat(formatter.format("正文", "标题", "页脚")).endsWith("页脚");
    }
}
