package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 长文本排版：按段落切分为不超过 chunk-size 的片段，多段时加 [第i部分/n] 标记，可选标题横幅与页脚。
 */
@Component
@RequiredArgsConstructor
public class LongTextFormatter {

    private final TextworldProperties properties;

    /**
     * 按换行切段、贪心合并；单段超长时硬切。
     */
    public List<String> split(String text) {
        int size = Math.max(1, properties.getChunkSize());
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String para : text.split("\n", -1)) {
            if (current.length() + para.length() + 1 <= size) {
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(para);
                continue;
            }
            if (current.length() > 0) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            if (para.length() > size) {
                for (int i = 0; i < para.length(); i += size) {
                    chunks.add(para.substring(i, Math.min(para.length(), i + size)));
                }
            } else {
                current.append(para);
            }
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks.isEmpty() ? List.of(text) : chunks;
    }

    public String format(String text, String title) {
        return format(text, title, null);
    }

    public String format(String text, String title, String footer) {
        StringBuilder sb = new StringBuilder();
        if (title != null) {
            sb.append("━━━━ ").append(title).append(" ━━━━\n\n");
        }
        List<String> chunks = split(text);
        if (chunks.size() == 1) {
            sb.append(chunks.get(0));
        } else {
            for (int i = 0; i < chunks.size(); i++) {
                sb.append("[第").append(i + 1).append("部分/").append(chunks.size()).append("]\n")
                        .append(chunks.get(i)).append("\n\n");
            }
        }
        if (footer != null) {
            sb.append('\n').append(GameMessages.DIVIDER).append('\n').append(footer);
        }
        return sb.toString().strip();
    }
}
