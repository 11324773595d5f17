package com.textworld.adventureservice.infrastructure.file;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.ParseResult;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class UploadedFileParserTest {

    private UploadedFileParser parser;

    @BeforeEach
    void setUp() {
        parser = new UploadedFileParser(RestClient.builder(), new TextworldProperties());
    }

    @Test
    void decodesUtf8Text() {
        ParseResult r = parser.parseContent(".txt", "  蒸汽朋克城市\n齿轮与烟雾  ".getBytes(StandardCharsets.UTF_8));

        assertThat(r.ok()).isTrue();
        assertThat(r.text()).isEqualTo("蒸汽朋克城市\n齿轮与烟雾");
    }

    @Test
    void fallsBackToGbk() {
        ParseResult r = parser.parseContent(".txt", "中文世界观设定".getBytes(Charset.forName("GBK")));

        assertThat(r.ok()).isTrue();
        assertThat(r.text()).isEqualTo("中文世界观设定");
    }

    @Test
    void extractsDocxParagraphs() throws Exception {
        byte[] docx;
        try (XWPFDocument doc = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            doc.createParagraph().createRun().setText("第一段");
            doc.createParagraph().createRun().setText("   ");
            doc.createParagraph().createRun().setText("第二段");
            doc.write(out);
            docx = out.toByteArray();
        }

        ParseResult r = parser.parseContent(".docx", docx);

        assertThat(r.ok()).isTrue();
        assertThat(r.text()).isEqualTo("第一段\n\n第二段");
    }

    @Test
    void corruptDocxIsReported() {
        ParseResult r = parser.parseContent(".docx", "not a zip".getBytes(StandardCharsets.UTF_8));

        assertThat(r.ok()).isFalse();
        assertThat(r.error()).startsWith("解析失败");
    }

    @Test
    void rejectsUnsupportedFormatsBeforeDownloading() {
        assertThat(parser.parse("http://files/w.pdf", "w.pdf").error()).isEqualTo("不支持的格式");
        assertThat(parser.parse(" ", "w.txt").error()).isEqualTo("无法获取URL");
    }

    @Test
    void extensionIsLowerCased() {
        assertThat(UploadedFileParser.extension("World.TXT")).isEqualTo(".txt");
        assertThat(UploadedFileParser.extension("noext")).isEmpty();
        assertThat(UploadedFileParser.extension(null)).isEmpty();
    }
}
