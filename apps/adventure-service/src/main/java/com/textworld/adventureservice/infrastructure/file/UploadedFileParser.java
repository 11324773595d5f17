package com.textworld.adventureservice.infrastructure.file;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.FileTextExtractor;
import com.textworld.adventureservice.engine.core.ParseResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 上传文件解析：下载 .txt / .docx 并提取纯文本。
 */
@Slf4j
@Component
public class UploadedFileParser implements FileTextExtractor {

    static final Set<String> SUPPORTED = Set.of(".txt", ".docx");

    /** 文本文件依次尝试的编码 */
    private static final List<String> TXT_ENCODINGS = List.of("UTF-8", "GBK", "GB2312", "UTF-16", "ISO-8859-1");

    private final RestClient restClient;

    public UploadedFileParser(RestClient.Builder builder, TextworldProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getFileDownloadTimeoutSeconds());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        this.restClient = builder.requestFactory(factory).build();
    }

    @Override
    public ParseResult parse(String url, String filename) {
        if (StringUtils.isBlank(url)) {
            return ParseResult.failure("无法获取URL");
        }
        String ext = extension(filename);
        if (!SUPPORTED.contains(ext)) {
            return ParseResult.failure("不支持的格式");
        }
        byte[] content = download(url);
        if (content == null || content.length == 0) {
            return ParseResult.failure("下载失败");
        }
        return parseContent(ext, content);
    }

    /**
     * 按扩展名解析已下载的内容
     */
    ParseResult parseContent(String ext, byte[] content) {
        return switch (ext) {
            case ".txt" -> parseTxt(content);
            case ".docx" -> parseDocx(content);
            default -> ParseResult.failure("不支持的格式");
        };
    }

    private byte[] download(String url) {
        try {
            return restClient.get().uri(URI.create(url)).retrieve().body(byte[].class);
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("文件下载失败: url={}, ex={}", url, e.toString());
            return null;
        }
    }

    private ParseResult parseTxt(byte[] content) {
        for (String encoding : TXT_ENCODINGS) {
            if (!Charset.isSupported(encoding)) {
                continue;
            }
            try {
                String text = Charset.forName(encoding).newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString()
                        .strip();
                if (!text.isEmpty()) {
                    return ParseResult.success(text);
                }
            } catch (CharacterCodingException e) {
                log.debug("编码 {} 解码失败，尝试下一个", encoding);
            }
        }
        return ParseResult.failure("无法识别编码");
    }

    private ParseResult parseDocx(byte[] content) {
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(content))) {
            List<String> paragraphs = new ArrayList<>();
            for (XWPFParagraph p : doc.getParagraphs()) {
                String text = StringUtils.strip(p.getText());
                if (StringUtils.isNotEmpty(text)) {
                    paragraphs.add(text);
                }
            }
            return paragraphs.isEmpty()
                    ? ParseResult.failure("文档为空")
                    : ParseResult.success(String.join("\n\n", paragraphs));
        } catch (IOException | RuntimeException e) {
            log.warn("docx 解析失败: {}", e.toString());
            return ParseResult.failure("解析失败: " + StringUtils.abbreviate(e.getMessage(), 40));
        }
    }

    static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot < 0 ? "" : lower.substring(dot);
    }
}
