package com.textworld.adventureservice.games.textworld.interfaces.http.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * HTTP 输入请求体：与 WS 的 InputCmd 字段一致。
 */
@Data
public class InputRequest {
    @Size(max = 8000)
    private String text;
    private String attachmentUrl;
    private String attachmentName;
}
