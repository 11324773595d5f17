package com.textworld.adventureservice.games.textworld.interfaces.http;

import com.textworld.adventureservice.games.textworld.domain.dto.RoomSummary;
import com.textworld.adventureservice.games.textworld.service.TextworldService;
import com.textworld.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 大厅 - 在线房间列表查询
 *
 * 暂不做鉴权，前端可直接调用。
 */
@RestController
@RequestMapping("/api/textworld/rooms")
@RequiredArgsConstructor
public class RoomListController {

    private final TextworldService service;

    @GetMapping
    public ApiResponse<List<RoomSummary>> list() {
        return ApiResponse.success(service.listRooms());
    }
}
