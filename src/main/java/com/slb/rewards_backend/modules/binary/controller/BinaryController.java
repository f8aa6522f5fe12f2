package com.slb.rewards_backend.modules.binary.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.binary.dto.PlaceUserDto;
import com.slb.rewards_backend.modules.binary.service.BinaryPlacementService;
import com.slb.rewards_backend.modules.binary.vo.BinaryTreeNodeVo;
import com.slb.rewards_backend.modules.binary.vo.MonthlyPerformanceVo;
import com.slb.rewards_backend.modules.binary.vo.PlacementSlotVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/binary")
@Tag(name = "双轨制", description = "安置树、安置操作与月度业绩")
public class BinaryController {

    private final BinaryPlacementService placementService;

    public BinaryController(BinaryPlacementService placementService) {
        this.placementService = placementService;
    }

    @GetMapping("/{userId}/tree")
    @Operation(summary = "安置树", description = """
            以用户为根展开左右区安置树。
            - maxDepth 默认 6，超过上限按上限截断
            - 根节点 level 为 0
            """)
    public ApiResponse<BinaryTreeNodeVo> getTree(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "展开深度", example = "6") @RequestParam(required = false) Integer maxDepth) {
        return ApiResponse.ok(placementService.buildBinaryTree(userId, maxDepth));
    }

    @GetMapping("/{userId}/placement-options")
    @Operation(summary = "可安置位置", description = "返回该节点下仍为空的左/右区位置。")
    public ApiResponse<List<PlacementSlotVo>> getPlacementOptions(
            @Parameter(description = "安置父节点ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(placementService.getPlacementOptions(userId));
    }

    @GetMapping("/{userId}/next-placement")
    @Operation(summary = "自动寻位", description = "从该节点开始按层序查找第一个空位，同层优先 preferredLeg。")
    public ApiResponse<PlacementSlotVo> findNextPlacement(
            @Parameter(description = "起始节点ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "优先区：left / right", example = "left") @RequestParam(required = false) String preferredLeg) {
        return ApiResponse.ok(placementService.findNextAvailablePlacement(userId, preferredLeg));
    }

    @PostMapping("/{userId}/place")
    @Operation(summary = "安置用户", description = """
            将尚未安置的用户放到指定父节点的左/右区。
            - position 为空时从父节点开始自动寻位
            - 位置已占用、用户已安置、父节点位于用户子树中时返回 409
            """)
    public ApiResponse<PlacementSlotVo> place(
            @Parameter(description = "待安置用户ID", example = "1002") @PathVariable Long userId,
            @Valid @RequestBody PlaceUserDto dto) {
        return ApiResponse.ok(placementService.placeUser(userId, dto));
    }

    @GetMapping("/{userId}/performance")
    @Operation(summary = "月度业绩", description = "按年月倒序返回已生成的月结业绩，可按 year / month 过滤。")
    public ApiResponse<List<MonthlyPerformanceVo>> getPerformance(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "年份", example = "2026") @RequestParam(required = false) Integer year,
            @Parameter(description = "月份 1-12", example = "9") @RequestParam(required = false) Integer month) {
        return ApiResponse.ok(placementService.getMonthlyPerformance(userId, year, month));
    }
}
