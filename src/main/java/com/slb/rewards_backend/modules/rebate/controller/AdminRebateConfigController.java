package com.slb.rewards_backend.modules.rebate.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.rebate.dto.RebateConfigSaveDto;
import com.slb.rewards_backend.modules.rebate.service.RebateConfigService;
import com.slb.rewards_backend.modules.rebate.vo.RebateConfigVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/rebate-configs")
@Tag(name = "管理员/返利配置", description = "按商品、层级配置返利比例或固定金额")
public class AdminRebateConfigController {

    private final RebateConfigService rebateConfigService;

    public AdminRebateConfigController(RebateConfigService rebateConfigService) {
        this.rebateConfigService = rebateConfigService;
    }

    @GetMapping
    @Operation(summary = "查询商品的返利配置", description = "按 level 升序返回。")
    public ApiResponse<List<RebateConfigVo>> listByProduct(
            @Parameter(description = "商品ID", required = true, example = "501") @RequestParam Long productId) {
        return ApiResponse.ok(rebateConfigService.listByProduct(productId));
    }

    @PostMapping
    @Operation(
            summary = "新增返利配置",
            description = """
                    percentage 类型只填 percentage（0-100），fixed 类型只填 fixedAmount（>= 0）。
                    字段组合不合法返回 422；同一商品同一层级重复返回 409。
                    """
    )
    public ApiResponse<RebateConfigVo> create(@Valid @RequestBody RebateConfigSaveDto dto) {
        return ApiResponse.ok(rebateConfigService.create(dto));
    }

    @PutMapping("/{id}")
    @Operation(summary = "修改返利配置", description = "只影响之后生成的返利，已生成的返利行不变。")
    public ApiResponse<RebateConfigVo> update(
            @Parameter(description = "配置ID", example = "1") @PathVariable Long id,
            @Valid @RequestBody RebateConfigSaveDto dto) {
        return ApiResponse.ok(rebateConfigService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除返利配置")
    public ApiResponse<Void> delete(@Parameter(description = "配置ID", example = "1") @PathVariable Long id) {
        rebateConfigService.delete(id);
        return ApiResponse.ok();
    }
}
