package com.slb.rewards_backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("会员奖励后端服务 API / SLB Rewards Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                - API 名称 / API Name: 会员奖励后端服务 API (SLB Rewards Backend API)
                                - 版本号 / Version: 1.0.0

                                API 介绍 / API Introduction:
                                本服务负责多层级返利计算、双轨制（左右区）月度业绩快照与等级晋升。
                                This service computes multi-level purchase rebates, binary-plan monthly performance
                                snapshots and rank advancement.

                                返利计算公式 / Rebate Formula:
                                百分比返利 = 订单金额 × 百分比 / 100，按 HALF_UP 保留 2 位小数，每条返利只舍入一次。
                                Percentage rebate = totalAmount × percentage / 100, rounded HALF_UP to 2 decimals once per row.

                                对碰奖 / Group Volume Bonus:
                                对碰奖 = floor(弱区PV / 每对PV) × 每对奖金，按弱区（左右区较小者）计算。
                                Bonus = floor(weakerLegPV / pairPv) × pairBonus, always bounded by the weaker leg.

                                2. 统一返回结构 / Unified Response Envelope:
                                所有接口统一包裹在 ApiResponse<T> 结构中（code / message / data / traceId / error）。

                                3. 异常约定 / Error Handling:
                                - 404: 用户/订单/配置不存在 / referenced record missing
                                - 409: 状态冲突（订单未完成、位置已被占用、配置重复）/ state conflict
                                - 422: 返利配置非法 / invalid rebate configuration
                                - 503: 存储暂不可用，可整体重试 / store unavailable, retryable
                                """
                        )
                        .contact(new Contact()
                                .name("Hyperion")
                                .email("backend@slb.xyz")
                        )
                );
    }
}
