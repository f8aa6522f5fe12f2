package com.slb.rewards_backend.modules.rebate.vo;

import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class RebateConfigVo {
    private Long id;
    private Long productId;
    private Integer level;
    private String rewardType;
    private BigDecimal percentage;
    private BigDecimal fixedAmount;
    private LocalDateTime updateTime;

    public static RebateConfigVo from(RebateConfig config) {
        RebateConfigVo vo = new RebateConfigVo();
        vo.setId(config.getId());
        vo.setProductId(config.getProductId());
        vo.setLevel(config.getLevel());
        vo.setRewardType(config.getRewardType());
        vo.setPercentage(config.getPercentage());
        vo.setFixedAmount(config.getFixedAmount());
        vo.setUpdateTime(config.getUpdateTime());
        return vo;
    }
}
