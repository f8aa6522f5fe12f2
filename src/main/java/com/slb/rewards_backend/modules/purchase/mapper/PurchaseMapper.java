package com.slb.rewards_backend.modules.purchase.mapper;

import com.slb.rewards_backend.modules.purchase.entity.Purchase;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Optional;

@Mapper
public interface PurchaseMapper {

    Optional<Purchase> selectById(@Param("id") Long id);

    /**
     * 指定用户集合已完成订单的金额合计（无记录返回 0）。
     */
    BigDecimal sumCompletedAmountByUserIds(@Param("userIds") Collection<Long> userIds);
}
