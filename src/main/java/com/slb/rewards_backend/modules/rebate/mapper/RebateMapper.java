package com.slb.rewards_backend.modules.rebate.mapper;

import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MyBatis mapper：rebates 表。
 * 状态流转只能通过带 status='pending' 条件的 UPDATE 完成，影响行数即为“是否抢到”。
 */
@Mapper
public interface RebateMapper {

    /**
     * 幂等插入：命中 (purchase_id, level) 唯一键时忽略（返回 0），已有行不会被改写。
     */
    int insertIgnore(Rebate rebate);

    Optional<Rebate> selectById(@Param("id") Long id);

    List<Rebate> selectByPurchaseId(@Param("purchaseId") Long purchaseId);

    /**
     * keyset 分页：id > afterId 的 pending 返利 ID，按 id 升序。
     */
    List<Long> selectPendingIdsAfter(@Param("afterId") Long afterId, @Param("limit") int limit);

    /**
     * 抢占：pending -> processed。
     *
     * @return 1 抢占成功；0 已被其他执行者处理
     */
    int claimPending(@Param("id") Long id, @Param("processedTime") LocalDateTime processedTime);

    /**
     * pending -> failed，仅当仍为 pending 时生效。
     */
    int markFailed(@Param("id") Long id, @Param("failureReason") String failureReason);

    int linkWalletTransaction(@Param("id") Long id, @Param("walletTransactionId") Long walletTransactionId);

    List<Rebate> selectPageByReceiver(@Param("receiverId") Long receiverId,
                                      @Param("status") String status,
                                      @Param("offset") int offset,
                                      @Param("size") int size);

    long countByReceiver(@Param("receiverId") Long receiverId, @Param("status") String status);

    /**
     * 收款人在某状态下的金额合计（无记录返回 null）。
     */
    BigDecimal sumAmountByReceiverAndStatus(@Param("receiverId") Long receiverId, @Param("status") String status);

    List<LevelAmountRow> sumProcessedByLevel(@Param("receiverId") Long receiverId);

    List<Rebate> selectPageByStatus(@Param("status") String status,
                                    @Param("offset") int offset,
                                    @Param("size") int size);

    long countByStatus(@Param("status") String status);
}
