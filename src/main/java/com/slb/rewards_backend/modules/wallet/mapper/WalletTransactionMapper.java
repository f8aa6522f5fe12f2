package com.slb.rewards_backend.modules.wallet.mapper;

import com.slb.rewards_backend.modules.wallet.entity.WalletTransaction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

/**
 * MyBatis mapper：用于 wallet_transactions 表的持久化操作。
 */
@Mapper
public interface WalletTransactionMapper {

    /**
     * 幂等插入：若命中 (ref_type, ref_id) 唯一键冲突则忽略（返回 0）。
     * 成功插入时回填 id。
     */
    int insertIgnore(WalletTransaction transaction);

    Optional<WalletTransaction> selectByRef(@Param("refType") String refType, @Param("refId") Long refId);

    List<WalletTransaction> selectPageByUserId(@Param("userId") Long userId,
                                               @Param("offset") int offset,
                                               @Param("size") int size);

    long countByUserId(@Param("userId") Long userId);
}
