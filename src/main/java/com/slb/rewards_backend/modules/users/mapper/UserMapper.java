package com.slb.rewards_backend.modules.users.mapper;

import com.slb.rewards_backend.modules.users.entity.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Mapper
public interface UserMapper {

    /**
     * 根据ID查找用户
     */
    Optional<User> selectById(@Param("id") Long id);

    /**
     * 批量查询用户（顺序不保证）
     */
    List<User> selectByIds(@Param("ids") Collection<Long> ids);

    /**
     * 按 id 升序分批拉取用户 ID，用于全量批处理（keyset 分页）。
     */
    List<Long> selectIdsAfter(@Param("afterId") Long afterId, @Param("limit") int limit);

    /**
     * 原子增加钱包余额：wallet_balance = wallet_balance + amount。
     * 禁止在应用层“读余额-算新值-写回”。
     *
     * @return 影响行数；0 表示用户不存在
     */
    int incrementWalletBalance(@Param("userId") Long userId, @Param("amount") BigDecimal amount);

    /**
     * 等级 CAS 更新：仅当当前 rank_id 仍为 expectedRankId 时才更新（expectedRankId 可为 null）。
     *
     * @return 影响行数；0 表示已被并发修改
     */
    int updateRankIfCurrent(@Param("userId") Long userId,
                            @Param("expectedRankId") Long expectedRankId,
                            @Param("newRankId") Long newRankId);

    /**
     * 占用上级的左/右区空位（仅当该位置为空时成功）。
     *
     * @param position left / right
     * @return 影响行数；0 表示位置已被占用
     */
    int claimLegSlot(@Param("parentId") Long parentId,
                     @Param("position") String position,
                     @Param("childId") Long childId);

    /**
     * 写入安置关系（仅当该用户尚未被安置时成功）。
     */
    int updatePlacementIfUnplaced(@Param("userId") Long userId,
                                  @Param("parentId") Long parentId,
                                  @Param("position") String position);
}
