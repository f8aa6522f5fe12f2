package com.slb.rewards_backend.modules.genealogy.mapper;

import com.slb.rewards_backend.modules.genealogy.dto.DownlineFilter;
import com.slb.rewards_backend.modules.users.entity.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 推荐关系（users.upline_id）只读查询。所有按父节点批量查询都按 create_time, id 升序返回。
 */
@Mapper
public interface GenealogyMapper {

    /**
     * 一层 BFS：查询一批推荐人的全部直属下级。
     */
    List<User> selectByUplineIds(@Param("uplineIds") Collection<Long> uplineIds);

    /**
     * 只取 ID 的 BFS 版本（层级统计、全量下级 ID）。
     */
    List<Long> selectIdsByUplineIds(@Param("uplineIds") Collection<Long> uplineIds);

    List<ChildCountRow> countChildrenGroupByUpline(@Param("uplineIds") Collection<Long> uplineIds);

    /**
     * 直属下级分页。
     *
     * @param sortColumn 已经过白名单转换的列名（create_time / name / id）
     * @param sortDesc   是否倒序；相同值总是再按 id 升序
     */
    List<User> selectDirectChildrenPage(@Param("uplineId") Long uplineId,
                                        @Param("filter") DownlineFilter filter,
                                        @Param("sortColumn") String sortColumn,
                                        @Param("sortDesc") boolean sortDesc,
                                        @Param("offset") int offset,
                                        @Param("size") int size);

    long countDirectChildren(@Param("uplineId") Long uplineId, @Param("filter") DownlineFilter filter);

    long countCreatedSince(@Param("userIds") Collection<Long> userIds, @Param("since") LocalDateTime since);

    /**
     * 窗口内有已完成订单的不同用户数。
     */
    long countActivePurchasersSince(@Param("userIds") Collection<Long> userIds, @Param("since") LocalDateTime since);

    List<RankCountRow> countGroupByRank(@Param("userIds") Collection<Long> userIds);

    /**
     * 用户已到账（processed）的返利总额。
     */
    BigDecimal sumProcessedRebateAmount(@Param("receiverId") Long receiverId);
}
