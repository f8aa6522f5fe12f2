package com.slb.rewards_backend.modules.genealogy.service;

import com.google.common.collect.Lists;
import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.genealogy.config.GenealogyProperties;
import com.slb.rewards_backend.modules.genealogy.dto.DownlineFilter;
import com.slb.rewards_backend.modules.genealogy.mapper.ChildCountRow;
import com.slb.rewards_backend.modules.genealogy.mapper.GenealogyMapper;
import com.slb.rewards_backend.modules.genealogy.mapper.RankCountRow;
import com.slb.rewards_backend.modules.genealogy.vo.DownlineTreeVo;
import com.slb.rewards_backend.modules.genealogy.vo.GenealogyNodeVo;
import com.slb.rewards_backend.modules.genealogy.vo.GenealogyStatisticsVo;
import com.slb.rewards_backend.modules.genealogy.vo.LevelExpansionVo;
import com.slb.rewards_backend.modules.genealogy.vo.PerformanceMetricsVo;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 推荐关系（族谱）只读服务。
 * <p>
 * 所有遍历都是显式 frontier 的迭代 BFS：每一层一次批量 IN 查询（超过 chunk 大小时分片），
 * 不做递归，也不会加载超过 maxLevel 的节点。数据库异常（DataAccessException）原样抛出，由全局处理器映射为 503。
 */
@Slf4j
@Service
public class GenealogyService {

    private static final Map<String, String> SORT_COLUMNS = Map.of(
            "createtime", "create_time",
            "name", "name",
            "id", "id"
    );

    private final GenealogyMapper genealogyMapper;
    private final UserMapper userMapper;
    private final PurchaseMapper purchaseMapper;
    private final GenealogyProperties properties;

    public GenealogyService(GenealogyMapper genealogyMapper,
                            UserMapper userMapper,
                            PurchaseMapper purchaseMapper,
                            GenealogyProperties properties) {
        this.genealogyMapper = genealogyMapper;
        this.userMapper = userMapper;
        this.purchaseMapper = purchaseMapper;
        this.properties = properties;
    }

    /**
     * 根节点（level 0）+ 分页的直属下级（level 1），每个下级带子树直到 maxLevel。
     */
    public DownlineTreeVo getDownline(Long userId, Integer maxLevel, Integer page, Integer pageSize, DownlineFilter filter) {
        User root = requireUser(userId);
        int effectiveMaxLevel = resolveMaxLevel(maxLevel);
        int safePage = page == null || page < 1 ? 1 : page;
        int safeSize = resolvePageSize(pageSize);

        String sortColumn = SORT_COLUMNS.getOrDefault(
                filter == null || filter.getSortBy() == null ? "" : filter.getSortBy().trim().toLowerCase(),
                "create_time");
        boolean sortDesc = filter != null && "desc".equalsIgnoreCase(filter.getSortDir());

        long total = genealogyMapper.countDirectChildren(userId, filter);
        List<User> firstLevel = total == 0
                ? List.of()
                : genealogyMapper.selectDirectChildrenPage(userId, filter, sortColumn, sortDesc,
                (safePage - 1) * safeSize, safeSize);

        GenealogyNodeVo rootNode = GenealogyNodeVo.of(root, 0);
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        Map<Long, GenealogyNodeVo> frontier = new LinkedHashMap<>();
        for (User child : firstLevel) {
            if (!visited.add(child.getId())) {
                continue;
            }
            GenealogyNodeVo node = GenealogyNodeVo.of(child, 1);
            rootNode.getChildren().add(node);
            frontier.put(child.getId(), node);
        }

        Map<Integer, Long> loadedCounts = new LinkedHashMap<>();
        if (!frontier.isEmpty()) {
            loadedCounts.put(1, (long) frontier.size());
            loadedCounts.putAll(expand(frontier, 1, effectiveMaxLevel, visited));
        }

        DownlineTreeVo.Pagination pagination = new DownlineTreeVo.Pagination();
        pagination.setPage(safePage);
        pagination.setPageSize(safeSize);
        pagination.setTotalChildren(total);
        pagination.setTotalPages((int) ((total + safeSize - 1) / safeSize));

        DownlineTreeVo.Metadata metadata = new DownlineTreeVo.Metadata();
        metadata.setMaxLevel(effectiveMaxLevel);
        metadata.setLoadedNodes(loadedCounts.values().stream().mapToInt(Long::intValue).sum());
        metadata.setLoadedLevelCounts(loadedCounts);

        DownlineTreeVo vo = new DownlineTreeVo();
        vo.setNode(rootNode);
        vo.setPagination(pagination);
        vo.setMetadata(metadata);
        return vo;
    }

    /**
     * 按需展开：节点当前显示在 currentLevel，返回其 currentLevel+1..maxLevel 的后代（层级仍按原树编号）。
     */
    public LevelExpansionVo loadAdditionalLevels(Long userId, int currentLevel, Integer maxLevel) {
        if (currentLevel < 0) {
            throw new BizException("currentLevel 不能小于 0");
        }
        requireUser(userId);
        int target = maxLevel == null ? currentLevel + properties.getDefaultMaxLevel() : maxLevel;
        if (target <= currentLevel) {
            throw new BizException("maxLevel 必须大于 currentLevel");
        }
        if (target - currentLevel > properties.getMaxLevelLimit()) {
            target = currentLevel + properties.getMaxLevelLimit();
        }

        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        GenealogyNodeVo holder = new GenealogyNodeVo();
        holder.setId(userId);
        holder.setLevel(currentLevel);
        Map<Long, GenealogyNodeVo> frontier = new LinkedHashMap<>();
        frontier.put(userId, holder);
        expand(frontier, currentLevel, target, visited);

        LevelExpansionVo vo = new LevelExpansionVo();
        vo.setUserId(userId);
        vo.setFromLevel(currentLevel + 1);
        vo.setToLevel(target);
        vo.setNodes(holder.getChildren());
        return vo;
    }

    /**
     * 每层下级人数（level 1 为直属）。超过 maxLevel 的层不计算；某层为空即停止。
     */
    public Map<Integer, Long> getLevelCounts(Long userId, Integer maxLevel) {
        requireUser(userId);
        int effectiveMaxLevel = resolveMaxLevel(maxLevel);
        Map<Integer, Long> counts = new LinkedHashMap<>();
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        List<Long> frontier = List.of(userId);
        for (int level = 1; level <= effectiveMaxLevel && !frontier.isEmpty(); level++) {
            frontier = nextIds(frontier, visited);
            if (frontier.isEmpty()) {
                break;
            }
            counts.put(level, (long) frontier.size());
        }
        return counts;
    }

    public PerformanceMetricsVo getPerformanceMetrics(Long userId) {
        requireUser(userId);
        List<Long> downline = getEntireDownlineIds(userId);
        LocalDateTime since = LocalDateTime.now().minusDays(properties.getNewMemberWindowDays());

        BigDecimal personalSales = nz(purchaseMapper.sumCompletedAmountByUserIds(List.of(userId)));
        BigDecimal teamSales = BigDecimal.ZERO;
        long newMembers = 0L;
        for (List<Long> chunk : Lists.partition(downline, chunkSize())) {
            teamSales = teamSales.add(nz(purchaseMapper.sumCompletedAmountByUserIds(chunk)));
            newMembers += genealogyMapper.countCreatedSince(chunk, since);
        }

        PerformanceMetricsVo vo = new PerformanceMetricsVo();
        vo.setUserId(userId);
        vo.setPersonalSales(personalSales);
        vo.setTeamSales(teamSales);
        vo.setRebatesEarned(nz(genealogyMapper.sumProcessedRebateAmount(userId)));
        vo.setTeamSize((long) downline.size());
        vo.setNewTeamMembers(newMembers);
        vo.setNewMemberWindowDays(properties.getNewMemberWindowDays());
        return vo;
    }

    /**
     * maxLevel 层以内的团队统计：每层人数、活跃成员（窗口内有已完成订单）与等级分布。
     */
    public GenealogyStatisticsVo getStatistics(Long userId, Integer maxLevel) {
        requireUser(userId);
        int effectiveMaxLevel = resolveMaxLevel(maxLevel);
        GenealogyStatisticsVo vo = new GenealogyStatisticsVo();
        List<Long> members = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        List<Long> frontier = List.of(userId);
        for (int level = 1; level <= effectiveMaxLevel; level++) {
            frontier = nextIds(frontier, visited);
            if (frontier.isEmpty()) {
                break;
            }
            vo.getLevelCounts().put(level, (long) frontier.size());
            members.addAll(frontier);
        }

        LocalDateTime since = LocalDateTime.now().minusDays(properties.getActiveWindowDays());
        long active = 0L;
        long unranked = 0L;
        for (List<Long> chunk : Lists.partition(members, chunkSize())) {
            active += genealogyMapper.countActivePurchasersSince(chunk, since);
            for (RankCountRow row : genealogyMapper.countGroupByRank(chunk)) {
                long count = row.getUserCount() == null ? 0L : row.getUserCount();
                if (row.getRankId() == null) {
                    unranked += count;
                } else {
                    vo.getRankDistribution().merge(row.getRankId(), count, Long::sum);
                }
            }
        }

        vo.setUserId(userId);
        vo.setMaxLevel(effectiveMaxLevel);
        vo.setTotalUsers(members.size() + 1L);
        vo.setDirectDownlineCount(vo.getLevelCounts().getOrDefault(1, 0L));
        vo.setActiveUsers(active);
        vo.setActiveUserPercentage(members.isEmpty()
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(active * 100).divide(BigDecimal.valueOf(members.size()), 2, RoundingMode.HALF_UP));
        vo.setActiveWindowDays(properties.getActiveWindowDays());
        vo.setUnrankedCount(unranked);
        return vo;
    }

    /**
     * 上级链：index 0 为直属推荐人（level 1）。到达根节点或 maxLevels 即停止；
     * 遇到环或悬空的 upline_id 时截断并告警，不抛异常。
     */
    public List<Long> getUpline(Long userId, int maxLevels) {
        User current = requireUser(userId);
        List<Long> chain = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(userId);
        Long next = current.getUplineId();
        while (next != null && chain.size() < maxLevels) {
            if (!seen.add(next)) {
                log.warn("Upline cycle detected, chain truncated (userId={}, repeatedId={}, depth={})", userId, next, chain.size());
                break;
            }
            User upline = userMapper.selectById(next).orElse(null);
            if (upline == null) {
                log.warn("Dangling upline reference, chain truncated (userId={}, missingId={})", userId, next);
                break;
            }
            chain.add(next);
            next = upline.getUplineId();
        }
        return chain;
    }

    /**
     * 全部下级 ID（不限层数，BFS 顺序）。
     */
    public List<Long> getEntireDownlineIds(Long userId) {
        List<Long> result = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        List<Long> frontier = List.of(userId);
        while (!frontier.isEmpty()) {
            frontier = nextIds(frontier, visited);
            result.addAll(frontier);
        }
        return result;
    }

    public long countDirectDownline(Long userId) {
        return genealogyMapper.countDirectChildren(userId, null);
    }

    private Map<Integer, Long> expand(Map<Long, GenealogyNodeVo> frontier, int frontierLevel, int maxLevel, Set<Long> visited) {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        Map<Long, GenealogyNodeVo> current = frontier;
        for (int level = frontierLevel + 1; level <= maxLevel && !current.isEmpty(); level++) {
            Map<Long, GenealogyNodeVo> next = new LinkedHashMap<>();
            for (List<Long> chunk : Lists.partition(new ArrayList<>(current.keySet()), chunkSize())) {
                for (User child : genealogyMapper.selectByUplineIds(chunk)) {
                    if (!visited.add(child.getId())) {
                        log.warn("Node reached twice during downline expansion, skipped (id={})", child.getId());
                        continue;
                    }
                    GenealogyNodeVo parent = current.get(child.getUplineId());
                    if (parent == null) {
                        continue;
                    }
                    GenealogyNodeVo node = GenealogyNodeVo.of(child, level);
                    parent.getChildren().add(node);
                    next.put(child.getId(), node);
                }
            }
            if (!next.isEmpty()) {
                counts.put(level, (long) next.size());
            }
            current = next;
        }
        // 最深一层只返回子节点数量，供前端按需展开
        if (!current.isEmpty()) {
            for (List<Long> chunk : Lists.partition(new ArrayList<>(current.keySet()), chunkSize())) {
                for (ChildCountRow row : genealogyMapper.countChildrenGroupByUpline(chunk)) {
                    GenealogyNodeVo node = current.get(row.getUplineId());
                    if (node != null) {
                        node.setPendingChildCount(row.getChildCount());
                    }
                }
            }
        }
        return counts;
    }

    private List<Long> nextIds(Collection<Long> frontier, Set<Long> visited) {
        List<Long> next = new ArrayList<>();
        for (List<Long> chunk : Lists.partition(new ArrayList<>(frontier), chunkSize())) {
            for (Long id : genealogyMapper.selectIdsByUplineIds(chunk)) {
                if (visited.add(id)) {
                    next.add(id);
                } else {
                    log.warn("Node reached twice during BFS, skipped (id={})", id);
                }
            }
        }
        return next;
    }

    private User requireUser(Long userId) {
        return userMapper.selectById(userId)
                .orElseThrow(() -> BizException.notFound("用户不存在: " + userId));
    }

    private int resolveMaxLevel(Integer maxLevel) {
        if (maxLevel == null) {
            return properties.getDefaultMaxLevel();
        }
        if (maxLevel < 1) {
            throw new BizException("maxLevel 必须大于等于 1");
        }
        return Math.min(maxLevel, properties.getMaxLevelLimit());
    }

    private int resolvePageSize(Integer pageSize) {
        if (pageSize == null || pageSize < 1) {
            return properties.getDefaultPageSize();
        }
        return Math.min(pageSize, properties.getMaxPageSize());
    }

    private int chunkSize() {
        return Math.max(1, properties.getQueryChunkSize());
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
