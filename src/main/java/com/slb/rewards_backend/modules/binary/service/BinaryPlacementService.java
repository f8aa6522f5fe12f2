package com.slb.rewards_backend.modules.binary.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.binary.config.BinaryPlanProperties;
import com.slb.rewards_backend.modules.binary.dto.PlaceUserDto;
import com.slb.rewards_backend.modules.binary.mapper.MonthlyPerformanceMapper;
import com.slb.rewards_backend.modules.binary.vo.BinaryTreeNodeVo;
import com.slb.rewards_backend.modules.binary.vo.MonthlyPerformanceVo;
import com.slb.rewards_backend.modules.binary.vo.PlacementSlotVo;
import com.slb.rewards_backend.modules.binary.vo.TopEarnerVo;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.enums.LegPosition;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 双轨制安置：空位查询、自动寻位、安置写入、安置树与月度业绩查询。
 * 安置关系与推荐关系（upline_id）相互独立，这里只改 placement 相关字段。
 */
@Slf4j
@Service
public class BinaryPlacementService {

    private static final int MAX_TOP_EARNERS = 100;

    private final UserMapper userMapper;
    private final MonthlyPerformanceMapper performanceMapper;
    private final BinaryPlanProperties plan;

    public BinaryPlacementService(UserMapper userMapper,
                                  MonthlyPerformanceMapper performanceMapper,
                                  BinaryPlanProperties plan) {
        this.userMapper = userMapper;
        this.performanceMapper = performanceMapper;
        this.plan = plan;
    }

    public List<PlacementSlotVo> getPlacementOptions(Long parentId) {
        User parent = requireUser(parentId, "安置父节点不存在");
        List<PlacementSlotVo> options = new ArrayList<>(2);
        if (parent.getLeftLegId() == null) {
            options.add(new PlacementSlotVo(parentId, LegPosition.LEFT.code()));
        }
        if (parent.getRightLegId() == null) {
            options.add(new PlacementSlotVo(parentId, LegPosition.RIGHT.code()));
        }
        return options;
    }

    /**
     * 从 startId 开始按层序寻找第一个空位；同一节点优先 preferredLeg。
     */
    public PlacementSlotVo findNextAvailablePlacement(Long startId, String preferredLeg) {
        User start = requireUser(startId, "安置父节点不存在");
        LegPosition preferred = parseLeg(preferredLeg, LegPosition.LEFT);

        Set<Long> visited = new HashSet<>();
        List<User> level = List.of(start);
        visited.add(start.getId());
        while (!level.isEmpty()) {
            List<Long> nextIds = new ArrayList<>();
            for (User node : level) {
                for (LegPosition leg : List.of(preferred, preferred.opposite())) {
                    Long child = legOf(node, leg);
                    if (child == null) {
                        return new PlacementSlotVo(node.getId(), leg.code());
                    }
                    if (visited.add(child)) {
                        nextIds.add(child);
                    }
                }
            }
            if (nextIds.isEmpty()) {
                break;
            }
            Map<Long, User> byId = indexById(userMapper.selectByIds(nextIds));
            List<User> next = new ArrayList<>(nextIds.size());
            for (Long id : nextIds) {
                User child = byId.get(id);
                if (child == null) {
                    // 悬空的腿引用：该位置视为被占用，不往下走
                    log.warn("Placement leg points to missing user (userId={})", id);
                    continue;
                }
                next.add(child);
            }
            level = next;
        }
        throw BizException.conflict("未找到可用的安置位置");
    }

    @Transactional
    public PlacementSlotVo placeUser(Long userId, PlaceUserDto dto) {
        if (dto == null || dto.getParentId() == null) {
            throw new BizException("parentId 不能为空");
        }
        if (userId.equals(dto.getParentId())) {
            throw new BizException("不能将用户安置在自己下面");
        }
        User user = requireUser(userId, "用户不存在");
        User parent = requireUser(dto.getParentId(), "安置父节点不存在");
        if (user.getPlacementParentId() != null) {
            throw BizException.conflict("用户已被安置");
        }
        ensureNotInSubtree(user.getId(), parent);

        PlacementSlotVo slot;
        if (dto.getPosition() == null || dto.getPosition().isBlank()) {
            slot = findNextAvailablePlacement(parent.getId(), dto.getPreferredLeg());
            if (!slot.getParentId().equals(parent.getId())) {
                // 自动寻位可能落到更深的节点，再做一次子树检查
                ensureNotInSubtree(user.getId(), requireUser(slot.getParentId(), "安置父节点不存在"));
            }
        } else {
            LegPosition position = parseLeg(dto.getPosition(), null);
            if (position == null) {
                throw new BizException("position 只能为 left / right");
            }
            slot = new PlacementSlotVo(parent.getId(), position.code());
        }

        if (userMapper.claimLegSlot(slot.getParentId(), slot.getPosition(), userId) == 0) {
            throw BizException.conflict("该安置位置已被占用");
        }
        if (userMapper.updatePlacementIfUnplaced(userId, slot.getParentId(), slot.getPosition()) == 0) {
            throw BizException.conflict("用户已被安置");
        }
        log.info("User placed (userId={}, parentId={}, position={})", userId, slot.getParentId(), slot.getPosition());
        return slot;
    }

    public BinaryTreeNodeVo buildBinaryTree(Long userId, Integer maxDepth) {
        int depth = maxDepth == null ? plan.getTreeDefaultDepth() : maxDepth;
        if (depth < 0) {
            throw new BizException("maxDepth 不能小于 0");
        }
        depth = Math.min(depth, plan.getTreeMaxDepth());

        User root = requireUser(userId, "用户不存在");
        BinaryTreeNodeVo rootVo = toNode(root, 0, null);
        Set<Long> visited = new HashSet<>();
        visited.add(root.getId());

        Map<Long, BinaryTreeNodeVo> frontier = new HashMap<>();
        Map<Long, User> frontierUsers = new HashMap<>();
        frontier.put(root.getId(), rootVo);
        frontierUsers.put(root.getId(), root);

        for (int level = 1; level <= depth && !frontier.isEmpty(); level++) {
            List<Long> childIds = new ArrayList<>();
            for (User node : frontierUsers.values()) {
                for (LegPosition leg : LegPosition.values()) {
                    Long child = legOf(node, leg);
                    if (child != null && visited.add(child)) {
                        childIds.add(child);
                    }
                }
            }
            if (childIds.isEmpty()) {
                break;
            }
            Map<Long, User> children = indexById(userMapper.selectByIds(childIds));
            Map<Long, BinaryTreeNodeVo> nextFrontier = new HashMap<>();
            Map<Long, User> nextUsers = new HashMap<>();
            for (User parent : frontierUsers.values()) {
                BinaryTreeNodeVo parentVo = frontier.get(parent.getId());
                for (LegPosition leg : LegPosition.values()) {
                    Long childId = legOf(parent, leg);
                    User child = childId == null ? null : children.get(childId);
                    if (child == null || nextFrontier.containsKey(childId)) {
                        continue;
                    }
                    BinaryTreeNodeVo childVo = toNode(child, level, leg);
                    if (leg == LegPosition.LEFT) {
                        parentVo.setLeft(childVo);
                    } else {
                        parentVo.setRight(childVo);
                    }
                    nextFrontier.put(childId, childVo);
                    nextUsers.put(childId, child);
                }
            }
            frontier = nextFrontier;
            frontierUsers = nextUsers;
        }
        return rootVo;
    }

    public List<MonthlyPerformanceVo> getMonthlyPerformance(Long userId, Integer year, Integer month) {
        if (month != null && (month < 1 || month > 12)) {
            throw new BizException("month 必须在 1..12 之间");
        }
        requireUser(userId, "用户不存在");
        return performanceMapper.selectByUser(userId, year, month).stream()
                .map(MonthlyPerformanceVo::from)
                .toList();
    }

    public List<TopEarnerVo> getTopEarners(int year, int month, Integer limit) {
        if (month < 1 || month > 12) {
            throw new BizException("month 必须在 1..12 之间");
        }
        int size = limit == null ? 10 : Math.max(1, Math.min(limit, MAX_TOP_EARNERS));
        return performanceMapper.selectTopEarners(year, month, size);
    }

    /**
     * 沿 parent 的安置祖先向上走，遇到 userId 说明 parent 在 user 的安置子树中。
     */
    private void ensureNotInSubtree(Long userId, User parent) {
        Set<Long> seen = new HashSet<>();
        Long current = parent.getPlacementParentId();
        seen.add(parent.getId());
        while (current != null) {
            if (current.equals(userId)) {
                throw BizException.conflict("不能安置到自己的安置子树中");
            }
            if (!seen.add(current)) {
                log.warn("Placement ancestry contains a cycle (parentId={}, at={})", parent.getId(), current);
                throw BizException.conflict("安置关系存在环，无法安置");
            }
            current = userMapper.selectById(current).map(User::getPlacementParentId).orElse(null);
        }
    }

    private User requireUser(Long id, String message) {
        return userMapper.selectById(id).orElseThrow(() -> BizException.notFound(message));
    }

    private static LegPosition parseLeg(String value, LegPosition fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        LegPosition leg = LegPosition.fromCode(value);
        if (leg == null) {
            throw new BizException("无效的区位: " + value);
        }
        return leg;
    }

    private static Long legOf(User user, LegPosition leg) {
        return leg == LegPosition.LEFT ? user.getLeftLegId() : user.getRightLegId();
    }

    private static Map<Long, User> indexById(List<User> users) {
        Map<Long, User> map = new HashMap<>(users.size() * 2);
        for (User u : users) {
            map.put(u.getId(), u);
        }
        return map;
    }

    private static BinaryTreeNodeVo toNode(User user, int level, LegPosition position) {
        BinaryTreeNodeVo vo = new BinaryTreeNodeVo();
        vo.setUserId(user.getId());
        vo.setName(user.getName());
        vo.setEmail(user.getEmail());
        vo.setRankId(user.getRankId());
        vo.setLevel(level);
        vo.setPosition(position == null ? null : position.code());
        return vo;
    }
}
