package com.slb.rewards_backend.modules.binary.service;

import com.slb.rewards_backend.modules.binary.config.BinaryPlanProperties;
import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import com.slb.rewards_backend.modules.binary.repository.PlacementNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 双轨制月结计算（纯内存，不访问数据库）。
 * <p>
 * 输入全部用户的安置关系与本期个人 PV，输出每个用户的月度业绩行。
 * 左右区引用异常（指向自己、指向不存在的用户、被多个位置同时引用）或处于安置环中的用户会被跳过并给出原因；
 * 异常的那条腿在向上汇总业绩时按空处理。
 */
@Slf4j
@Component
public class BinaryCommissionCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public Result compute(int year,
                          int month,
                          Collection<PlacementNode> placementNodes,
                          Map<Long, BigDecimal> personalPv,
                          LocalDateTime periodStart,
                          LocalDateTime periodEnd,
                          BinaryPlanProperties plan) {
        Map<Long, PlacementNode> nodes = new LinkedHashMap<>();
        for (PlacementNode node : placementNodes) {
            nodes.put(node.id(), node);
        }
        Map<Long, String> skipped = new LinkedHashMap<>();

        // 1. 校验左右区引用
        Map<Long, Integer> claimCount = new HashMap<>();
        for (PlacementNode node : nodes.values()) {
            countClaim(claimCount, node.leftLegId());
            countClaim(claimCount, node.rightLegId());
        }
        Map<Long, Long> effectiveLeft = new HashMap<>();
        Map<Long, Long> effectiveRight = new HashMap<>();
        Map<Long, Long> parentOf = new HashMap<>();
        for (PlacementNode node : nodes.values()) {
            Long left = validLeg(node, node.leftLegId(), nodes, claimCount, skipped);
            Long right = validLeg(node, node.rightLegId(), nodes, claimCount, skipped);
            if (left != null) {
                effectiveLeft.put(node.id(), left);
                parentOf.put(left, node.id());
            }
            if (right != null) {
                effectiveRight.put(node.id(), right);
                parentOf.put(right, node.id());
            }
        }

        // 2. 安置环：每个节点至多一个有效父节点，沿父链找环
        Set<Long> cycleMembers = findCycleMembers(nodes.keySet(), parentOf);
        for (Long id : cycleMembers) {
            skipped.putIfAbsent(id, "placement cycle detected");
        }

        // 3. 子树 PV（后序迭代，环上节点不参与）
        Map<Long, BigDecimal> subtreePv = computeSubtreePv(nodes.keySet(), cycleMembers, effectiveLeft, effectiveRight, personalPv);

        // 4. 本期新直推（推荐关系，不是安置关系）
        Map<Long, List<Long>> newReferrals = new HashMap<>();
        for (PlacementNode node : nodes.values()) {
            if (node.uplineId() == null || node.createTime() == null) {
                continue;
            }
            if (!node.createTime().isBefore(periodStart) && node.createTime().isBefore(periodEnd)) {
                newReferrals.computeIfAbsent(node.uplineId(), k -> new ArrayList<>()).add(node.id());
            }
        }

        Map<Integer, BigDecimal> levelRates = new HashMap<>();
        for (BinaryPlanProperties.LevelRate rate : plan.getLevelRates()) {
            if (rate.getPercentage() != null && rate.getLevel() >= 1 && rate.getLevel() <= plan.getMaxDepth()) {
                levelRates.put(rate.getLevel(), rate.getPercentage());
            }
        }
        List<BinaryPlanProperties.GroupVolumeTier> tiers = plan.getGroupVolumeTiers().stream()
                .filter(t -> t.getPairPv() != null && t.getPairPv().signum() > 0 && t.getPairBonus() != null)
                .sorted(Comparator.comparing(BinaryPlanProperties.GroupVolumeTier::getMinWeakerLegPv,
                        Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder())))
                .toList();

        List<MonthlyPerformance> rows = new ArrayList<>();
        Map<Long, String> failed = new LinkedHashMap<>();
        for (Long userId : nodes.keySet()) {
            if (skipped.containsKey(userId)) {
                continue;
            }
            try {
                BigDecimal left = effectiveLeft.containsKey(userId) ? subtreePv.get(effectiveLeft.get(userId)) : BigDecimal.ZERO;
                BigDecimal right = effectiveRight.containsKey(userId) ? subtreePv.get(effectiveRight.get(userId)) : BigDecimal.ZERO;
                BigDecimal own = personalPv.getOrDefault(userId, BigDecimal.ZERO);

                BigDecimal directBonus = directReferralBonus(newReferrals.getOrDefault(userId, List.of()), personalPv, plan);
                BigDecimal levelBonus = levelCommissions(userId, effectiveLeft, effectiveRight, personalPv, levelRates, plan.getMaxDepth());
                BigDecimal groupBonus = groupVolumeBonus(left, right, tiers);

                MonthlyPerformance row = new MonthlyPerformance();
                row.setUserId(userId);
                row.setYear(year);
                row.setMonth(month);
                row.setPersonalPv(own.setScale(2, RoundingMode.HALF_UP));
                row.setLeftLegPv(left.setScale(2, RoundingMode.HALF_UP));
                row.setRightLegPv(right.setScale(2, RoundingMode.HALF_UP));
                row.setTotalGroupPv(left.add(right).setScale(2, RoundingMode.HALF_UP));
                row.setDirectReferralBonus(directBonus);
                row.setLevelCommissions(levelBonus);
                row.setGroupVolumeBonus(groupBonus);
                row.setTotalEarnings(directBonus.add(levelBonus).add(groupBonus));
                rows.add(row);
            } catch (RuntimeException ex) {
                log.warn("Monthly performance computation failed (userId={}, period={}-{}): {}", userId, year, month, ex.getMessage());
                failed.put(userId, ex.getClass().getSimpleName() + ": " + ex.getMessage());
            }
        }
        return new Result(rows, skipped, failed);
    }

    /**
     * 新直推奖：fixed 为每人固定金额；percentage 为该直推本期个人 PV × 百分比。
     */
    BigDecimal directReferralBonus(List<Long> referrals, Map<Long, BigDecimal> personalPv, BinaryPlanProperties plan) {
        BinaryPlanProperties.DirectReferral rule = plan.getDirectReferral();
        if (rule == null || !rule.isEnabled() || referrals.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal total = BigDecimal.ZERO;
        if ("percentage".equalsIgnoreCase(rule.getRewardType())) {
            BigDecimal pct = rule.getPercentage() == null ? BigDecimal.ZERO : rule.getPercentage();
            for (Long referral : referrals) {
                total = total.add(personalPv.getOrDefault(referral, BigDecimal.ZERO).multiply(pct).divide(HUNDRED));
            }
        } else {
            BigDecimal fixed = rule.getFixedAmount() == null ? BigDecimal.ZERO : rule.getFixedAmount();
            total = fixed.multiply(BigDecimal.valueOf(referrals.size()));
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * 层级奖：安置深度 1..maxDepth 每层个人 PV 之和 × 该层比例。
     */
    BigDecimal levelCommissions(Long userId,
                                Map<Long, Long> effectiveLeft,
                                Map<Long, Long> effectiveRight,
                                Map<Long, BigDecimal> personalPv,
                                Map<Integer, BigDecimal> levelRates,
                                int maxDepth) {
        if (levelRates.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal total = BigDecimal.ZERO;
        List<Long> frontier = List.of(userId);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<Long> next = new ArrayList<>();
            BigDecimal levelPv = BigDecimal.ZERO;
            for (Long id : frontier) {
                Long left = effectiveLeft.get(id);
                Long right = effectiveRight.get(id);
                if (left != null) {
                    next.add(left);
                    levelPv = levelPv.add(personalPv.getOrDefault(left, BigDecimal.ZERO));
                }
                if (right != null) {
                    next.add(right);
                    levelPv = levelPv.add(personalPv.getOrDefault(right, BigDecimal.ZERO));
                }
            }
            BigDecimal rate = levelRates.get(depth);
            if (rate != null) {
                total = total.add(levelPv.multiply(rate).divide(HUNDRED));
            }
            frontier = next;
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * 对碰奖：只看弱区。取 minWeakerLegPv 不超过弱区 PV 的最高一档，
     * 奖金 = floor(弱区PV / pairPv) × pairBonus，有封顶则取较小值。
     */
    BigDecimal groupVolumeBonus(BigDecimal leftPv, BigDecimal rightPv, List<BinaryPlanProperties.GroupVolumeTier> sortedTiers) {
        BigDecimal weaker = leftPv.min(rightPv);
        BinaryPlanProperties.GroupVolumeTier matched = null;
        for (BinaryPlanProperties.GroupVolumeTier tier : sortedTiers) {
            BigDecimal min = tier.getMinWeakerLegPv() == null ? BigDecimal.ZERO : tier.getMinWeakerLegPv();
            if (weaker.compareTo(min) >= 0) {
                matched = tier;
            }
        }
        if (matched == null || weaker.signum() <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal pairs = weaker.divide(matched.getPairPv(), 0, RoundingMode.FLOOR);
        BigDecimal bonus = pairs.multiply(matched.getPairBonus());
        if (matched.getMaxBonus() != null && bonus.compareTo(matched.getMaxBonus()) > 0) {
            bonus = matched.getMaxBonus();
        }
        return bonus.setScale(2, RoundingMode.HALF_UP);
    }

    private static void countClaim(Map<Long, Integer> claimCount, Long target) {
        if (target != null) {
            claimCount.merge(target, 1, Integer::sum);
        }
    }

    private static Long validLeg(PlacementNode node,
                                 Long target,
                                 Map<Long, PlacementNode> nodes,
                                 Map<Long, Integer> claimCount,
                                 Map<Long, String> skipped) {
        if (target == null) {
            return null;
        }
        String reason = null;
        if (target.equals(node.id())) {
            reason = "leg points to itself: " + target;
        } else if (!nodes.containsKey(target)) {
            reason = "leg points to missing user: " + target;
        } else if (claimCount.getOrDefault(target, 0) > 1) {
            reason = "leg target claimed by more than one slot: " + target;
        }
        if (reason != null) {
            skipped.putIfAbsent(node.id(), reason);
            return null;
        }
        return target;
    }

    private static Set<Long> findCycleMembers(Collection<Long> ids, Map<Long, Long> parentOf) {
        Set<Long> cycleMembers = new HashSet<>();
        Set<Long> done = new HashSet<>();
        for (Long start : ids) {
            if (done.contains(start)) {
                continue;
            }
            List<Long> path = new ArrayList<>();
            Map<Long, Integer> indexOnPath = new HashMap<>();
            Long current = start;
            while (current != null && !done.contains(current)) {
                Integer seenAt = indexOnPath.get(current);
                if (seenAt != null) {
                    cycleMembers.addAll(path.subList(seenAt, path.size()));
                    break;
                }
                indexOnPath.put(current, path.size());
                path.add(current);
                current = parentOf.get(current);
            }
            done.addAll(path);
        }
        return cycleMembers;
    }

    private static Map<Long, BigDecimal> computeSubtreePv(Collection<Long> ids,
                                                          Set<Long> cycleMembers,
                                                          Map<Long, Long> effectiveLeft,
                                                          Map<Long, Long> effectiveRight,
                                                          Map<Long, BigDecimal> personalPv) {
        Map<Long, BigDecimal> subtree = new HashMap<>();
        Deque<Long> stack = new ArrayDeque<>();
        for (Long root : ids) {
            if (cycleMembers.contains(root) || subtree.containsKey(root)) {
                continue;
            }
            stack.push(root);
            while (!stack.isEmpty()) {
                Long id = stack.peek();
                Long left = effectiveLeft.get(id);
                Long right = effectiveRight.get(id);
                boolean leftReady = left == null || subtree.containsKey(left);
                boolean rightReady = right == null || subtree.containsKey(right);
                if (leftReady && rightReady) {
                    stack.pop();
                    BigDecimal sum = personalPv.getOrDefault(id, BigDecimal.ZERO);
                    if (left != null) {
                        sum = sum.add(subtree.get(left));
                    }
                    if (right != null) {
                        sum = sum.add(subtree.get(right));
                    }
                    subtree.put(id, sum);
                } else {
                    if (!leftReady) {
                        stack.push(left);
                    }
                    if (!rightReady) {
                        stack.push(right);
                    }
                }
            }
        }
        return subtree;
    }

    /**
     * @param skipped 因安置数据异常被跳过的用户及原因
     * @param failed  计算过程中抛异常的用户及原因
     */
    public record Result(List<MonthlyPerformance> rows, Map<Long, String> skipped, Map<Long, String> failed) {
    }
}
