package com.slb.rewards_backend.modules.binary.repository;

import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 月结的批量读写：一次性加载全部安置关系与本期个人 PV，按批 upsert 结果。
 */
@Slf4j
@Repository
public class BinaryVolumeRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public BinaryVolumeRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<PlacementNode> loadPlacementNodes() {
        String sql = """
                SELECT id, upline_id, left_leg_id, right_leg_id, create_time
                FROM users
                ORDER BY id
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp created = rs.getTimestamp("create_time");
            return new PlacementNode(
                    rs.getLong("id"),
                    rs.getObject("upline_id", Long.class),
                    rs.getObject("left_leg_id", Long.class),
                    rs.getObject("right_leg_id", Long.class),
                    created == null ? null : created.toLocalDateTime());
        });
    }

    /**
     * 周期 [start, end) 内已完成订单的个人 PV，key 为 user_id；没有订单的用户不在结果中。
     */
    public Map<Long, BigDecimal> sumPersonalPvBetween(LocalDateTime start, LocalDateTime end) {
        String sql = """
                SELECT user_id, SUM(total_pv) AS pv
                FROM purchases
                WHERE status = 'completed'
                  AND create_time >= :start
                  AND create_time < :end
                GROUP BY user_id
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("start", Timestamp.valueOf(start))
                .addValue("end", Timestamp.valueOf(end));
        Map<Long, BigDecimal> result = new HashMap<>();
        jdbcTemplate.query(sql, params, rs -> {
            BigDecimal pv = rs.getBigDecimal("pv");
            result.put(rs.getLong("user_id"), pv == null ? BigDecimal.ZERO : pv);
        });
        return result;
    }

    /**
     * 按 (user_id, year, month) upsert，整行覆盖。
     */
    public void upsertPerformance(List<MonthlyPerformance> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO monthly_performance
                    (user_id, year, month, personal_pv, left_leg_pv, right_leg_pv, total_group_pv,
                     direct_referral_bonus, level_commissions, group_volume_bonus, total_earnings,
                     create_time, update_time)
                VALUES
                    (:userId, :year, :month, :personalPv, :leftLegPv, :rightLegPv, :totalGroupPv,
                     :directReferralBonus, :levelCommissions, :groupVolumeBonus, :totalEarnings,
                     NOW(), NOW())
                ON DUPLICATE KEY UPDATE
                    personal_pv = VALUES(personal_pv),
                    left_leg_pv = VALUES(left_leg_pv),
                    right_leg_pv = VALUES(right_leg_pv),
                    total_group_pv = VALUES(total_group_pv),
                    direct_referral_bonus = VALUES(direct_referral_bonus),
                    level_commissions = VALUES(level_commissions),
                    group_volume_bonus = VALUES(group_volume_bonus),
                    total_earnings = VALUES(total_earnings),
                    update_time = NOW()
                """;
        MapSqlParameterSource[] batch = rows.stream()
                .map(row -> new MapSqlParameterSource()
                        .addValue("userId", row.getUserId())
                        .addValue("year", row.getYear())
                        .addValue("month", row.getMonth())
                        .addValue("personalPv", row.getPersonalPv())
                        .addValue("leftLegPv", row.getLeftLegPv())
                        .addValue("rightLegPv", row.getRightLegPv())
                        .addValue("totalGroupPv", row.getTotalGroupPv())
                        .addValue("directReferralBonus", row.getDirectReferralBonus())
                        .addValue("levelCommissions", row.getLevelCommissions())
                        .addValue("groupVolumeBonus", row.getGroupVolumeBonus())
                        .addValue("totalEarnings", row.getTotalEarnings()))
                .toArray(MapSqlParameterSource[]::new);
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Upserted [{}] monthly performance rows", rows.size());
    }
}
