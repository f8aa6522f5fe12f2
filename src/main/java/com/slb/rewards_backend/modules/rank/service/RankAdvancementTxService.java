package com.slb.rewards_backend.modules.rank.service;

import com.slb.rewards_backend.modules.rank.entity.RankAdvancement;
import com.slb.rewards_backend.modules.rank.mapper.RankAdvancementMapper;
import com.slb.rewards_backend.modules.rank.vo.RankEligibilityVo;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 晋升落库的事务实现：等级 CAS 更新 + 审计记录，要么都成功要么都不生效。
 */
@Service
@Slf4j
public class RankAdvancementTxService {

    private final UserMapper userMapper;
    private final RankAdvancementMapper rankAdvancementMapper;

    public RankAdvancementTxService(UserMapper userMapper, RankAdvancementMapper rankAdvancementMapper) {
        this.userMapper = userMapper;
        this.rankAdvancementMapper = rankAdvancementMapper;
    }

    /**
     * @param expectedRankId 评估时读到的等级（可为空）
     * @return false 表示等级已被并发修改（CAS 失败），未写任何数据
     */
    @Transactional
    public boolean advance(Long userId, Long expectedRankId, Long newRankId, RankEligibilityVo snapshot) {
        int updated = userMapper.updateRankIfCurrent(userId, expectedRankId, newRankId);
        if (updated == 0) {
            log.info("Rank CAS lost, user rank changed concurrently (userId={}, expectedRankId={}, newRankId={})",
                    userId, expectedRankId, newRankId);
            return false;
        }
        RankAdvancement advancement = new RankAdvancement();
        advancement.setUserId(userId);
        advancement.setPreviousRankId(expectedRankId);
        advancement.setNewRankId(newRankId);
        advancement.setPersonalSales(snapshot.getPersonalSales());
        advancement.setGroupSales(snapshot.getGroupSales());
        advancement.setDirectDownlineCount(snapshot.getDirectDownlineCount());
        advancement.setQualifiedDownlineCount(snapshot.getQualifiedDownlineCount());
        advancement.setCreateTime(LocalDateTime.now());
        rankAdvancementMapper.insert(advancement);
        return true;
    }
}
