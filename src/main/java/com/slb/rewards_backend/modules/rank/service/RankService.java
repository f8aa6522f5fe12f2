package com.slb.rewards_backend.modules.rank.service;

import com.slb.rewards_backend.modules.rank.entity.Rank;
import com.slb.rewards_backend.modules.rank.entity.RankRequirement;
import com.slb.rewards_backend.modules.rank.mapper.RankMapper;
import com.slb.rewards_backend.modules.rank.vo.RankVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 等级阶梯（ranks + rank_requirements），极少变动，走 Spring Cache。
 */
@Slf4j
@Service
public class RankService {

    public static final String LADDER_CACHE = "rankLadderCache";

    private final RankMapper rankMapper;

    public RankService(RankMapper rankMapper) {
        this.rankMapper = rankMapper;
    }

    /**
     * 按 level 升序的等级阶梯。level 不连续时只告警，不影响读取。
     */
    @Cacheable(cacheNames = LADDER_CACHE, key = "'all'", sync = true)
    public List<RankVo> getLadder() {
        List<Rank> ranks = rankMapper.selectAllOrderByLevel();
        Map<Long, RankRequirement> requirements = rankMapper.selectAllRequirements().stream()
                .collect(Collectors.toMap(RankRequirement::getRankId, Function.identity(), (a, b) -> a));
        for (int i = 0; i < ranks.size(); i++) {
            Integer level = ranks.get(i).getLevel();
            if (level == null || level != i + 1) {
                log.warn("Rank levels are not contiguous from 1 (index={}, level={}, rankId={})", i, level, ranks.get(i).getId());
                break;
            }
        }
        return ranks.stream().map(r -> RankVo.of(r, requirements.get(r.getId()))).toList();
    }

    /**
     * [定时任务] 每小时清空等级缓存，后台改动等级配置后最迟一小时生效
     */
    @Scheduled(cron = "0 0 * * * ?")
    @CacheEvict(cacheNames = LADDER_CACHE, allEntries = true)
    public void evictLadderCache() {
    }
}
