package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.rebate.enums.RebateStatus;
import com.slb.rewards_backend.modules.rebate.mapper.LevelAmountRow;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import com.slb.rewards_backend.modules.rebate.vo.RebateStatsVo;
import com.slb.rewards_backend.modules.rebate.vo.RebateVo;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Service
public class RebateQueryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final RebateMapper rebateMapper;

    public RebateQueryService(RebateMapper rebateMapper) {
        this.rebateMapper = rebateMapper;
    }

    public PageVo<RebateVo> listReceived(Long userId, String status, int page, int size) {
        String statusCode = parseStatus(status);
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        long total = rebateMapper.countByReceiver(userId, statusCode);
        if (total == 0) {
            return new PageVo<>(0L, safePage, safeSize, List.of());
        }
        List<RebateVo> list = rebateMapper.selectPageByReceiver(userId, statusCode, (safePage - 1) * safeSize, safeSize)
                .stream().map(RebateVo::from).toList();
        return new PageVo<>(total, safePage, safeSize, list);
    }

    public RebateStatsVo getStats(Long userId) {
        RebateStatsVo vo = new RebateStatsVo();
        vo.setUserId(userId);
        vo.setTotalProcessed(nz(rebateMapper.sumAmountByReceiverAndStatus(userId, RebateStatus.PROCESSED.code())));
        vo.setTotalPending(nz(rebateMapper.sumAmountByReceiverAndStatus(userId, RebateStatus.PENDING.code())));
        vo.setTotalFailed(nz(rebateMapper.sumAmountByReceiverAndStatus(userId, RebateStatus.FAILED.code())));
        for (LevelAmountRow row : rebateMapper.sumProcessedByLevel(userId)) {
            RebateStatsVo.LevelStat stat = new RebateStatsVo.LevelStat();
            stat.setLevel(row.getLevel());
            stat.setCount(row.getCount());
            stat.setAmount(nz(row.getAmount()));
            vo.getByLevel().add(stat);
        }
        return vo;
    }

    /**
     * 管理端按状态查看返利（status 为空则查全部）。
     */
    public PageVo<RebateVo> listByStatus(String status, int page, int size) {
        String statusCode = parseStatus(status);
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        long total = rebateMapper.countByStatus(statusCode);
        if (total == 0) {
            return new PageVo<>(0L, safePage, safeSize, List.of());
        }
        List<RebateVo> list = rebateMapper.selectPageByStatus(statusCode, (safePage - 1) * safeSize, safeSize)
                .stream().map(RebateVo::from).toList();
        return new PageVo<>(total, safePage, safeSize, list);
    }

    private String parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        RebateStatus parsed = RebateStatus.fromCode(status);
        if (parsed == null) {
            throw new BizException("status 仅支持 pending / processed / failed");
        }
        return parsed.code();
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
