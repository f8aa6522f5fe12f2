package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.purchase.entity.Purchase;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.rebate.config.RebateProperties;
import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import com.slb.rewards_backend.modules.rebate.enums.RebateStatus;
import com.slb.rewards_backend.modules.rebate.enums.RewardType;
import com.slb.rewards_backend.modules.rebate.mapper.RebateConfigMapper;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 订单完成后生成各层上级的 pending 返利。
 * <p>
 * 金额口径：percentage 类型为 totalAmount × percentage / 100，每行单独 HALF_UP 到 2 位小数；
 * fixed 类型直接取固定金额，忽略 percentage。重复调用依赖 (purchase_id, level) 唯一键，已存在的行不会被改写。
 */
@Slf4j
@Service
public class RebateCalculationService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final PurchaseMapper purchaseMapper;
    private final RebateConfigMapper rebateConfigMapper;
    private final RebateMapper rebateMapper;
    private final GenealogyService genealogyService;
    private final RebateProperties rebateProperties;

    public RebateCalculationService(PurchaseMapper purchaseMapper,
                                    RebateConfigMapper rebateConfigMapper,
                                    RebateMapper rebateMapper,
                                    GenealogyService genealogyService,
                                    RebateProperties rebateProperties) {
        this.purchaseMapper = purchaseMapper;
        this.rebateConfigMapper = rebateConfigMapper;
        this.rebateMapper = rebateMapper;
        this.genealogyService = genealogyService;
        this.rebateProperties = rebateProperties;
    }

    /**
     * @return 本次新生成的 pending 返利（已存在的行不在返回值中）
     * @throws BizException 订单不存在（404）或订单未完成（409）
     */
    @Transactional
    public List<Rebate> computeRebatesForPurchase(Long purchaseId) {
        Purchase purchase = purchaseMapper.selectById(purchaseId)
                .orElseThrow(() -> BizException.notFound("订单不存在: " + purchaseId));
        if (!purchase.isCompleted()) {
            throw BizException.conflict("订单未完成，不能生成返利: purchaseId=" + purchaseId + ", status=" + purchase.getStatus());
        }

        Map<Integer, RebateConfig> configByLevel = rebateConfigMapper.selectByProductId(purchase.getProductId()).stream()
                .filter(c -> c.getLevel() != null && c.getLevel() >= 1 && c.getLevel() <= rebateProperties.getMaxLevel())
                .collect(Collectors.toMap(RebateConfig::getLevel, Function.identity(), (a, b) -> a));
        if (configByLevel.isEmpty()) {
            log.info("No rebate config for product, skip (purchaseId={}, productId={})", purchaseId, purchase.getProductId());
            return List.of();
        }
        int deepestLevel = configByLevel.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);

        List<Long> upline = genealogyService.getUpline(purchase.getUserId(), deepestLevel);
        List<Rebate> created = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < upline.size(); i++) {
            int level = i + 1;
            RebateConfig config = configByLevel.get(level);
            if (config == null) {
                continue;
            }
            BigDecimal amount = computeAmount(purchase.getTotalAmount(), config);
            if (amount.signum() <= 0) {
                continue;
            }
            Rebate rebate = new Rebate();
            rebate.setPurchaseId(purchaseId);
            rebate.setGeneratorId(purchase.getUserId());
            rebate.setReceiverId(upline.get(i));
            rebate.setLevel(level);
            rebate.setRewardType(config.getRewardType());
            rebate.setPercentage(RewardType.FIXED.code().equals(config.getRewardType()) ? null : config.getPercentage());
            rebate.setAmount(amount);
            rebate.setStatus(RebateStatus.PENDING.code());
            rebate.setCreateTime(now);
            // 幂等写入：同一订单同一层级只会有一行
            if (rebateMapper.insertIgnore(rebate) > 0) {
                created.add(rebate);
            }
        }
        log.info("Rebates computed (purchaseId={}, generatorId={}, uplineDepth={}, created={})",
                purchaseId, purchase.getUserId(), upline.size(), created.size());
        return created;
    }

    /**
     * 单行返利金额，HALF_UP 保留 2 位小数。
     */
    static BigDecimal computeAmount(BigDecimal totalAmount, RebateConfig config) {
        if (RewardType.FIXED.code().equals(config.getRewardType())) {
            BigDecimal fixed = config.getFixedAmount();
            return fixed == null ? BigDecimal.ZERO : fixed.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal pct = config.getPercentage();
        if (pct == null || totalAmount == null) {
            return BigDecimal.ZERO;
        }
        return totalAmount.multiply(pct).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }
}
