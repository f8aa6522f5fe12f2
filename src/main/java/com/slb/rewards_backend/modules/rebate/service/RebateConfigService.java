package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.rebate.config.RebateProperties;
import com.slb.rewards_backend.modules.rebate.dto.RebateConfigSaveDto;
import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import com.slb.rewards_backend.modules.rebate.enums.RewardType;
import com.slb.rewards_backend.modules.rebate.mapper.RebateConfigMapper;
import com.slb.rewards_backend.modules.rebate.vo.RebateConfigVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 返利配置管理。配置合法性只在写入时校验，计算时不再二次判断。
 * 修改配置不会影响已生成的返利行。
 */
@Slf4j
@Service
public class RebateConfigService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final RebateConfigMapper rebateConfigMapper;
    private final RebateProperties rebateProperties;

    public RebateConfigService(RebateConfigMapper rebateConfigMapper, RebateProperties rebateProperties) {
        this.rebateConfigMapper = rebateConfigMapper;
        this.rebateProperties = rebateProperties;
    }

    public List<RebateConfigVo> listByProduct(Long productId) {
        return rebateConfigMapper.selectByProductId(productId).stream().map(RebateConfigVo::from).toList();
    }

    @Transactional
    public RebateConfigVo create(RebateConfigSaveDto dto) {
        RebateConfig config = toValidatedEntity(dto);
        if (rebateConfigMapper.selectByProductAndLevel(dto.getProductId(), dto.getLevel()).isPresent()) {
            throw BizException.conflict("该商品此层级已存在返利配置: productId=" + dto.getProductId() + ", level=" + dto.getLevel());
        }
        LocalDateTime now = LocalDateTime.now();
        config.setCreateTime(now);
        config.setUpdateTime(now);
        try {
            rebateConfigMapper.insert(config);
        } catch (DuplicateKeyException ex) {
            throw BizException.conflict("该商品此层级已存在返利配置: productId=" + dto.getProductId() + ", level=" + dto.getLevel());
        }
        log.info("Rebate config created (id={}, productId={}, level={}, type={})",
                config.getId(), config.getProductId(), config.getLevel(), config.getRewardType());
        return RebateConfigVo.from(config);
    }

    @Transactional
    public RebateConfigVo update(Long id, RebateConfigSaveDto dto) {
        RebateConfig existing = rebateConfigMapper.selectById(id)
                .orElseThrow(() -> BizException.notFound("返利配置不存在: " + id));
        RebateConfig config = toValidatedEntity(dto);
        rebateConfigMapper.selectByProductAndLevel(dto.getProductId(), dto.getLevel())
                .filter(other -> !other.getId().equals(id))
                .ifPresent(other -> {
                    throw BizException.conflict("该商品此层级已存在返利配置: productId=" + dto.getProductId() + ", level=" + dto.getLevel());
                });
        config.setId(id);
        config.setCreateTime(existing.getCreateTime());
        config.setUpdateTime(LocalDateTime.now());
        try {
            rebateConfigMapper.update(config);
        } catch (DuplicateKeyException ex) {
            throw BizException.conflict("该商品此层级已存在返利配置: productId=" + dto.getProductId() + ", level=" + dto.getLevel());
        }
        log.info("Rebate config updated (id={}, productId={}, level={}, type={})",
                id, config.getProductId(), config.getLevel(), config.getRewardType());
        return RebateConfigVo.from(config);
    }

    @Transactional
    public void delete(Long id) {
        if (rebateConfigMapper.deleteById(id) == 0) {
            throw BizException.notFound("返利配置不存在: " + id);
        }
        log.info("Rebate config deleted (id={})", id);
    }

    /**
     * 校验奖励字段组合，不合法抛 422。
     */
    RebateConfig toValidatedEntity(RebateConfigSaveDto dto) {
        Integer level = dto.getLevel();
        if (level == null || level < 1 || level > rebateProperties.getMaxLevel()) {
            throw BizException.invalidConfig("level 必须在 1.." + rebateProperties.getMaxLevel() + " 之间");
        }
        RewardType type = RewardType.fromCode(dto.getRewardType());
        if (type == null) {
            throw BizException.invalidConfig("rewardType 必须为 percentage 或 fixed");
        }

        RebateConfig config = new RebateConfig();
        config.setProductId(dto.getProductId());
        config.setLevel(level);
        config.setRewardType(type.code());
        if (type == RewardType.PERCENTAGE) {
            if (dto.getFixedAmount() != null) {
                throw BizException.invalidConfig("percentage 类型不能同时设置 fixedAmount");
            }
            BigDecimal pct = dto.getPercentage();
            if (pct == null || pct.signum() < 0 || pct.compareTo(HUNDRED) > 0) {
                throw BizException.invalidConfig("percentage 必须在 [0, 100] 之间");
            }
            config.setPercentage(pct);
        } else {
            if (dto.getPercentage() != null) {
                throw BizException.invalidConfig("fixed 类型不能同时设置 percentage");
            }
            BigDecimal fixed = dto.getFixedAmount();
            if (fixed == null || fixed.signum() < 0) {
                throw BizException.invalidConfig("fixedAmount 必须大于等于 0");
            }
            if (fixed.stripTrailingZeros().scale() > 2) {
                throw BizException.invalidConfig("fixedAmount 最多 2 位小数");
            }
            config.setFixedAmount(fixed.setScale(2, RoundingMode.UNNECESSARY));
        }
        return config;
    }
}
