package com.slb.rewards_backend.modules.rebate.mapper;

import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface RebateConfigMapper {

    Optional<RebateConfig> selectById(@Param("id") Long id);

    /**
     * 商品的全部层级配置，按 level 升序。
     */
    List<RebateConfig> selectByProductId(@Param("productId") Long productId);

    Optional<RebateConfig> selectByProductAndLevel(@Param("productId") Long productId, @Param("level") Integer level);

    /**
     * 插入配置并回填 id；(product_id, level) 重复时抛 DuplicateKeyException。
     */
    int insert(RebateConfig config);

    int update(RebateConfig config);

    int deleteById(@Param("id") Long id);
}
