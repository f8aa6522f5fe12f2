package com.slb.rewards_backend.modules.binary.mapper;

import com.slb.rewards_backend.modules.binary.entity.MonthlyCutoff;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface MonthlyCutoffMapper {

    Optional<MonthlyCutoff> selectByPeriod(@Param("year") int year, @Param("month") int month);

    /**
     * 开始一次月结：不存在则插入，存在则重置为 processing。
     */
    int upsertProcessing(MonthlyCutoff cutoff);

    /**
     * 写入本次月结的最终状态与计数。
     */
    int updateFinished(MonthlyCutoff cutoff);
}
