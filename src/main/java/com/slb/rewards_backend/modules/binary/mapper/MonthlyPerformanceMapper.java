package com.slb.rewards_backend.modules.binary.mapper;

import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import com.slb.rewards_backend.modules.binary.vo.TopEarnerVo;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MonthlyPerformanceMapper {

    /**
     * 用户月度业绩，year / month 为空表示不限，按 year、month 倒序。
     */
    List<MonthlyPerformance> selectByUser(@Param("userId") Long userId,
                                          @Param("year") Integer year,
                                          @Param("month") Integer month);

    /**
     * 周期内收益排行（total_earnings 倒序，相同按 user_id 升序）。
     */
    List<TopEarnerVo> selectTopEarners(@Param("year") int year,
                                       @Param("month") int month,
                                       @Param("limit") int limit);
}
