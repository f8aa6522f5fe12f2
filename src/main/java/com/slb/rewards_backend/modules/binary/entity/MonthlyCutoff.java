package com.slb.rewards_backend.modules.binary.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：monthly_cutoffs，UNIQUE(year, month)，记录每个周期最近一次月结的执行情况。
 */
@Data
public class MonthlyCutoff implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    private Long id;
    private Integer year;
    private Integer month;

    /**
     * processing / completed / failed
     */
    private String status;

    private Integer processedUsers;
    private Integer skippedUsers;
    private Integer failedUsers;

    private LocalDateTime startedTime;
    private LocalDateTime finishedTime;

    private String notes;
}
