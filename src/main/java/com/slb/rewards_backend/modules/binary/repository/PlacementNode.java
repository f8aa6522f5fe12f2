package com.slb.rewards_backend.modules.binary.repository;

import java.time.LocalDateTime;

/**
 * 月结用的最小用户快照：推荐人 + 左右区。
 */
public record PlacementNode(Long id,
                            Long uplineId,
                            Long leftLegId,
                            Long rightLegId,
                            LocalDateTime createTime) {
}
