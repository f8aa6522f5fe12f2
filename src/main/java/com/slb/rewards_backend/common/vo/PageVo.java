package com.slb.rewards_backend.common.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageVo<T> {
    private Long total;
    private Integer page;
    private Integer size;
    private List<T> list;

    public static <T> PageVo<T> empty(int page, int size) {
        return new PageVo<>(0L, page, size, List.of());
    }

    public int getTotalPages() {
        if (total == null || size == null || size <= 0) {
            return 0;
        }
        return (int) ((total + size - 1) / size);
    }
}
