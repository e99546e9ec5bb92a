package com.example.musiccollection.api.response;

import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> records;
    private long total;
    private int pageNo;
    private int pageSize;

    public static <T> PageResponse<T> empty(int pageNo, int pageSize) {
        return new PageResponse<>(Collections.<T>emptyList(), 0L, pageNo, pageSize);
    }
}
