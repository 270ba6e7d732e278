package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageInfo {
    private int page;
    private int limit;
    private int total;      // после фильтрации, до пагинации
    private int totalPages;
    private boolean hasNext;
    private boolean hasPrev;

    public static PageInfo of(int page, int limit, int total) {
        int totalPages = (int) Math.ceil((double) total / limit);
        return new PageInfo(page, limit, total, totalPages, page < totalPages, page > 1);
    }
}
