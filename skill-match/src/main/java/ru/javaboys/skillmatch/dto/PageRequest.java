package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageRequest {
    private int page = 1;
    private int limit = 15;

    public static PageRequest of(int page, int limit) {
        return new PageRequest(page, limit);
    }

    // long: при большом номере страницы int переполняется
    public long getOffset() {
        return (long) (page - 1) * limit;
    }
}
