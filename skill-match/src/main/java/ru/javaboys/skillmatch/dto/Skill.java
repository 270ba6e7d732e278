package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Skill {
    private String name;          // единственное обязательное поле
    private Integer proficiency;  // 0..100, может отсутствовать
    private String level;         // категориальный уровень (expert, beginner...), в скоринге нейтрален
    private String category;

    public static Skill of(String name) {
        return Skill.builder().name(name).build();
    }

    public static Skill of(String name, int proficiency) {
        return Skill.builder().name(name).proficiency(proficiency).build();
    }
}
