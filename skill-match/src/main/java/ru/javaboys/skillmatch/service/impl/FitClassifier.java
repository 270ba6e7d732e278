package ru.javaboys.skillmatch.service.impl;

import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.entity.FitEnum;

@Component
public class FitClassifier {

    public FitEnum classify(int score) {
        if (score >= 80) return FitEnum.EXCELLENT;
        if (score >= 60) return FitEnum.GOOD;
        if (score >= 40) return FitEnum.FAIR;
        return FitEnum.POOR;
    }
}
