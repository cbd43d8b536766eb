package com.purchasingpower.micros.service.impl;

import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.service.GoalsService;
import com.purchasingpower.micros.storage.InMemoryNutritionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class GoalsServiceImpl implements GoalsService {

    private final InMemoryNutritionStore store;

    @Override
    public Map<String, Double> getGoals(long userId) {
        return store.findGoals(userId)
                .orElseThrow(() -> NutritionDomainException.userNotFound(userId));
    }
}
