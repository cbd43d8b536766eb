package com.purchasingpower.micros.service.impl;

import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.storage.InMemoryNutritionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class FoodCatalogServiceImpl implements FoodCatalogService {

    private final InMemoryNutritionStore store;

    @Override
    public List<FoodSummary> searchByName(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);

        List<FoodSummary> matches = store.allFoods().stream()
                .map(CatalogFood::getSummary)
                .filter(food -> contains(food.getName(), needle) || contains(food.getBrand(), needle))
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());

        log.debug("Search '{}' (limit {}) → {} foods", query, limit, matches.size());
        return matches;
    }

    @Override
    public List<FoodSummary> lookupByUpc(String upc) {
        if (upc == null || upc.isBlank()) {
            return List.of();
        }
        String code = upc.trim();
        return store.allFoods().stream()
                .map(CatalogFood::getSummary)
                .filter(food -> code.equals(food.getUpc()))
                .collect(Collectors.toList());
    }

    @Override
    public List<FoodSummary> listFoods(int limit, int offset) {
        return store.allFoods().stream()
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .map(CatalogFood::getSummary)
                .collect(Collectors.toList());
    }

    @Override
    public List<CatalogFood> listCatalog() {
        return store.allFoods();
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
