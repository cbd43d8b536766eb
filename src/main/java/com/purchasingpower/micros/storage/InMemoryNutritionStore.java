package com.purchasingpower.micros.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.Nutrient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory users, foods and meal logs, seeded from YAML at startup.
 *
 * Meal logs are appended under a lock so each log is recorded whole or not at all;
 * reads take a snapshot of the current set and never cache aggregates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryNutritionStore {

    private final AssistantConfig assistantConfig;
    private final Clock clock;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<Long, SeedData.SeedUser> users = new LinkedHashMap<>();
    private final Map<Long, CatalogFood> foods = new LinkedHashMap<>();
    private final List<LogRecord> logs = new ArrayList<>();
    private final AtomicLong logIds = new AtomicLong();

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @PostConstruct
    public void loadSeed() {
        String location = assistantConfig.getSeedResource();
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            log.warn("⚠️ Seed resource not found: {} (starting with an empty store)", location);
            return;
        }

        try (InputStream in = resource.getInputStream()) {
            SeedData seed = yamlMapper.readValue(in, SeedData.class);
            load(seed);
            log.info("✅ Loaded seed data from {}: {} users, {} foods", location, users.size(), foods.size());
        } catch (IOException e) {
            log.error("Failed to load seed data from {}", location, e);
            throw new IllegalStateException("Seed data initialization failed: " + location, e);
        }
    }

    public synchronized void load(SeedData seed) {
        for (SeedData.SeedUser user : seed.getUsers()) {
            users.put(user.getId(), user);
        }
        for (SeedData.SeedFood food : seed.getFoods()) {
            foods.put(food.getId(), toCatalogFood(food));
        }
    }

    // ================================================================
    // READS
    // ================================================================

    public synchronized boolean userExists(long userId) {
        return users.containsKey(userId);
    }

    public synchronized Optional<Map<String, Double>> findGoals(long userId) {
        SeedData.SeedUser user = users.get(userId);
        if (user == null) {
            return Optional.empty();
        }
        return Optional.of(new LinkedHashMap<>(user.getGoals()));
    }

    public synchronized Optional<CatalogFood> findFood(long foodId) {
        return Optional.ofNullable(foods.get(foodId));
    }

    /**
     * Foods in id order.
     */
    public synchronized List<CatalogFood> allFoods() {
        return new ArrayList<>(foods.values());
    }

    public synchronized List<LogRecord> logsForUser(long userId) {
        return logs.stream()
                .filter(record -> record.getUserId() == userId)
                .collect(Collectors.toList());
    }

    public synchronized List<LogRecord> logsForDay(long userId, LocalDate date) {
        return logs.stream()
                .filter(record -> record.getUserId() == userId)
                .filter(record -> record.getLoggedAt().toLocalDate().equals(date))
                .collect(Collectors.toList());
    }

    // ================================================================
    // WRITES
    // ================================================================

    /**
     * Appends a log built from the next id and the current time.
     */
    public synchronized LogRecord appendLog(Function<LogRecord.LogRecordBuilder, LogRecord.LogRecordBuilder> fill) {
        LogRecord record = fill.apply(LogRecord.builder()
                        .id(logIds.incrementAndGet())
                        .loggedAt(LocalDateTime.now(clock)))
                .build();
        logs.add(record);
        return record;
    }

    private CatalogFood toCatalogFood(SeedData.SeedFood food) {
        Map<String, Double> nutrients = new LinkedHashMap<>();
        food.getNutrients().forEach((key, value) -> {
            if (Nutrient.fromKey(key).isEmpty()) {
                log.warn("⚠️ Unknown nutrient '{}' on food {} ignored", key, food.getId());
                return;
            }
            nutrients.put(key, value != null ? value : 0.0);
        });

        FoodSummary summary = FoodSummary.builder()
                .id(food.getId())
                .name(food.getName())
                .brand(food.getBrand())
                .upc(food.getUpc())
                .calories(nutrients.getOrDefault(Nutrient.CALORIES.getKey(), 0.0))
                .proteinG(nutrients.getOrDefault(Nutrient.PROTEIN.getKey(), 0.0))
                .fatG(nutrients.getOrDefault(Nutrient.FAT.getKey(), 0.0))
                .carbsG(nutrients.getOrDefault(Nutrient.CARBS.getKey(), 0.0))
                .build();

        return CatalogFood.builder()
                .summary(summary)
                .nutrientsPer100g(nutrients)
                .build();
    }
}
