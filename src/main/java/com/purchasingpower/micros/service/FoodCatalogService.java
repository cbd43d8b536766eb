package com.purchasingpower.micros.service;

import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.FoodSummary;

import java.util.List;

/**
 * Read access to the food catalog. Result order is the catalog's own order.
 */
public interface FoodCatalogService {

    /**
     * Case-insensitive name/brand match.
     */
    List<FoodSummary> searchByName(String query, int limit);

    /**
     * Zero or more foods carrying the given UPC.
     */
    List<FoodSummary> lookupByUpc(String upc);

    /**
     * Default browse list, used when the user has not named a food yet.
     */
    List<FoodSummary> listFoods(int limit, int offset);

    /**
     * Every food with its full nutrient profile, for recommendation scoring.
     */
    List<CatalogFood> listCatalog();
}
