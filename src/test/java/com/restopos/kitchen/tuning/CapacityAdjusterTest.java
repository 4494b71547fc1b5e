package com.restopos.kitchen.tuning;

import com.restopos.kitchen.KitchenTestSupport;
import com.restopos.kitchen.tuning.CapacityRecommendation.Trend;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.restopos.kitchen.KitchenTestSupport.at;
import static com.restopos.kitchen.KitchenTestSupport.deliveredOrder;
import static com.restopos.kitchen.KitchenTestSupport.inPreparationOrder;

public class CapacityAdjusterTest {

    private static void saveRecentDeliveries(KitchenTestSupport kitchen, int count, int actualMinutes) {
        for (int i = 0; i < count; i++) {
            kitchen.orderStore.save(deliveredOrder("delivered-" + i, at("08:30").plus(Duration.ofMinutes(i)), actualMinutes));
        }
    }

    @Test public void testFastKitchenCanTakeMore() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        saveRecentDeliveries(kitchen, 5, 8);

        CapacityRecommendation recommendation = kitchen.capacityAdjuster.recommend();

        Assertions.assertEquals(Trend.Increase, recommendation.getTrend());
        Assertions.assertEquals(10, recommendation.getRecommendedCapacity());
        Assertions.assertEquals(5, recommendation.getSampleCount());
        Assertions.assertEquals(8.0, recommendation.getAverageMinutes());
    }

    @Test public void testSlowKitchenShouldTakeLess() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        saveRecentDeliveries(kitchen, 6, 30);

        CapacityRecommendation recommendation = kitchen.capacityAdjuster.recommend();

        Assertions.assertEquals(Trend.Decrease, recommendation.getTrend());
        Assertions.assertEquals(6, recommendation.getRecommendedCapacity());
    }

    @Test public void testManyLateOrdersShouldTakeLess() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        saveRecentDeliveries(kitchen, 5, 8);
        kitchen.orderStore.save(inPreparationOrder("late-1", at("09:00"), 15));
        kitchen.orderStore.save(inPreparationOrder("late-2", at("09:10"), 15));
        kitchen.orderStore.save(inPreparationOrder("on-time", at("09:55"), 15));

        CapacityRecommendation recommendation = kitchen.capacityAdjuster.recommend();

        Assertions.assertEquals(Trend.Decrease, recommendation.getTrend());
        Assertions.assertEquals(2, recommendation.getLateOrders());
        Assertions.assertEquals(3, recommendation.getOrdersInPreparation());
        Assertions.assertTrue(recommendation.getLatePercent() > 30);
    }

    @Test public void testNotEnoughHistoryKeepsCapacity() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        saveRecentDeliveries(kitchen, 4, 8);
        // Older than the analysed window.
        kitchen.orderStore.save(deliveredOrder("early", at("04:00"), 8));

        CapacityRecommendation recommendation = kitchen.capacityAdjuster.recommend();

        Assertions.assertEquals(Trend.Maintain, recommendation.getTrend());
        Assertions.assertEquals(8, recommendation.getRecommendedCapacity());
        Assertions.assertFalse(recommendation.isAdjustmentNeeded());
    }

    @Test public void testRecommendationIsAdvisoryOnly() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        saveRecentDeliveries(kitchen, 5, 8);
        kitchen.capacityAdjuster.recommend();
        Assertions.assertFalse(kitchen.configuration.get("max_concurrent_preparations").isPresent());
    }

    @Test public void testStorageFailureKeepsCapacity() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.failReads = true;
        CapacityRecommendation recommendation = kitchen.capacityAdjuster.recommend();
        Assertions.assertEquals(Trend.Maintain, recommendation.getTrend());
        Assertions.assertEquals(8, recommendation.getRecommendedCapacity());
    }

    @Test public void testStepIsBounded() {
        Assertions.assertEquals(10, CapacityAdjuster.recommendedCapacity(8, Trend.Increase));
        Assertions.assertEquals(6, CapacityAdjuster.recommendedCapacity(8, Trend.Decrease));
        Assertions.assertEquals(5, CapacityAdjuster.recommendedCapacity(4, Trend.Increase));
        Assertions.assertEquals(3, CapacityAdjuster.recommendedCapacity(4, Trend.Decrease));
        Assertions.assertEquals(22, CapacityAdjuster.recommendedCapacity(20, Trend.Increase));
        Assertions.assertEquals(1, CapacityAdjuster.recommendedCapacity(1, Trend.Decrease));
        Assertions.assertEquals(7, CapacityAdjuster.recommendedCapacity(7, Trend.Maintain));
    }
}
