package com.restopos.kitchen.entities.kitchen;

import com.restopos.kitchen.KitchenTestSupport;
import com.restopos.kitchen.MutableClock;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.config.SystemConfiguration;
import com.restopos.kitchen.store.InMemoryOrderStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static com.restopos.kitchen.KitchenTestSupport.asapOrder;
import static com.restopos.kitchen.KitchenTestSupport.at;
import static com.restopos.kitchen.KitchenTestSupport.inPreparationOrder;

public class CapacityOracleTest {

    @Test public void testDefaultCapacity() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        Assertions.assertEquals(8, kitchen.capacityOracle.maxCapacity());
        Assertions.assertEquals(0, kitchen.capacityOracle.currentLoad());
        Assertions.assertEquals(8, kitchen.capacityOracle.availableSlots());
        Assertions.assertFalse(kitchen.capacityOracle.isFull());
    }

    @Test public void testInvalidCapacityFallsBackToDefault() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.configuration.put("max_concurrent_preparations", "lots");
        Assertions.assertEquals(8, kitchen.capacityOracle.maxCapacity());
        kitchen.configuration.put("max_concurrent_preparations", "0");
        Assertions.assertEquals(8, kitchen.capacityOracle.maxCapacity());
        kitchen.configuration.put("max_concurrent_preparations", " 3 ");
        Assertions.assertEquals(3, kitchen.capacityOracle.maxCapacity());
    }

    @Test public void testFailingConfigurationFallsBackToDefault() {
        SystemConfiguration broken = new SystemConfiguration() {
            @Override public Optional<String> get(String key) {
                throw new IllegalStateException("configuration table locked");
            }

            @Override public void put(String key, String value) {
                throw new IllegalStateException("configuration table locked");
            }

            @Override public boolean remove(String key) {
                return false;
            }

            @Override public Map<String, String> entries() {
                throw new IllegalStateException("configuration table locked");
            }
        };
        MutableClock clock = new MutableClock(KitchenTestSupport.OPENING, KitchenTestSupport.ZONE);
        CapacityOracle oracle = new CapacityOracle(new InMemoryOrderStore(), new ConfigReader(broken), clock);
        Assertions.assertEquals(8, oracle.maxCapacity());
    }

    @Test public void testLoadCountsTodaysOrdersInPreparation() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(3);
        kitchen.orderStore.save(inPreparationOrder("a", at("09:00"), 15));
        kitchen.orderStore.save(inPreparationOrder("b", at("09:30"), 15));
        kitchen.orderStore.save(inPreparationOrder("yesterday", at("09:30").minus(Duration.ofDays(1)), 15));
        kitchen.orderStore.save(asapOrder("waiting", at("09:45")));

        Assertions.assertEquals(2, kitchen.capacityOracle.currentLoad());
        Assertions.assertEquals(1, kitchen.capacityOracle.availableSlots());

        CapacitySnapshot snapshot = kitchen.capacityOracle.snapshot();
        Assertions.assertEquals(3, snapshot.getMaxCapacity());
        Assertions.assertEquals(2, snapshot.getCurrentLoad());
        Assertions.assertEquals(67, snapshot.getUtilizationPercent());
    }

    @Test public void testOverloadedKitchenHasNoNegativeSlots() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(inPreparationOrder("a", at("09:00"), 15));
        kitchen.orderStore.save(inPreparationOrder("b", at("09:30"), 15));
        // Ceiling lowered below the current load.
        kitchen.setCapacity(1);

        Assertions.assertEquals(0, kitchen.capacityOracle.availableSlots());
        Assertions.assertTrue(kitchen.capacityOracle.isFull());
        Assertions.assertEquals(200, kitchen.capacityOracle.snapshot().getUtilizationPercent());
    }

    @Test public void testCapacityChangesAreSeenImmediately() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(inPreparationOrder("a", at("09:00"), 15));
        kitchen.setCapacity(1);
        Assertions.assertTrue(kitchen.capacityOracle.isFull());
        kitchen.setCapacity(2);
        Assertions.assertFalse(kitchen.capacityOracle.isFull());
    }
}
