package com.restopos.kitchen.daemons;

import lombok.Getter;

import java.util.List;

/**
 * Input orders file converted into a list of this class's instances.
 * This class along with Gson makes reading input easier.
 */
@Getter public class OrderInput {
    private String customerName;
    /**
     * Minutes from the arrival of the order until the requested delivery, absent for "as soon as possible" orders.
     */
    private Integer deliveryInMinutes;
    private Integer estimatedDurationMinutes;
    private Boolean autoPromote;
    private String notes;
    private List<ItemInput> items;

    @Getter public static class ItemInput {
        private long articleId;
        private String name;
        private int quantity;
        private String customization;
        private String notes;
    }
}
