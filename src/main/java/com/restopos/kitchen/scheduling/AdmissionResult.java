package com.restopos.kitchen.scheduling;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one admission pass.
 */
public class AdmissionResult {

    public enum Outcome {
        /**
         * The pass ran to completion. Nothing may have been promoted if every candidate was gated by its delivery time.
         */
        Completed,
        /**
         * No free slot, storage was not touched beyond the capacity count.
         */
        KitchenFull,
        /**
         * Free slots, but no order waiting for automatic admission.
         */
        NoBacklog,
        /**
         * The pass failed and everything it did was rolled back.
         */
        Failed
    }

    private final Outcome outcome;
    private final List<String> promotedOrderIds;
    private final int skippedCount;
    private final CapacitySnapshot capacity;
    private final RuntimeException error;

    private AdmissionResult(Outcome outcome, List<String> promotedOrderIds, int skippedCount, CapacitySnapshot capacity,
        RuntimeException error) {
        this.outcome = outcome;
        this.promotedOrderIds = ImmutableList.copyOf(promotedOrderIds);
        this.skippedCount = skippedCount;
        this.capacity = capacity;
        this.error = error;
    }

    public static AdmissionResult completed(List<String> promotedOrderIds, int skippedCount, CapacitySnapshot capacity) {
        return new AdmissionResult(Outcome.Completed, promotedOrderIds, skippedCount, capacity, null);
    }

    public static AdmissionResult kitchenFull(CapacitySnapshot capacity) {
        return new AdmissionResult(Outcome.KitchenFull, ImmutableList.of(), 0, capacity, null);
    }

    public static AdmissionResult noBacklog(CapacitySnapshot capacity) {
        return new AdmissionResult(Outcome.NoBacklog, ImmutableList.of(), 0, capacity, null);
    }

    public static AdmissionResult failed(RuntimeException error) {
        return new AdmissionResult(Outcome.Failed, ImmutableList.of(), 0, null, error);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccessful() {
        return outcome != Outcome.Failed;
    }

    public List<String> getPromotedOrderIds() {
        return promotedOrderIds;
    }

    public int getPromotedCount() {
        return promotedOrderIds.size();
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    /**
     * @return the capacity as seen by the pass, after its promotions. Empty for failed passes.
     */
    public Optional<CapacitySnapshot> getCapacity() {
        return Optional.ofNullable(capacity);
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(AdmissionResult.class).omitNullValues().add("outcome", outcome)
            .add("promotedOrderIds", promotedOrderIds).add("skippedCount", skippedCount).add("capacity", capacity).add("error", error)
            .toString();
    }
}
