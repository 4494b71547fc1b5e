package com.restopos.kitchen.entities.orders;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * One article of an order, as the kitchen has to prepare it.
 */
@ThreadSafe public class OrderLine {

    private final long articleId;
    private final String articleName;
    private final int quantity;
    private final String customization;
    private final String notes;

    public OrderLine(long articleId, String articleName, int quantity, String customization, String notes) {
        Preconditions.checkArgument(quantity > 0, "quantity must be positive, was %s", quantity);
        this.articleId = articleId;
        this.articleName = articleName;
        this.quantity = quantity;
        this.customization = customization;
        this.notes = notes;
    }

    public OrderLine(long articleId, String articleName, int quantity) {
        this(articleId, articleName, quantity, null, null);
    }

    public long getArticleId() {
        return articleId;
    }

    public String getArticleName() {
        return articleName;
    }

    public int getQuantity() {
        return quantity;
    }

    public String getCustomization() {
        return customization;
    }

    public String getNotes() {
        return notes;
    }

    @Override public boolean equals(Object other) {
        if (other == this)
            return true;
        if (!(other instanceof OrderLine))
            return false;
        OrderLine that = (OrderLine) other;
        return articleId == that.articleId && quantity == that.quantity && Objects.equals(articleName, that.articleName) && Objects
            .equals(customization, that.customization) && Objects.equals(notes, that.notes);
    }

    @Override public int hashCode() {
        return Objects.hash(articleId, articleName, quantity, customization, notes);
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(OrderLine.class).omitNullValues().add("articleId", articleId).add("articleName", articleName)
            .add("quantity", quantity).add("customization", customization).toString();
    }
}
