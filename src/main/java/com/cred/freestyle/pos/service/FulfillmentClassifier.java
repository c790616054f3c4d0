package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.OrderLine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides which completion path an order follows.
 *
 * An order with at least one line in the deferred-fulfillment category is a job
 * order: it is completed by timestamp and only its deferred-category lines are
 * deducted. Every other order is completed by receipt number and all of its lines
 * are deducted. Mixed orders therefore never have their non-deferred lines deducted.
 *
 * @author POS Team
 */
@Component
public class FulfillmentClassifier {

    private final String deferredCategory;

    public FulfillmentClassifier(@Value("${pos.fulfillment.deferred-category:Souvenir}") String deferredCategory) {
        this.deferredCategory = deferredCategory;
    }

    public String getDeferredCategory() {
        return deferredCategory;
    }

    public boolean isDeferred(Item item) {
        return item != null && deferredCategory.equals(item.getCategory());
    }

    /**
     * @param order Order with its lines
     * @return true if any line references a deferred-fulfillment item
     */
    public boolean requiresDeferredPath(Order order) {
        return order.getLines().stream().anyMatch(line -> isDeferred(line.getItem()));
    }

    /**
     * Lines the job order path deducts.
     *
     * @param order Order with its lines
     * @return Deferred-category lines
     */
    public List<OrderLine> deferredLines(Order order) {
        return order.getLines().stream()
                .filter(line -> isDeferred(line.getItem()))
                .collect(Collectors.toList());
    }

    /**
     * Lines the receipt path deducts: all of them for a normal order, none for a job order.
     *
     * @param order Order with its lines
     * @return Lines to deduct on receipt-based finalization
     */
    public List<OrderLine> normalPathLines(Order order) {
        if (requiresDeferredPath(order)) {
            return List.of();
        }
        return List.copyOf(order.getLines());
    }
}
