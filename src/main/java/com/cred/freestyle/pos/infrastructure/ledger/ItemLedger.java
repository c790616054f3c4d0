package com.cred.freestyle.pos.infrastructure.ledger;

import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.OrderLine;
import com.cred.freestyle.pos.exception.InsufficientStockException;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stock balance per item, mutated only under an exclusive row lock.
 *
 * Locking discipline:
 * - Every method joins the caller's transaction and refuses to run without one,
 *   so locks are released exactly when that transaction commits or rolls back
 * - Item rows are locked in ascending item ID order, after the caller has locked
 *   the order row
 * - Validation and deduction for an item happen under the same lock, so two
 *   transactions never interleave their check-then-deduct on one item
 *
 * Declared as a repository so lock timeouts surface as Spring's
 * {@link org.springframework.dao.PessimisticLockingFailureException}.
 *
 * @author POS Team
 */
@Repository
@Transactional(propagation = Propagation.MANDATORY)
public class ItemLedger {

    private static final Logger logger = LoggerFactory.getLogger(ItemLedger.class);

    @PersistenceContext
    private EntityManager entityManager;

    public ItemLedger() {
    }

    ItemLedger(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    /**
     * Lock item rows for update.
     * The row is re-read under the lock, so an instance already loaded in this
     * transaction reflects the latest committed balance.
     *
     * @param itemIds Item IDs (duplicates ignored)
     * @return Locked items keyed by ID, in ascending ID order
     * @throws ResourceNotFoundException if any item does not exist
     */
    public Map<Long, Item> lockItems(Collection<Long> itemIds) {
        Map<Long, Item> locked = new LinkedHashMap<>();
        for (Long itemId : new TreeSet<>(itemIds)) {
            Item item = entityManager.find(Item.class, itemId);
            if (item == null) {
                throw new ResourceNotFoundException("Item", itemId);
            }
            entityManager.refresh(item, LockModeType.PESSIMISTIC_WRITE);
            locked.put(itemId, item);
        }
        logger.debug("Locked {} item rows: {}", locked.size(), locked.keySet());
        return locked;
    }

    /**
     * Lock the demanded items and check every balance covers its demand.
     * Nothing is mutated.
     *
     * @param demand Quantity needed per item ID
     * @return Locked items keyed by ID
     * @throws InsufficientStockException for the first item (by ID) that falls short
     */
    public Map<Long, Item> lockAndVerify(Map<Long, Integer> demand) {
        Map<Long, Item> locked = lockItems(demand.keySet());
        verifyAvailable(demand, locked);
        return locked;
    }

    /**
     * Lock, verify and deduct stock for a set of order lines, all or nothing.
     *
     * @param lines Lines to deduct
     * @return Locked items keyed by ID, with balances after deduction
     * @throws InsufficientStockException if any item falls short; no balance is changed
     */
    public Map<Long, Item> deduct(Collection<OrderLine> lines) {
        Map<Long, Integer> demand = demandOf(lines);
        Map<Long, Item> locked = lockAndVerify(demand);

        demand.forEach((itemId, quantity) -> {
            Item item = locked.get(itemId);
            item.deductStock(quantity);
            logger.debug("Deducted {} from item {}, balance now {}", quantity, itemId, item.getStockQuantity());
            if (item.isBelowReorderLevel()) {
                logger.info("Item {} at or below reorder level: stock={}, reorderLevel={}",
                        itemId, item.getStockQuantity(), item.getReorderLevel());
            }
        });
        return locked;
    }

    /**
     * Lock and give back stock for a set of order lines.
     *
     * @param lines Lines whose quantities are returned
     * @return Locked items keyed by ID, with balances after restoration
     */
    public Map<Long, Item> restore(Collection<OrderLine> lines) {
        Map<Long, Integer> demand = demandOf(lines);
        Map<Long, Item> locked = lockItems(demand.keySet());

        demand.forEach((itemId, quantity) -> {
            Item item = locked.get(itemId);
            item.restoreStock(quantity);
            logger.debug("Restored {} to item {}, balance now {}", quantity, itemId, item.getStockQuantity());
        });
        return locked;
    }

    /**
     * Sum line quantities per item. Lines for the same item are checked against
     * stock together.
     *
     * @param lines Order lines
     * @return Quantity per item ID, ascending by ID
     */
    public static Map<Long, Integer> demandOf(Collection<OrderLine> lines) {
        Map<Long, Integer> demand = new TreeMap<>();
        for (OrderLine line : lines) {
            addDemand(demand, line.getItemId(), line.getQuantity());
        }
        return demand;
    }

    /**
     * Add one line's quantity to the running demand for its item.
     *
     * @param demand Quantity needed per item ID, updated in place
     * @param itemId Item ID
     * @param quantity Units on the line, strictly positive
     * @throws IllegalArgumentException if the quantity is not positive or the
     *         item's total does not fit in an int
     */
    public static void addDemand(Map<Long, Integer> demand, Long itemId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantities must be positive.");
        }
        long total = (long) demand.getOrDefault(itemId, 0) + quantity;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Total quantity for item " + itemId + " exceeds " + Integer.MAX_VALUE);
        }
        demand.put(itemId, (int) total);
    }

    private void verifyAvailable(Map<Long, Integer> demand, Map<Long, Item> locked) {
        for (Map.Entry<Long, Integer> entry : demand.entrySet()) {
            Item item = locked.get(entry.getKey());
            if (!item.hasStockFor(entry.getValue())) {
                logger.warn("Insufficient stock for item {}: requested={}, available={}",
                        entry.getKey(), entry.getValue(), item.getStockQuantity());
                throw new InsufficientStockException(entry.getKey(), entry.getValue(), item.getStockQuantity());
            }
        }
    }
}
