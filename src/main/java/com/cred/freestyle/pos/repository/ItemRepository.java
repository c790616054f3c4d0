package com.cred.freestyle.pos.repository;

import com.cred.freestyle.pos.domain.model.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Item entity.
 * Locked reads and stock mutation go through {@link com.cred.freestyle.pos.infrastructure.ledger.ItemLedger}.
 *
 * @author POS Team
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    /**
     * Catalog listing for point-of-sale selects.
     *
     * @return All items ordered by name
     */
    List<Item> findAllByOrderByNameAsc();
}
