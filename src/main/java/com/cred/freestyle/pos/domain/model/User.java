package com.cred.freestyle.pos.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Staff account that owns a sale.
 * Read-only here; accounts are managed elsewhere.
 *
 * @author POS Team
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_username_unique", columnList = "username", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "username", nullable = false, length = 100)
    private String username;
}
