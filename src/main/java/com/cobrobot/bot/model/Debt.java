package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "debts", indexes = {
        @Index(name = "idx_debts_owner_status", columnList = "owner_phone,status"),
        @Index(name = "idx_debts_owner_client", columnList = "owner_phone,client_key")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Debt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_phone", nullable = false, length = 64)
    private String ownerPhone;

    @Column(name = "client_name", nullable = false)
    private String clientName;

    // normalized client name (lower case, no accents) used for lookups
    @Column(name = "client_key", nullable = false)
    private String clientKey;

    @Column(name = "amount_due", nullable = false, precision = 14, scale = 2)
    private BigDecimal amountDue;

    @Column(name = "due_text")
    private String dueText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private DebtStatus status = DebtStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
