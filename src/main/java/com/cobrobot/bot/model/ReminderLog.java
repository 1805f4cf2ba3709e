package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "reminder_logs", indexes = {
        @Index(name = "idx_reminder_logs_owner_debt_sent", columnList = "owner_phone,debt_id,sent_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReminderLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_phone", nullable = false, length = 64)
    private String ownerPhone;

    @Column(name = "debt_id", nullable = false)
    private Long debtId;

    @Column(name = "sent_at", nullable = false)
    private LocalDateTime sentAt;
}
