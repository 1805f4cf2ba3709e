package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "clients", uniqueConstraints = {
        @UniqueConstraint(name = "uk_clients_owner_name", columnNames = {"owner_phone", "name_key"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_phone", nullable = false, length = 64)
    private String ownerPhone;

    @Column(nullable = false)
    private String name;

    // normalized name (lower case, no accents) used for lookups
    @Column(name = "name_key", nullable = false)
    private String nameKey;

    @Column(length = 64)
    private String phone;
}
