package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ClientRepository extends JpaRepository<Client, Long> {

    Optional<Client> findByOwnerPhoneAndNameKey(String ownerPhone, String nameKey);
}
