package com.kb.metering.repository;

import com.kb.metering.model.entity.ClientBalance;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClientBalanceRepository extends ReactiveMongoRepository<ClientBalance, String> {
}
