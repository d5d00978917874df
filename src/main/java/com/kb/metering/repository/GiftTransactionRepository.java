package com.kb.metering.repository;

import com.kb.metering.model.entity.GiftTransaction;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GiftTransactionRepository extends ReactiveMongoRepository<GiftTransaction, String> {
}
