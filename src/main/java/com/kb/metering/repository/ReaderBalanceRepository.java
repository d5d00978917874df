package com.kb.metering.repository;

import com.kb.metering.model.entity.ReaderBalance;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReaderBalanceRepository extends ReactiveMongoRepository<ReaderBalance, String> {
}
